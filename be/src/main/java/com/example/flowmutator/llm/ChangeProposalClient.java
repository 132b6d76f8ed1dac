package com.example.flowmutator.llm;

import com.example.flowmutator.domain.WorkflowGraph;

/**
 * Asks a generation backend for a change-set that implements a natural-language request
 * against a workflow. The reply is raw model text; extraction happens downstream.
 */
public interface ChangeProposalClient {

    String proposeChanges(WorkflowGraph graph, String description);
}
