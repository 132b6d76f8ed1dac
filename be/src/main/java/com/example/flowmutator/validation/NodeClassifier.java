package com.example.flowmutator.validation;

import com.example.flowmutator.domain.WorkflowNode;

/**
 * Classifies nodes for the orphan and reachability checks.
 */
public interface NodeClassifier {

    NodeCategory classify(WorkflowNode node);
}
