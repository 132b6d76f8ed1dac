package com.example.flowmutator.service;

import com.example.flowmutator.domain.WorkflowGraph;
import com.example.flowmutator.domain.WorkflowGraphCodec;
import com.example.flowmutator.llm.ChangeProposalClient;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

/**
 * Turns a natural-language modification request into a mutation: the generation backend
 * proposes a change-set, then {@link WorkflowMutationService} applies and validates it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowModificationService {

    private final WorkflowGraphCodec codec;
    private final ChangeProposalClient proposalClient;
    private final WorkflowMutationService mutationService;

    public MutationResult modify(String graphJson, String description) {
        WorkflowGraph original = codec.parse(graphJson);
        log.info("Requesting modification name={} nodes={} descriptionLength={}",
                original.name(), original.nodes().size(), description != null ? description.length() : 0);
        String reply = proposalClient.proposeChanges(original, description);
        MutationResult result = mutationService.mutate(original, graphJson, reply);
        log.info("Modification finished name={} extracted={} applied={} rolledBack={}",
                original.name(), result.extracted(), result.appliedCount(), result.rolledBack());
        return result;
    }
}
