package com.example.flowmutator.mutation;

import com.example.flowmutator.domain.WorkflowGraph;

import java.util.List;

/**
 * Result of applying a change-set.
 *
 * @param graph        the mutated graph (a new instance; the input is untouched)
 * @param appliedCount instructions that changed the working copy
 * @param skipped      one reason per instruction that was dropped, failed or had no effect
 */
public record MutationOutcome(WorkflowGraph graph, int appliedCount, List<String> skipped) {

    public MutationOutcome {
        skipped = List.copyOf(skipped);
    }
}
