package com.example.flowmutator.service;

import com.example.flowmutator.diff.WorkflowDiff;
import com.example.flowmutator.validation.ValidationError;

import java.util.List;

/**
 * Outcome of one mutation attempt.
 *
 * @param resultJson   the accepted graph, or the input document unchanged when nothing was
 *                     extracted or the attempt was rolled back
 * @param extracted    whether a change-set or replacement workflow was found in the text
 * @param replacement  whether the text carried a whole workflow instead of instructions
 * @param appliedCount instructions that changed the graph
 * @param rolledBack   whether the mutated graph failed validation and was discarded
 * @param errors       validation errors of the mutated graph (empty unless rolled back)
 * @param warnings     validation warnings of the mutated graph
 * @param skipped      instructions that were dropped or had no effect, with the reason
 * @param diff         accepted result against the input; null when nothing was accepted
 */
public record MutationResult(String resultJson,
                             boolean extracted,
                             boolean replacement,
                             int appliedCount,
                             boolean rolledBack,
                             List<ValidationError> errors,
                             List<ValidationError> warnings,
                             List<String> skipped,
                             WorkflowDiff diff) {

    public MutationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        skipped = List.copyOf(skipped);
    }

    static MutationResult notExtracted(String originalJson) {
        return new MutationResult(originalJson, false, false, 0, false, List.of(), List.of(), List.of(), null);
    }
}
