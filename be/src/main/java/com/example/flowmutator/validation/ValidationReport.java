package com.example.flowmutator.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of {@link WorkflowGraphValidator#validate}.
 *
 * @param errors             findings that make the graph unacceptable
 * @param warnings           advisory findings
 * @param cycles             each detected cycle as node ids in edge order
 * @param orphanNodeIds      nodes without any connection that were reported
 * @param unreachableNodeIds connected nodes that no trigger reaches
 */
public record ValidationReport(List<ValidationError> errors,
                               List<ValidationError> warnings,
                               List<List<String>> cycles,
                               List<String> orphanNodeIds,
                               List<String> unreachableNodeIds) {

    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        cycles = cycles.stream().map(List::copyOf).toList();
        orphanNodeIds = List.copyOf(orphanNodeIds);
        unreachableNodeIds = List.copyOf(unreachableNodeIds);
    }

    @JsonProperty("valid")
    public boolean valid() {
        return errors.isEmpty();
    }
}
