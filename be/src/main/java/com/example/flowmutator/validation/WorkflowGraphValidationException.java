package com.example.flowmutator.validation;

import lombok.Getter;

import java.util.List;

/**
 * Thrown by {@link WorkflowGraphValidator#requireValid} when a graph has structural errors.
 * <p>
 * Mapped to HTTP 400 with {@link #getErrors()} in the response body by {@link com.example.flowmutator.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class WorkflowGraphValidationException extends RuntimeException {

    private final List<ValidationError> errors;

    public WorkflowGraphValidationException(List<ValidationError> errors) {
        super("Workflow graph validation failed: " + (errors != null ? errors.size() + " error(s)" : ""));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
