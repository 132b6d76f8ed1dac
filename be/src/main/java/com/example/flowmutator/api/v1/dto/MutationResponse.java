package com.example.flowmutator.api.v1.dto;

import com.example.flowmutator.diff.WorkflowDiff;
import com.example.flowmutator.validation.ValidationError;

import tools.jackson.databind.JsonNode;

import java.util.List;

/**
 * Response for mutate and modify. {@code graph} is the accepted workflow, or the input
 * unchanged when nothing was extracted or the attempt was rolled back.
 */
public record MutationResponse(
        JsonNode graph,
        boolean extracted,
        boolean replacement,
        int appliedCount,
        boolean rolledBack,
        List<ValidationError> errors,
        List<ValidationError> warnings,
        List<String> skipped,
        WorkflowDiff diff
) {}
