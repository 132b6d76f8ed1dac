package com.example.flowmutator.api.v1.dto;

import jakarta.validation.constraints.NotNull;

import tools.jackson.databind.JsonNode;

/**
 * Request body for applying free-text model output to a workflow.
 */
public record MutateRequest(
        @NotNull JsonNode graph,
        @NotNull String instructions
) {}
