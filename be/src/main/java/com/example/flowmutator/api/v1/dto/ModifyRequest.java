package com.example.flowmutator.api.v1.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import tools.jackson.databind.JsonNode;

/**
 * Request body for a natural-language modification.
 */
public record ModifyRequest(
        @NotNull JsonNode graph,
        @NotBlank String description
) {}
