package com.example.flowmutator.api.v1.dto;

import jakarta.validation.constraints.NotNull;

import tools.jackson.databind.JsonNode;

public record DiffRequest(
        @NotNull JsonNode original,
        @NotNull JsonNode modified
) {}
