package com.example.flowmutator.api.v1.dto;

import jakarta.validation.constraints.NotNull;

import tools.jackson.databind.JsonNode;

public record ValidateRequest(@NotNull JsonNode graph) {}
