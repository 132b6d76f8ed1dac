package com.example.flowmutator.validation;

import java.util.Objects;

/**
 * A single structural finding: the offending location ({@code nodes[3].type},
 * {@code connections[Webhook].main}) and a message.
 */
public record ValidationError(String field, String message) {
    public ValidationError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }
}
