package com.example.flowmutator.domain;

/**
 * Thrown when a workflow graph document cannot be parsed or does not have the
 * top-level {@code nodes}/{@code connections} shape.
 * <p>
 * Mapped to HTTP 400 by {@link com.example.flowmutator.api.GlobalExceptionHandler}.
 * </p>
 */
public class MalformedGraphException extends RuntimeException {

    public MalformedGraphException(String message) {
        super(message);
    }

    public MalformedGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
