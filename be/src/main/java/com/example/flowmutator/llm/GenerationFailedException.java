package com.example.flowmutator.llm;

/**
 * Thrown when the generation backend gives no usable reply after all attempts.
 */
public class GenerationFailedException extends RuntimeException {

    public GenerationFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public GenerationFailedException(String message) {
        super(message);
    }
}
