package com.example.flowmutator.mutation;

/**
 * Thrown when a change-set element is not a well-formed instruction: not an object,
 * unknown action, non-object details or a missing required detail. The instruction is
 * dropped; the rest of the change-set still applies.
 */
public class InstructionValidationException extends RuntimeException {

    public InstructionValidationException(String message) {
        super(message);
    }
}
