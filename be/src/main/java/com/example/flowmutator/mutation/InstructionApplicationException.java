package com.example.flowmutator.mutation;

import lombok.Getter;

/**
 * Thrown while applying a single instruction that cannot take effect on the current
 * working copy, for example a connection endpoint that does not resolve. Caught by
 * {@link WorkflowMutator}, which records the instruction as skipped.
 */
@Getter
public class InstructionApplicationException extends RuntimeException {

    private final MutationAction action;

    public InstructionApplicationException(MutationAction action, String message) {
        super(action.wireName() + ": " + message);
        this.action = action;
    }
}
