package com.example.flowmutator.extraction;

/**
 * What an extracted JSON payload describes.
 */
public enum PayloadShape {
    /** Non-empty array of mutation instructions. */
    INSTRUCTION_LIST,
    /** Complete workflow object with {@code nodes} and {@code connections}. */
    WORKFLOW_GRAPH
}
