package com.example.flowmutator.validation;

/**
 * Coarse role of a node, as far as structural checks care.
 */
public enum NodeCategory {
    /** Starts executions; a legitimate graph entry point. */
    TRIGGER,
    /** Terminal or utility node that may legitimately stand alone. */
    SINK,
    OTHER
}
