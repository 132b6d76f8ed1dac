package com.example.flowmutator.diff;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of change recorded in a {@link WorkflowDiff}.
 */
public enum ChangeType {

    NODE_ADDED,
    NODE_REMOVED,
    NODE_MODIFIED,
    CONNECTION_ADDED,
    CONNECTION_REMOVED,
    PARAMETER_ADDED,
    PARAMETER_REMOVED,
    PARAMETER_MODIFIED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Human form, e.g. {@code Node Added}. */
    public String label() {
        StringBuilder label = new StringBuilder();
        for (String word : name().split("_")) {
            if (!label.isEmpty()) {
                label.append(' ');
            }
            label.append(word.charAt(0)).append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return label.toString();
    }
}
