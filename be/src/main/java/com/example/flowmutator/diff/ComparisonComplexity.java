package com.example.flowmutator.diff;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Size class of a comparison, by the node count of both graphs together.
 */
public enum ComparisonComplexity {
    SIMPLE,
    MODERATE,
    COMPLEX;

    static ComparisonComplexity of(int totalNodes) {
        if (totalNodes > 100) {
            return COMPLEX;
        }
        return totalNodes > 20 ? MODERATE : SIMPLE;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
