package com.example.flowmutator.diff;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a change, ordered by {@link #rank()}: MINOR &lt; MODERATE &lt; MAJOR &lt; CRITICAL.
 */
public enum DiffSeverity {

    /** Cosmetic changes such as a significant canvas move. */
    MINOR(0),
    /** Parameter, type, name and connection changes. */
    MODERATE(1),
    /** Node additions and removals. */
    MAJOR(2),
    /** The comparison itself failed. */
    CRITICAL(3);

    private final int rank;

    DiffSeverity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static DiffSeverity max(DiffSeverity a, DiffSeverity b) {
        return a.rank >= b.rank ? a : b;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
