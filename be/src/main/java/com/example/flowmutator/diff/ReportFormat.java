package com.example.flowmutator.diff;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Output formats of {@link DiffReportRenderer}.
 */
public enum ReportFormat {
    TEXT("text/plain"),
    HTML("text/html"),
    JSON("application/json");

    private final String mediaType;

    ReportFormat(String mediaType) {
        this.mediaType = mediaType;
    }

    public String mediaType() {
        return mediaType;
    }

    /**
     * @throws IllegalArgumentException for an unknown format name
     */
    public static ReportFormat fromString(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown report format '" + value + "'; must be one of: "
                    + Arrays.stream(values()).map(f -> f.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", ")), e);
        }
    }
}
