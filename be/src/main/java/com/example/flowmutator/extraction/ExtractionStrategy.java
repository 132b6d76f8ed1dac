package com.example.flowmutator.extraction;

/**
 * Extraction steps in the order they are tried.
 */
public enum ExtractionStrategy {
    BALANCED_SCAN,
    FENCED_BLOCK,
    ARRAY_SPAN,
    OBJECT_PATTERN,
    LINE_SCAN
}
