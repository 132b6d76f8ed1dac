package com.example.flowmutator.diff;

/**
 * Change of a workflow-level property ({@code name}, {@code settings} or {@code active}).
 */
public record MetadataChange(Object oldValue, Object newValue) {
}
