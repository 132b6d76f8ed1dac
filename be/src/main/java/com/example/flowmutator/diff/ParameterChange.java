package com.example.flowmutator.diff;

/**
 * Change of one node parameter. {@code oldValue} is null for additions and
 * {@code newValue} is null for removals.
 */
public record ParameterChange(ChangeType kind, Object oldValue, Object newValue) {
}
