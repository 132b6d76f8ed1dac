package com.example.flowmutator.diff;

import java.util.Map;

/**
 * Difference for one node id between two graph versions.
 *
 * @param oldData          node as it was; null for additions
 * @param newData          node as it is; null for removals
 * @param parameterChanges per-parameter changes, keyed by parameter name
 * @param positionChanged  true only for moves beyond the configured threshold
 */
public record NodeDiff(String nodeId,
                       String nodeName,
                       ChangeType changeType,
                       DiffSeverity severity,
                       Map<String, Object> oldData,
                       Map<String, Object> newData,
                       Map<String, ParameterChange> parameterChanges,
                       boolean positionChanged,
                       String description) {
}
