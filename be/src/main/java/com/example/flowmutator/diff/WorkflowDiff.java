package com.example.flowmutator.diff;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured comparison of two workflow versions.
 *
 * @param originalHash     normalized content hash of the first version
 * @param modifiedHash     normalized content hash of the second version
 * @param workflowChanges  changed workflow-level properties, keyed by property name
 * @param analysisDurationMs time spent comparing, excluding cache hits
 */
public record WorkflowDiff(String originalHash,
                           String modifiedHash,
                           Instant analyzedAt,
                           boolean hasChanges,
                           DiffSeverity overallSeverity,
                           String changeSummary,
                           List<NodeDiff> nodeDiffs,
                           List<ConnectionDiff> connectionDiffs,
                           Map<String, MetadataChange> workflowChanges,
                           DiffStatistics statistics,
                           double analysisDurationMs,
                           ComparisonComplexity complexity) {

    public WorkflowDiff {
        nodeDiffs = List.copyOf(nodeDiffs);
        connectionDiffs = List.copyOf(connectionDiffs);
        workflowChanges = Collections.unmodifiableMap(new LinkedHashMap<>(workflowChanges));
    }
}
