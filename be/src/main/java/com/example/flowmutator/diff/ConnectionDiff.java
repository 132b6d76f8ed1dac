package com.example.flowmutator.diff;

/**
 * An edge present in only one of the two versions. Endpoints are node ids where they
 * resolve, the raw connection key otherwise.
 */
public record ConnectionDiff(String source,
                             String target,
                             String connectionType,
                             ChangeType changeType,
                             DiffSeverity severity,
                             String description) {
}
