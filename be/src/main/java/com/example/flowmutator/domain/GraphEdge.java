package com.example.flowmutator.domain;

/**
 * Flattened directed edge as stored in the connections structure. Source and target
 * are the raw keys (id or name); resolve them through {@link WorkflowGraph#resolveKey(String)}.
 */
public record GraphEdge(String source, String target, String connectionType) {
}
