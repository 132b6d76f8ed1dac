package com.example.flowmutator.diff;

import com.example.flowmutator.domain.GraphEdge;
import com.example.flowmutator.domain.JsonValues;
import com.example.flowmutator.domain.MalformedGraphException;
import com.example.flowmutator.domain.WorkflowGraph;
import com.example.flowmutator.domain.WorkflowGraphCodec;
import com.example.flowmutator.domain.WorkflowNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Compares two workflow versions node by node and edge by edge.
 * <p>
 * Nodes are matched by id. Edges are compared as a set of
 * {@code (source, target, connectionType)} tuples with both endpoints resolved to node ids,
 * so renaming a node does not show up as rewired edges. Results are cached per pair of
 * content hashes in a bounded LRU map guarded by a single lock.
 * </p>
 */
public class WorkflowDiffer {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDiffer.class);

    private final WorkflowGraphCodec codec;
    private final WorkflowHasher hasher;
    private final double moveThreshold;
    private final Object cacheLock = new Object();
    private final Map<String, WorkflowDiff> cache;

    public WorkflowDiffer(WorkflowGraphCodec codec, WorkflowHasher hasher, int cacheSize, double moveThreshold) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.moveThreshold = moveThreshold;
        int capacity = Math.max(cacheSize, 0);
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, WorkflowDiff> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * Compares two graph documents. A document that cannot be parsed yields a CRITICAL diff
     * without changes whose summary carries the parse failure; nothing is thrown.
     */
    public WorkflowDiff compare(String originalJson, String modifiedJson) {
        long started = System.nanoTime();
        WorkflowGraph original;
        WorkflowGraph modified;
        try {
            original = codec.parse(originalJson);
            modified = codec.parse(modifiedJson);
        } catch (MalformedGraphException e) {
            log.error("Workflow comparison failed: {}", e.getMessage());
            return failed(originalJson, modifiedJson, e.getMessage(), started);
        }
        return compare(original, modified);
    }

    public WorkflowDiff compare(WorkflowGraph original, WorkflowGraph modified) {
        String originalHash = hasher.hash(original);
        String modifiedHash = hasher.hash(modified);
        String cacheKey = originalHash + ":" + modifiedHash;
        synchronized (cacheLock) {
            WorkflowDiff cached = cache.get(cacheKey);
            if (cached != null) {
                log.debug("Returning cached diff key={}", cacheKey);
                return cached;
            }
        }

        long started = System.nanoTime();
        List<NodeDiff> nodeDiffs = compareNodes(original, modified);
        List<ConnectionDiff> connectionDiffs = compareConnections(original, modified);
        Map<String, MetadataChange> workflowChanges = compareMetadata(original, modified);

        DiffStatistics statistics = statistics(nodeDiffs, connectionDiffs, workflowChanges);
        DiffSeverity severity = DiffSeverity.MINOR;
        for (NodeDiff diff : nodeDiffs) {
            severity = DiffSeverity.max(severity, diff.severity());
        }
        for (ConnectionDiff diff : connectionDiffs) {
            severity = DiffSeverity.max(severity, diff.severity());
        }
        WorkflowDiff diff = new WorkflowDiff(
                originalHash,
                modifiedHash,
                Instant.now(),
                statistics.hasChanges(),
                severity,
                statistics.summary(),
                nodeDiffs,
                connectionDiffs,
                workflowChanges,
                statistics,
                elapsedMillis(started),
                ComparisonComplexity.of(original.nodes().size() + modified.nodes().size())
        );
        synchronized (cacheLock) {
            cache.put(cacheKey, diff);
        }
        log.info("Compared workflows original={} modified={} changes={} severity={} summary={}",
                originalHash, modifiedHash, diff.hasChanges(), severity.value(), diff.changeSummary());
        return diff;
    }

    public void clearCache() {
        synchronized (cacheLock) {
            cache.clear();
        }
        log.info("Diff cache cleared");
    }

    public int cacheSize() {
        synchronized (cacheLock) {
            return cache.size();
        }
    }

    private List<NodeDiff> compareNodes(WorkflowGraph original, WorkflowGraph modified) {
        Map<String, WorkflowNode> before = byId(original);
        Map<String, WorkflowNode> after = byId(modified);
        List<NodeDiff> diffs = new ArrayList<>();

        after.forEach((id, node) -> {
            if (!before.containsKey(id)) {
                diffs.add(new NodeDiff(id, nameOrDefault(node), ChangeType.NODE_ADDED, DiffSeverity.MAJOR,
                        null, node.attributes(), Map.of(), false,
                        "Added new node '" + node.name() + "' of type '" + node.type() + "'"));
            }
        });
        before.forEach((id, node) -> {
            if (!after.containsKey(id)) {
                diffs.add(new NodeDiff(id, nameOrDefault(node), ChangeType.NODE_REMOVED, DiffSeverity.MAJOR,
                        node.attributes(), null, Map.of(), false,
                        "Removed node '" + node.name() + "' of type '" + node.type() + "'"));
            }
        });
        before.forEach((id, node) -> {
            WorkflowNode changed = after.get(id);
            if (changed != null) {
                compareNode(id, node, changed).ifPresent(diffs::add);
            }
        });
        return diffs;
    }

    private Optional<NodeDiff> compareNode(String id, WorkflowNode before, WorkflowNode after) {
        List<String> descriptions = new ArrayList<>();
        DiffSeverity severity = DiffSeverity.MINOR;

        if (!Objects.equals(before.name(), after.name())) {
            descriptions.add("Name changed from '" + before.name() + "' to '" + after.name() + "'");
            severity = DiffSeverity.MODERATE;
        }
        if (!Objects.equals(before.type(), after.type())) {
            descriptions.add("Type changed from '" + before.type() + "' to '" + after.type() + "'");
            severity = DiffSeverity.MODERATE;
        }
        Map<String, ParameterChange> parameterChanges = compareParameters(before.parameters(), after.parameters());
        if (!parameterChanges.isEmpty()) {
            descriptions.add(parameterChanges.size() + " parameter(s) changed");
            severity = DiffSeverity.MODERATE;
        }
        boolean moved = movedSignificantly(before, after);
        if (moved) {
            descriptions.add("Position moved significantly");
        }
        if (descriptions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new NodeDiff(id, nameOrDefault(before), ChangeType.NODE_MODIFIED, severity,
                before.attributes(), after.attributes(), parameterChanges, moved, String.join("; ", descriptions)));
    }

    static Map<String, ParameterChange> compareParameters(Map<String, Object> before, Map<String, Object> after) {
        Map<String, ParameterChange> changes = new LinkedHashMap<>();
        Set<String> keys = new LinkedHashSet<>(before.keySet());
        keys.addAll(after.keySet());
        for (String key : keys) {
            if (!before.containsKey(key)) {
                changes.put(key, new ParameterChange(ChangeType.PARAMETER_ADDED, null, after.get(key)));
            } else if (!after.containsKey(key)) {
                changes.put(key, new ParameterChange(ChangeType.PARAMETER_REMOVED, before.get(key), null));
            } else if (!Objects.equals(before.get(key), after.get(key))) {
                changes.put(key, new ParameterChange(ChangeType.PARAMETER_MODIFIED, before.get(key), after.get(key)));
            }
        }
        return changes;
    }

    private boolean movedSignificantly(WorkflowNode before, WorkflowNode after) {
        double[] from = before.position().orElse(new double[]{0, 0});
        double[] to = after.position().orElse(new double[]{0, 0});
        return Math.hypot(to[0] - from[0], to[1] - from[1]) > moveThreshold;
    }

    private static List<ConnectionDiff> compareConnections(WorkflowGraph original, WorkflowGraph modified) {
        Set<GraphEdge> before = canonicalEdges(original);
        Set<GraphEdge> after = canonicalEdges(modified);
        List<ConnectionDiff> diffs = new ArrayList<>();
        for (GraphEdge edge : after) {
            if (!before.contains(edge)) {
                diffs.add(new ConnectionDiff(edge.source(), edge.target(), edge.connectionType(),
                        ChangeType.CONNECTION_ADDED, DiffSeverity.MODERATE,
                        "Added connection from '" + label(modified, edge.source()) + "' to '"
                                + label(modified, edge.target()) + "' via '" + edge.connectionType() + "'"));
            }
        }
        for (GraphEdge edge : before) {
            if (!after.contains(edge)) {
                diffs.add(new ConnectionDiff(edge.source(), edge.target(), edge.connectionType(),
                        ChangeType.CONNECTION_REMOVED, DiffSeverity.MODERATE,
                        "Removed connection from '" + label(original, edge.source()) + "' to '"
                                + label(original, edge.target()) + "' via '" + edge.connectionType() + "'"));
            }
        }
        return diffs;
    }

    private static Set<GraphEdge> canonicalEdges(WorkflowGraph graph) {
        Set<GraphEdge> edges = new LinkedHashSet<>();
        for (GraphEdge edge : graph.edges()) {
            edges.add(new GraphEdge(
                    graph.resolveKey(edge.source()).orElse(edge.source()),
                    graph.resolveKey(edge.target()).orElse(edge.target()),
                    edge.connectionType()));
        }
        return edges;
    }

    private static String label(WorkflowGraph graph, String id) {
        return graph.nameOf(id).orElse(id);
    }

    private static Map<String, MetadataChange> compareMetadata(WorkflowGraph original, WorkflowGraph modified) {
        Map<String, MetadataChange> changes = new LinkedHashMap<>();
        if (!Objects.equals(original.property("name"), modified.property("name"))) {
            changes.put("name", new MetadataChange(original.property("name"), modified.property("name")));
        }
        if (!original.settings().equals(modified.settings())) {
            changes.put("settings", new MetadataChange(original.settings(), modified.settings()));
        }
        if (original.active() != modified.active()) {
            changes.put("active", new MetadataChange(original.active(), modified.active()));
        }
        return changes;
    }

    private static DiffStatistics statistics(List<NodeDiff> nodeDiffs, List<ConnectionDiff> connectionDiffs,
                                             Map<String, MetadataChange> workflowChanges) {
        int added = 0;
        int removed = 0;
        int modified = 0;
        int parameters = 0;
        for (NodeDiff diff : nodeDiffs) {
            switch (diff.changeType()) {
                case NODE_ADDED -> added++;
                case NODE_REMOVED -> removed++;
                default -> modified++;
            }
            parameters += diff.parameterChanges().size();
        }
        int connectionsAdded = (int) connectionDiffs.stream().filter(d -> d.changeType() == ChangeType.CONNECTION_ADDED).count();
        int connectionsRemoved = connectionDiffs.size() - connectionsAdded;
        return new DiffStatistics(added, removed, modified, connectionsAdded, connectionsRemoved, parameters, workflowChanges.size());
    }

    private WorkflowDiff failed(String originalJson, String modifiedJson, String reason, long started) {
        return new WorkflowDiff(
                hasher.hashRaw(originalJson),
                hasher.hashRaw(modifiedJson),
                Instant.now(),
                false,
                DiffSeverity.CRITICAL,
                "Comparison failed: " + reason,
                List.of(),
                List.of(),
                Map.of(),
                new DiffStatistics(0, 0, 0, 0, 0, 0, 0),
                elapsedMillis(started),
                ComparisonComplexity.SIMPLE
        );
    }

    private static Map<String, WorkflowNode> byId(WorkflowGraph graph) {
        Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
        for (WorkflowNode node : graph.nodes()) {
            if (!JsonValues.isBlank(node.id())) {
                nodes.putIfAbsent(node.id(), node);
            }
        }
        return nodes;
    }

    private static String nameOrDefault(WorkflowNode node) {
        return JsonValues.isBlank(node.name()) ? "Node " + node.id() : node.name();
    }

    private static double elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000.0;
    }
}
