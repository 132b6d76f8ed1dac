package com.example.flowmutator.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable in-memory workflow graph: nodes, the connections structure and the
 * remaining top-level properties ({@code name}, {@code settings}, {@code active},
 * {@code version}, ...).
 * <p>
 * Connections are stored exactly as addressed in the source document
 * ({@code sourceKey -> connectionType -> [[target, ...], ...]}), where every key may be a
 * node id or a node name. All lookups go through {@link #resolveKey(String)}.
 * Changes are made on a {@link Builder} obtained from {@link #toBuilder()}, which is a
 * deep copy; an instance is never modified after construction.
 * </p>
 */
public final class WorkflowGraph {

    private final Map<String, Object> properties;
    private final List<WorkflowNode> nodes;
    private final Map<String, Map<String, List<List<ConnectionTarget>>>> connections;
    private final NodeKeyIndex index;

    private WorkflowGraph(Map<String, Object> properties,
                          List<WorkflowNode> nodes,
                          Map<String, Map<String, List<List<ConnectionTarget>>>> connections) {
        this.properties = JsonValues.freezeMap(properties);
        this.nodes = List.copyOf(nodes);
        this.connections = freezeConnections(connections);
        this.index = NodeKeyIndex.of(this.nodes);
    }

    public static Builder builder() {
        return new Builder(new LinkedHashMap<>(), new ArrayList<>(), new LinkedHashMap<>());
    }

    public Builder toBuilder() {
        return new Builder(JsonValues.thawMap(properties), new ArrayList<>(nodes), thawConnections(connections));
    }

    /** Workflow name, or null when absent or not a string. */
    public String name() {
        return properties.get("name") instanceof String s ? s : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> settings() {
        return properties.get("settings") instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    /** Defaults to true when absent, as workflow documents usually omit it. */
    public boolean active() {
        return !(properties.get("active") instanceof Boolean b) || b;
    }

    public Object property(String key) {
        return properties.get(key);
    }

    public boolean hasProperty(String key) {
        return properties.containsKey(key);
    }

    public Map<String, Object> properties() {
        return properties;
    }

    public List<WorkflowNode> nodes() {
        return nodes;
    }

    public Map<String, Map<String, List<List<ConnectionTarget>>>> connections() {
        return connections;
    }

    /**
     * Resolves a node id or node name to the node id. Ids win over names; ambiguous
     * names and unknown keys resolve to empty.
     */
    public Optional<String> resolveKey(String key) {
        return index.resolve(key);
    }

    public boolean isAmbiguousName(String key) {
        return index.isAmbiguous(key);
    }

    public NodeKeyIndex index() {
        return index;
    }

    public Optional<WorkflowNode> findNode(String id) {
        return nodes.stream().filter(n -> Objects.equals(n.id(), id)).findFirst();
    }

    /** Display name of the node with the given id; the id itself for unnamed nodes. */
    public Optional<String> nameOf(String id) {
        return findNode(id).map(WorkflowNode::displayName);
    }

    /** All edges in structure order, with raw (unresolved) keys. Targets without a node key are skipped. */
    public List<GraphEdge> edges() {
        return flattenEdges(connections);
    }

    static List<GraphEdge> flattenEdges(Map<String, Map<String, List<List<ConnectionTarget>>>> connections) {
        List<GraphEdge> edges = new ArrayList<>();
        connections.forEach((source, buckets) -> buckets.forEach((type, outputs) -> {
            for (List<ConnectionTarget> output : outputs) {
                for (ConnectionTarget target : output) {
                    if (target.node() != null) {
                        edges.add(new GraphEdge(source, target.node(), type));
                    }
                }
            }
        }));
        return edges;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorkflowGraph other)) {
            return false;
        }
        return properties.equals(other.properties)
                && nodes.equals(other.nodes)
                && connections.equals(other.connections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(properties, nodes, connections);
    }

    @Override
    public String toString() {
        return "WorkflowGraph[name=" + name() + ", nodes=" + nodes.size() + ", sources=" + connections.size() + "]";
    }

    private static Map<String, Map<String, List<List<ConnectionTarget>>>> freezeConnections(
            Map<String, Map<String, List<List<ConnectionTarget>>>> source) {
        Map<String, Map<String, List<List<ConnectionTarget>>>> copy = new LinkedHashMap<>();
        source.forEach((key, buckets) -> {
            Map<String, List<List<ConnectionTarget>>> bucketCopy = new LinkedHashMap<>();
            buckets.forEach((type, outputs) -> bucketCopy.put(type, outputs.stream().map(List::copyOf).toList()));
            copy.put(key, Collections.unmodifiableMap(bucketCopy));
        });
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, Map<String, List<List<ConnectionTarget>>>> thawConnections(
            Map<String, Map<String, List<List<ConnectionTarget>>>> source) {
        Map<String, Map<String, List<List<ConnectionTarget>>>> copy = new LinkedHashMap<>();
        source.forEach((key, buckets) -> {
            Map<String, List<List<ConnectionTarget>>> bucketCopy = new LinkedHashMap<>();
            buckets.forEach((type, outputs) -> {
                List<List<ConnectionTarget>> outputCopy = new ArrayList<>();
                outputs.forEach(output -> outputCopy.add(new ArrayList<>(output)));
                bucketCopy.put(type, outputCopy);
            });
            copy.put(key, bucketCopy);
        });
        return copy;
    }

    /**
     * Mutable working copy of a graph. Not thread-safe; owned by a single mutation.
     */
    public static final class Builder {

        private final Map<String, Object> properties;
        private final List<WorkflowNode> nodes;
        private final Map<String, Map<String, List<List<ConnectionTarget>>>> connections;

        private Builder(Map<String, Object> properties,
                        List<WorkflowNode> nodes,
                        Map<String, Map<String, List<List<ConnectionTarget>>>> connections) {
            this.properties = properties;
            this.nodes = nodes;
            this.connections = connections;
        }

        public Builder property(String key, Object value) {
            properties.put(key, value);
            return this;
        }

        public Builder node(WorkflowNode node) {
            nodes.add(node);
            return this;
        }

        public Builder connection(String sourceKey, String connectionType, List<List<ConnectionTarget>> outputs) {
            List<List<ConnectionTarget>> outputCopy = new ArrayList<>();
            outputs.forEach(output -> outputCopy.add(new ArrayList<>(output)));
            connections.computeIfAbsent(sourceKey, k -> new LinkedHashMap<>()).put(connectionType, outputCopy);
            return this;
        }

        /** Live, mutable node list. */
        public List<WorkflowNode> nodes() {
            return nodes;
        }

        /** Live, mutable connections structure. */
        public Map<String, Map<String, List<List<ConnectionTarget>>>> connections() {
            return connections;
        }

        /** Index over the current node list; rebuild after node changes. */
        public NodeKeyIndex index() {
            return NodeKeyIndex.of(nodes);
        }

        public List<GraphEdge> edges() {
            return flattenEdges(connections);
        }

        public WorkflowGraph build() {
            return new WorkflowGraph(properties, nodes, connections);
        }
    }
}
