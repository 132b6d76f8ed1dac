package com.example.flowmutator.domain;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the external JSON form of a workflow graph.
 * <p>
 * The document is an object with a {@code nodes} array and a {@code connections}
 * object ({@code sourceKey -> connectionType -> [[{node, type, index}, ...], ...]});
 * every other top-level key is kept as a graph property and written back unchanged.
 * </p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowGraphCodec {

    static final String NODES = "nodes";
    static final String CONNECTIONS = "connections";

    private final JsonMapper jsonMapper;

    /**
     * Parses a graph document.
     *
     * @throws MalformedGraphException if the text is not a JSON object with a {@code nodes}
     *                                 array and a {@code connections} object, or a node or
     *                                 connection entry has the wrong shape
     */
    public WorkflowGraph parse(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedGraphException("workflow JSON is empty");
        }
        Object root;
        try {
            root = jsonMapper.readValue(json, Object.class);
        } catch (JacksonException e) {
            throw new MalformedGraphException("workflow is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!(root instanceof Map<?, ?> document)) {
            throw new MalformedGraphException("workflow JSON must be an object");
        }
        return fromMap(document);
    }

    /**
     * Builds a graph from an already-parsed JSON object (as produced by Jackson for {@code Object}).
     */
    public WorkflowGraph fromMap(Map<?, ?> document) {
        Object nodes = document.get(NODES);
        if (!(nodes instanceof List<?> nodeList)) {
            throw new MalformedGraphException("workflow must have a 'nodes' array");
        }
        Object connections = document.get(CONNECTIONS);
        boolean emptyArray = connections instanceof List<?> list && list.isEmpty();
        if (!(connections instanceof Map<?, ?>) && !emptyArray) {
            throw new MalformedGraphException("workflow must have a 'connections' object");
        }

        WorkflowGraph.Builder builder = WorkflowGraph.builder();
        document.forEach((key, value) -> {
            String name = String.valueOf(key);
            if (!NODES.equals(name) && !CONNECTIONS.equals(name)) {
                builder.property(name, value);
            }
        });
        for (int i = 0; i < nodeList.size(); i++) {
            if (!(nodeList.get(i) instanceof Map<?, ?> attributes)) {
                throw new MalformedGraphException("nodes[" + i + "] must be an object");
            }
            builder.node(new WorkflowNode(stringKeys(attributes)));
        }
        if (connections instanceof Map<?, ?> entries) {
            entries.forEach((source, buckets) -> readSource(builder, String.valueOf(source), buckets));
        }
        WorkflowGraph graph = builder.build();
        log.debug("Parsed workflow name={} nodes={} sources={}", graph.name(), graph.nodes().size(), graph.connections().size());
        return graph;
    }

    public String write(WorkflowGraph graph) {
        try {
            return jsonMapper.writeValueAsString(toMap(graph));
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize workflow", e);
        }
    }

    /**
     * External JSON tree of the graph. {@code nodes} and {@code connections} follow
     * {@code name} when present, otherwise they come first.
     */
    public Map<String, Object> toMap(WorkflowGraph graph) {
        Map<String, Object> document = new LinkedHashMap<>();
        if (!graph.hasProperty("name")) {
            putStructure(document, graph);
        }
        graph.properties().forEach((key, value) -> {
            document.put(key, value);
            if ("name".equals(key)) {
                putStructure(document, graph);
            }
        });
        return document;
    }

    private static void putStructure(Map<String, Object> document, WorkflowGraph graph) {
        document.put(NODES, graph.nodes().stream().map(WorkflowNode::attributes).toList());
        Map<String, Object> connections = new LinkedHashMap<>();
        graph.connections().forEach((source, buckets) -> {
            Map<String, Object> bucketMap = new LinkedHashMap<>();
            buckets.forEach((type, outputs) -> bucketMap.put(type, outputs.stream()
                    .map(output -> output.stream().map(WorkflowGraphCodec::targetToMap).toList())
                    .toList()));
            connections.put(source, bucketMap);
        });
        document.put(CONNECTIONS, connections);
    }

    private static Map<String, Object> targetToMap(ConnectionTarget target) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("node", target.node());
        map.put("type", target.type());
        map.put("index", target.index());
        return map;
    }

    private static void readSource(WorkflowGraph.Builder builder, String source, Object buckets) {
        String path = "connections[" + source + "]";
        if (!(buckets instanceof Map<?, ?> bucketMap)) {
            throw new MalformedGraphException(path + " must be an object keyed by connection type");
        }
        bucketMap.forEach((rawType, rawOutputs) -> {
            String type = String.valueOf(rawType);
            String bucketPath = path + "." + type;
            if (!(rawOutputs instanceof List<?> outputs)) {
                throw new MalformedGraphException(bucketPath + " must be a list of output lists");
            }
            List<List<ConnectionTarget>> parsed = new ArrayList<>();
            for (int o = 0; o < outputs.size(); o++) {
                parsed.add(readOutput(bucketPath + "[" + o + "]", type, outputs.get(o)));
            }
            builder.connection(source, type, parsed);
        });
    }

    private static List<ConnectionTarget> readOutput(String path, String bucketType, Object rawOutput) {
        // unused outputs are written as null by some editors
        if (rawOutput == null) {
            return List.of();
        }
        if (!(rawOutput instanceof List<?> output)) {
            throw new MalformedGraphException(path + " must be a list of connection targets");
        }
        List<ConnectionTarget> targets = new ArrayList<>();
        for (int t = 0; t < output.size(); t++) {
            if (!(output.get(t) instanceof Map<?, ?> target)) {
                throw new MalformedGraphException(path + "[" + t + "] must be an object");
            }
            String type = JsonValues.scalarText(target.get("type"));
            Object index = target.get("index");
            targets.add(new ConnectionTarget(
                    JsonValues.scalarText(target.get("node")),
                    type != null ? type : bucketType,
                    index instanceof Integer i ? i : 0));
        }
        return targets;
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
