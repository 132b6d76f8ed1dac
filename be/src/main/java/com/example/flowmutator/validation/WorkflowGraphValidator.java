package com.example.flowmutator.validation;

import com.example.flowmutator.domain.ConnectionTarget;
import com.example.flowmutator.domain.JsonValues;
import com.example.flowmutator.domain.WorkflowGraph;
import com.example.flowmutator.domain.WorkflowNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates a workflow graph: document fields, node fields, reference integrity, then
 * cycles, orphans and reachability.
 * <p>
 * Every check runs even when an earlier one failed, so a single pass reports everything.
 * Problems with fields, nodes and connection references are errors. Cycles, orphan
 * nodes and nodes no trigger reaches are warnings, or errors when the validator is strict.
 * </p>
 */
public class WorkflowGraphValidator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowGraphValidator.class);

    private final NodeClassifier classifier;
    private final boolean strict;

    public WorkflowGraphValidator(NodeClassifier classifier, boolean strict) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.strict = strict;
    }

    public ValidationReport validate(WorkflowGraph graph) {
        Objects.requireNonNull(graph, "graph");
        Findings findings = new Findings();

        validateDocument(graph, findings);
        validateNodes(graph, findings);
        List<String[]> edges = validateConnections(graph, findings);

        Map<String, List<String>> adjacency = adjacency(graph, edges);
        List<List<String>> cycles = CycleDetector.findCycles(adjacency);
        for (List<String> cycle : cycles) {
            findings.advisory("connections", "cycle detected: " + describeCycle(graph, cycle));
        }
        Set<String> connected = new HashSet<>();
        edges.forEach(edge -> {
            connected.add(edge[0]);
            connected.add(edge[1]);
        });
        List<String> orphans = findOrphans(graph, connected, findings);
        List<String> unreachable = findUnreachable(graph, adjacency, connected, findings);

        ValidationReport report = new ValidationReport(findings.errors, findings.warnings, cycles, orphans, unreachable);
        log.debug("Validated workflow name={} nodes={} errors={} warnings={} cycles={}",
                graph.name(), graph.nodes().size(), report.errors().size(), report.warnings().size(), cycles.size());
        return report;
    }

    /**
     * Validates the graph. Throws {@link WorkflowGraphValidationException} with all errors if invalid.
     */
    public ValidationReport requireValid(WorkflowGraph graph) {
        ValidationReport report = validate(graph);
        if (!report.valid()) {
            throw new WorkflowGraphValidationException(report.errors());
        }
        return report;
    }

    public boolean isStrict() {
        return strict;
    }

    private static void validateDocument(WorkflowGraph graph, Findings findings) {
        if (!graph.hasProperty("name") || graph.property("name") == null) {
            findings.error("name", "name is required");
        } else if (!(graph.property("name") instanceof String)) {
            findings.error("name", "name must be a string");
        }
        if (graph.hasProperty("settings") && !(graph.property("settings") instanceof Map<?, ?>)) {
            findings.error("settings", "settings must be an object");
        }
        if (graph.hasProperty("version") && !(graph.property("version") instanceof Number)) {
            findings.error("version", "version must be a number");
        }
        if (graph.hasProperty("active") && !(graph.property("active") instanceof Boolean)) {
            findings.error("active", "active must be a boolean");
        }
        if (graph.nodes().isEmpty()) {
            findings.warning("nodes", "workflow has no nodes");
        }
    }

    private static void validateNodes(WorkflowGraph graph, Findings findings) {
        Set<String> seenIds = new HashSet<>();
        Map<String, Integer> nameCounts = new LinkedHashMap<>();
        List<WorkflowNode> nodes = graph.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            WorkflowNode node = nodes.get(i);
            String id = node.id();
            String prefix = "nodes[" + (JsonValues.isBlank(id) ? String.valueOf(i) : id) + "]";

            if (JsonValues.isBlank(id)) {
                findings.error(prefix + ".id", "node id is required");
            } else if (!seenIds.add(id)) {
                findings.error(prefix + ".id", "duplicate node id '" + id + "'");
            }
            if (JsonValues.isBlank(node.name())) {
                findings.error(prefix + ".name", "node name is required");
            } else {
                nameCounts.merge(node.name(), 1, Integer::sum);
            }
            if (JsonValues.isBlank(node.type())) {
                findings.error(prefix + ".type", "node type is required");
            }
            Map<String, Object> attributes = node.attributes();
            if (attributes.get(WorkflowNode.PARAMETERS) != null && !(attributes.get(WorkflowNode.PARAMETERS) instanceof Map<?, ?>)) {
                findings.error(prefix + ".parameters", "parameters must be an object");
            }
            if (attributes.get(WorkflowNode.POSITION) != null && node.position().isEmpty()) {
                findings.error(prefix + ".position", "position must be two numbers");
            }
        }
        nameCounts.forEach((name, count) -> {
            if (count > 1) {
                findings.warning("nodes", "node name '" + name + "' is shared by " + count
                        + " nodes; connections addressing it are ambiguous");
            }
        });
    }

    /**
     * Checks every connection endpoint and returns the edges whose endpoints both resolve,
     * as {@code [sourceId, targetId]} pairs.
     */
    private static List<String[]> validateConnections(WorkflowGraph graph, Findings findings) {
        List<String[]> resolved = new ArrayList<>();
        graph.connections().forEach((source, buckets) -> {
            Optional<String> sourceId = resolveEndpoint(graph, source, "connections[" + source + "]", "source", findings);
            buckets.forEach((type, outputs) -> {
                String path = "connections[" + source + "]." + type;
                for (List<ConnectionTarget> output : outputs) {
                    for (ConnectionTarget target : output) {
                        if (JsonValues.isBlank(target.node())) {
                            findings.error(path, "connection target is missing 'node'");
                            continue;
                        }
                        Optional<String> targetId = resolveEndpoint(graph, target.node(), path, "target", findings);
                        if (sourceId.isPresent() && targetId.isPresent()) {
                            resolved.add(new String[]{sourceId.get(), targetId.get()});
                        }
                    }
                }
            });
        });
        return resolved;
    }

    private static Optional<String> resolveEndpoint(WorkflowGraph graph, String key, String field, String role, Findings findings) {
        Optional<String> id = graph.resolveKey(key);
        if (id.isEmpty()) {
            if (graph.isAmbiguousName(key)) {
                findings.error(field, role + " '" + key + "' is ambiguous: several nodes share this name");
            } else {
                findings.error(field, role + " '" + key + "' does not match any node id or name");
            }
        }
        return id;
    }

    private static Map<String, List<String>> adjacency(WorkflowGraph graph, List<String[]> edges) {
        Map<String, Set<String>> successors = new LinkedHashMap<>();
        for (WorkflowNode node : graph.nodes()) {
            if (!JsonValues.isBlank(node.id())) {
                successors.putIfAbsent(node.id(), new LinkedHashSet<>());
            }
        }
        for (String[] edge : edges) {
            successors.computeIfAbsent(edge[0], k -> new LinkedHashSet<>()).add(edge[1]);
        }
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        successors.forEach((id, next) -> adjacency.put(id, List.copyOf(next)));
        return adjacency;
    }

    private static String describeCycle(WorkflowGraph graph, List<String> cycle) {
        List<String> names = new ArrayList<>(cycle);
        names.add(cycle.get(0));
        return names.stream()
                .map(id -> graph.nameOf(id).orElse(id))
                .collect(Collectors.joining(" -> "));
    }

    private List<String> findOrphans(WorkflowGraph graph, Set<String> connected, Findings findings) {
        List<WorkflowNode> nodes = graph.nodes();
        if (nodes.size() <= 1) {
            return List.of();
        }
        List<String> orphans = new ArrayList<>();
        for (WorkflowNode node : nodes) {
            String id = node.id();
            if (JsonValues.isBlank(id) || connected.contains(id)) {
                continue;
            }
            NodeCategory category = classifier.classify(node);
            if (category == NodeCategory.SINK) {
                log.info("Standalone sink node accepted id={} name={} type={}", id, node.name(), node.type());
            } else if (category == NodeCategory.TRIGGER && nodes.size() <= 2) {
                log.info("Standalone trigger node accepted in small workflow id={} name={}", id, node.name());
            } else {
                orphans.add(id);
                findings.advisory("nodes[" + id + "]", "node '" + node.displayName() + "' has no connections");
            }
        }
        return orphans;
    }

    private List<String> findUnreachable(WorkflowGraph graph, Map<String, List<String>> adjacency,
                                         Set<String> connected, Findings findings) {
        List<String> triggers = graph.nodes().stream()
                .filter(n -> !JsonValues.isBlank(n.id()) && classifier.classify(n) == NodeCategory.TRIGGER)
                .map(WorkflowNode::id)
                .toList();
        if (triggers.isEmpty()) {
            log.debug("Skipping reachability check, workflow has no trigger node name={}", graph.name());
            return List.of();
        }
        Set<String> reached = new HashSet<>(triggers);
        Deque<String> frontier = new ArrayDeque<>(triggers);
        while (!frontier.isEmpty()) {
            for (String next : adjacency.getOrDefault(frontier.poll(), List.of())) {
                if (reached.add(next)) {
                    frontier.add(next);
                }
            }
        }
        List<String> unreachable = new ArrayList<>();
        for (WorkflowNode node : graph.nodes()) {
            String id = node.id();
            // isolated nodes are covered by the orphan check
            if (JsonValues.isBlank(id) || reached.contains(id) || !connected.contains(id) || unreachable.contains(id)) {
                continue;
            }
            unreachable.add(id);
            findings.advisory("nodes[" + id + "]", "node '" + node.displayName() + "' is not reachable from any trigger");
        }
        return unreachable;
    }

    private final class Findings {
        private final List<ValidationError> errors = new ArrayList<>();
        private final List<ValidationError> warnings = new ArrayList<>();

        void error(String field, String message) {
            errors.add(new ValidationError(field, message));
        }

        void warning(String field, String message) {
            warnings.add(new ValidationError(field, message));
        }

        /** Cycle, orphan and reachability findings; errors only in strict mode. */
        void advisory(String field, String message) {
            if (strict) {
                error(field, message);
            } else {
                warning(field, message);
            }
        }
    }
}
