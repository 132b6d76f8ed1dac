package com.example.flowmutator.mutation;

import com.example.flowmutator.domain.ConnectionTarget;
import com.example.flowmutator.domain.JsonValues;
import com.example.flowmutator.domain.NodeKeyIndex;
import com.example.flowmutator.domain.WorkflowGraph;
import com.example.flowmutator.domain.WorkflowNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import static com.example.flowmutator.mutation.MutationInstruction.NAME;
import static com.example.flowmutator.mutation.MutationInstruction.NEW_TARGET;
import static com.example.flowmutator.mutation.MutationInstruction.NODE_ID;
import static com.example.flowmutator.mutation.MutationInstruction.NODE_TYPE;
import static com.example.flowmutator.mutation.MutationInstruction.OLD_TARGET;
import static com.example.flowmutator.mutation.MutationInstruction.PARAMETERS;
import static com.example.flowmutator.mutation.MutationInstruction.POSITION;
import static com.example.flowmutator.mutation.MutationInstruction.SOURCE_NODE;
import static com.example.flowmutator.mutation.MutationInstruction.TARGET_NODE;

/**
 * Applies a change-set to a workflow graph.
 * <p>
 * Works on a deep copy; the input graph is never modified. Instructions run once each,
 * in list order, after {@link ConflictResolver}. A failing or ineffective instruction is
 * logged at WARN and recorded in {@link MutationOutcome#skipped()}; the remaining
 * instructions still run. Whether the result is structurally sound is for the validator
 * to decide.
 * </p>
 */
public class WorkflowMutator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowMutator.class);

    static final String DEFAULT_NODE_TYPE = "n8n-nodes-base.noOp";

    /**
     * Parses raw change-set elements and applies the well-formed ones. Malformed elements
     * are skipped with their validation message.
     */
    public MutationOutcome applyChangeSet(WorkflowGraph graph, List<?> elements) {
        List<MutationInstruction> instructions = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            try {
                instructions.add(MutationInstruction.fromJson(elements.get(i)));
            } catch (InstructionValidationException e) {
                log.warn("Dropped invalid instruction position={} reason={}", i, e.getMessage());
                rejected.add("instruction " + i + ": " + e.getMessage());
            }
        }
        MutationOutcome outcome = apply(graph, instructions);
        if (rejected.isEmpty()) {
            return outcome;
        }
        rejected.addAll(outcome.skipped());
        return new MutationOutcome(outcome.graph(), outcome.appliedCount(), rejected);
    }

    public MutationOutcome apply(WorkflowGraph graph, List<MutationInstruction> instructions) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(instructions, "instructions");
        List<MutationInstruction> resolved = ConflictResolver.resolve(graph, instructions);
        WorkflowGraph.Builder working = graph.toBuilder();
        int applied = 0;
        List<String> skipped = new ArrayList<>();
        for (MutationInstruction instruction : resolved) {
            try {
                if (applyOne(working, instruction)) {
                    applied++;
                    log.debug("Applied instruction {}", instruction.describe());
                } else {
                    log.warn("Instruction had no effect {}", instruction.describe());
                    skipped.add(instruction.describe() + ": no matching element, nothing changed");
                }
            } catch (InstructionApplicationException e) {
                log.warn("Skipped instruction {} reason={}", instruction.describe(), e.getMessage());
                skipped.add(instruction.describe() + ": " + e.getMessage());
            }
        }
        log.info("Applied change-set instructions={} applied={} skipped={}", instructions.size(), applied, skipped.size());
        return new MutationOutcome(working.build(), applied, skipped);
    }

    private boolean applyOne(WorkflowGraph.Builder working, MutationInstruction instruction) {
        return switch (instruction.action()) {
            case ADD_NODE -> addNode(working, instruction);
            case MODIFY_NODE -> modifyNode(working, instruction);
            case REMOVE_NODE -> removeNode(working, instruction);
            case ADD_CONNECTION -> addConnection(working, instruction);
            case MODIFY_CONNECTION -> modifyConnection(working, instruction);
            case REMOVE_CONNECTION -> removeConnection(working, instruction);
        };
    }

    private boolean addNode(WorkflowGraph.Builder working, MutationInstruction instruction) {
        int ordinal = working.nodes().size() + 1;
        String id = instruction.text(NODE_ID);
        String name = instruction.text(NAME);
        String type = instruction.text(NODE_TYPE);
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(WorkflowNode.ID, JsonValues.isBlank(id) ? String.valueOf(ordinal) : id);
        attributes.put(WorkflowNode.NAME, JsonValues.isBlank(name) ? "New Node " + ordinal : name);
        attributes.put(WorkflowNode.TYPE, JsonValues.isBlank(type) ? DEFAULT_NODE_TYPE : type);
        attributes.put(WorkflowNode.PARAMETERS, instruction.get(PARAMETERS) instanceof Map<?, ?> p ? p : Map.of());
        attributes.put(WorkflowNode.POSITION, instruction.get(POSITION) instanceof List<?> p ? p : List.of(0, 0));
        working.node(new WorkflowNode(attributes));
        return true;
    }

    private boolean modifyNode(WorkflowGraph.Builder working, MutationInstruction instruction) {
        String key = instruction.text(NODE_ID);
        int position = locate(working, instruction, key);
        if (position < 0) {
            return false;
        }
        WorkflowNode original = working.nodes().get(position);
        WorkflowNode updated = original;
        if (instruction.has(PARAMETERS)) {
            if (!(instruction.get(PARAMETERS) instanceof Map<?, ?> changes)) {
                throw new InstructionApplicationException(instruction.action(), "parameters must be an object");
            }
            Map<String, Object> merged = JsonValues.thawMap(original.parameters());
            changes.forEach((k, v) -> merged.put(String.valueOf(k), v));
            updated = updated.withParameters(merged);
        }
        String newName = instruction.text(NAME);
        if (!JsonValues.isBlank(newName)) {
            // ids resolve before names, so such a name would address the other node
            if (!newName.equals(original.id()) && working.index().ids().contains(newName)) {
                throw new InstructionApplicationException(instruction.action(),
                        "name '" + newName + "' is the id of another node");
            }
            updated = updated.withName(newName);
        }
        if (updated.equals(original)) {
            return false;
        }
        working.nodes().set(position, updated);
        String oldName = original.name();
        if (!JsonValues.isBlank(newName) && !JsonValues.isBlank(oldName) && !oldName.equals(newName)) {
            renameConnectionKeys(working, oldName, newName);
        }
        return true;
    }

    /**
     * Rewrites connection keys that addressed a renamed node by its old name. Skipped when the
     * old name still identifies another node, since those keys then belong to it.
     */
    private static void renameConnectionKeys(WorkflowGraph.Builder working, String oldName, String newName) {
        NodeKeyIndex index = working.index();
        if (index.ids().contains(oldName) || working.nodes().stream().anyMatch(n -> oldName.equals(n.name()))) {
            return;
        }
        Map<String, Map<String, List<List<ConnectionTarget>>>> connections = working.connections();
        Map<String, List<List<ConnectionTarget>>> moved = connections.remove(oldName);
        if (moved != null) {
            Map<String, List<List<ConnectionTarget>>> existing = connections.get(newName);
            if (existing == null) {
                connections.put(newName, moved);
            } else {
                moved.forEach((type, outputs) -> mergeOutputs(existing.computeIfAbsent(type, t -> new ArrayList<>()), outputs));
            }
        }
        forEachOutput(connections, output -> output.replaceAll(t -> oldName.equals(t.node()) ? t.withNode(newName) : t));
        log.debug("Rewrote connection keys after rename old={} new={}", oldName, newName);
    }

    private static void mergeOutputs(List<List<ConnectionTarget>> into, List<List<ConnectionTarget>> from) {
        for (int i = 0; i < from.size(); i++) {
            if (i < into.size()) {
                into.get(i).addAll(from.get(i));
            } else {
                into.add(from.get(i));
            }
        }
    }

    private boolean removeNode(WorkflowGraph.Builder working, MutationInstruction instruction) {
        String key = instruction.text(NODE_ID);
        int position = locate(working, instruction, key);
        if (position < 0) {
            return false;
        }
        NodeKeyIndex before = working.index();
        WorkflowNode removed = working.nodes().remove(position);
        String id = removed.id();
        Map<String, Map<String, List<List<ConnectionTarget>>>> connections = working.connections();
        connections.keySet().removeIf(source -> source.equals(id) || before.resolve(source).filter(id::equals).isPresent());
        forEachOutput(connections, output -> output.removeIf(t ->
                id != null && (id.equals(t.node()) || before.resolve(t.node()).filter(id::equals).isPresent())));
        log.debug("Removed node id={} name={}", id, removed.name());
        return true;
    }

    private boolean addConnection(WorkflowGraph.Builder working, MutationInstruction instruction) {
        NodeKeyIndex index = working.index();
        String sourceName = endpoint(index, instruction, instruction.text(SOURCE_NODE), "source");
        String targetName = endpoint(index, instruction, instruction.text(TARGET_NODE), "target");
        String type = instruction.connectionType();
        String sourceKey = existingSourceKey(working, index, sourceName).orElse(sourceName);

        List<List<ConnectionTarget>> outputs = working.connections()
                .computeIfAbsent(sourceKey, k -> new LinkedHashMap<>())
                .computeIfAbsent(type, t -> new ArrayList<>());
        if (outputs.isEmpty()) {
            outputs.add(new ArrayList<>());
        }
        boolean duplicate = outputs.get(0).stream()
                .anyMatch(t -> t.index() == instruction.index() && index.sameNode(t.node(), targetName));
        if (duplicate) {
            return false;
        }
        outputs.get(0).add(new ConnectionTarget(targetName, type, instruction.index()));
        return true;
    }

    private boolean modifyConnection(WorkflowGraph.Builder working, MutationInstruction instruction) {
        NodeKeyIndex index = working.index();
        String oldTarget = instruction.text(OLD_TARGET);
        String newTarget = endpoint(index, instruction, instruction.text(NEW_TARGET), "new target");
        String type = instruction.connectionType();
        for (String sourceKey : sourceKeys(index, instruction.text(SOURCE_NODE))) {
            Map<String, List<List<ConnectionTarget>>> buckets = working.connections().get(sourceKey);
            List<List<ConnectionTarget>> outputs = buckets != null ? buckets.get(type) : null;
            if (outputs == null) {
                continue;
            }
            for (List<ConnectionTarget> output : outputs) {
                for (int i = 0; i < output.size(); i++) {
                    if (index.sameNode(output.get(i).node(), oldTarget)) {
                        output.set(i, output.get(i).withNode(newTarget));
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private boolean removeConnection(WorkflowGraph.Builder working, MutationInstruction instruction) {
        NodeKeyIndex index = working.index();
        String target = instruction.text(TARGET_NODE);
        boolean changed = false;
        for (String sourceKey : sourceKeys(index, instruction.text(SOURCE_NODE))) {
            Map<String, List<List<ConnectionTarget>>> buckets = working.connections().get(sourceKey);
            if (buckets == null) {
                continue;
            }
            for (List<List<ConnectionTarget>> outputs : buckets.values()) {
                for (List<ConnectionTarget> output : outputs) {
                    changed |= output.removeIf(t -> index.sameNode(t.node(), target));
                }
            }
        }
        return changed;
    }

    /**
     * Position of the node addressed by {@code key}: by id, or by name when no id matches.
     * Returns -1 when absent; an ambiguous name fails the instruction.
     */
    private static int locate(WorkflowGraph.Builder working, MutationInstruction instruction, String key) {
        NodeKeyIndex index = working.index();
        if (index.isAmbiguous(key)) {
            throw new InstructionApplicationException(instruction.action(), "node name '" + key + "' is ambiguous");
        }
        Optional<String> id = index.resolve(key);
        if (id.isEmpty()) {
            return -1;
        }
        List<WorkflowNode> nodes = working.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            if (id.get().equals(nodes.get(i).id())) {
                return i;
            }
        }
        return -1;
    }

    /** Resolves a connection endpoint to the key used in the connections structure (the node name). */
    private static String endpoint(NodeKeyIndex index, MutationInstruction instruction, String key, String role) {
        if (index.isAmbiguous(key)) {
            throw new InstructionApplicationException(instruction.action(), role + " '" + key + "' is ambiguous");
        }
        return index.connectionKeyOf(key).orElseThrow(() ->
                new InstructionApplicationException(instruction.action(), role + " '" + key + "' does not match any node"));
    }

    /** Source entry already stored for the node, under its name or its id. */
    private static Optional<String> existingSourceKey(WorkflowGraph.Builder working, NodeKeyIndex index, String sourceName) {
        if (working.connections().containsKey(sourceName)) {
            return Optional.of(sourceName);
        }
        return index.resolve(sourceName).filter(working.connections()::containsKey);
    }

    /** Keys a source may be stored under, in lookup order: name, id, then the key as given. */
    private static Set<String> sourceKeys(NodeKeyIndex index, String source) {
        Set<String> keys = new LinkedHashSet<>();
        index.connectionKeyOf(source).ifPresent(keys::add);
        index.resolve(source).ifPresent(keys::add);
        if (source != null) {
            keys.add(source);
        }
        return keys;
    }

    private static void forEachOutput(Map<String, Map<String, List<List<ConnectionTarget>>>> connections,
                                      Consumer<List<ConnectionTarget>> action) {
        connections.values().forEach(buckets -> buckets.values().forEach(outputs -> outputs.forEach(action)));
    }
}
