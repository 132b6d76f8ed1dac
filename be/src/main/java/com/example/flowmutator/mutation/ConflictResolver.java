package com.example.flowmutator.mutation;

import com.example.flowmutator.domain.GraphEdge;
import com.example.flowmutator.domain.JsonValues;
import com.example.flowmutator.domain.NodeKeyIndex;
import com.example.flowmutator.domain.WorkflowGraph;
import com.example.flowmutator.domain.WorkflowNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.example.flowmutator.mutation.MutationInstruction.NAME;
import static com.example.flowmutator.mutation.MutationInstruction.NEW_TARGET;
import static com.example.flowmutator.mutation.MutationInstruction.NODE_ID;
import static com.example.flowmutator.mutation.MutationInstruction.NODE_TYPE;
import static com.example.flowmutator.mutation.MutationInstruction.OLD_TARGET;
import static com.example.flowmutator.mutation.MutationInstruction.SOURCE_NODE;
import static com.example.flowmutator.mutation.MutationInstruction.TARGET_NODE;

/**
 * Drops {@code add_connection} instructions that duplicate the edge a
 * {@code modify_connection} in the same change-set will produce.
 * <p>
 * Model output often describes a rewired edge twice: once as
 * {@code modify_connection(S, X -> T)} and once as {@code add_connection(S, T)}. When the
 * modify can take effect (the graph has an edge {@code S -> X} of that connection type, or
 * an earlier {@code add_connection(S, X)} creates it) the matching add is dropped. When it
 * cannot, the modify will be a no-op and the add is kept, so exactly one {@code S -> T}
 * edge results either way. Endpoints are compared after id/name resolution against the
 * input graph plus the nodes declared by {@code add_node} instructions of the same
 * change-set, so a new node matches whether it is addressed by id or by name.
 * Surviving instructions keep their relative order.
 * </p>
 */
public final class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    private ConflictResolver() {
    }

    public static List<MutationInstruction> resolve(WorkflowGraph graph, List<MutationInstruction> instructions) {
        NodeKeyIndex index = plannedIndex(graph, instructions);
        Set<Integer> dropped = new HashSet<>();
        for (int m = 0; m < instructions.size(); m++) {
            MutationInstruction modify = instructions.get(m);
            if (modify.action() != MutationAction.MODIFY_CONNECTION) {
                continue;
            }
            String source = modify.text(SOURCE_NODE);
            String type = modify.connectionType();
            if (!canTakeEffect(graph, index, instructions.subList(0, m), source, modify.text(OLD_TARGET), type)) {
                log.debug("Modify cannot take effect, keeping matching adds instruction={}", modify.describe());
                continue;
            }
            for (int a = 0; a < instructions.size(); a++) {
                MutationInstruction add = instructions.get(a);
                if (!dropped.contains(a)
                        && add.action() == MutationAction.ADD_CONNECTION
                        && type.equals(add.connectionType())
                        && index.sameNode(add.text(SOURCE_NODE), source)
                        && index.sameNode(add.text(TARGET_NODE), modify.text(NEW_TARGET))) {
                    dropped.add(a);
                    log.info("Dropped duplicate add_connection {} in favour of {}", add.describe(), modify.describe());
                    break;
                }
            }
        }
        if (dropped.isEmpty()) {
            return instructions;
        }
        List<MutationInstruction> resolved = new ArrayList<>(instructions.size() - dropped.size());
        for (int i = 0; i < instructions.size(); i++) {
            if (!dropped.contains(i)) {
                resolved.add(instructions.get(i));
            }
        }
        log.info("Conflict resolution kept {} of {} instructions", resolved.size(), instructions.size());
        return resolved;
    }

    private static NodeKeyIndex plannedIndex(WorkflowGraph graph, List<MutationInstruction> instructions) {
        List<WorkflowNode> nodes = new ArrayList<>(graph.nodes());
        for (MutationInstruction instruction : instructions) {
            if (instruction.action() == MutationAction.ADD_NODE && !JsonValues.isBlank(instruction.text(NODE_ID))) {
                nodes.add(WorkflowNode.of(instruction.text(NODE_ID), instruction.text(NAME), instruction.text(NODE_TYPE), null, null));
            }
        }
        return nodes.size() == graph.nodes().size() ? graph.index() : NodeKeyIndex.of(nodes);
    }

    private static boolean canTakeEffect(WorkflowGraph graph, NodeKeyIndex index, List<MutationInstruction> earlier,
                                         String source, String oldTarget, String type) {
        for (GraphEdge edge : graph.edges()) {
            if (type.equals(edge.connectionType())
                    && index.sameNode(edge.source(), source)
                    && index.sameNode(edge.target(), oldTarget)) {
                return true;
            }
        }
        return earlier.stream().anyMatch(i -> i.action() == MutationAction.ADD_CONNECTION
                && type.equals(i.connectionType())
                && index.sameNode(i.text(SOURCE_NODE), source)
                && index.sameNode(i.text(TARGET_NODE), oldTarget));
    }
}
