package com.example.flowmutator.domain;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a connection key (node id or node name) to a node id.
 * <p>
 * Ids are checked first, then names. A name carried by more than one node that
 * matches no id is ambiguous and does not resolve: there is no defined tie-break,
 * so callers report it instead of picking one of the nodes.
 * </p>
 */
public final class NodeKeyIndex {

    private final Set<String> ids;
    private final Map<String, List<String>> idsByName;
    private final Map<String, String> nameById;

    private NodeKeyIndex(Set<String> ids, Map<String, List<String>> idsByName, Map<String, String> nameById) {
        this.ids = ids;
        this.idsByName = idsByName;
        this.nameById = nameById;
    }

    public static NodeKeyIndex of(List<WorkflowNode> nodes) {
        Set<String> ids = new LinkedHashSet<>();
        Map<String, List<String>> idsByName = new HashMap<>();
        Map<String, String> nameById = new HashMap<>();
        for (WorkflowNode node : nodes) {
            String id = node.id();
            if (JsonValues.isBlank(id)) {
                continue;
            }
            ids.add(id);
            String name = node.name();
            if (!JsonValues.isBlank(name)) {
                idsByName.computeIfAbsent(name, k -> new ArrayList<>()).add(id);
                nameById.putIfAbsent(id, name);
            }
        }
        return new NodeKeyIndex(ids, idsByName, nameById);
    }

    public Optional<String> resolve(String key) {
        if (JsonValues.isBlank(key)) {
            return Optional.empty();
        }
        if (ids.contains(key)) {
            return Optional.of(key);
        }
        List<String> byName = idsByName.get(key);
        if (byName != null && byName.size() == 1) {
            return Optional.of(byName.get(0));
        }
        return Optional.empty();
    }

    public boolean isAmbiguous(String key) {
        if (JsonValues.isBlank(key) || ids.contains(key)) {
            return false;
        }
        List<String> byName = idsByName.get(key);
        return byName != null && byName.size() > 1;
    }

    /**
     * Name under which the node is addressed in the connections structure; the id if the node has no name.
     */
    public Optional<String> connectionKeyOf(String key) {
        return resolve(key).map(id -> nameById.getOrDefault(id, id));
    }

    /** True when both keys resolve to the same node, or are literally equal. */
    public boolean sameNode(String a, String b) {
        if (a != null && a.equals(b)) {
            return true;
        }
        Optional<String> left = resolve(a);
        return left.isPresent() && left.equals(resolve(b));
    }

    public Set<String> ids() {
        return ids;
    }
}
