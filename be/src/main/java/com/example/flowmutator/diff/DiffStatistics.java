package com.example.flowmutator.diff;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters of a {@link WorkflowDiff}.
 */
public record DiffStatistics(int nodesAdded,
                             int nodesRemoved,
                             int nodesModified,
                             int connectionsAdded,
                             int connectionsRemoved,
                             int parametersChanged,
                             int workflowSettingsChanged) {

    public boolean hasChanges() {
        return nodesAdded + nodesRemoved + nodesModified + connectionsAdded + connectionsRemoved
                + workflowSettingsChanged > 0;
    }

    /**
     * One-line summary such as {@code Added 2 node(s); Modified 1 parameter(s)}.
     */
    public String summary() {
        List<String> parts = new ArrayList<>();
        addPart(parts, "Added", nodesAdded, "node(s)");
        addPart(parts, "Removed", nodesRemoved, "node(s)");
        addPart(parts, "Modified", nodesModified, "node(s)");
        addPart(parts, "Added", connectionsAdded, "connection(s)");
        addPart(parts, "Removed", connectionsRemoved, "connection(s)");
        addPart(parts, "Modified", parametersChanged, "parameter(s)");
        addPart(parts, "Modified", workflowSettingsChanged, "workflow setting(s)");
        return parts.isEmpty() ? "No changes detected" : String.join("; ", parts);
    }

    private static void addPart(List<String> parts, String verb, int count, String noun) {
        if (count > 0) {
            parts.add(verb + " " + count + " " + noun);
        }
    }
}
