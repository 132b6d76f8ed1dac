package com.example.flowmutator.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WorkflowGraph")
class WorkflowGraphTest {

    private static WorkflowGraph sample() {
        return WorkflowGraph.builder()
                .property("name", "Sample")
                .node(WorkflowNode.of("1", "Start", "manualTrigger", Map.of("a", 1), List.of(0, 0)))
                .node(WorkflowNode.of("2", "Send", "emailSend", Map.of(), List.of(200, 0)))
                .connection("Start", "main", List.of(List.of(new ConnectionTarget("2", "main", 0))))
                .build();
    }

    @Nested
    @DisplayName("key resolution")
    class KeyResolution {

        @Test
        @DisplayName("resolves ids first, then names")
        void idsThenNames() {
            WorkflowGraph graph = sample();
            assertEquals(Optional.of("1"), graph.resolveKey("1"));
            assertEquals(Optional.of("1"), graph.resolveKey("Start"));
            assertEquals(Optional.empty(), graph.resolveKey("Missing"));
        }

        @Test
        @DisplayName("a name shared by two nodes is ambiguous and never resolved")
        void duplicateNamesAreAmbiguous() {
            WorkflowGraph graph = WorkflowGraph.builder()
                    .property("name", "Dup")
                    .node(WorkflowNode.of("a", "Same", "t", null, null))
                    .node(WorkflowNode.of("b", "Same", "t", null, null))
                    .build();
            assertTrue(graph.isAmbiguousName("Same"));
            assertEquals(Optional.empty(), graph.resolveKey("Same"));
            assertEquals(Optional.of("a"), graph.resolveKey("a"));
        }

        @Test
        @DisplayName("an id wins over another node's name")
        void idWinsOverName() {
            WorkflowGraph graph = WorkflowGraph.builder()
                    .property("name", "Clash")
                    .node(WorkflowNode.of("X", "First", "t", null, null))
                    .node(WorkflowNode.of("2", "X", "t", null, null))
                    .build();
            assertEquals(Optional.of("X"), graph.resolveKey("X"));
            assertFalse(graph.isAmbiguousName("X"));
        }
    }

    @Nested
    @DisplayName("immutability")
    class Immutability {

        @Test
        @DisplayName("the builder from toBuilder is a deep copy")
        void toBuilderIsDeepCopy() {
            WorkflowGraph graph = sample();
            WorkflowGraph.Builder builder = graph.toBuilder();
            builder.connections().get("Start").get("main").get(0).clear();
            builder.nodes().remove(1);
            WorkflowGraph changed = builder.build();

            assertEquals(2, graph.nodes().size());
            assertEquals(1, graph.edges().size());
            assertEquals(1, changed.nodes().size());
            assertTrue(changed.edges().isEmpty());
            assertNotEquals(graph, changed);
        }

        @Test
        @DisplayName("exposed collections cannot be modified")
        void collectionsAreUnmodifiable() {
            WorkflowGraph graph = sample();
            assertThrows(UnsupportedOperationException.class, () -> graph.nodes().clear());
            assertThrows(UnsupportedOperationException.class, () -> graph.connections().clear());
            assertThrows(UnsupportedOperationException.class, () -> graph.nodes().get(0).parameters().put("b", 2));
        }

        @Test
        @DisplayName("caller collections are copied on build")
        void callerCollectionsAreCopied() {
            List<ConnectionTarget> output = new ArrayList<>(List.of(new ConnectionTarget("2", "main", 0)));
            WorkflowGraph graph = WorkflowGraph.builder()
                    .property("name", "Copy")
                    .node(WorkflowNode.of("1", "Start", "t", null, null))
                    .node(WorkflowNode.of("2", "End", "t", null, null))
                    .connection("1", "main", List.of(output))
                    .build();
            output.clear();
            assertEquals(1, graph.edges().size());
        }
    }

    @Test
    @DisplayName("nameOf and defaults for absent properties")
    void accessors() {
        WorkflowGraph graph = sample();
        assertEquals(Optional.of("Send"), graph.nameOf("2"));
        assertTrue(graph.active());
        assertTrue(graph.settings().isEmpty());
        assertEquals(List.of(new GraphEdge("Start", "2", "main")), graph.edges());
    }
}
