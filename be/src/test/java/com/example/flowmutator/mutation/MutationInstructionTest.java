package com.example.flowmutator.mutation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("MutationInstruction")
class MutationInstructionTest {

    private static Map<String, Object> element(String action, Map<String, Object> details) {
        return Map.of("action", action, "details", details);
    }

    @Nested
    @DisplayName("fromJson")
    class FromJson {

        @Test
        @DisplayName("accepts short aliases for endpoints and ids")
        void aliases() {
            MutationInstruction add = MutationInstruction.fromJson(
                    element("add_connection", Map.of("source", "A", "target", "B", "type", "ai_tool")));
            assertEquals(MutationAction.ADD_CONNECTION, add.action());
            assertEquals("A", add.text(MutationInstruction.SOURCE_NODE));
            assertEquals("B", add.text(MutationInstruction.TARGET_NODE));
            assertEquals("ai_tool", add.connectionType());
            assertFalse(add.has("source"));

            MutationInstruction node = MutationInstruction.fromJson(
                    element("add_node", Map.of("id", 3, "type", "emailSend", "name", "Email")));
            assertEquals("3", node.text(MutationInstruction.NODE_ID));
            assertEquals("emailSend", node.text(MutationInstruction.NODE_TYPE));
        }

        @Test
        @DisplayName("canonical keys win over aliases")
        void canonicalWins() {
            MutationInstruction instruction = MutationInstruction.fromJson(
                    element("remove_connection", Map.of("source_node", "A", "source", "Z", "target_node", "B")));
            assertEquals("A", instruction.text(MutationInstruction.SOURCE_NODE));
        }

        @Test
        @DisplayName("connection type defaults to main and index to 0")
        void defaults() {
            MutationInstruction instruction = MutationInstruction.fromJson(
                    element("add_connection", Map.of("source_node", "A", "target_node", "B")));
            assertEquals("main", instruction.connectionType());
            assertEquals(0, instruction.index());
        }

        @Test
        @DisplayName("rejects unknown actions, non-object elements and bad details")
        void rejectsMalformed() {
            assertThrows(InstructionValidationException.class, () -> MutationInstruction.fromJson("add_node"));
            assertThrows(InstructionValidationException.class,
                    () -> MutationInstruction.fromJson(element("rename_everything", Map.of())));
            assertThrows(InstructionValidationException.class,
                    () -> MutationInstruction.fromJson(Map.of("action", "remove_node", "details", List.of("1"))));
        }

        @Test
        @DisplayName("reports the first missing required key per action")
        void requiredKeys() {
            InstructionValidationException noType = assertThrows(InstructionValidationException.class,
                    () -> MutationInstruction.fromJson(element("add_node", Map.of("name", "X"))));
            assertThat(noType.getMessage()).isEqualTo("add_node requires 'node_type'");

            InstructionValidationException noTarget = assertThrows(InstructionValidationException.class,
                    () -> MutationInstruction.fromJson(element("modify_connection",
                            Map.of("source_node", "A", "old_target", "B"))));
            assertThat(noTarget.getMessage()).contains("new_target");

            assertThrows(InstructionValidationException.class,
                    () -> MutationInstruction.fromJson(Map.of("action", "remove_node")));
        }
    }

    @Test
    @DisplayName("describe gives a short form for logs")
    void describe() {
        MutationInstruction modify = MutationInstruction.fromJson(element("modify_connection",
                Map.of("source_node", "A", "old_target", "B", "new_target", "C")));
        assertEquals("modify_connection(A -> B => C)", modify.describe());
    }
}
