package com.example.flowmutator.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tools.jackson.databind.json.JsonMapper;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("InstructionExtractor")
class InstructionExtractorTest {

    private final InstructionExtractor extractor = new InstructionExtractor(JsonMapper.builder().build());

    private static final String ADD_NODE =
            "{\"action\":\"add_node\",\"details\":{\"node_id\":\"3\",\"node_type\":\"n8n-nodes-base.emailSend\"}}";

    private ExtractedPayload extract(String text) {
        return extractor.extract(text).orElseThrow(() -> new AssertionError("nothing extracted from: " + text));
    }

    @Nested
    @DisplayName("instruction lists")
    class InstructionLists {

        @Test
        @DisplayName("reads a bare JSON array")
        void bareArray() {
            ExtractedPayload payload = extract("[" + ADD_NODE + "]");
            assertEquals(PayloadShape.INSTRUCTION_LIST, payload.shape());
            assertEquals(ExtractionStrategy.BALANCED_SCAN, payload.strategy());
            assertEquals(1, ((List<?>) payload.value()).size());
        }

        @Test
        @DisplayName("ignores surrounding prose")
        void surroundingProse() {
            ExtractedPayload payload = extract("Sure! Here is the change:\n[" + ADD_NODE + "]\nLet me know if you need more.");
            assertEquals(PayloadShape.INSTRUCTION_LIST, payload.shape());
        }

        @Test
        @DisplayName("drops closed reasoning blocks")
        void reasoningBlocks() {
            String text = "<think>maybe [\"not this\"] or {\"action\":\"remove_node\"}</think>\n[" + ADD_NODE + "]";
            ExtractedPayload payload = extract(text);
            Map<?, ?> first = (Map<?, ?>) ((List<?>) payload.value()).get(0);
            assertEquals("add_node", first.get("action"));
        }

        @Test
        @DisplayName("recovers the answer after an unclosed reasoning tag")
        void unclosedReasoningTag() {
            ExtractedPayload payload = extract("<think>I should add an email node.\n[" + ADD_NODE + "]");
            assertEquals(PayloadShape.INSTRUCTION_LIST, payload.shape());
            Map<?, ?> first = (Map<?, ?>) ((List<?>) payload.value()).get(0);
            assertEquals("add_node", first.get("action"));
        }

        @Test
        @DisplayName("brackets inside string values do not end the span")
        void bracketsInsideStrings() {
            String text = "[{\"action\":\"modify_node\",\"details\":{\"node_id\":\"1\",\"parameters\":{\"text\":\"a ] and } here\"}}}]";
            ExtractedPayload payload = extract(text);
            assertEquals(ExtractionStrategy.BALANCED_SCAN, payload.strategy());
            assertEquals(text, payload.json());
        }

        @Test
        @DisplayName("keeps the last valid list when several are present")
        void lastListWins() {
            String first = "[{\"action\":\"remove_node\",\"details\":{\"node_id\":\"9\"}}]";
            ExtractedPayload payload = extract("Draft: " + first + "\nFinal: [" + ADD_NODE + "]");
            Map<?, ?> instruction = (Map<?, ?>) ((List<?>) payload.value()).get(0);
            assertEquals("add_node", instruction.get("action"));
        }

        @Test
        @DisplayName("falls back to a fenced block when the balanced scan finds nothing valid")
        void fencedBlock() {
            String text = "Broken { start\n```json\n[" + ADD_NODE + "]\n```";
            ExtractedPayload payload = extract(text);
            assertEquals(PayloadShape.INSTRUCTION_LIST, payload.shape());
            assertEquals(ExtractionStrategy.FENCED_BLOCK, payload.strategy());
        }

        @Test
        @DisplayName("finds an array inside an unclosed object")
        void arrayInsideUnclosedObject() {
            String list = "[{\"action\":\"remove_node\",\"details\":{\"node_id\":\"2\"}}]";
            ExtractedPayload payload = extract("Plan: { \"steps\": " + list);
            assertEquals(ExtractionStrategy.ARRAY_SPAN, payload.strategy());
            assertEquals(list, payload.json());
        }

        @Test
        @DisplayName("wraps a lone instruction object into a list")
        void loneObject() {
            ExtractedPayload payload = extract("Do this: " + ADD_NODE);
            assertEquals(PayloadShape.INSTRUCTION_LIST, payload.shape());
            assertEquals("[" + ADD_NODE + "]", payload.json());
            assertEquals(ExtractionStrategy.OBJECT_PATTERN, payload.strategy());
        }
    }

    @Nested
    @DisplayName("workflow objects")
    class WorkflowObjects {

        @Test
        @DisplayName("recognises a whole workflow")
        void wholeWorkflow() {
            ExtractedPayload payload = extract("Updated workflow:\n{\"name\":\"W\",\"nodes\":[],\"connections\":{}}");
            assertEquals(PayloadShape.WORKFLOW_GRAPH, payload.shape());
            assertTrue(payload.value() instanceof Map<?, ?>);
        }

        @Test
        @DisplayName("falls back to the one line that parses")
        void singleParsableLine() {
            String workflow = "{\"name\":\"W\",\"nodes\":[{\"id\":\"1\",\"name\":\"A\",\"type\":\"t\"}],"
                    + "\"connections\":{\"A\":{\"main\":[[{\"node\":\"A\",\"type\":\"main\",\"index\":0}]]}}}";
            ExtractedPayload payload = extract("{ \"draft\": [\n" + workflow + "\nthat is all");
            assertEquals(ExtractionStrategy.LINE_SCAN, payload.strategy());
            assertEquals(PayloadShape.WORKFLOW_GRAPH, payload.shape());
            assertEquals(workflow, payload.json());
        }
    }

    @Nested
    @DisplayName("nothing to extract")
    class NothingToExtract {

        @Test
        @DisplayName("blank and prose-only text")
        void blankAndProse() {
            assertEquals(Optional.empty(), extractor.extract(null));
            assertEquals(Optional.empty(), extractor.extract("   "));
            assertEquals(Optional.empty(), extractor.extract("I could not work out what to change."));
        }

        @Test
        @DisplayName("an empty list and lists without known actions")
        void emptyOrUnknown() {
            assertEquals(Optional.empty(), extractor.extract("[]"));
            assertEquals(Optional.empty(), extractor.extract("[{\"action\":\"explode\"}]"));
            assertEquals(Optional.empty(), extractor.extract("[1, 2, 3]"));
        }
    }

    @Test
    @DisplayName("stripReasoning removes closed think blocks case-insensitively")
    void stripReasoning() {
        assertEquals("answer", InstructionExtractor.stripReasoning("<THINK>x</THINK> answer "));
        assertEquals("before <think> never closed", InstructionExtractor.stripReasoning("before <think> never closed"));
    }
}
