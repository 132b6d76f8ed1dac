package com.example.flowmutator.service;

import com.example.flowmutator.diff.DiffReportRenderer;
import com.example.flowmutator.diff.WorkflowDiffer;
import com.example.flowmutator.diff.WorkflowHasher;
import com.example.flowmutator.domain.WorkflowGraphCodec;
import com.example.flowmutator.extraction.InstructionExtractor;
import com.example.flowmutator.llm.GenerationFailedException;
import com.example.flowmutator.mutation.WorkflowMutator;
import com.example.flowmutator.validation.HeuristicNodeClassifier;
import com.example.flowmutator.validation.WorkflowGraphValidator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tools.jackson.databind.json.JsonMapper;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("WorkflowModificationService")
class WorkflowModificationServiceTest {

    private static final String WORKFLOW = """
            {"name":"Ping","nodes":[
              {"id":"1","name":"Every hour","type":"n8n-nodes-base.scheduleTrigger","parameters":{}},
              {"id":"2","name":"Ping","type":"n8n-nodes-base.httpRequest","parameters":{"url":"https://a"}}],
             "connections":{"Every hour":{"main":[[{"node":"Ping","type":"main","index":0}]]}}}
            """;

    private final JsonMapper jsonMapper = JsonMapper.builder().build();
    private final WorkflowGraphCodec codec = new WorkflowGraphCodec(jsonMapper);
    private final WorkflowMutationService mutationService = new WorkflowMutationService(
            codec,
            new InstructionExtractor(jsonMapper),
            new WorkflowMutator(),
            new WorkflowGraphValidator(new HeuristicNodeClassifier(), false),
            new WorkflowDiffer(codec, new WorkflowHasher(codec, jsonMapper), 10, 100.0),
            new DiffReportRenderer(jsonMapper));

    @Test
    @DisplayName("applies the change-set proposed for the request")
    void appliesProposal() {
        AtomicReference<String> requested = new AtomicReference<>();
        WorkflowModificationService service = new WorkflowModificationService(codec, (graph, description) -> {
            requested.set(description);
            return "```json\n[{\"action\":\"modify_node\",\"details\":{\"node_id\":\"Ping\",\"parameters\":{\"url\":\"https://b\"}}}]\n```";
        }, mutationService);

        MutationResult result = service.modify(WORKFLOW, "Ping b instead of a");

        assertEquals("Ping b instead of a", requested.get());
        assertEquals(1, result.appliedCount());
        assertFalse(result.rolledBack());
        assertEquals("https://b", codec.parse(result.resultJson()).findNode("2").orElseThrow().parameters().get("url"));
    }

    @Test
    @DisplayName("a reply without a change-set leaves the workflow unchanged")
    void proseReply() {
        WorkflowModificationService service = new WorkflowModificationService(codec,
                (graph, description) -> "Sorry, I cannot help with that.", mutationService);
        MutationResult result = service.modify(WORKFLOW, "Do something");
        assertFalse(result.extracted());
        assertEquals(WORKFLOW, result.resultJson());
    }

    @Test
    @DisplayName("generation failures propagate")
    void generationFailure() {
        WorkflowModificationService service = new WorkflowModificationService(codec, (graph, description) -> {
            throw new GenerationFailedException("backend down");
        }, mutationService);
        assertThrows(GenerationFailedException.class, () -> service.modify(WORKFLOW, "anything"));
    }
}
