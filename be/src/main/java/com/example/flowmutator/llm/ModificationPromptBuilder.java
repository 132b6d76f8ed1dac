package com.example.flowmutator.llm;

import com.example.flowmutator.domain.WorkflowGraph;
import com.example.flowmutator.domain.WorkflowGraphCodec;
import com.example.flowmutator.domain.WorkflowNode;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the prompt that asks a model for a JSON change-set.
 * <p>
 * Only node ids, names and types plus the connection map are sent; parameters and
 * positions are left out to keep the prompt small.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class ModificationPromptBuilder {

    static final String SYSTEM_PROMPT =
            "You edit automation workflows. You answer with a JSON array of change instructions and nothing else.";

    private static final String TEMPLATE = """
            Modify the workflow. Respond with JSON only.

            Current workflow:
            %s

            Request: %s

            IMPORTANT: When adding nodes, you MUST also create connections to integrate them into the workflow flow. Isolated nodes will be rejected.

            CONNECTION RULES:
            - Use "add_connection" to create NEW connections between existing nodes
            - Use "modify_connection" to CHANGE an existing connection to point to a different target
            - NEVER use both add_connection AND modify_connection for the same source->target pair

            Example for adding an email node and redirecting an existing connection:
            [
              {"action":"add_node","details":{"node_id":"email-node","name":"Send Email","node_type":"n8n-nodes-base.emailSend","parameters":{"to":"user@example.com","subject":"Workflow Complete"},"position":[1000,300]}},
              {"action":"modify_connection","details":{"source_node":"process-data","old_target":"webhook-response","new_target":"email-node","connection_type":"main"}}
            ]

            Valid actions: add_node, modify_node, remove_node, add_connection, modify_connection, remove_connection
            Return ONLY a valid JSON array. No thinking tags, no code fences, no explanations.""";

    private final WorkflowGraphCodec codec;
    private final JsonMapper jsonMapper;

    public String build(WorkflowGraph graph, String description) {
        return TEMPLATE.formatted(simplified(graph), description == null ? "" : description.trim());
    }

    private String simplified(WorkflowGraph graph) {
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (WorkflowNode node : graph.nodes()) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put(WorkflowNode.ID, node.id());
            summary.put(WorkflowNode.NAME, node.name());
            summary.put(WorkflowNode.TYPE, node.type());
            nodes.add(summary);
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("name", graph.name() == null ? "" : graph.name());
        document.put("nodes", nodes);
        document.put("connections", codec.toMap(graph).get("connections"));
        try {
            return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize workflow for prompt", e);
        }
    }
}
