package com.example.flowmutator.validation;

import com.example.flowmutator.domain.WorkflowNode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("HeuristicNodeClassifier")
class HeuristicNodeClassifierTest {

    private final NodeClassifier classifier = new HeuristicNodeClassifier();

    @ParameterizedTest(name = "{0} / {1} -> {2}")
    @CsvSource({
            "n8n-nodes-base.webhook, Incoming, TRIGGER",
            "n8n-nodes-base.scheduleTrigger, Every hour, TRIGGER",
            "n8n-nodes-base.respondToWebhook, Reply, SINK",
            "n8n-nodes-base.code, Webhook Response, SINK",
            "n8n-nodes-base.emailSend, Mail, SINK",
            "n8n-nodes-base.code, Write to database, SINK",
            "n8n-nodes-base.noOp, Done, SINK",
            "n8n-nodes-base.code, Process, OTHER",
            "n8n-nodes-base.if, Check, OTHER"
    })
    @DisplayName("classifies by type and name")
    void classifies(String type, String name, NodeCategory expected) {
        assertEquals(expected, classifier.classify(WorkflowNode.of("1", name, type, null, null)));
    }
}
