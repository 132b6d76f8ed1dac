package com.example.flowmutator.validation;

import com.example.flowmutator.domain.WorkflowNode;

import java.util.List;
import java.util.Locale;

/**
 * Substring-based node classification over the node type and name.
 * <p>
 * Response nodes are sinks even though their type often mentions the webhook they answer.
 * Triggers are recognised from the type alone; sinks and utility nodes from type or name.
 * </p>
 */
public class HeuristicNodeClassifier implements NodeClassifier {

    private static final List<String> RESPONSE_KEYWORDS = List.of("respond", "response");

    private static final List<String> TRIGGER_KEYWORDS = List.of("trigger", "webhook", "schedule");

    private static final List<String> SINK_KEYWORDS = List.of(
            "no operation", "noop", "stop and error", "stopanderror", "merge",
            "http request", "httprequest", "database", "mysql", "postgres", "mongodb",
            "redis", "elasticsearch", "graphql",
            "email", "slack", "discord", "telegram", "sms",
            "file", "csv", "json", "xml", "pdf", "excel",
            "transform", "filter", "sort", "aggregate", "calculate"
    );

    @Override
    public NodeCategory classify(WorkflowNode node) {
        String type = lower(node.type());
        String name = lower(node.name());
        if (containsAny(type, RESPONSE_KEYWORDS) || containsAny(name, RESPONSE_KEYWORDS)) {
            return NodeCategory.SINK;
        }
        if (containsAny(type, TRIGGER_KEYWORDS)) {
            return NodeCategory.TRIGGER;
        }
        if (containsAny(type, SINK_KEYWORDS) || containsAny(name, SINK_KEYWORDS)) {
            return NodeCategory.SINK;
        }
        return NodeCategory.OTHER;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String value, List<String> keywords) {
        return !value.isEmpty() && keywords.stream().anyMatch(value::contains);
    }
}
