package com.example.flowmutator.diff;

import com.example.flowmutator.domain.WorkflowGraph;
import com.example.flowmutator.domain.WorkflowGraphCodec;
import com.example.flowmutator.domain.WorkflowNode;

import lombok.RequiredArgsConstructor;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content fingerprint of a workflow: SHA-256 over a canonical JSON form, truncated to
 * 16 hex characters.
 * <p>
 * The canonical form holds {@code name} (default empty), the nodes sorted by id,
 * the connections, {@code settings} (default empty) and {@code active} (default true),
 * with all object keys sorted. Node order and key order therefore do not change the hash.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class WorkflowHasher {

    static final int HASH_LENGTH = 16;

    private final WorkflowGraphCodec codec;
    private final JsonMapper jsonMapper;

    public String hash(WorkflowGraph graph) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("name", graph.name() != null ? graph.name() : "");
        List<WorkflowNode> nodes = new ArrayList<>(graph.nodes());
        nodes.sort(Comparator.comparing(n -> n.id() != null ? n.id() : ""));
        normalized.put("nodes", nodes.stream().map(WorkflowNode::attributes).toList());
        normalized.put("connections", codec.toMap(graph).get("connections"));
        normalized.put("settings", graph.settings());
        normalized.put("active", graph.active());
        try {
            return digest(jsonMapper.writeValueAsString(canonical(normalized)));
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize workflow for hashing", e);
        }
    }

    /** Hash of the raw text, for documents that cannot be parsed. */
    public String hashRaw(String text) {
        return digest(text != null ? text : "");
    }

    private static Object canonical(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), canonical(v)));
            return sorted;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(WorkflowHasher::canonical).toList();
        }
        return value;
    }

    private static String digest(String text) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha256.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
