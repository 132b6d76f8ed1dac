package com.example.flowmutator.api.v1;

import com.example.flowmutator.llm.OpenRouterChatModelFactory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * GET /api/v1/health returns 200 with status, service name and whether the generation
 * backend has an API key.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final OpenRouterChatModelFactory chatModelFactory;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        log.trace("Health check");
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "flow-mutator-be",
                "generationConfigured", chatModelFactory.isConfigured()));
    }
}
