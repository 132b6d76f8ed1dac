package com.example.flowmutator.api.v1;

import com.example.flowmutator.api.v1.dto.DiffRequest;
import com.example.flowmutator.api.v1.dto.ModifyRequest;
import com.example.flowmutator.api.v1.dto.MutateRequest;
import com.example.flowmutator.api.v1.dto.MutationResponse;
import com.example.flowmutator.api.v1.dto.ValidateRequest;
import com.example.flowmutator.diff.ReportFormat;
import com.example.flowmutator.diff.WorkflowDiff;
import com.example.flowmutator.service.MutationResult;
import com.example.flowmutator.service.WorkflowModificationService;
import com.example.flowmutator.service.WorkflowMutationService;
import com.example.flowmutator.validation.ValidationReport;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

/**
 * REST controller for workflow graph operations.
 * <p>
 * Exposes {@code /api/v1/graphs} for mutate (POST /mutate), natural-language modify
 * (POST /modify), validate (POST /validate), diff (POST /diff) and rendered diff reports
 * (POST /diff/report?format=text|html|json). Graphs travel as JSON objects.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/graphs")
@RequiredArgsConstructor
@Slf4j
public class GraphController {

    private final WorkflowMutationService mutationService;
    private final WorkflowModificationService modificationService;
    private final JsonMapper jsonMapper;

    @PostMapping("/mutate")
    public ResponseEntity<MutationResponse> mutate(@Valid @RequestBody MutateRequest request) {
        log.info("Mutating workflow instructionsLength={}", request.instructions().length());
        MutationResult result = mutationService.mutate(toJson(request.graph()), request.instructions());
        return ResponseEntity.ok(toResponse(result));
    }

    @PostMapping("/modify")
    public ResponseEntity<MutationResponse> modify(@Valid @RequestBody ModifyRequest request) {
        log.info("Modifying workflow descriptionLength={}", request.description().length());
        MutationResult result = modificationService.modify(toJson(request.graph()), request.description());
        return ResponseEntity.ok(toResponse(result));
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidationReport> validate(@Valid @RequestBody ValidateRequest request) {
        log.debug("Validating workflow");
        return ResponseEntity.ok(mutationService.validate(toJson(request.graph())));
    }

    @PostMapping("/diff")
    public ResponseEntity<WorkflowDiff> diff(@Valid @RequestBody DiffRequest request) {
        log.debug("Comparing workflows");
        return ResponseEntity.ok(mutationService.diff(toJson(request.original()), toJson(request.modified())));
    }

    @PostMapping("/diff/report")
    public ResponseEntity<String> diffReport(@Valid @RequestBody DiffRequest request,
                                             @RequestParam(name = "format", required = false) String format) {
        ReportFormat reportFormat = ReportFormat.fromString(format);
        log.debug("Rendering diff report format={}", reportFormat);
        String report = mutationService.diffReport(toJson(request.original()), toJson(request.modified()), reportFormat);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(reportFormat.mediaType()))
                .body(report);
    }

    private String toJson(JsonNode graph) {
        try {
            return jsonMapper.writeValueAsString(graph);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize workflow graph", e);
        }
    }

    private MutationResponse toResponse(MutationResult result) {
        JsonNode graph;
        try {
            graph = jsonMapper.readTree(result.resultJson());
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to read mutated workflow graph", e);
        }
        return new MutationResponse(graph, result.extracted(), result.replacement(), result.appliedCount(),
                result.rolledBack(), result.errors(), result.warnings(), result.skipped(), result.diff());
    }
}
