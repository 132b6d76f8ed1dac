package com.example.flowmutator.service;

import com.example.flowmutator.diff.DiffReportRenderer;
import com.example.flowmutator.diff.ReportFormat;
import com.example.flowmutator.diff.WorkflowDiff;
import com.example.flowmutator.diff.WorkflowDiffer;
import com.example.flowmutator.domain.MalformedGraphException;
import com.example.flowmutator.domain.WorkflowGraph;
import com.example.flowmutator.domain.WorkflowGraphCodec;
import com.example.flowmutator.extraction.ExtractedPayload;
import com.example.flowmutator.extraction.InstructionExtractor;
import com.example.flowmutator.extraction.PayloadShape;
import com.example.flowmutator.mutation.MutationOutcome;
import com.example.flowmutator.mutation.WorkflowMutator;
import com.example.flowmutator.validation.ValidationError;
import com.example.flowmutator.validation.ValidationReport;
import com.example.flowmutator.validation.WorkflowGraphValidator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the pipeline: extract a change-set from free text, apply it to a copy of the graph,
 * validate the result and either accept it (with a diff against the input) or roll back.
 * <p>
 * A malformed input graph throws {@link MalformedGraphException}. Everything else is
 * reported in the {@link MutationResult}.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowMutationService {

    private final WorkflowGraphCodec codec;
    private final InstructionExtractor extractor;
    private final WorkflowMutator mutator;
    private final WorkflowGraphValidator validator;
    private final WorkflowDiffer differ;
    private final DiffReportRenderer reportRenderer;

    public MutationResult mutate(String graphJson, String instructionsText) {
        WorkflowGraph original = codec.parse(graphJson);
        return mutate(original, graphJson, instructionsText);
    }

    MutationResult mutate(WorkflowGraph original, String graphJson, String instructionsText) {
        Optional<ExtractedPayload> payload = extractor.extract(instructionsText);
        if (payload.isEmpty()) {
            log.info("No change-set found, workflow left unchanged name={}", original.name());
            return MutationResult.notExtracted(graphJson);
        }
        ExtractedPayload extracted = payload.get();
        log.debug("Extracted payload shape={} strategy={}", extracted.shape(), extracted.strategy());

        if (extracted.shape() == PayloadShape.WORKFLOW_GRAPH) {
            return replace(original, graphJson, extracted);
        }
        MutationOutcome outcome = mutator.applyChangeSet(original, (List<?>) extracted.value());
        return gate(original, graphJson, outcome.graph(), false, outcome.appliedCount(), outcome.skipped());
    }

    public ValidationReport validate(String graphJson) {
        WorkflowGraph graph = codec.parse(graphJson);
        ValidationReport report = validator.validate(graph);
        log.info("Validated workflow name={} valid={} errors={} warnings={}",
                graph.name(), report.valid(), report.errors().size(), report.warnings().size());
        return report;
    }

    /**
     * Compares two documents. Unparseable input gives a CRITICAL diff rather than an exception.
     */
    public WorkflowDiff diff(String originalJson, String modifiedJson) {
        WorkflowDiff diff = differ.compare(originalJson, modifiedJson);
        log.info("Compared workflows severity={} summary=\"{}\"", diff.overallSeverity(), diff.changeSummary());
        return diff;
    }

    public String diffReport(String originalJson, String modifiedJson, ReportFormat format) {
        return reportRenderer.render(diff(originalJson, modifiedJson), format);
    }

    private MutationResult replace(WorkflowGraph original, String graphJson, ExtractedPayload extracted) {
        WorkflowGraph replacement;
        try {
            replacement = codec.fromMap((Map<?, ?>) extracted.value());
        } catch (MalformedGraphException e) {
            log.warn("Rejected replacement workflow, rolled back name={} reason={}", original.name(), e.getMessage());
            List<ValidationError> errors = List.of(new ValidationError("workflow", e.getMessage()));
            return new MutationResult(graphJson, true, true, 0, true, errors, List.of(), List.of(), null);
        }
        return gate(original, graphJson, replacement, true, 0, List.of());
    }

    private MutationResult gate(WorkflowGraph original, String graphJson, WorkflowGraph candidate,
                                boolean replacement, int appliedCount, List<String> skipped) {
        ValidationReport report = validator.validate(candidate);
        if (!report.valid()) {
            log.warn("Mutated workflow failed validation, rolled back name={} errors={} firstError=\"{}\"",
                    original.name(), report.errors().size(), report.errors().get(0).message());
            return new MutationResult(graphJson, true, replacement, appliedCount, true,
                    report.errors(), report.warnings(), skipped, null);
        }
        WorkflowDiff diff = differ.compare(original, candidate);
        log.info("Mutation accepted name={} applied={} skipped={} warnings={} severity={}",
                candidate.name(), appliedCount, skipped.size(), report.warnings().size(), diff.overallSeverity());
        return new MutationResult(codec.write(candidate), true, replacement, appliedCount, false,
                List.of(), report.warnings(), skipped, diff);
    }
}
