package com.example.flowmutator.extraction;

import com.example.flowmutator.mutation.MutationAction;

import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectReader;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a change-set (instruction array) or a complete workflow object from noisy
 * model output.
 * <p>
 * Closed reasoning blocks ({@code <think>...</think>}) are removed first. An unclosed
 * {@code <think>} is left in place, since a truncated reply may still carry its answer
 * after it. Then the steps of
 * {@link ExtractionStrategy} are tried in order. A candidate counts only if it parses as
 * JSON and has one of the two accepted shapes:
 * </p>
 * <ul>
 *   <li>a non-empty array whose elements are all objects with a known {@code action};</li>
 *   <li>an object with a {@code nodes} array and a {@code connections} object or array.</li>
 * </ul>
 */
@Component
@Slf4j
public class InstructionExtractor {

    private static final Pattern THINK_BLOCK = Pattern.compile("<think>.*?</think>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern FENCED_BLOCK = Pattern.compile("```[\\w-]*\\s*(.*?)\\s*```", Pattern.DOTALL);
    // balanced objects up to two levels deep
    private static final Pattern OBJECT = Pattern.compile("\\{[^{}]*(?:\\{[^{}]*\\}[^{}]*)*\\}", Pattern.DOTALL);

    private final ObjectReader reader;

    public InstructionExtractor(JsonMapper jsonMapper) {
        this.reader = jsonMapper.readerFor(Object.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public Optional<ExtractedPayload> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String cleaned = stripReasoning(text);
        Optional<ExtractedPayload> payload = balancedScan(cleaned)
                .or(() -> fencedBlocks(cleaned))
                .or(() -> arraySpans(cleaned))
                .or(() -> objectPatterns(cleaned))
                .or(() -> lines(cleaned));
        if (payload.isPresent()) {
            log.debug("Extracted payload shape={} strategy={} length={}",
                    payload.get().shape(), payload.get().strategy(), payload.get().json().length());
        } else {
            log.warn("No change-set or workflow found in text length={}", text.length());
        }
        return payload;
    }

    static String stripReasoning(String text) {
        return THINK_BLOCK.matcher(text).replaceAll("").strip();
    }

    /**
     * Left-to-right depth scan; keeps the last top-level span with a valid shape.
     * Brackets inside string literals of an open span do not count.
     */
    private Optional<ExtractedPayload> balancedScan(String text) {
        ExtractedPayload last = null;
        int depth = 0;
        int start = -1;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"' && depth > 0) {
                inString = true;
            } else if (c == '{' || c == '[') {
                if (depth == 0) {
                    start = i;
                }
                depth++;
            } else if ((c == '}' || c == ']') && depth > 0) {
                depth--;
                if (depth == 0) {
                    ExtractedPayload candidate = accept(text.substring(start, i + 1).strip(), ExtractionStrategy.BALANCED_SCAN);
                    if (candidate != null) {
                        last = candidate;
                    }
                }
            }
        }
        return Optional.ofNullable(last);
    }

    private Optional<ExtractedPayload> fencedBlocks(String text) {
        Matcher matcher = FENCED_BLOCK.matcher(text);
        while (matcher.find()) {
            ExtractedPayload candidate = accept(matcher.group(1).strip(), ExtractionStrategy.FENCED_BLOCK);
            if (candidate != null) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private Optional<ExtractedPayload> arraySpans(String text) {
        for (int start = text.lastIndexOf('['); start >= 0; start = text.lastIndexOf('[', start - 1)) {
            int end = matchingBracket(text, start);
            if (end < 0) {
                continue;
            }
            ExtractedPayload candidate = accept(text.substring(start, end + 1), ExtractionStrategy.ARRAY_SPAN);
            if (candidate != null) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static int matchingBracket(String text, int start) {
        int count = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') {
                count++;
            } else if (c == ']') {
                count--;
                if (count == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private Optional<ExtractedPayload> objectPatterns(String text) {
        List<String> matches = new ArrayList<>();
        Matcher matcher = OBJECT.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.group());
        }
        for (int i = matches.size() - 1; i >= 0; i--) {
            String match = matches.get(i);
            Object parsed = parse(match);
            if (parsed instanceof Map<?, ?> && isInstructionList(List.of(parsed))) {
                return Optional.of(new ExtractedPayload("[" + match + "]", PayloadShape.INSTRUCTION_LIST,
                        ExtractionStrategy.OBJECT_PATTERN, List.of(parsed)));
            }
            if (isWorkflow(parsed)) {
                return Optional.of(new ExtractedPayload(match, PayloadShape.WORKFLOW_GRAPH,
                        ExtractionStrategy.OBJECT_PATTERN, parsed));
            }
        }
        return Optional.empty();
    }

    private Optional<ExtractedPayload> lines(String text) {
        String[] lines = text.split("\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].strip();
            if (line.startsWith("[") || line.startsWith("{")) {
                ExtractedPayload candidate = accept(line, ExtractionStrategy.LINE_SCAN);
                if (candidate != null) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    private ExtractedPayload accept(String candidate, ExtractionStrategy strategy) {
        Object parsed = parse(candidate);
        if (isInstructionList(parsed)) {
            return new ExtractedPayload(candidate, PayloadShape.INSTRUCTION_LIST, strategy, parsed);
        }
        if (isWorkflow(parsed)) {
            return new ExtractedPayload(candidate, PayloadShape.WORKFLOW_GRAPH, strategy, parsed);
        }
        return null;
    }

    private Object parse(String candidate) {
        if (candidate.isEmpty()) {
            return null;
        }
        try {
            return reader.readValue(candidate);
        } catch (JacksonException e) {
            log.trace("Candidate is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    static boolean isInstructionList(Object parsed) {
        if (!(parsed instanceof List<?> list) || list.isEmpty()) {
            return false;
        }
        return list.stream().allMatch(item -> item instanceof Map<?, ?> map && MutationAction.isKnown(map.get("action")));
    }

    static boolean isWorkflow(Object parsed) {
        return parsed instanceof Map<?, ?> map
                && map.get("nodes") instanceof List<?>
                && (map.get("connections") instanceof Map<?, ?> || map.get("connections") instanceof List<?>);
    }
}
