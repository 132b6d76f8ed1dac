package com.example.flowmutator.extraction;

/**
 * JSON payload recovered from free-form text.
 *
 * @param json     the payload text as it should be parsed
 * @param shape    what the payload describes
 * @param strategy the step that found it
 * @param value    the parsed JSON tree ({@code List} for instructions, {@code Map} for a workflow)
 */
public record ExtractedPayload(String json, PayloadShape shape, ExtractionStrategy strategy, Object value) {
}
