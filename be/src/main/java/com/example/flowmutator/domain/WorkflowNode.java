package com.example.flowmutator.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One node of a workflow graph.
 * <p>
 * Holds the node's full JSON object so keys the engine does not interpret
 * ({@code typeVersion}, {@code credentials}, ...) survive a parse/write cycle. The
 * accessors expose the fields the engine works with; {@link #attributes()} keeps the
 * raw values for validation of their JSON types.
 * </p>
 */
public record WorkflowNode(Map<String, Object> attributes) {

    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String TYPE = "type";
    public static final String PARAMETERS = "parameters";
    public static final String POSITION = "position";

    public WorkflowNode {
        attributes = JsonValues.freezeMap(attributes);
    }

    public static WorkflowNode of(String id, String name, String type, Map<String, ?> parameters, List<? extends Number> position) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put(ID, id);
        attrs.put(NAME, name);
        attrs.put(TYPE, type);
        attrs.put(PARAMETERS, parameters != null ? parameters : Map.of());
        attrs.put(POSITION, position != null ? position : List.of(0, 0));
        return new WorkflowNode(attrs);
    }

    /** Node id as text; numeric ids are rendered as strings. Null if absent or not a scalar. */
    public String id() {
        return JsonValues.scalarText(attributes.get(ID));
    }

    public String name() {
        return JsonValues.scalarText(attributes.get(NAME));
    }

    public String type() {
        return JsonValues.scalarText(attributes.get(TYPE));
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> parameters() {
        Object value = attributes.get(PARAMETERS);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    /**
     * Canvas position when present as two numbers.
     */
    public Optional<double[]> position() {
        Object value = attributes.get(POSITION);
        if (value instanceof List<?> list && list.size() == 2
                && list.get(0) instanceof Number x && list.get(1) instanceof Number y) {
            return Optional.of(new double[]{x.doubleValue(), y.doubleValue()});
        }
        return Optional.empty();
    }

    /** Name if set, otherwise id. Used wherever a node must be shown or keyed by name. */
    public String displayName() {
        String name = name();
        return JsonValues.isBlank(name) ? id() : name;
    }

    public WorkflowNode withName(String newName) {
        Map<String, Object> attrs = new LinkedHashMap<>(attributes);
        attrs.put(NAME, newName);
        return new WorkflowNode(attrs);
    }

    public WorkflowNode withParameters(Map<String, ?> newParameters) {
        Map<String, Object> attrs = new LinkedHashMap<>(attributes);
        attrs.put(PARAMETERS, newParameters);
        return new WorkflowNode(attrs);
    }
}
