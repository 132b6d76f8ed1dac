package com.example.flowmutator.mutation;

import com.example.flowmutator.domain.JsonValues;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One validated edit of a change-set.
 * <p>
 * Details are normalized on parse: the short keys {@code source}, {@code target} and
 * {@code id} are accepted for {@code source_node}, {@code target_node} and
 * {@code node_id}; {@code type} means {@code node_type} on node actions and
 * {@code connection_type} on connection actions. A canonical key always wins over its alias.
 * </p>
 */
public record MutationInstruction(MutationAction action, Map<String, Object> details) {

    public static final String NODE_ID = "node_id";
    public static final String NODE_TYPE = "node_type";
    public static final String NAME = "name";
    public static final String PARAMETERS = "parameters";
    public static final String POSITION = "position";
    public static final String SOURCE_NODE = "source_node";
    public static final String TARGET_NODE = "target_node";
    public static final String OLD_TARGET = "old_target";
    public static final String NEW_TARGET = "new_target";
    public static final String CONNECTION_TYPE = "connection_type";
    public static final String INDEX = "index";

    static final String DEFAULT_CONNECTION_TYPE = "main";

    private static final Set<MutationAction> NODE_ACTIONS =
            Set.of(MutationAction.ADD_NODE, MutationAction.MODIFY_NODE, MutationAction.REMOVE_NODE);

    public MutationInstruction {
        Objects.requireNonNull(action, "action");
        details = JsonValues.freezeMap(details);
    }

    /**
     * Parses one change-set element ({@code {"action": ..., "details": {...}}}).
     *
     * @throws InstructionValidationException if the element is not a well-formed instruction
     */
    public static MutationInstruction fromJson(Object element) {
        if (!(element instanceof Map<?, ?> map)) {
            throw new InstructionValidationException("instruction must be an object");
        }
        Object rawAction = map.get("action");
        MutationAction action = MutationAction.fromWire(rawAction)
                .orElseThrow(() -> new InstructionValidationException("unknown action '" + rawAction + "'"));
        Object rawDetails = map.get("details");
        if (rawDetails != null && !(rawDetails instanceof Map<?, ?>)) {
            throw new InstructionValidationException(action.wireName() + ": details must be an object");
        }
        Map<String, Object> details = normalize(action, rawDetails instanceof Map<?, ?> d ? d : Map.of());
        for (String key : requiredKeys(action)) {
            if (JsonValues.isBlank(JsonValues.scalarText(details.get(key)))) {
                throw new InstructionValidationException(action.wireName() + " requires '" + key + "'");
            }
        }
        return new MutationInstruction(action, details);
    }

    static List<String> requiredKeys(MutationAction action) {
        return switch (action) {
            case ADD_NODE -> List.of(NODE_TYPE);
            case MODIFY_NODE, REMOVE_NODE -> List.of(NODE_ID);
            case ADD_CONNECTION, REMOVE_CONNECTION -> List.of(SOURCE_NODE, TARGET_NODE);
            case MODIFY_CONNECTION -> List.of(SOURCE_NODE, OLD_TARGET, NEW_TARGET);
        };
    }

    private static Map<String, Object> normalize(MutationAction action, Map<?, ?> raw) {
        Map<String, Object> details = new LinkedHashMap<>();
        raw.forEach((k, v) -> details.put(String.valueOf(k), v));
        alias(details, "source", SOURCE_NODE);
        alias(details, "target", TARGET_NODE);
        alias(details, "id", NODE_ID);
        alias(details, "type", NODE_ACTIONS.contains(action) ? NODE_TYPE : CONNECTION_TYPE);
        return details;
    }

    private static void alias(Map<String, Object> details, String alias, String canonical) {
        if (details.containsKey(alias)) {
            Object value = details.remove(alias);
            details.putIfAbsent(canonical, value);
        }
    }

    /** Text of a scalar detail, or null. Numeric values are rendered as text. */
    public String text(String key) {
        return JsonValues.scalarText(details.get(key));
    }

    public boolean has(String key) {
        return details.containsKey(key);
    }

    public Object get(String key) {
        return details.get(key);
    }

    public String connectionType() {
        String type = text(CONNECTION_TYPE);
        return JsonValues.isBlank(type) ? DEFAULT_CONNECTION_TYPE : type;
    }

    public int index() {
        return details.get(INDEX) instanceof Number n ? n.intValue() : 0;
    }

    /** Short form for logs, e.g. {@code add_connection(Trigger -> Email)}. */
    public String describe() {
        return switch (action) {
            case ADD_NODE -> action.wireName() + "(" + text(NODE_TYPE) + ")";
            case MODIFY_NODE, REMOVE_NODE -> action.wireName() + "(" + text(NODE_ID) + ")";
            case ADD_CONNECTION, REMOVE_CONNECTION ->
                    action.wireName() + "(" + text(SOURCE_NODE) + " -> " + text(TARGET_NODE) + ")";
            case MODIFY_CONNECTION -> action.wireName() + "(" + text(SOURCE_NODE) + " -> "
                    + text(OLD_TARGET) + " => " + text(NEW_TARGET) + ")";
        };
    }
}
