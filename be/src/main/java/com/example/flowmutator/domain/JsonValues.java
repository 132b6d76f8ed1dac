package com.example.flowmutator.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the untyped JSON trees (maps, lists, scalars) that Jackson produces when
 * reading into {@code Object}.
 */
public final class JsonValues {

    private JsonValues() {
    }

    /**
     * Deep copy into unmodifiable maps and lists. Map iteration order is preserved.
     */
    public static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), freeze(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(freeze(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * Deep copy into mutable {@link LinkedHashMap}s and {@link ArrayList}s.
     */
    public static Object thaw(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), thaw(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(thaw(v)));
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> freezeMap(Map<String, ?> map) {
        return map == null ? Map.of() : (Map<String, Object>) freeze(map);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> thawMap(Map<String, ?> map) {
        return map == null ? new LinkedHashMap<>() : (Map<String, Object>) thaw(map);
    }

    /**
     * Text form of a scalar key value: strings as-is, numbers and booleans via
     * {@link String#valueOf}. Objects, arrays and null yield null. Integral doubles
     * ({@code 3.0}) render without the fraction so numeric ids stay stable.
     */
    public static String scalarText(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Double d && d == Math.rint(d) && !d.isInfinite()) {
            return String.valueOf(d.longValue());
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return null;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
