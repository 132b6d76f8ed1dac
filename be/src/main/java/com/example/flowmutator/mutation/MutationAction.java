package com.example.flowmutator.mutation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * The six graph edits a change-set may contain, with their wire names.
 */
public enum MutationAction {

    ADD_NODE("add_node"),
    MODIFY_NODE("modify_node"),
    REMOVE_NODE("remove_node"),
    ADD_CONNECTION("add_connection"),
    MODIFY_CONNECTION("modify_connection"),
    REMOVE_CONNECTION("remove_connection");

    private final String wireName;

    MutationAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<MutationAction> fromWire(Object value) {
        return Arrays.stream(values())
                .filter(a -> a.wireName.equals(value))
                .findFirst();
    }

    public static boolean isKnown(Object value) {
        return fromWire(value).isPresent();
    }
}
