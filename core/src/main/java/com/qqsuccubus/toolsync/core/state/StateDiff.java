package com.qqsuccubus.toolsync.core.state;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Field-level diff over opaque state trees.
 * <p>
 * Only top-level fields are compared; a nested change is reported under its top-level
 * field name. Non-object states have no fields.
 * </p>
 */
public final class StateDiff {
    private StateDiff() {
    }

    /**
     * Returns the top-level fields whose values differ between the two states.
     * Fields of {@code oldState} come first, then fields only present in {@code newState}.
     *
     * @param oldState previous state, may be null
     * @param newState next state, may be null
     * @return changed field names
     */
    public static List<String> changedFields(JsonNode oldState, JsonNode newState) {
        Set<String> keys = new LinkedHashSet<>();
        collectFieldNames(oldState, keys);
        collectFieldNames(newState, keys);

        List<String> changed = new ArrayList<>();
        for (String key : keys) {
            if (!Objects.equals(field(oldState, key), field(newState, key))) {
                changed.add(key);
            }
        }
        return changed;
    }

    static JsonNode field(JsonNode state, String name) {
        if (state == null || !state.isObject()) {
            return null;
        }
        return state.get(name);
    }

    private static void collectFieldNames(JsonNode state, Set<String> into) {
        if (state == null || !state.isObject()) {
            return;
        }
        Iterator<String> names = state.fieldNames();
        while (names.hasNext()) {
            into.add(names.next());
        }
    }
}
