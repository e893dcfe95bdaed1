package com.qqsuccubus.toolsync.core.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.toolsync.core.util.JsonUtils;

/**
 * Shallow, single-level merge of two state objects.
 * <p>
 * Client fields override server fields with the same name; nested objects are replaced
 * wholesale, never merged recursively. Operands that are not objects contribute no fields.
 * </p>
 */
public final class StateMerge {
    private StateMerge() {
    }

    public static ObjectNode shallow(JsonNode server, JsonNode client) {
        ObjectNode merged = JsonUtils.objectNode();
        if (server != null && server.isObject()) {
            merged.setAll((ObjectNode) server.deepCopy());
        }
        if (client != null && client.isObject()) {
            merged.setAll((ObjectNode) client.deepCopy());
        }
        return merged;
    }
}
