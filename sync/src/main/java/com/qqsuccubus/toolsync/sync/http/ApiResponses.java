package com.qqsuccubus.toolsync.sync.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.toolsync.core.util.JsonUtils;
import com.qqsuccubus.toolsync.sync.error.ErrorCode;
import com.qqsuccubus.toolsync.sync.error.ToolSyncException;

/**
 * JSON envelopes of the tool-update API.
 * <p>
 * Success: {@code {"success": true, ...body fields}}. Failure:
 * {@code {"success": false, "error": {"code": ..., "message": ...}}}.
 * </p>
 */
final class ApiResponses {
    static final String INTERNAL_MESSAGE = "Internal server error";

    private ApiResponses() {
    }

    /**
     * Inlines the fields of {@code body} next to {@code success}.
     */
    static String success(Object body) {
        ObjectNode root = JsonUtils.objectNode().put("success", true);
        JsonNode tree = JsonUtils.valueToTree(body);
        if (tree != null && tree.isObject()) {
            root.setAll((ObjectNode) tree);
        }
        return JsonUtils.writeValueAsString(root);
    }

    /**
     * Nests {@code value} under {@code field}.
     */
    static String success(String field, Object value) {
        ObjectNode root = JsonUtils.objectNode().put("success", true);
        root.set(field, JsonUtils.valueToTree(value));
        return JsonUtils.writeValueAsString(root);
    }

    static String error(ErrorCode code, String message) {
        ObjectNode root = JsonUtils.objectNode().put("success", false);
        root.putObject("error")
            .put("code", code.name())
            .put("message", message);
        return JsonUtils.writeValueAsString(root);
    }

    /**
     * Maps any failure to the exception the client sees. Anything that is not a
     * {@link ToolSyncException} becomes {@link ErrorCode#INTERNAL_ERROR} with a generic message,
     * so a request is only rejected as invalid where its decoding raised that code.
     */
    static ToolSyncException toClientError(Throwable err) {
        if (err instanceof ToolSyncException known) {
            if (known.getCode() == ErrorCode.INTERNAL_ERROR) {
                return new ToolSyncException(ErrorCode.INTERNAL_ERROR, INTERNAL_MESSAGE, known);
            }
            return known;
        }
        return ToolSyncException.internal(INTERNAL_MESSAGE, err);
    }
}
