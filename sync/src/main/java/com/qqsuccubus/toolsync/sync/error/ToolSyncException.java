package com.qqsuccubus.toolsync.sync.error;

import lombok.Getter;

/**
 * Failure of a client-facing operation, carrying the code the client sees.
 * <p>
 * The message is short and safe to show; store or broker detail belongs in the cause.
 * </p>
 */
@Getter
public class ToolSyncException extends RuntimeException {
    private final ErrorCode code;

    public ToolSyncException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ToolSyncException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static ToolSyncException unauthorized() {
        return new ToolSyncException(ErrorCode.UNAUTHORIZED, "Unauthorized");
    }

    public static ToolSyncException forbidden(String message) {
        return new ToolSyncException(ErrorCode.FORBIDDEN, message);
    }

    public static ToolSyncException invalidInput(String message) {
        return new ToolSyncException(ErrorCode.INVALID_INPUT, message);
    }

    public static ToolSyncException notFound(String message) {
        return new ToolSyncException(ErrorCode.RESOURCE_NOT_FOUND, message);
    }

    public static ToolSyncException internal(String message, Throwable cause) {
        return new ToolSyncException(ErrorCode.INTERNAL_ERROR, message, cause);
    }
}
