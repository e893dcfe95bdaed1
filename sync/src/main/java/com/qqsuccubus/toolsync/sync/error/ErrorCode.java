package com.qqsuccubus.toolsync.sync.error;

import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Stable, machine-readable error codes returned to clients.
 */
public enum ErrorCode {
    UNAUTHORIZED(HttpResponseStatus.UNAUTHORIZED),
    FORBIDDEN(HttpResponseStatus.FORBIDDEN),
    INVALID_INPUT(HttpResponseStatus.BAD_REQUEST),
    RESOURCE_NOT_FOUND(HttpResponseStatus.NOT_FOUND),
    RATE_LIMITED(HttpResponseStatus.TOO_MANY_REQUESTS),
    INTERNAL_ERROR(HttpResponseStatus.INTERNAL_SERVER_ERROR);

    private final HttpResponseStatus status;

    ErrorCode(HttpResponseStatus status) {
        this.status = status;
    }

    public HttpResponseStatus status() {
        return status;
    }
}
