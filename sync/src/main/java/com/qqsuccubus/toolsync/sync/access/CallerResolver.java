package com.qqsuccubus.toolsync.sync.access;

import io.netty.handler.codec.http.HttpHeaders;

import java.util.Optional;

/**
 * Resolves the verified caller of a request.
 * <p>
 * Authentication happens upstream: the gateway verifies the session and forwards the user id
 * in {@code X-User-Id}. For local development a bearer token carrying the user id is also
 * accepted.
 * </p>
 */
public class CallerResolver {
    public static final String USER_HEADER = "X-User-Id";
    private static final String BEARER_PREFIX = "Bearer ";

    public Optional<String> resolve(HttpHeaders headers) {
        String forwarded = headers.get(USER_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            return Optional.of(forwarded.trim());
        }
        String authorization = headers.get("Authorization");
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }
}
