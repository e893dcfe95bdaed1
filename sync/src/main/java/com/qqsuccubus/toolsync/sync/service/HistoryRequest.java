package com.qqsuccubus.toolsync.sync.service;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class HistoryRequest {
    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 100;

    String toolId;
    String deploymentId;
    String spaceId;
    Instant since;
    Integer limit;
    boolean includeSnapshot;

    /**
     * Requested limit clamped to {@code [1, 100]}, 50 when absent.
     */
    public int effectiveLimit() {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }
}
