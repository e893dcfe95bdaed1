package com.qqsuccubus.toolsync.sync.service;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Deletes one event by id, or every event of the tool older than {@code olderThan}.
 */
@Value
@Builder
public class CleanupRequest {
    String toolId;
    String deploymentId;
    String eventId;
    Instant olderThan;
}
