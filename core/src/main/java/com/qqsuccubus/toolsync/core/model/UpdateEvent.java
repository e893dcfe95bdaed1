package com.qqsuccubus.toolsync.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Immutable record of one accepted state change.
 * <p>
 * <b>Ordering guarantee:</b> {@code sequenceNumber} is unique and strictly increasing per
 * {@link ToolStateKey}. Nothing is guaranteed across keys.
 * </p>
 * <p>
 * Events are append-only. They are never mutated, and only removed by explicit cleanup.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UpdateEvent {
    String id;

    String toolId;

    String deploymentId;

    String spaceId;

    /**
     * Author of the change.
     */
    String userId;

    UpdateType updateType;

    EventData eventData;

    /**
     * Users who should receive this update (and, with {@link #requiresAck}, acknowledge it).
     */
    @Builder.Default
    List<String> affectedUsers = List.of();

    Instant timestamp;

    long sequenceNumber;

    @Builder.Default
    List<String> broadcastChannels = List.of();

    boolean requiresAck;

    Instant expiresAt;

    @JsonIgnore
    public ToolStateKey key() {
        return ToolStateKey.of(toolId, deploymentId);
    }
}
