package com.qqsuccubus.toolsync.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Tracks which recipients still owe an acknowledgment for an update event.
 * <p>
 * Only exists for events submitted with {@code requiresAck = true}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AckTracking {
    String updateEventId;

    String toolId;

    String deploymentId;

    @Builder.Default
    List<String> requiredAcks = List.of();

    @Builder.Default
    List<String> receivedAcks = List.of();

    Instant ackDeadline;

    Instant createdAt;

    AckStatus status;

    @JsonIgnore
    public boolean isSatisfied() {
        return receivedAcks.containsAll(requiredAcks);
    }

    @JsonIgnore
    public boolean isPastDeadline(Instant now) {
        return ackDeadline != null && now.isAfter(ackDeadline);
    }
}
