package com.qqsuccubus.toolsync.sync.service;

import com.qqsuccubus.toolsync.core.model.EventData;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Body of a submit-update request. {@code updateType} stays a raw string so an unknown type
 * is reported as invalid input rather than a parse failure.
 */
@Value
@Builder
@Jacksonized
public class SubmitUpdateRequest {
    String toolId;
    String deploymentId;
    String spaceId;
    String updateType;
    EventData eventData;
    List<String> targetUsers;
    @Builder.Default
    boolean broadcastToSpace = true;
    boolean requiresAck;
    Integer expiresInMinutes;
}
