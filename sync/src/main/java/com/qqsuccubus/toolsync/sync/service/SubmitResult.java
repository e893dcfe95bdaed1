package com.qqsuccubus.toolsync.sync.service;

import com.qqsuccubus.toolsync.core.model.UpdateType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SubmitResult {
    String id;
    String toolId;
    UpdateType updateType;
    long sequenceNumber;
    /**
     * Number of users the update concerns.
     */
    int affectedUsers;
    Instant timestamp;
}
