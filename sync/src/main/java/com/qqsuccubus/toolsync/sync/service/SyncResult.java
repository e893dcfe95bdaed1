package com.qqsuccubus.toolsync.sync.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.toolsync.core.model.ConflictDescriptor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@Builder
public class SyncResult {
    public static final String CLIENT_STATE_ACCEPTED = "client_state_accepted";
    public static final String SYNC_SUCCESSFUL = "sync_successful";
    public static final String CONFLICT_RESOLVED = "conflict_resolved";

    String syncResult;
    JsonNode serverState;
    long serverVersion;
    @Builder.Default
    List<ConflictDescriptor> conflicts = List.of();
    /**
     * Set for {@link #CONFLICT_RESOLVED} only.
     */
    String resolutionStrategy;
}
