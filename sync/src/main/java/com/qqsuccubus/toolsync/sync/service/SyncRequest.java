package com.qqsuccubus.toolsync.sync.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SyncRequest {
    String toolId;
    String deploymentId;
    Long clientVersion;
    JsonNode clientState;
    /**
     * latest_wins, client_wins or merge; anything else means latest_wins.
     */
    String conflictResolution;
    boolean forceMerge;
}
