package com.qqsuccubus.toolsync.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * The single authoritative materialized state of a {@link ToolStateKey}.
 * <p>
 * Created lazily on the first write or sync for a key and replaced on every accepted
 * update. {@code version} always equals the highest sequence number applied to it.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StateSnapshot {
    String toolId;

    String deploymentId;

    String spaceId;

    JsonNode currentState;

    long version;

    Instant lastUpdate;

    @Builder.Default
    List<String> activeConnections = List.of();

    @Builder.Default
    List<UpdateEvent> pendingUpdates = List.of();

    SnapshotMetadata metadata;

    @JsonIgnore
    public ToolStateKey key() {
        return ToolStateKey.of(toolId, deploymentId);
    }
}
