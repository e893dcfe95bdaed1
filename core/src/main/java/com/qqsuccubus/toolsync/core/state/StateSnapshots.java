package com.qqsuccubus.toolsync.core.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.toolsync.core.model.SnapshotMetadata;
import com.qqsuccubus.toolsync.core.model.StateSnapshot;
import com.qqsuccubus.toolsync.core.model.SyncStatus;
import com.qqsuccubus.toolsync.core.model.ToolStateKey;
import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import com.qqsuccubus.toolsync.core.util.JsonUtils;

import java.time.Instant;
import java.util.List;

/**
 * Pure snapshot transitions. All version stamping happens here.
 */
public final class StateSnapshots {
    private StateSnapshots() {
    }

    /**
     * Applies an accepted event to the previous snapshot of its key.
     * <p>
     * {@code newState} replaces the current state (no deep merge). An event without a new
     * state keeps the previous state. The version becomes the event's sequence number.
     * </p>
     *
     * @param event    accepted event
     * @param previous current snapshot, or null when the key has none yet
     * @return the next snapshot
     */
    public static StateSnapshot apply(UpdateEvent event, StateSnapshot previous) {
        JsonNode newState = event.getEventData() != null && event.getEventData().hasNewState()
            ? event.getEventData().getNewState()
            : null;

        if (previous == null) {
            return StateSnapshot.builder()
                .toolId(event.getToolId())
                .deploymentId(event.getDeploymentId())
                .spaceId(event.getSpaceId())
                .currentState(newState != null ? newState : JsonUtils.objectNode())
                .version(event.getSequenceNumber())
                .lastUpdate(event.getTimestamp())
                .activeConnections(List.of())
                .pendingUpdates(List.of())
                .metadata(SnapshotMetadata.builder()
                    .createdAt(event.getTimestamp())
                    .updatedBy(event.getUserId())
                    .syncStatus(SyncStatus.SYNCED)
                    .build())
                .build();
        }

        return previous.toBuilder()
            .currentState(newState != null ? newState : previous.getCurrentState())
            .version(event.getSequenceNumber())
            .lastUpdate(event.getTimestamp())
            .metadata(previous.getMetadata().toBuilder()
                .updatedBy(event.getUserId())
                .syncStatus(SyncStatus.SYNCED)
                .build())
            .build();
    }

    /**
     * Builds the first snapshot of a key from a client's state (version 1).
     */
    public static StateSnapshot fromClient(ToolStateKey key, JsonNode state, String userId, Instant now) {
        return StateSnapshot.builder()
            .toolId(key.getToolId())
            .deploymentId(key.getDeploymentId())
            .currentState(state)
            .version(1L)
            .lastUpdate(now)
            .activeConnections(List.of())
            .pendingUpdates(List.of())
            .metadata(SnapshotMetadata.builder()
                .createdAt(now)
                .updatedBy(userId)
                .syncStatus(SyncStatus.SYNCED)
                .build())
            .build();
    }
}
