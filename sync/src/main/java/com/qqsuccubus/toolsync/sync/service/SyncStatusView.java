package com.qqsuccubus.toolsync.sync.service;

import com.qqsuccubus.toolsync.core.model.StateSnapshot;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Sync summary of a key as reported by the history endpoint.
 */
@Value
@Builder
public class SyncStatusView {
    public static final String NO_STATE = "no_state";
    public static final String ERROR = "error";

    String status;
    Instant lastSync;
    long version;
    int pendingUpdates;
    int activeConnections;

    public static SyncStatusView of(StateSnapshot snapshot) {
        return SyncStatusView.builder()
            .status(snapshot.getMetadata() != null && snapshot.getMetadata().getSyncStatus() != null
                ? snapshot.getMetadata().getSyncStatus().wire()
                : NO_STATE)
            .lastSync(snapshot.getLastUpdate())
            .version(snapshot.getVersion())
            .pendingUpdates(snapshot.getPendingUpdates().size())
            .activeConnections(snapshot.getActiveConnections().size())
            .build();
    }

    public static SyncStatusView noState() {
        return SyncStatusView.builder().status(NO_STATE).build();
    }

    public static SyncStatusView error() {
        return SyncStatusView.builder().status(ERROR).build();
    }
}
