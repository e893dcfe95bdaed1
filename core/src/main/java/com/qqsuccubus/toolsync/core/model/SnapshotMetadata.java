package com.qqsuccubus.toolsync.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@With
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SnapshotMetadata {
    Instant createdAt;

    String updatedBy;

    SyncStatus syncStatus;

    /**
     * Set once a conflict has been resolved on the snapshot; absent before that.
     */
    ConflictResolutionMode conflictResolution;
}
