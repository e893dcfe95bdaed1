package com.qqsuccubus.toolsync.sync.store;

import com.qqsuccubus.toolsync.core.model.StateSnapshot;
import com.qqsuccubus.toolsync.core.model.ToolStateKey;
import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import lombok.Builder;
import lombok.Value;

/**
 * One atomic write: the next snapshot of a key plus the event that produced it.
 * <p>
 * Lands only if the stored version still equals {@code expectedVersion} (0 when the key
 * had no snapshot yet).
 * </p>
 */
@Value
@Builder
public class Commit {
    ToolStateKey key;
    long expectedVersion;
    StateSnapshot snapshot;
    /**
     * Event appended together with the snapshot, may be null.
     */
    UpdateEvent event;
}
