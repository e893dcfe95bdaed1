package com.qqsuccubus.toolsync.sync.error;

import com.qqsuccubus.toolsync.core.model.ToolStateKey;
import lombok.Getter;

/**
 * A compare-and-set commit lost the race: the snapshot version moved since it was read.
 * Never reaches clients; the commit path retries on it.
 */
@Getter
public class VersionConflictException extends RuntimeException {
    private final ToolStateKey key;
    private final long expectedVersion;

    public VersionConflictException(ToolStateKey key, long expectedVersion) {
        super("Snapshot " + key + " is no longer at version " + expectedVersion);
        this.key = key;
        this.expectedVersion = expectedVersion;
    }
}
