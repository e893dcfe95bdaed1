package com.qqsuccubus.toolsync.sync.store;

import com.qqsuccubus.toolsync.core.model.StateSnapshot;
import com.qqsuccubus.toolsync.core.model.ToolStateKey;
import reactor.core.publisher.Mono;

/**
 * Snapshot storage with version-checked writes.
 */
public interface ISnapshotStore {
    /**
     * @return the current snapshot, or empty if the key has none
     */
    Mono<StateSnapshot> get(ToolStateKey key);

    /**
     * Writes the commit's snapshot and event atomically.
     *
     * @return Mono completing when written, or failing with
     * {@link com.qqsuccubus.toolsync.sync.error.VersionConflictException} when the stored
     * version is no longer {@link Commit#getExpectedVersion()}
     */
    Mono<Void> commit(Commit commit);
}
