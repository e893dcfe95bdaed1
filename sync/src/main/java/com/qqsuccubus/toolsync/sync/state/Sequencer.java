package com.qqsuccubus.toolsync.sync.state;

import com.qqsuccubus.toolsync.core.model.StateSnapshot;
import com.qqsuccubus.toolsync.sync.store.ISnapshotStore;

/**
 * Computes the next sequence number of a key from its snapshot version.
 * <p>
 * Reading is not allocating: the number is only claimed when the commit that carries it
 * passes the version check in {@link ISnapshotStore#commit}.
 * </p>
 */
public final class Sequencer {

    private Sequencer() {
    }

    /**
     * @param current snapshot, or null when the key has none
     */
    public static long next(StateSnapshot current) {
        return current == null ? 1L : current.getVersion() + 1;
    }
}
