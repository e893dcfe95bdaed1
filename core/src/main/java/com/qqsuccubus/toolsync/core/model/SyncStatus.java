package com.qqsuccubus.toolsync.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Synchronization state recorded on a snapshot.
 */
public enum SyncStatus {
    SYNCED("synced"),
    PENDING("pending"),
    CONFLICT("conflict"),
    ERROR("error");

    private final String wire;

    SyncStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static SyncStatus fromWire(String wire) {
        for (SyncStatus s : values()) {
            if (s.wire.equals(wire)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown sync status: " + wire);
    }
}
