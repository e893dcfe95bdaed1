package com.qqsuccubus.toolsync.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the last conflict on a snapshot was settled, as recorded in its metadata.
 */
public enum ConflictResolutionMode {
    MANUAL("manual"),
    AUTOMATIC("automatic"),
    LATEST_WINS("latest_wins");

    private final String wire;

    ConflictResolutionMode(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static ConflictResolutionMode fromWire(String wire) {
        for (ConflictResolutionMode m : values()) {
            if (m.wire.equals(wire)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown conflict resolution mode: " + wire);
    }
}
