package com.qqsuccubus.toolsync.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Policy applied when a client syncs against a snapshot whose version moved on.
 */
public enum ConflictStrategy {
    /**
     * Server state is authoritative; the client's concurrent write is only audited.
     */
    LATEST_WINS("latest_wins"),
    /**
     * Client state replaces the server state.
     */
    CLIENT_WINS("client_wins"),
    /**
     * Shallow union of top-level fields, client fields override server fields.
     */
    MERGE("merge");

    private final String wire;

    ConflictStrategy(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /**
     * Parses a strategy name. Null and unrecognized names fall back to {@link #LATEST_WINS}.
     */
    public static ConflictStrategy parse(String wire) {
        for (ConflictStrategy s : values()) {
            if (s.wire.equals(wire)) {
                return s;
            }
        }
        return LATEST_WINS;
    }

    public ConflictResolutionMode recordedAs() {
        return this == LATEST_WINS ? ConflictResolutionMode.LATEST_WINS : ConflictResolutionMode.AUTOMATIC;
    }
}
