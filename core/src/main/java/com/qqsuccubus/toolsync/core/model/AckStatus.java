package com.qqsuccubus.toolsync.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AckStatus {
    PENDING("pending"),
    COMPLETE("complete"),
    EXPIRED("expired");

    private final String wire;

    AckStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static AckStatus fromWire(String wire) {
        for (AckStatus s : values()) {
            if (s.wire.equals(wire)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown ack status: " + wire);
    }
}
