package com.qqsuccubus.toolsync.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of change carried by an {@link UpdateEvent}.
 */
public enum UpdateType {
    STATE_CHANGE("state_change"),
    VALUE_UPDATE("value_update"),
    CONFIGURATION_CHANGE("configuration_change"),
    DEPLOYMENT_UPDATE("deployment_update"),
    EXECUTION_RESULT("execution_result"),
    ERROR("error"),
    STATUS_CHANGE("status_change");

    private final String wire;

    UpdateType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /**
     * Looks up a type by its wire name.
     *
     * @param wire wire name, e.g. {@code state_change}
     * @return the matching type, or empty for null / unknown names
     */
    public static Optional<UpdateType> find(String wire) {
        return Arrays.stream(values()).filter(t -> t.wire.equals(wire)).findFirst();
    }

    @JsonCreator
    public static UpdateType fromWire(String wire) {
        return find(wire).orElseThrow(() -> new IllegalArgumentException("Unknown update type: " + wire));
    }
}
