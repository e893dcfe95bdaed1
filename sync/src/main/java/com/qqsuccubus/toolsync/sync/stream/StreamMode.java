package com.qqsuccubus.toolsync.sync.stream;

import java.util.Locale;

/**
 * Where a live stream takes its state_update frames from.
 */
public enum StreamMode {
    /**
     * Committed events pushed through the in-process update hub.
     */
    SUBSCRIBE,
    /**
     * Fixed-interval survey of the event log and snapshot store.
     */
    POLL;

    public static StreamMode parse(String value) {
        if (value == null || value.isBlank()) {
            return SUBSCRIBE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
