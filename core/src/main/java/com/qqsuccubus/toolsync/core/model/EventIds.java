package com.qqsuccubus.toolsync.core.model;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Event id generation. Ids carry a kind prefix, the tool id, the creation time and a random
 * suffix, e.g. {@code tool_update_t1_1767225600000_k3j9x0ab}.
 */
public final class EventIds {
    private EventIds() {
    }

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 8;

    public static String toolUpdate(String toolId, Instant now) {
        return generate("tool_update", toolId, now);
    }

    public static String sync(String toolId, Instant now) {
        return generate("sync", toolId, now);
    }

    public static String conflictResolution(String toolId, Instant now) {
        return generate("conflict_resolution", toolId, now);
    }

    public static String broadcast(String eventId, Instant now) {
        return generate("tool_update_broadcast", eventId, now);
    }

    private static String generate(String kind, String subject, Instant now) {
        StringBuilder id = new StringBuilder(kind)
            .append('_').append(subject)
            .append('_').append(now.toEpochMilli())
            .append('_');
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            id.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return id.toString();
    }
}
