package com.qqsuccubus.toolsync.core.redis;

/**
 * Redis keyspace definitions for snapshots, the update event log, ack tracking and channel outboxes.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Use namespace prefixes to avoid collisions (tool-state:, tool:, deployment:, ack:, outbox:)</li>
 *   <li>Use hashes for documents, sorted sets for time indexes, streams for outboxes</li>
 *   <li>Set TTLs on outboxes to prevent unbounded growth</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Snapshot of a key: {@code tool-state:{id}}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b>
     * <ul>
     *   <li>{@code version}: Current version (also the CAS guard)</li>
     *   <li>{@code json}: Serialized StateSnapshot</li>
     * </ul>
     * </p>
     *
     * @param stateId {@code toolId} or {@code toolId_deploymentId}
     * @return Redis key
     */
    public static String snapshot(String stateId) {
        return "tool-state:" + stateId;
    }

    /**
     * All update events: {@code tool-update-events}
     * <p>
     * <b>Type:</b> Hash, field = event id, value = serialized UpdateEvent
     * </p>
     */
    public static String events() {
        return "tool-update-events";
    }

    /**
     * Time index of a tool's events across all its deployments: {@code tool:{toolId}:events}
     * <p>
     * <b>Type:</b> Sorted set, member = event id, score = timestamp (epoch millis)
     * </p>
     */
    public static String toolEvents(String toolId) {
        return "tool:" + toolId + ":events";
    }

    /**
     * Time index of one deployment's events: {@code deployment:{deploymentId}:events}
     * <p>
     * <b>Type:</b> Sorted set, member = event id, score = timestamp (epoch millis)
     * </p>
     */
    public static String deploymentEvents(String deploymentId) {
        return "deployment:" + deploymentId + ":events";
    }

    /**
     * Ack tracking documents: {@code tool-update-acks}
     * <p>
     * <b>Type:</b> Hash, field = update event id, value = serialized AckTracking
     * </p>
     */
    public static String acks() {
        return "tool-update-acks";
    }

    /**
     * Users who acknowledged an event: {@code ack:{eventId}:received}
     * <p>
     * <b>Type:</b> Set. SADD keeps concurrent acks from overwriting each other.
     * </p>
     */
    public static String ackReceived(String updateEventId) {
        return "ack:" + updateEventId + ":received";
    }

    /**
     * Channel outbox: {@code outbox:{channel}}
     * <p>
     * <b>Type:</b> Stream (XADD with MAXLEN ~ N), field {@code msg} = serialized BroadcastMessage
     * <br>
     * <b>Retention:</b> Last N messages and a TTL refreshed on every append
     * </p>
     */
    public static String outbox(String channel) {
        return "outbox:" + channel;
    }
}
