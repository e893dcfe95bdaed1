package com.qqsuccubus.toolsync.core.metrics;

/**
 * Micrometer metric names used by the sync node.
 * <p>
 * <b>Naming convention:</b> {@code rtc.toolsync.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Update events accepted through submit.
     * <p>
     * Tags: type (update type)
     * </p>
     */
    public static final String UPDATES_TOTAL = "rtc.toolsync.updates.total";

    /**
     * Counter: Reconcile requests by outcome.
     * <p>
     * Tags: result (client_state_accepted/sync_successful/conflict_resolved)
     * </p>
     */
    public static final String SYNCS_TOTAL = "rtc.toolsync.sync.total";

    /**
     * Counter: Conflicts resolved.
     * <p>
     * Tags: strategy
     * </p>
     */
    public static final String CONFLICTS_TOTAL = "rtc.toolsync.conflicts.total";

    /**
     * Counter: Commits retried after losing a compare-and-set race.
     */
    public static final String COMMIT_RETRIES_TOTAL = "rtc.toolsync.commit.retries.total";

    /**
     * Timer: Read-sequence-commit round trip, retries included.
     */
    public static final String COMMIT_LATENCY = "rtc.toolsync.commit.latency";

    /**
     * Counter: Broadcast messages appended to channel outboxes.
     * <p>
     * Tags: type (outbox/publish)
     * </p>
     */
    public static final String BROADCAST_TOTAL = "rtc.toolsync.broadcast.total";

    /**
     * Counter: Broadcast failures that were logged and dropped.
     * <p>
     * Tags: reason (outbox/publish)
     * </p>
     */
    public static final String BROADCAST_FAILURES_TOTAL = "rtc.toolsync.broadcast.failures.total";

    public static final String ACKS_TOTAL = "rtc.toolsync.acks.total";

    /**
     * Counter: Frames written on live update streams.
     * <p>
     * Tags: type (connected/heartbeat/state_update)
     * </p>
     */
    public static final String STREAM_FRAMES_TOTAL = "rtc.toolsync.stream.frames.total";

    /**
     * Gauge: Currently open streaming connections.
     */
    public static final String STREAM_CONNECTIONS = "rtc.toolsync.stream.connections";
}
