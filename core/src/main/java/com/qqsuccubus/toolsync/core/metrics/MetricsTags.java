package com.qqsuccubus.toolsync.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "node_id";

    /**
     * Tag key for update / frame / broadcast type.
     */
    public static final String TYPE = "type";

    public static final String RESULT = "result";

    public static final String STRATEGY = "strategy";

    /**
     * Tag key for failure reason.
     */
    public static final String REASON = "reason";
}
