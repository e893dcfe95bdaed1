package com.qqsuccubus.toolsync.core.msg;

public final class Topics {
    private Topics() {
    }

    /**
     * Broadcast topic for tool updates (BroadcastMessage values).
     * <p>
     * Record key is the channel id, so messages of one channel stay in one partition
     * and keep their publish order.
     * </p>
     */
    public static final String TOOL_BROADCAST = "rtc.tool.broadcast";
}
