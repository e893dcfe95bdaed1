package com.qqsuccubus.toolsync.core.msg;

import java.util.ArrayList;
import java.util.List;

/**
 * Logical broadcast addresses an update event belongs to.
 * <p>
 * Channel naming:
 * <ul>
 *   <li>{@code tool:{toolId}:updates} - always</li>
 *   <li>{@code deployment:{deploymentId}:updates} - when the update targets a deployment</li>
 *   <li>{@code space:{spaceId}:tools} - when a space is given and space broadcast is on</li>
 * </ul>
 * </p>
 */
public final class Channels {
    private Channels() {
    }

    public static final String TOOL_PREFIX = "tool:";
    public static final String DEPLOYMENT_PREFIX = "deployment:";
    public static final String SPACE_PREFIX = "space:";

    public static String tool(String toolId) {
        return TOOL_PREFIX + toolId + ":updates";
    }

    public static String deployment(String deploymentId) {
        return DEPLOYMENT_PREFIX + deploymentId + ":updates";
    }

    public static String space(String spaceId) {
        return SPACE_PREFIX + spaceId + ":tools";
    }

    public static boolean isToolChannel(String channel) {
        return channel != null && channel.startsWith(TOOL_PREFIX);
    }

    /**
     * Computes the channels for an update, in tool, deployment, space order.
     *
     * @param toolId           Tool identifier (required)
     * @param deploymentId     Deployment identifier, may be null
     * @param spaceId          Space identifier, may be null
     * @param broadcastToSpace Whether the space channel should be included
     * @return Channel ids
     */
    public static List<String> channelsFor(String toolId, String deploymentId, String spaceId,
                                           boolean broadcastToSpace) {
        List<String> channels = new ArrayList<>(3);
        channels.add(tool(toolId));
        if (deploymentId != null && !deploymentId.isBlank()) {
            channels.add(deployment(deploymentId));
        }
        if (spaceId != null && !spaceId.isBlank() && broadcastToSpace) {
            channels.add(space(spaceId));
        }
        return channels;
    }
}
