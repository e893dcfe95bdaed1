package com.qqsuccubus.toolsync.core.model;

import lombok.Value;

/**
 * Identifies one independently versioned state stream: a tool, or one deployment of it.
 * <p>
 * A blank deployment id is normalized to {@code null}, in which case the tool itself is the
 * unit of state.
 * </p>
 */
@Value
public class ToolStateKey {
    String toolId;
    String deploymentId;

    private ToolStateKey(String toolId, String deploymentId) {
        this.toolId = toolId;
        this.deploymentId = deploymentId;
    }

    public static ToolStateKey of(String toolId, String deploymentId) {
        if (toolId == null || toolId.isBlank()) {
            throw new IllegalArgumentException("toolId must not be blank");
        }
        String deployment = deploymentId == null || deploymentId.isBlank() ? null : deploymentId;
        return new ToolStateKey(toolId, deployment);
    }

    public static ToolStateKey of(String toolId) {
        return of(toolId, null);
    }

    public boolean hasDeployment() {
        return deploymentId != null;
    }

    /**
     * Storage id of the key: {@code toolId} or {@code toolId_deploymentId}.
     */
    public String id() {
        return deploymentId == null ? toolId : toolId + "_" + deploymentId;
    }

    @Override
    public String toString() {
        return id();
    }
}
