package com.qqsuccubus.toolsync.sync.access;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A tool deployed by a user, optionally into a space.
 */
@Value
@Builder
@Jacksonized
public class DeploymentRecord {
    String id;
    String toolId;
    String deployedBy;
    String spaceId;
}
