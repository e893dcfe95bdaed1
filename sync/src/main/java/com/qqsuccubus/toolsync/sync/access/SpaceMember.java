package com.qqsuccubus.toolsync.sync.access;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

@Value
@Builder
@Jacksonized
public class SpaceMember {
    /**
     * Roles that may update tools deployed in the space.
     */
    public static final Set<String> EDITOR_ROLES = Set.of("builder", "moderator", "admin");

    String spaceId;
    String userId;
    @Builder.Default
    String role = "member";
    @Builder.Default
    boolean active = true;

    public boolean canEditTools() {
        return active && EDITOR_ROLES.contains(role);
    }
}
