package com.qqsuccubus.toolsync.sync.access;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Lookup of tools, deployments and space membership, owned by the surrounding platform.
 */
public interface IToolDirectory {

    Mono<ToolRecord> findTool(String toolId);

    Mono<DeploymentRecord> findDeployment(String deploymentId);

    /**
     * @return the user's membership of the space if it is active, else empty
     */
    Mono<SpaceMember> findActiveMember(String spaceId, String userId);

    Flux<SpaceMember> activeMembers(String spaceId);
}
