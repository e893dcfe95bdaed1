package com.qqsuccubus.toolsync.sync.access;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Who may change, read and receive updates of a tool.
 * <p>
 * Directory failures deny access: they are logged and read as "no".
 * </p>
 */
public class ToolAccessPolicy {
    private static final Logger log = LoggerFactory.getLogger(ToolAccessPolicy.class);

    private final IToolDirectory directory;

    public ToolAccessPolicy(IToolDirectory directory) {
        this.directory = directory;
    }

    /**
     * Update permission: tool author, deployer of the given deployment, or an active member of
     * the given space with an editor role.
     */
    public Mono<Boolean> canUpdate(String userId, String toolId, String deploymentId, String spaceId) {
        Mono<Boolean> deployer = deploymentId == null
            ? Mono.just(false)
            : directory.findDeployment(deploymentId).map(d -> userId.equals(d.getDeployedBy())).defaultIfEmpty(false);
        Mono<Boolean> editor = spaceId == null
            ? Mono.just(false)
            : directory.findActiveMember(spaceId, userId).map(SpaceMember::canEditTools).defaultIfEmpty(false);

        return directory.findTool(toolId)
            .flatMap(tool -> userId.equals(tool.getAuthorId())
                ? Mono.just(true)
                : anyOf(deployer, editor))
            .defaultIfEmpty(false)
            .onErrorResume(err -> deny("update", userId, toolId, err));
    }

    /**
     * Read access: tool author, deployer, active member of the deployment's space, or active
     * member of the given space.
     */
    public Mono<Boolean> canRead(String userId, String toolId, String deploymentId, String spaceId) {
        Mono<Boolean> author = directory.findTool(toolId)
            .map(tool -> userId.equals(tool.getAuthorId()))
            .defaultIfEmpty(false);
        Mono<Boolean> viaDeployment = deploymentId == null
            ? Mono.just(false)
            : directory.findDeployment(deploymentId)
                .flatMap(d -> userId.equals(d.getDeployedBy())
                    ? Mono.just(true)
                    : isMember(d.getSpaceId(), userId))
                .defaultIfEmpty(false);
        Mono<Boolean> viaSpace = isMember(spaceId, userId);

        return anyOf(author, viaDeployment, viaSpace)
            .onErrorResume(err -> deny("read", userId, toolId, err));
    }

    /**
     * Users an update concerns: tool author, deployer, members of the deployment's space and
     * members of the given space, deduplicated in that order.
     */
    public Mono<List<String>> affectedUsers(String toolId, String deploymentId, String spaceId) {
        Flux<String> author = directory.findTool(toolId).mapNotNull(ToolRecord::getAuthorId).flux();
        Flux<String> deployment = deploymentId == null
            ? Flux.empty()
            : directory.findDeployment(deploymentId).flatMapMany(d -> {
                Flux<String> deployer = Mono.justOrEmpty(d.getDeployedBy()).flux();
                Flux<String> members = d.getSpaceId() == null
                    ? Flux.empty()
                    : directory.activeMembers(d.getSpaceId()).map(SpaceMember::getUserId);
                return deployer.concatWith(members);
            });
        Flux<String> space = spaceId == null
            ? Flux.empty()
            : directory.activeMembers(spaceId).map(SpaceMember::getUserId);

        return Flux.concat(author, deployment, space)
            .collect(LinkedHashSet<String>::new, Set::add)
            .<List<String>>map(ArrayList::new)
            .onErrorResume(err -> {
                log.error("Failed to resolve users of tool {}", toolId, err);
                return Mono.just(List.of());
            });
    }

    private Mono<Boolean> isMember(String spaceId, String userId) {
        if (spaceId == null) {
            return Mono.just(false);
        }
        return directory.findActiveMember(spaceId, userId).hasElement();
    }

    @SafeVarargs
    private static Mono<Boolean> anyOf(Mono<Boolean>... checks) {
        return Flux.concat(checks)
            .any(Boolean::booleanValue);
    }

    private static Mono<Boolean> deny(String action, String userId, String toolId, Throwable err) {
        log.error("Failed to verify {} permission of {} on tool {}", action, userId, toolId, err);
        return Mono.just(false);
    }
}
