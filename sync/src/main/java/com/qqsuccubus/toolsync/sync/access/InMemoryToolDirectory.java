package com.qqsuccubus.toolsync.sync.access;

import com.qqsuccubus.toolsync.core.util.JsonUtils;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Directory held in memory, optionally seeded from a JSON file of the form
 * {@code {"tools": [...], "deployments": [...], "members": [...]}}.
 */
public class InMemoryToolDirectory implements IToolDirectory {
    private static final Logger log = LoggerFactory.getLogger(InMemoryToolDirectory.class);

    private final Map<String, ToolRecord> tools = new ConcurrentHashMap<>();
    private final Map<String, DeploymentRecord> deployments = new ConcurrentHashMap<>();
    private final List<SpaceMember> members = new CopyOnWriteArrayList<>();

    public static InMemoryToolDirectory fromFile(Path path) {
        InMemoryToolDirectory directory = new InMemoryToolDirectory();
        try {
            Seed seed = JsonUtils.readValue(Files.readString(path), Seed.class);
            seed.getTools().forEach(directory::putTool);
            seed.getDeployments().forEach(directory::putDeployment);
            seed.getMembers().forEach(directory::putMember);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read tool directory " + path, e);
        }
        log.info("Loaded tool directory from {}: {} tools, {} deployments, {} members",
            path, directory.tools.size(), directory.deployments.size(), directory.members.size());
        return directory;
    }

    public InMemoryToolDirectory putTool(ToolRecord tool) {
        tools.put(tool.getId(), tool);
        return this;
    }

    public InMemoryToolDirectory putDeployment(DeploymentRecord deployment) {
        deployments.put(deployment.getId(), deployment);
        return this;
    }

    public InMemoryToolDirectory putMember(SpaceMember member) {
        members.removeIf(m -> m.getSpaceId().equals(member.getSpaceId()) && m.getUserId().equals(member.getUserId()));
        members.add(member);
        return this;
    }

    @Override
    public Mono<ToolRecord> findTool(String toolId) {
        return Mono.justOrEmpty(tools.get(toolId));
    }

    @Override
    public Mono<DeploymentRecord> findDeployment(String deploymentId) {
        return Mono.justOrEmpty(deployments.get(deploymentId));
    }

    @Override
    public Mono<SpaceMember> findActiveMember(String spaceId, String userId) {
        return activeMembers(spaceId)
            .filter(m -> m.getUserId().equals(userId))
            .next();
    }

    @Override
    public Flux<SpaceMember> activeMembers(String spaceId) {
        return Flux.fromIterable(members)
            .filter(m -> m.isActive() && m.getSpaceId().equals(spaceId));
    }

    @Value
    @Builder
    @Jacksonized
    static class Seed {
        @Builder.Default
        List<ToolRecord> tools = List.of();
        @Builder.Default
        List<DeploymentRecord> deployments = List.of();
        @Builder.Default
        List<SpaceMember> members = List.of();
    }
}
