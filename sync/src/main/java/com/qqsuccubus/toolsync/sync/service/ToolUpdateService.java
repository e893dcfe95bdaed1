package com.qqsuccubus.toolsync.sync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.toolsync.core.model.AckTracking;
import com.qqsuccubus.toolsync.core.model.ConflictStrategy;
import com.qqsuccubus.toolsync.core.model.EventData;
import com.qqsuccubus.toolsync.core.model.EventIds;
import com.qqsuccubus.toolsync.core.model.StateSnapshot;
import com.qqsuccubus.toolsync.core.model.ToolStateKey;
import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import com.qqsuccubus.toolsync.core.model.UpdateType;
import com.qqsuccubus.toolsync.core.msg.Channels;
import com.qqsuccubus.toolsync.core.msg.StreamFrame;
import com.qqsuccubus.toolsync.core.state.StateDiff;
import com.qqsuccubus.toolsync.sync.access.IToolDirectory;
import com.qqsuccubus.toolsync.sync.access.ToolAccessPolicy;
import com.qqsuccubus.toolsync.sync.ack.AckTracker;
import com.qqsuccubus.toolsync.sync.broadcast.BroadcastFanOut;
import com.qqsuccubus.toolsync.sync.broadcast.UpdateHub;
import com.qqsuccubus.toolsync.sync.conflict.ConflictResolver;
import com.qqsuccubus.toolsync.sync.conflict.Resolution;
import com.qqsuccubus.toolsync.sync.error.ToolSyncException;
import com.qqsuccubus.toolsync.sync.metrics.MetricsService;
import com.qqsuccubus.toolsync.sync.state.Sequencer;
import com.qqsuccubus.toolsync.sync.state.SnapshotService;
import com.qqsuccubus.toolsync.sync.store.Commit;
import com.qqsuccubus.toolsync.sync.store.EventQuery;
import com.qqsuccubus.toolsync.sync.store.IEventLog;
import com.qqsuccubus.toolsync.sync.stream.StreamingChannel;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Request orchestration for tool updates: submit, history, live stream, sync, cleanup and
 * acknowledgments.
 * <p>
 * Validation and permission checks run before anything is written. The primary write is one
 * atomic commit through {@link SnapshotService#write}; broadcast fan-out and ack registration
 * run after it and never fail the request.
 * </p>
 */
public class ToolUpdateService {
    private static final Logger log = LoggerFactory.getLogger(ToolUpdateService.class);

    static final int DEFAULT_EXPIRES_IN_MINUTES = 60;
    private static final String SYNCED_FROM = "syncedFrom";
    private static final String SYNCED_FROM_CLIENT = "client";

    private final IToolDirectory directory;
    private final ToolAccessPolicy accessPolicy;
    private final SnapshotService snapshotService;
    private final IEventLog eventLog;
    private final ConflictResolver conflictResolver;
    private final BroadcastFanOut fanOut;
    private final AckTracker ackTracker;
    private final UpdateHub hub;
    private final StreamingChannel streamingChannel;
    private final MetricsService metricsService;
    private final Clock clock;

    public ToolUpdateService(IToolDirectory directory,
                             ToolAccessPolicy accessPolicy,
                             SnapshotService snapshotService,
                             IEventLog eventLog,
                             ConflictResolver conflictResolver,
                             BroadcastFanOut fanOut,
                             AckTracker ackTracker,
                             UpdateHub hub,
                             StreamingChannel streamingChannel,
                             MetricsService metricsService,
                             Clock clock) {
        this.directory = directory;
        this.accessPolicy = accessPolicy;
        this.snapshotService = snapshotService;
        this.eventLog = eventLog;
        this.conflictResolver = conflictResolver;
        this.fanOut = fanOut;
        this.ackTracker = ackTracker;
        this.hub = hub;
        this.streamingChannel = streamingChannel;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    // ---------------------------------------------------------------- submit

    /**
     * Accepts an update: sequences it, appends it to the event log, applies it to the
     * snapshot, then fans it out and registers ack tracking when required.
     */
    public Mono<SubmitResult> submit(String userId, SubmitUpdateRequest request) {
        return Mono.defer(() -> {
            UpdateType updateType = validateSubmit(request);
            ToolStateKey key = ToolStateKey.of(request.getToolId(), request.getDeploymentId());

            return directory.findTool(request.getToolId())
                .switchIfEmpty(Mono.error(() -> ToolSyncException.notFound("Tool not found")))
                .then(accessPolicy.canUpdate(userId, request.getToolId(), request.getDeploymentId(),
                    request.getSpaceId()))
                .flatMap(allowed -> allowed
                    ? affectedUsers(request)
                    : Mono.<List<String>>error(ToolSyncException.forbidden("Insufficient permissions to update tool")))
                .flatMap(users -> snapshotService.write(key,
                    current -> planSubmit(key, userId, updateType, request, users, current)))
                .doOnNext(event -> {
                    metricsService.recordUpdate(event.getUpdateType());
                    log.info("Update {} accepted for {} (seq={}, by={})",
                        event.getId(), key, event.getSequenceNumber(), userId);
                    hub.publish(event);
                    runSideEffects(event);
                })
                .map(event -> SubmitResult.builder()
                    .id(event.getId())
                    .toolId(event.getToolId())
                    .updateType(event.getUpdateType())
                    .sequenceNumber(event.getSequenceNumber())
                    .affectedUsers(event.getAffectedUsers().size())
                    .timestamp(event.getTimestamp())
                    .build());
        });
    }

    private static UpdateType validateSubmit(SubmitUpdateRequest request) {
        if (request == null || isBlank(request.getToolId())) {
            throw ToolSyncException.invalidInput("toolId is required");
        }
        if (isBlank(request.getUpdateType())) {
            throw ToolSyncException.invalidInput("updateType is required");
        }
        UpdateType updateType = UpdateType.find(request.getUpdateType())
            .orElseThrow(() -> ToolSyncException.invalidInput("Unknown updateType: " + request.getUpdateType()));
        if (request.getEventData() == null) {
            throw ToolSyncException.invalidInput("eventData is required");
        }
        if (request.getExpiresInMinutes() != null && request.getExpiresInMinutes() <= 0) {
            throw ToolSyncException.invalidInput("expiresInMinutes must be positive");
        }
        return updateType;
    }

    private Mono<List<String>> affectedUsers(SubmitUpdateRequest request) {
        if (request.getTargetUsers() != null && !request.getTargetUsers().isEmpty()) {
            return Mono.just(List.copyOf(request.getTargetUsers()));
        }
        return accessPolicy.affectedUsers(request.getToolId(), request.getDeploymentId(), request.getSpaceId());
    }

    private SnapshotService.Plan<UpdateEvent> planSubmit(ToolStateKey key,
                                                         String userId,
                                                         UpdateType updateType,
                                                         SubmitUpdateRequest request,
                                                         List<String> affectedUsers,
                                                         Optional<StateSnapshot> current) {
        Instant now = clock.instant();
        StateSnapshot previous = current.orElse(null);
        EventData data = request.getEventData();

        List<String> changedFields = data.getChangedFields();
        if ((changedFields == null || changedFields.isEmpty()) && data.hasNewState()) {
            changedFields = StateDiff.changedFields(previous != null ? previous.getCurrentState() : null,
                data.getNewState());
        }
        Map<String, Object> metadata = new LinkedHashMap<>(data.getMetadata() != null ? data.getMetadata() : Map.of());
        metadata.put("triggeredBy", userId);
        metadata.put("timestamp", now.toString());

        int expiresIn = request.getExpiresInMinutes() != null
            ? request.getExpiresInMinutes()
            : DEFAULT_EXPIRES_IN_MINUTES;

        UpdateEvent event = UpdateEvent.builder()
            .id(EventIds.toolUpdate(key.getToolId(), now))
            .toolId(key.getToolId())
            .deploymentId(key.getDeploymentId())
            .spaceId(request.getSpaceId())
            .userId(userId)
            .updateType(updateType)
            .eventData(data.toBuilder()
                .changedFields(changedFields != null ? changedFields : List.of())
                .metadata(metadata)
                .build())
            .affectedUsers(affectedUsers)
            .timestamp(now)
            .sequenceNumber(Sequencer.next(previous))
            .broadcastChannels(Channels.channelsFor(key.getToolId(), key.getDeploymentId(),
                request.getSpaceId(), request.isBroadcastToSpace()))
            .requiresAck(request.isRequiresAck())
            .expiresAt(now.plus(Duration.ofMinutes(expiresIn)))
            .build();

        return SnapshotService.Plan.of(commitOf(key, previous, snapshotService.applyUpdate(event, previous), event),
            event);
    }

    /**
     * Fan-out and ack registration. Subscribed without waiting; failures are logged and dropped.
     */
    private void runSideEffects(UpdateEvent event) {
        Mono<AckTracking> ack = event.isRequiresAck()
            ? ackTracker.register(event)
                .onErrorResume(err -> {
                    log.warn("Failed to register ack tracking for {}: {}", event.getId(), err.toString());
                    return Mono.empty();
                })
            : Mono.empty();

        fanOut.fanOut(event)
            .onErrorResume(err -> {
                log.warn("Broadcast of {} failed: {}", event.getId(), err.toString());
                return Mono.empty();
            })
            .then(ack)
            .subscribe(
                ignored -> { },
                err -> log.error("Side effects of update {} failed", event.getId(), err));
    }

    // ---------------------------------------------------------------- history

    public Mono<HistoryResult> history(String userId, HistoryRequest request) {
        return Mono.defer(() -> {
            if (request == null || isBlank(request.getToolId())) {
                return Mono.error(ToolSyncException.invalidInput("toolId is required"));
            }
            ToolStateKey key = ToolStateKey.of(request.getToolId(), request.getDeploymentId());
            int limit = request.effectiveLimit();

            Mono<List<UpdateEvent>> events = eventLog.query(EventQuery.builder()
                    .toolId(request.getToolId())
                    .deploymentId(key.getDeploymentId())
                    .spaceId(request.getSpaceId())
                    .since(request.getSince())
                    .limit(limit)
                    .build())
                .collectList();

            Mono<HistoryResult> snapshotPart = snapshotService.get(key)
                .map(snapshot -> HistoryResult.builder()
                    .stateSnapshot(request.isIncludeSnapshot() ? snapshot : null)
                    .syncStatus(SyncStatusView.of(snapshot))
                    .build())
                .defaultIfEmpty(HistoryResult.builder().syncStatus(SyncStatusView.noState()).build())
                .onErrorResume(err -> {
                    log.warn("Snapshot {} unavailable for history: {}", key, err.toString());
                    return Mono.just(HistoryResult.builder().syncStatus(SyncStatusView.error()).build());
                });

            return requireRead(userId, request.getToolId(), request.getDeploymentId(), request.getSpaceId())
                .then(events.zipWith(snapshotPart, (newestFirst, partial) -> {
                    List<UpdateEvent> chronological = new ArrayList<>(newestFirst);
                    Collections.reverse(chronological);
                    return partial.toBuilder()
                        .updates(chronological)
                        .hasMore(newestFirst.size() == limit)
                        .lastSequenceNumber(newestFirst.isEmpty() ? 0L : newestFirst.get(0).getSequenceNumber())
                        .build();
                }));
        });
    }

    // ---------------------------------------------------------------- stream

    /**
     * Opens the live stream of a deployment once the caller is known to have read access.
     *
     * @param toolId tool of the deployment; looked up from the deployment when null
     */
    public Mono<Flux<StreamFrame>> openStream(String userId, String deploymentId, String toolId) {
        return Mono.defer(() -> {
            if (isBlank(deploymentId)) {
                return Mono.error(ToolSyncException.invalidInput("deploymentId is required for streaming"));
            }
            Mono<String> resolvedTool = !isBlank(toolId)
                ? Mono.just(toolId)
                : directory.findDeployment(deploymentId)
                    .flatMap(d -> Mono.justOrEmpty(d.getToolId()))
                    .switchIfEmpty(Mono.error(() -> ToolSyncException.notFound("Deployment not found")));

            return resolvedTool.flatMap(tool -> requireRead(userId, tool, deploymentId, null)
                .thenReturn(streamingChannel.open(userId, deploymentId, tool)));
        });
    }

    // ---------------------------------------------------------------- sync

    /**
     * Reconciles a client's view of a key with the server snapshot.
     * <ul>
     *     <li>no snapshot: the client state becomes version 1</li>
     *     <li>same version, no forced merge: the client state becomes the next version</li>
     *     <li>otherwise: the conflict is resolved with the requested strategy</li>
     * </ul>
     */
    public Mono<SyncResult> sync(String userId, SyncRequest request) {
        return Mono.defer(() -> {
            validateSync(request);
            ToolStateKey key = ToolStateKey.of(request.getToolId(), request.getDeploymentId());
            ConflictStrategy strategy = ConflictStrategy.parse(request.getConflictResolution());

            return requireRead(userId, request.getToolId(), request.getDeploymentId(), null)
                .then(snapshotService.write(key, current -> planSync(key, userId, request, strategy, current)))
                .doOnNext(outcome -> {
                    metricsService.recordSync(outcome.getResult().getSyncResult());
                    if (outcome.getStrategy() != null) {
                        metricsService.recordConflict(outcome.getStrategy());
                    }
                    log.info("Sync of {} by {}: {} (v{})", key, userId,
                        outcome.getResult().getSyncResult(), outcome.getResult().getServerVersion());
                    hub.publish(outcome.getEvent());
                    relayToPeers(outcome.getEvent());
                })
                .map(SyncOutcome::getResult);
        });
    }

    private void relayToPeers(UpdateEvent event) {
        fanOut.relay(event)
            .subscribe(
                ignored -> { },
                err -> log.error("Relay of sync event {} failed", event.getId(), err));
    }

    private static void validateSync(SyncRequest request) {
        if (request == null || isBlank(request.getToolId())) {
            throw ToolSyncException.invalidInput("toolId is required");
        }
        if (request.getClientVersion() == null) {
            throw ToolSyncException.invalidInput("clientVersion is required");
        }
        if (request.getClientState() == null || request.getClientState().isNull()) {
            throw ToolSyncException.invalidInput("clientState is required");
        }
    }

    private SnapshotService.Plan<SyncOutcome> planSync(ToolStateKey key,
                                                       String userId,
                                                       SyncRequest request,
                                                       ConflictStrategy strategy,
                                                       Optional<StateSnapshot> current) {
        JsonNode clientState = request.getClientState();

        if (current.isEmpty()) {
            StateSnapshot created = snapshotService.createFromClient(key, clientState, userId);
            UpdateEvent event = syncEvent(key, userId, null, clientState, 1L, created.getLastUpdate());
            SyncResult result = SyncResult.builder()
                .syncResult(SyncResult.CLIENT_STATE_ACCEPTED)
                .serverState(clientState)
                .serverVersion(created.getVersion())
                .build();
            return SnapshotService.Plan.of(commitOf(key, null, created, event), new SyncOutcome(result, event, null));
        }

        StateSnapshot server = current.get();
        Instant now = clock.instant();

        if (request.getClientVersion() == server.getVersion() && !request.isForceMerge()) {
            UpdateEvent event = syncEvent(key, userId, server.getCurrentState(), clientState,
                Sequencer.next(server), now);
            StateSnapshot updated = snapshotService.applyUpdate(event, server);
            SyncResult result = SyncResult.builder()
                .syncResult(SyncResult.SYNC_SUCCESSFUL)
                .serverState(updated.getCurrentState())
                .serverVersion(updated.getVersion())
                .build();
            return SnapshotService.Plan.of(commitOf(key, server, updated, event), new SyncOutcome(result, event, null));
        }

        Resolution resolution = conflictResolver.resolve(server, clientState, request.getClientVersion(),
            strategy, userId, now);
        StateSnapshot applied = snapshotService.applyUpdate(resolution.getEvent(), server);
        StateSnapshot updated = applied.toBuilder()
            .metadata(applied.getMetadata().withConflictResolution(strategy.recordedAs()))
            .build();
        SyncResult result = SyncResult.builder()
            .syncResult(SyncResult.CONFLICT_RESOLVED)
            .serverState(resolution.getResolvedState())
            .serverVersion(resolution.newVersion())
            .conflicts(resolution.getConflicts())
            .resolutionStrategy(strategy.wire())
            .build();
        return SnapshotService.Plan.of(commitOf(key, server, updated, resolution.getEvent()),
            new SyncOutcome(result, resolution.getEvent(), strategy));
    }

    private static UpdateEvent syncEvent(ToolStateKey key,
                                         String userId,
                                         JsonNode previousState,
                                         JsonNode newState,
                                         long sequenceNumber,
                                         Instant now) {
        return UpdateEvent.builder()
            .id(EventIds.sync(key.getToolId(), now))
            .toolId(key.getToolId())
            .deploymentId(key.getDeploymentId())
            .userId(userId)
            .updateType(UpdateType.STATE_CHANGE)
            .eventData(EventData.builder()
                .previousState(previousState)
                .newState(newState)
                .changedFields(StateDiff.changedFields(previousState, newState))
                .metadata(Map.of(SYNCED_FROM, SYNCED_FROM_CLIENT))
                .build())
            .timestamp(now)
            .sequenceNumber(sequenceNumber)
            .build();
    }

    // ---------------------------------------------------------------- cleanup

    public Mono<CleanupResult> cleanup(String userId, CleanupRequest request) {
        return Mono.defer(() -> {
            if (request == null || isBlank(request.getToolId())) {
                return Mono.error(ToolSyncException.invalidInput("toolId is required"));
            }
            if (isBlank(request.getEventId()) && request.getOlderThan() == null) {
                return Mono.error(ToolSyncException.invalidInput("Either eventId or olderThan is required"));
            }
            String toolId = request.getToolId();

            Mono<Long> deletion = !isBlank(request.getEventId())
                ? eventLog.findById(request.getEventId())
                    .filter(event -> toolId.equals(event.getToolId()))
                    .switchIfEmpty(Mono.error(() -> ToolSyncException.notFound("Update event not found")))
                    .flatMap(event -> eventLog.delete(event.getId()))
                    .map(deleted -> deleted ? 1L : 0L)
                : eventLog.deleteOlderThan(toolId, request.getDeploymentId(), request.getOlderThan());

            return accessPolicy.canUpdate(userId, toolId, request.getDeploymentId(), null)
                .flatMap(allowed -> allowed
                    ? deletion
                    : Mono.<Long>error(ToolSyncException.forbidden("Insufficient permissions")))
                .doOnNext(count -> log.info("Cleaned up {} events of tool {} (by={})", count, toolId, userId))
                .map(CleanupResult::of);
        });
    }

    // ---------------------------------------------------------------- acks

    public Mono<AckTracking> acknowledge(String userId, String updateEventId) {
        if (isBlank(updateEventId)) {
            return Mono.error(ToolSyncException.invalidInput("updateEventId is required"));
        }
        return ackTracker.recordAck(updateEventId, userId);
    }

    public Mono<AckTracking> ackStatus(String updateEventId) {
        if (isBlank(updateEventId)) {
            return Mono.error(ToolSyncException.invalidInput("updateEventId is required"));
        }
        return ackTracker.get(updateEventId);
    }

    // ---------------------------------------------------------------- helpers

    private Mono<Void> requireRead(String userId, String toolId, String deploymentId, String spaceId) {
        return accessPolicy.canRead(userId, toolId, deploymentId, spaceId)
            .flatMap(allowed -> allowed
                ? Mono.<Void>empty()
                : Mono.<Void>error(ToolSyncException.forbidden("Access denied")));
    }

    private static Commit commitOf(ToolStateKey key, StateSnapshot previous, StateSnapshot next, UpdateEvent event) {
        return Commit.builder()
            .key(key)
            .expectedVersion(previous != null ? previous.getVersion() : 0L)
            .snapshot(next)
            .event(event)
            .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Value
    private static class SyncOutcome {
        SyncResult result;
        UpdateEvent event;
        /**
         * Strategy applied, null when no conflict was resolved.
         */
        ConflictStrategy strategy;
    }
}
