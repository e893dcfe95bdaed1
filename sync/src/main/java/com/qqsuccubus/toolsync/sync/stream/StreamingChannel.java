package com.qqsuccubus.toolsync.sync.stream;

import com.qqsuccubus.toolsync.core.model.StateSnapshot;
import com.qqsuccubus.toolsync.core.model.ToolStateKey;
import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import com.qqsuccubus.toolsync.core.msg.StreamFrame;
import com.qqsuccubus.toolsync.core.util.JsonUtils;
import com.qqsuccubus.toolsync.sync.broadcast.UpdateHub;
import com.qqsuccubus.toolsync.sync.config.SyncConfig;
import com.qqsuccubus.toolsync.sync.metrics.MetricsService;
import com.qqsuccubus.toolsync.sync.state.SnapshotService;
import com.qqsuccubus.toolsync.sync.store.EventQuery;
import com.qqsuccubus.toolsync.sync.store.IEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Live update stream of one deployment for one caller.
 * <p>
 * Frame order: {@code connected} first, then {@code heartbeat} frames on a fixed interval
 * merged with {@code state_update} frames. Updates authored by the caller are never sent
 * back, and an update is sent at most once per connection (by sequence number).
 * </p>
 * <p>
 * In {@link StreamMode#SUBSCRIBE} mode updates come from the {@link UpdateHub} as they are
 * committed. In {@link StreamMode#POLL} mode the event log and snapshot store are surveyed
 * on a fixed interval over a trailing window, so an update may be missed at window edges.
 * </p>
 * <p>
 * Cancelling the subscription closes the connection and stops both timers; results of a
 * survey still in flight are dropped. Nothing here writes to the stores.
 * </p>
 */
public class StreamingChannel {
    private static final Logger log = LoggerFactory.getLogger(StreamingChannel.class);

    private final SyncConfig config;
    private final IEventLog eventLog;
    private final SnapshotService snapshotService;
    private final UpdateHub hub;
    private final MetricsService metricsService;
    private final Clock clock;

    public StreamingChannel(SyncConfig config,
                            IEventLog eventLog,
                            SnapshotService snapshotService,
                            UpdateHub hub,
                            MetricsService metricsService,
                            Clock clock) {
        this.config = config;
        this.eventLog = eventLog;
        this.snapshotService = snapshotService;
        this.hub = hub;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * @param userId       caller; their own updates are filtered out
     * @param deploymentId deployment to follow (required)
     * @param toolId       tool of the deployment, may be null; enables the snapshot survey
     */
    public Flux<StreamFrame> open(String userId, String deploymentId, String toolId) {
        return Flux.defer(() -> {
            StreamConnection connection = new StreamConnection(userId, deploymentId, toolId);
            metricsService.streamOpened();
            log.info("Stream {} connecting: user={}, deployment={}, mode={}",
                connection.getConnectionId(), userId, deploymentId, config.getStreamMode());

            Mono<StreamFrame> connected = Mono.fromSupplier(() -> {
                connection.markStreaming();
                return StreamFrame.connected(deploymentId, clock.instant());
            });

            Flux<StreamFrame> heartbeats = Flux.interval(config.getHeartbeatInterval(), config.getHeartbeatInterval())
                .onBackpressureDrop()
                .map(tick -> StreamFrame.heartbeat(clock.instant()));

            Flux<StreamFrame> updates = config.getStreamMode() == StreamMode.POLL
                ? polled(connection)
                : subscribed(connection);

            return Flux.concat(connected, Flux.merge(heartbeats, updates))
                .doOnNext(frame -> metricsService.recordStreamFrame(frame.getType()))
                .doFinally(signal -> close(connection, signal));
        });
    }

    private Flux<StreamFrame> subscribed(StreamConnection connection) {
        return hub.events()
            .filter(event -> connection.getDeploymentId().equals(event.getDeploymentId()))
            .filter(event -> connection.getToolId() == null || connection.getToolId().equals(event.getToolId()))
            .filter(event -> !connection.getUserId().equals(event.getUserId()))
            .filter(event -> connection.admit(event.getSequenceNumber()))
            .map(StreamingChannel::stateUpdate);
    }

    private Flux<StreamFrame> polled(StreamConnection connection) {
        return Flux.interval(config.getPollInterval(), config.getPollInterval())
            .onBackpressureDrop()
            .concatMap(tick -> survey(connection));
    }

    /**
     * One poll: recent events of the deployment in sequence order, then the snapshot if it
     * changed inside the window.
     */
    Flux<StreamFrame> survey(StreamConnection connection) {
        Instant windowStart = clock.instant().minus(config.getPollWindow());

        EventQuery query = EventQuery.builder()
            .toolId(connection.getToolId())
            .deploymentId(connection.getDeploymentId())
            .since(windowStart)
            .limit(config.getPollMaxEvents())
            .build();

        Flux<StreamFrame> recent = eventLog.query(query)
            .collectList()
            .flatMapIterable(newestFirst -> {
                List<UpdateEvent> oldestFirst = new ArrayList<>(newestFirst);
                Collections.reverse(oldestFirst);
                return oldestFirst;
            })
            .filter(event -> !connection.getUserId().equals(event.getUserId()))
            .filter(event -> connection.admit(event.getSequenceNumber()))
            .map(StreamingChannel::stateUpdate);

        Flux<StreamFrame> snapshot = connection.getToolId() == null
            ? Flux.empty()
            : snapshotService.find(ToolStateKey.of(connection.getToolId(), connection.getDeploymentId()))
                .filter(s -> s.getLastUpdate() != null && s.getLastUpdate().isAfter(windowStart))
                .filter(s -> s.getMetadata() == null || !connection.getUserId().equals(s.getMetadata().getUpdatedBy()))
                .filter(s -> connection.admit(s.getVersion()))
                .map(StreamingChannel::snapshotUpdate)
                .flux();

        return recent.concatWith(snapshot)
            .onErrorResume(err -> {
                log.warn("Stream {} poll failed: {}", connection.getConnectionId(), err.toString());
                return Flux.empty();
            });
    }

    private void close(StreamConnection connection, SignalType signal) {
        if (connection.markClosed()) {
            metricsService.streamClosed();
            log.info("Stream {} closed ({})", connection.getConnectionId(), signal);
        }
    }

    static StreamFrame stateUpdate(UpdateEvent event) {
        return StreamFrame.builder()
            .type(StreamFrame.STATE_UPDATE)
            .state(event.getEventData() != null && event.getEventData().hasNewState()
                ? event.getEventData().getNewState()
                : JsonUtils.objectNode())
            .updateType(event.getUpdateType())
            .timestamp(event.getTimestamp())
            .triggeredBy(event.getUserId())
            .sequenceNumber(event.getSequenceNumber())
            .build();
    }

    static StreamFrame snapshotUpdate(StateSnapshot snapshot) {
        return StreamFrame.builder()
            .type(StreamFrame.STATE_UPDATE)
            .state(snapshot.getCurrentState() != null ? snapshot.getCurrentState() : JsonUtils.objectNode())
            .timestamp(snapshot.getLastUpdate())
            .triggeredBy(snapshot.getMetadata() != null ? snapshot.getMetadata().getUpdatedBy() : null)
            .sequenceNumber(snapshot.getVersion())
            .build();
    }
}
