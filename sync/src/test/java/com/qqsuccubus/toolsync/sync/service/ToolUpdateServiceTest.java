package com.qqsuccubus.toolsync.sync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.qqsuccubus.toolsync.core.model.AckStatus;
import com.qqsuccubus.toolsync.core.model.AckTracking;
import com.qqsuccubus.toolsync.core.model.ConflictResolutionMode;
import com.qqsuccubus.toolsync.core.model.EventData;
import com.qqsuccubus.toolsync.core.model.SnapshotMetadata;
import com.qqsuccubus.toolsync.core.model.StateSnapshot;
import com.qqsuccubus.toolsync.core.model.SyncStatus;
import com.qqsuccubus.toolsync.core.model.ToolStateKey;
import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import com.qqsuccubus.toolsync.core.model.UpdateType;
import com.qqsuccubus.toolsync.core.msg.BroadcastMessage;
import com.qqsuccubus.toolsync.core.msg.Channels;
import com.qqsuccubus.toolsync.core.msg.StreamFrame;
import com.qqsuccubus.toolsync.core.util.JsonUtils;
import com.qqsuccubus.toolsync.sync.access.DeploymentRecord;
import com.qqsuccubus.toolsync.sync.access.InMemoryToolDirectory;
import com.qqsuccubus.toolsync.sync.access.SpaceMember;
import com.qqsuccubus.toolsync.sync.access.ToolAccessPolicy;
import com.qqsuccubus.toolsync.sync.access.ToolRecord;
import com.qqsuccubus.toolsync.sync.ack.AckTracker;
import com.qqsuccubus.toolsync.sync.broadcast.BroadcastFanOut;
import com.qqsuccubus.toolsync.sync.broadcast.IBroadcastPublisher;
import com.qqsuccubus.toolsync.sync.broadcast.UpdateHub;
import com.qqsuccubus.toolsync.sync.config.SyncConfig;
import com.qqsuccubus.toolsync.sync.conflict.ConflictResolver;
import com.qqsuccubus.toolsync.sync.error.ErrorCode;
import com.qqsuccubus.toolsync.sync.error.ToolSyncException;
import com.qqsuccubus.toolsync.sync.metrics.MetricsService;
import com.qqsuccubus.toolsync.sync.state.SnapshotService;
import com.qqsuccubus.toolsync.sync.store.Commit;
import com.qqsuccubus.toolsync.sync.store.EventQuery;
import com.qqsuccubus.toolsync.sync.store.IAckStore;
import com.qqsuccubus.toolsync.sync.store.IBroadcastOutbox;
import com.qqsuccubus.toolsync.sync.store.InMemoryStateRepository;
import com.qqsuccubus.toolsync.sync.stream.StreamingChannel;
import com.qqsuccubus.toolsync.sync.support.MutableClock;
import com.qqsuccubus.toolsync.sync.support.TestConfigs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolUpdateServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final ToolStateKey KEY = ToolStateKey.of("tool-1", "dep-1");

    private MutableClock clock;
    private InMemoryStateRepository store;
    private UpdateHub hub;
    private InMemoryToolDirectory directory;
    private ToolUpdateService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemoryStateRepository(100);
        hub = new UpdateHub();
        directory = new InMemoryToolDirectory()
            .putTool(ToolRecord.builder().id("tool-1").name("Counter").authorId("author").build())
            .putDeployment(DeploymentRecord.builder()
                .id("dep-1").toolId("tool-1").deployedBy("deployer").spaceId("space-1").build())
            .putMember(SpaceMember.builder().spaceId("space-1").userId("builder").role("builder").build())
            .putMember(SpaceMember.builder().spaceId("space-1").userId("viewer").build());

        service = newService(store, IBroadcastPublisher.local(), store);
    }

    private ToolUpdateService newService(IBroadcastOutbox outbox, IBroadcastPublisher publisher, IAckStore acks) {
        SyncConfig config = TestConfigs.memory();
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry(), config);
        SnapshotService snapshotService = new SnapshotService(store, config, metricsService, clock);

        return new ToolUpdateService(
            directory,
            new ToolAccessPolicy(directory),
            snapshotService,
            store,
            new ConflictResolver(),
            new BroadcastFanOut(outbox, publisher, metricsService, config.getNodeId(), clock),
            new AckTracker(acks, metricsService, clock),
            hub,
            new StreamingChannel(config, store, snapshotService, hub, metricsService, clock),
            metricsService,
            clock
        );
    }

    // ---------------------------------------------------------------- submit

    @Test
    void testSubmit_SequencedAfterCurrentVersion() {
        seed("{\"count\":4,\"label\":\"x\"}", 3);

        SubmitResult result = service.submit("author", valueUpdate("{\"count\":5,\"label\":\"x\"}")).block();

        assertEquals(4L, result.getSequenceNumber());
        assertEquals(UpdateType.VALUE_UPDATE, result.getUpdateType());
        assertEquals(4, result.getAffectedUsers());

        StateSnapshot snapshot = store.get(KEY).block();
        assertEquals(4L, snapshot.getVersion());
        assertEquals(json("{\"count\":5,\"label\":\"x\"}"), snapshot.getCurrentState());
        assertEquals("author", snapshot.getMetadata().getUpdatedBy());

        UpdateEvent event = store.findById(result.getId()).block();
        assertEquals(List.of("count"), event.getEventData().getChangedFields());
        assertEquals("author", event.getEventData().getMetadata().get("triggeredBy"));
        assertEquals(NOW.plus(Duration.ofMinutes(60)), event.getExpiresAt());
        assertEquals(List.of(Channels.tool("tool-1"), Channels.deployment("dep-1")), event.getBroadcastChannels());
    }

    @Test
    void testSubmit_FirstUpdateStartsAtOne() {
        SubmitResult result = service.submit("deployer", valueUpdate("{\"count\":1}")).block();

        assertEquals(1L, result.getSequenceNumber());
        assertEquals(1L, store.get(KEY).block().getVersion());
    }

    @Test
    void testSubmit_AffectedUsersResolvedFromDirectory() {
        SubmitResult result = service.submit("builder", SubmitUpdateRequest.builder()
                .toolId("tool-1")
                .deploymentId("dep-1")
                .spaceId("space-1")
                .updateType("status_change")
                .eventData(EventData.builder().metadata(Map.of("status", "paused")).build())
                .build())
            .block();

        UpdateEvent event = store.findById(result.getId()).block();
        assertEquals(List.of("author", "deployer", "builder", "viewer"), event.getAffectedUsers());
        assertEquals(3, event.getBroadcastChannels().size());
        assertEquals(1, store.read(Channels.space("space-1"), 10).collectList().block().size());
    }

    @Test
    void testSubmit_PublishedToLiveFeed() {
        List<UpdateEvent> seen = new CopyOnWriteArrayList<>();
        hub.events().subscribe(seen::add);

        SubmitResult result = service.submit("author", valueUpdate("{\"count\":1}")).block();

        assertEquals(1, seen.size());
        assertEquals(result.getId(), seen.get(0).getId());
    }

    @Test
    void testSubmit_AckLifecycle() {
        SubmitResult result = service.submit("author", SubmitUpdateRequest.builder()
                .toolId("tool-1")
                .deploymentId("dep-1")
                .updateType("configuration_change")
                .eventData(EventData.builder().newState(json("{\"theme\":\"dark\"}")).build())
                .targetUsers(List.of("u1", "u2"))
                .requiresAck(true)
                .expiresInMinutes(10)
                .build())
            .block();

        assertEquals(2, result.getAffectedUsers());

        AckTracking first = service.acknowledge("u1", result.getId()).block();
        assertEquals(AckStatus.PENDING, first.getStatus());
        assertEquals(NOW.plus(Duration.ofMinutes(10)), first.getAckDeadline());

        AckTracking second = service.acknowledge("u2", result.getId()).block();
        assertEquals(AckStatus.COMPLETE, second.getStatus());
        assertEquals(AckStatus.COMPLETE, service.ackStatus(result.getId()).block().getStatus());
    }

    @Test
    void testSubmit_NoAckTrackingUnlessRequired() {
        SubmitResult result = service.submit("author", valueUpdate("{\"count\":1}")).block();

        expectError(service.ackStatus(result.getId()), ErrorCode.RESOURCE_NOT_FOUND);
    }

    @Test
    void testSubmit_BroadcastAndAckFailuresDoNotFailWrite() {
        IBroadcastOutbox brokenOutbox = new IBroadcastOutbox() {
            @Override
            public Mono<Void> append(String channel, BroadcastMessage message) {
                return Mono.error(new IllegalStateException("outbox unavailable"));
            }

            @Override
            public Flux<BroadcastMessage> read(String channel, int count) {
                return Flux.empty();
            }
        };
        IAckStore brokenAcks = new IAckStore() {
            @Override
            public Mono<Void> save(AckTracking tracking) {
                return Mono.error(new IllegalStateException("ack store unavailable"));
            }

            @Override
            public Mono<AckTracking> find(String updateEventId) {
                return Mono.error(new IllegalStateException("ack store unavailable"));
            }

            @Override
            public Mono<Void> addReceived(String updateEventId, String userId) {
                return Mono.error(new IllegalStateException("ack store unavailable"));
            }
        };
        IBroadcastPublisher brokenBroker = message -> Mono.error(new IllegalStateException("broker unavailable"));
        ToolUpdateService degraded = newService(brokenOutbox, brokenBroker, brokenAcks);
        seed("{\"count\":4}", 3);

        SubmitResult result = degraded.submit("author", SubmitUpdateRequest.builder()
                .toolId("tool-1")
                .deploymentId("dep-1")
                .updateType("value_update")
                .eventData(EventData.builder().newState(json("{\"count\":5}")).build())
                .targetUsers(List.of("u1"))
                .requiresAck(true)
                .build())
            .block();

        assertNotNull(result);
        assertEquals(4L, result.getSequenceNumber());
        assertEquals(UpdateType.VALUE_UPDATE, result.getUpdateType());
        assertEquals(1, result.getAffectedUsers());

        StateSnapshot snapshot = store.get(KEY).block();
        assertEquals(4L, snapshot.getVersion());
        assertEquals(json("{\"count\":5}"), snapshot.getCurrentState());
        assertNotNull(store.findById(result.getId()).block());
    }

    @Test
    void testSubmit_InvalidInputRejected() {
        expectError(service.submit("author", SubmitUpdateRequest.builder()
            .updateType("value_update")
            .eventData(EventData.builder().build())
            .build()), ErrorCode.INVALID_INPUT);
        expectError(service.submit("author", SubmitUpdateRequest.builder()
            .toolId("tool-1")
            .eventData(EventData.builder().build())
            .build()), ErrorCode.INVALID_INPUT);
        expectError(service.submit("author", SubmitUpdateRequest.builder()
            .toolId("tool-1")
            .updateType("value_update")
            .build()), ErrorCode.INVALID_INPUT);
        expectError(service.submit("author", SubmitUpdateRequest.builder()
            .toolId("tool-1")
            .updateType("value_update")
            .eventData(EventData.builder().build())
            .expiresInMinutes(0)
            .build()), ErrorCode.INVALID_INPUT);

        StepVerifier.create(service.submit("author", SubmitUpdateRequest.builder()
                .toolId("tool-1")
                .updateType("teleport")
                .eventData(EventData.builder().build())
                .build()))
            .expectErrorMessage("Unknown updateType: teleport")
            .verify();
    }

    @Test
    void testSubmit_UnknownToolNotFound() {
        expectError(service.submit("author", SubmitUpdateRequest.builder()
            .toolId("tool-9")
            .updateType("value_update")
            .eventData(EventData.builder().build())
            .build()), ErrorCode.RESOURCE_NOT_FOUND);
    }

    @Test
    void testSubmit_ForbiddenWritesNothing() {
        expectError(service.submit("viewer", valueUpdate("{\"count\":1}")), ErrorCode.FORBIDDEN);

        assertNull(store.get(KEY).block());
        assertTrue(store.query(query()).collectList().block().isEmpty());
    }

    // ---------------------------------------------------------------- sync

    @Test
    void testSync_NoSnapshotAcceptsClientState() {
        SyncResult result = service.sync("viewer", syncRequest(0L, "{\"count\":2}", null, false)).block();

        assertEquals(SyncResult.CLIENT_STATE_ACCEPTED, result.getSyncResult());
        assertEquals(1L, result.getServerVersion());
        assertEquals(json("{\"count\":2}"), result.getServerState());
        assertEquals(1L, store.get(KEY).block().getVersion());

        List<UpdateEvent> events = store.query(query()).collectList().block();
        assertEquals(1, events.size());
        assertEquals(1L, events.get(0).getSequenceNumber());
        assertEquals("client", events.get(0).getEventData().getMetadata().get("syncedFrom"));
    }

    @Test
    void testSync_SameVersionAdvances() {
        seed("{\"count\":4}", 3);

        SyncResult result = service.sync("viewer", syncRequest(3L, "{\"count\":9}", null, false)).block();

        assertEquals(SyncResult.SYNC_SUCCESSFUL, result.getSyncResult());
        assertEquals(4L, result.getServerVersion());
        assertEquals(json("{\"count\":9}"), result.getServerState());
        assertTrue(result.getConflicts().isEmpty());
        assertNull(result.getResolutionStrategy());
    }

    @Test
    void testSync_StaleClientLatestWins() {
        seed("{\"count\":6}", 4);

        SyncResult result = service.sync("viewer", syncRequest(3L, "{\"count\":99}", "latest_wins", false)).block();

        assertEquals(SyncResult.CONFLICT_RESOLVED, result.getSyncResult());
        assertEquals(json("{\"count\":6}"), result.getServerState());
        assertEquals(5L, result.getServerVersion());
        assertEquals("latest_wins", result.getResolutionStrategy());
        assertEquals(1, result.getConflicts().size());
        assertEquals("count", result.getConflicts().get(0).getField());

        StateSnapshot snapshot = store.get(KEY).block();
        assertEquals(5L, snapshot.getVersion());
        assertEquals(ConflictResolutionMode.LATEST_WINS, snapshot.getMetadata().getConflictResolution());
    }

    @Test
    void testSync_ForcedMergeAtSameVersion() {
        seed("{\"a\":1,\"b\":1}", 2);

        SyncResult result = service.sync("viewer", syncRequest(2L, "{\"b\":2}", "merge", true)).block();

        assertEquals(SyncResult.CONFLICT_RESOLVED, result.getSyncResult());
        assertEquals(json("{\"a\":1,\"b\":2}"), result.getServerState());
        assertEquals(3L, result.getServerVersion());
        assertEquals(ConflictResolutionMode.AUTOMATIC, store.get(KEY).block().getMetadata().getConflictResolution());
    }

    @Test
    void testSync_UnknownStrategyFallsBack() {
        seed("{\"count\":6}", 4);

        SyncResult result = service.sync("viewer", syncRequest(1L, "{\"count\":1}", "newest_wins", false)).block();

        assertEquals("latest_wins", result.getResolutionStrategy());
        assertEquals(json("{\"count\":6}"), result.getServerState());
    }

    @Test
    void testSync_RelayedToBrokerOnToolChannel() {
        List<BroadcastMessage> published = new CopyOnWriteArrayList<>();
        ToolUpdateService relaying = newService(store,
            message -> Mono.fromRunnable(() -> published.add(message)), store);
        seed("{\"count\":4}", 3);

        relaying.sync("viewer", syncRequest(3L, "{\"count\":5}", null, false)).block();
        relaying.sync("viewer", syncRequest(1L, "{\"count\":7}", "client_wins", false)).block();

        assertEquals(2, published.size());
        List<UpdateEvent> events = store.query(query()).collectList().block();
        for (BroadcastMessage message : published) {
            assertEquals(Channels.tool("tool-1"), message.getChannel());
            assertTrue(events.stream().anyMatch(e -> e.getId().equals(message.getContent().getUpdateEvent().getId())));
        }
        assertEquals(List.of(4L, 5L), published.stream()
            .map(message -> message.getContent().getUpdateEvent().getSequenceNumber())
            .collect(Collectors.toList()));
        assertTrue(store.read(Channels.tool("tool-1"), 10).collectList().block().isEmpty());
    }

    @Test
    void testSync_InvalidInputAndForbidden() {
        expectError(service.sync("viewer", SyncRequest.builder()
            .toolId("tool-1").deploymentId("dep-1").clientState(json("{}")).build()), ErrorCode.INVALID_INPUT);
        expectError(service.sync("viewer", SyncRequest.builder()
            .toolId("tool-1").deploymentId("dep-1").clientVersion(1L).clientState(NullNode.getInstance()).build()),
            ErrorCode.INVALID_INPUT);
        expectError(service.sync("stranger", syncRequest(0L, "{}", null, false)), ErrorCode.FORBIDDEN);
    }

    // ---------------------------------------------------------------- history

    @Test
    void testHistory_ChronologicalWithPaging() {
        for (int i = 1; i <= 3; i++) {
            service.submit("author", valueUpdate("{\"count\":" + i + "}")).block();
            clock.advance(Duration.ofSeconds(1));
        }

        HistoryResult result = service.history("viewer", HistoryRequest.builder()
                .toolId("tool-1")
                .deploymentId("dep-1")
                .limit(2)
                .includeSnapshot(true)
                .build())
            .block();

        assertEquals(List.of(2L, 3L), result.getUpdates().stream()
            .map(UpdateEvent::getSequenceNumber)
            .collect(Collectors.toList()));
        assertTrue(result.isHasMore());
        assertEquals(3L, result.getLastSequenceNumber());
        assertNotNull(result.getStateSnapshot());
        assertEquals(3L, result.getSyncStatus().getVersion());
        assertEquals(SyncStatus.SYNCED.wire(), result.getSyncStatus().getStatus());
    }

    @Test
    void testHistory_ToolWideSpansKeysInTimeOrder() {
        for (int i = 1; i <= 5; i++) {
            service.submit("author", SubmitUpdateRequest.builder()
                    .toolId("tool-1")
                    .updateType("value_update")
                    .eventData(EventData.builder().newState(json("{\"count\":" + i + "}")).build())
                    .build())
                .block();
            clock.advance(Duration.ofSeconds(1));
        }
        SubmitResult deploymentUpdate = service.submit("author", valueUpdate("{\"count\":100}")).block();

        HistoryResult result = service.history("author", HistoryRequest.builder()
                .toolId("tool-1")
                .limit(2)
                .build())
            .block();

        List<UpdateEvent> updates = result.getUpdates();
        assertEquals(2, updates.size());
        assertNull(updates.get(0).getDeploymentId());
        assertEquals(5L, updates.get(0).getSequenceNumber());
        assertEquals(deploymentUpdate.getId(), updates.get(1).getId());
        assertEquals("dep-1", updates.get(1).getDeploymentId());
        assertTrue(result.isHasMore());
        assertEquals(1L, result.getLastSequenceNumber());
    }

    @Test
    void testHistory_SinceExcludesOlder() {
        service.submit("author", valueUpdate("{\"count\":1}")).block();
        clock.advance(Duration.ofMinutes(1));
        service.submit("author", valueUpdate("{\"count\":2}")).block();

        HistoryResult result = service.history("author", HistoryRequest.builder()
                .toolId("tool-1")
                .deploymentId("dep-1")
                .since(NOW)
                .build())
            .block();

        assertEquals(1, result.getUpdates().size());
        assertFalse(result.isHasMore());
        assertNull(result.getStateSnapshot());
    }

    @Test
    void testHistory_NoState() {
        HistoryResult result = service.history("author", HistoryRequest.builder()
                .toolId("tool-1")
                .deploymentId("dep-1")
                .includeSnapshot(true)
                .build())
            .block();

        assertTrue(result.getUpdates().isEmpty());
        assertFalse(result.isHasMore());
        assertEquals(0L, result.getLastSequenceNumber());
        assertNull(result.getStateSnapshot());
        assertEquals(SyncStatusView.NO_STATE, result.getSyncStatus().getStatus());
    }

    @Test
    void testHistory_Forbidden() {
        expectError(service.history("stranger", HistoryRequest.builder().toolId("tool-1").deploymentId("dep-1").build()),
            ErrorCode.FORBIDDEN);
        expectError(service.history("author", HistoryRequest.builder().build()), ErrorCode.INVALID_INPUT);
    }

    // ---------------------------------------------------------------- stream

    @Test
    void testOpenStream_ToolResolvedFromDeployment() {
        StepVerifier.create(service.openStream("viewer", "dep-1", null).flatMapMany(frames -> frames))
            .expectNextMatches(frame -> StreamFrame.CONNECTED.equals(frame.getType())
                && "dep-1".equals(frame.getDeploymentId()))
            .thenCancel()
            .verify();
    }

    @Test
    void testOpenStream_Rejections() {
        expectError(service.openStream("viewer", null, "tool-1"), ErrorCode.INVALID_INPUT);
        expectError(service.openStream("viewer", "dep-9", null), ErrorCode.RESOURCE_NOT_FOUND);
        expectError(service.openStream("stranger", "dep-1", null), ErrorCode.FORBIDDEN);
    }

    // ---------------------------------------------------------------- cleanup

    @Test
    void testCleanup_ById() {
        SubmitResult result = service.submit("author", valueUpdate("{\"count\":1}")).block();

        CleanupResult cleanup = service.cleanup("author", CleanupRequest.builder()
                .toolId("tool-1")
                .eventId(result.getId())
                .build())
            .block();

        assertEquals(1L, cleanup.getDeletedCount());
        assertEquals("Cleaned up 1 tool update events", cleanup.getMessage());
        assertNull(store.findById(result.getId()).block());
    }

    @Test
    void testCleanup_RemovesAckTracking() {
        SubmitResult result = service.submit("author", SubmitUpdateRequest.builder()
                .toolId("tool-1")
                .deploymentId("dep-1")
                .updateType("configuration_change")
                .eventData(EventData.builder().newState(json("{\"theme\":\"dark\"}")).build())
                .targetUsers(List.of("u1", "u2"))
                .requiresAck(true)
                .build())
            .block();
        service.acknowledge("u1", result.getId()).block();

        service.cleanup("author", CleanupRequest.builder()
                .toolId("tool-1")
                .eventId(result.getId())
                .build())
            .block();

        expectError(service.ackStatus(result.getId()), ErrorCode.RESOURCE_NOT_FOUND);
        expectError(service.acknowledge("u2", result.getId()), ErrorCode.RESOURCE_NOT_FOUND);
    }

    @Test
    void testCleanup_OlderThan() {
        service.submit("author", valueUpdate("{\"count\":1}")).block();
        clock.advance(Duration.ofMinutes(10));
        service.submit("author", valueUpdate("{\"count\":2}")).block();

        CleanupResult cleanup = service.cleanup("deployer", CleanupRequest.builder()
                .toolId("tool-1")
                .deploymentId("dep-1")
                .olderThan(NOW.plus(Duration.ofMinutes(5)))
                .build())
            .block();

        assertEquals(1L, cleanup.getDeletedCount());
        assertEquals(1, store.query(query()).collectList().block().size());
    }

    @Test
    void testCleanup_Rejections() {
        SubmitResult result = service.submit("author", valueUpdate("{\"count\":1}")).block();

        expectError(service.cleanup("author", CleanupRequest.builder().toolId("tool-1").build()),
            ErrorCode.INVALID_INPUT);
        expectError(service.cleanup("author", CleanupRequest.builder().toolId("tool-1").eventId("nope").build()),
            ErrorCode.RESOURCE_NOT_FOUND);
        expectError(service.cleanup("viewer", CleanupRequest.builder().toolId("tool-1").eventId(result.getId()).build()),
            ErrorCode.FORBIDDEN);

        assertNotNull(store.findById(result.getId()).block());
    }

    @Test
    void testAcknowledge_RequiresEventId() {
        expectError(service.acknowledge("u1", " "), ErrorCode.INVALID_INPUT);
        expectError(service.acknowledge("u1", "missing"), ErrorCode.RESOURCE_NOT_FOUND);
    }

    // ---------------------------------------------------------------- helpers

    private void seed(String state, long version) {
        StateSnapshot snapshot = StateSnapshot.builder()
            .toolId("tool-1")
            .deploymentId("dep-1")
            .currentState(json(state))
            .version(version)
            .lastUpdate(NOW.minusSeconds(30))
            .metadata(SnapshotMetadata.builder()
                .createdAt(NOW.minusSeconds(300))
                .updatedBy("author")
                .syncStatus(SyncStatus.SYNCED)
                .build())
            .build();
        store.commit(Commit.builder().key(KEY).expectedVersion(0).snapshot(snapshot).build()).block();
    }

    private static SubmitUpdateRequest valueUpdate(String newState) {
        return SubmitUpdateRequest.builder()
            .toolId("tool-1")
            .deploymentId("dep-1")
            .updateType("value_update")
            .eventData(EventData.builder().newState(json(newState)).build())
            .build();
    }

    private static SyncRequest syncRequest(long clientVersion, String state, String strategy, boolean forceMerge) {
        return SyncRequest.builder()
            .toolId("tool-1")
            .deploymentId("dep-1")
            .clientVersion(clientVersion)
            .clientState(json(state))
            .conflictResolution(strategy)
            .forceMerge(forceMerge)
            .build();
    }

    private static EventQuery query() {
        return EventQuery.builder().toolId("tool-1").deploymentId("dep-1").limit(100).build();
    }

    private static void expectError(Mono<?> operation, ErrorCode code) {
        StepVerifier.create(operation)
            .expectErrorSatisfies(err -> assertEquals(code, ((ToolSyncException) err).getCode()))
            .verify();
    }

    private static JsonNode json(String value) {
        return JsonUtils.readTree(value);
    }
}
