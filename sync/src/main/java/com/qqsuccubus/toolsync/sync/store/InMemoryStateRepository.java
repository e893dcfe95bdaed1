package com.qqsuccubus.toolsync.sync.store;

import com.qqsuccubus.toolsync.core.model.AckTracking;
import com.qqsuccubus.toolsync.core.model.StateSnapshot;
import com.qqsuccubus.toolsync.core.model.ToolStateKey;
import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import com.qqsuccubus.toolsync.core.msg.BroadcastMessage;
import com.qqsuccubus.toolsync.sync.error.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Heap-backed store for local development ({@code STORE_MODE=memory}) and tests.
 * <p>
 * Same semantics as the Redis store. A commit runs inside {@link ConcurrentHashMap#compute},
 * which serializes writers per key.
 * </p>
 */
public class InMemoryStateRepository implements ISnapshotStore, IEventLog, IAckStore, IBroadcastOutbox {
    private static final Logger log = LoggerFactory.getLogger(InMemoryStateRepository.class);

    private final Map<String, StateSnapshot> snapshots = new ConcurrentHashMap<>();
    private final Map<String, UpdateEvent> events = new ConcurrentHashMap<>();
    private final Map<String, AckTracking> acks = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> received = new ConcurrentHashMap<>();
    private final Map<String, Deque<BroadcastMessage>> outboxes = new ConcurrentHashMap<>();
    private final int outboxMax;

    public InMemoryStateRepository(int outboxMax) {
        this.outboxMax = outboxMax;
    }

    @Override
    public Mono<StateSnapshot> get(ToolStateKey key) {
        return Mono.fromSupplier(() -> snapshots.get(key.id()));
    }

    @Override
    public Mono<Void> commit(Commit commit) {
        return Mono.fromRunnable(() -> snapshots.compute(commit.getKey().id(), (id, current) -> {
            long version = current == null ? 0L : current.getVersion();
            if (version != commit.getExpectedVersion()) {
                throw new VersionConflictException(commit.getKey(), commit.getExpectedVersion());
            }
            if (commit.getEvent() != null) {
                events.put(commit.getEvent().getId(), commit.getEvent());
            }
            return commit.getSnapshot();
        }));
    }

    @Override
    public Mono<UpdateEvent> findById(String eventId) {
        return Mono.fromSupplier(() -> events.get(eventId));
    }

    @Override
    public Flux<UpdateEvent> query(EventQuery query) {
        return Flux.defer(() -> Flux.fromIterable(events.values().stream()
            .filter(query::matches)
            .sorted(query.newestFirst())
            .limit(query.getLimit())
            .collect(Collectors.toList())));
    }

    @Override
    public Mono<Boolean> delete(String eventId) {
        return Mono.fromSupplier(() -> remove(eventId));
    }

    @Override
    public Mono<Long> deleteOlderThan(String toolId, String deploymentId, Instant cutoff) {
        EventQuery query = EventQuery.builder().toolId(toolId).deploymentId(deploymentId).before(cutoff).build();
        return Mono.fromSupplier(() -> {
            List<String> expired = events.values().stream()
                .filter(query::matches)
                .map(UpdateEvent::getId)
                .collect(Collectors.toList());
            long removed = expired.stream().filter(this::remove).count();
            log.debug("Removed {} events of tool {} older than {}", removed, toolId, cutoff);
            return removed;
        });
    }

    private boolean remove(String eventId) {
        acks.remove(eventId);
        received.remove(eventId);
        return events.remove(eventId) != null;
    }

    @Override
    public Mono<Void> save(AckTracking tracking) {
        return Mono.fromRunnable(() -> acks.put(tracking.getUpdateEventId(), tracking));
    }

    @Override
    public Mono<AckTracking> find(String updateEventId) {
        return Mono.fromSupplier(() -> {
            AckTracking tracking = acks.get(updateEventId);
            if (tracking == null) {
                return null;
            }
            Set<String> users = new LinkedHashSet<>(tracking.getReceivedAcks());
            Set<String> recorded = received.get(updateEventId);
            if (recorded != null) {
                synchronized (recorded) {
                    users.addAll(recorded);
                }
            }
            return tracking.withReceivedAcks(List.copyOf(users));
        });
    }

    @Override
    public Mono<Void> addReceived(String updateEventId, String userId) {
        return Mono.fromRunnable(() -> {
            Set<String> recorded = received.computeIfAbsent(updateEventId, id -> new LinkedHashSet<>());
            synchronized (recorded) {
                recorded.add(userId);
            }
        });
    }

    @Override
    public Mono<Void> append(String channel, BroadcastMessage message) {
        return Mono.fromRunnable(() -> outboxes.compute(channel, (c, box) -> {
            Deque<BroadcastMessage> target = box == null ? new ArrayDeque<>() : box;
            target.addLast(message);
            while (target.size() > outboxMax) {
                target.removeFirst();
            }
            return target;
        }));
    }

    @Override
    public Flux<BroadcastMessage> read(String channel, int count) {
        return Flux.defer(() -> {
            List<BroadcastMessage> copy = new ArrayList<>();
            outboxes.computeIfPresent(channel, (c, box) -> {
                box.stream().limit(count).forEach(copy::add);
                return box;
            });
            return Flux.fromIterable(copy);
        });
    }
}
