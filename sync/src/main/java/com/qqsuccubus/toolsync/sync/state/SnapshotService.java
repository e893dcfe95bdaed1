package com.qqsuccubus.toolsync.sync.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.toolsync.core.model.StateSnapshot;
import com.qqsuccubus.toolsync.core.model.ToolStateKey;
import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import com.qqsuccubus.toolsync.core.state.StateSnapshots;
import com.qqsuccubus.toolsync.sync.config.SyncConfig;
import com.qqsuccubus.toolsync.sync.error.ToolSyncException;
import com.qqsuccubus.toolsync.sync.error.VersionConflictException;
import com.qqsuccubus.toolsync.sync.metrics.MetricsService;
import com.qqsuccubus.toolsync.sync.store.Commit;
import com.qqsuccubus.toolsync.sync.store.ISnapshotStore;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Function;

/**
 * Single entry point for reading and writing snapshots.
 * <p>
 * Writes run as read, plan, compare-and-set. When another writer committed in between, the
 * whole step is replayed against the fresh snapshot with jittered exponential backoff, so
 * concurrent writers on a key always end up with distinct, gap-free sequence numbers.
 * </p>
 */
public class SnapshotService {
    private static final Logger log = LoggerFactory.getLogger(SnapshotService.class);

    private final ISnapshotStore store;
    private final SyncConfig config;
    private final MetricsService metricsService;
    private final Clock clock;

    public SnapshotService(ISnapshotStore store, SyncConfig config, MetricsService metricsService, Clock clock) {
        this.store = store;
        this.config = config;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Reads a snapshot for a write path. Store failures propagate.
     */
    public Mono<StateSnapshot> get(ToolStateKey key) {
        return store.get(key);
    }

    /**
     * Reads a snapshot for a convenience view. Store failures are logged and read as absent.
     */
    public Mono<StateSnapshot> find(ToolStateKey key) {
        return store.get(key)
            .onErrorResume(err -> {
                log.warn("Snapshot {} unavailable, treating as absent: {}", key, err.toString());
                return Mono.empty();
            });
    }

    public StateSnapshot applyUpdate(UpdateEvent event, StateSnapshot previous) {
        return StateSnapshots.apply(event, previous);
    }

    public StateSnapshot createFromClient(ToolStateKey key, JsonNode state, String userId) {
        return StateSnapshots.fromClient(key, state, userId, clock.instant());
    }

    /**
     * Runs {@code planner} against the current snapshot and commits the planned write,
     * replaying on version conflicts.
     *
     * @param key     key to write
     * @param planner turns the current snapshot (empty if none) into a commit plus the
     *                result to hand back once it lands; must be free of side effects
     * @return the result of the plan that committed
     */
    public <R> Mono<R> write(ToolStateKey key, Function<Optional<StateSnapshot>, Plan<R>> planner) {
        return Mono.defer(() -> {
                long startNanos = System.nanoTime();
                return store.get(key)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .flatMap(current -> {
                        Plan<R> plan = planner.apply(current);
                        return store.commit(plan.getCommit()).thenReturn(plan.getResult());
                    })
                    .doOnSuccess(r -> metricsService.recordCommitLatency(startNanos));
            })
            .retryWhen(Retry.backoff(config.getCommitMaxRetries(), config.getCommitBackoff())
                .jitter(0.5)
                .filter(VersionConflictException.class::isInstance)
                .doBeforeRetry(signal -> {
                    metricsService.recordCommitRetry();
                    log.debug("Version conflict on {}, retry #{}", key, signal.totalRetries() + 1);
                })
                .onRetryExhaustedThrow((spec, signal) -> ToolSyncException.internal(
                    "Failed to commit state", signal.failure())));
    }

    /**
     * A planned commit and the value to return when it lands.
     */
    @Value
    public static class Plan<R> {
        Commit commit;
        R result;

        public static <R> Plan<R> of(Commit commit, R result) {
            return new Plan<>(commit, result);
        }
    }
}
