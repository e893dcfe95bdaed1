package com.qqsuccubus.toolsync.sync.ack;

import com.qqsuccubus.toolsync.core.model.AckStatus;
import com.qqsuccubus.toolsync.core.model.AckTracking;
import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import com.qqsuccubus.toolsync.sync.error.ToolSyncException;
import com.qqsuccubus.toolsync.sync.metrics.MetricsService;
import com.qqsuccubus.toolsync.sync.store.IAckStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Tracks which affected users still owe an acknowledgment for an update.
 * <p>
 * Status moves {@code pending -> complete} once every required user acked, or
 * {@code pending -> expired} once the deadline passed. Expiry is evaluated lazily when a
 * tracking is read or acked; nothing sweeps or escalates in the background. Acks arriving
 * after expiry are still recorded but leave the status alone.
 * </p>
 */
public class AckTracker {
    private static final Logger log = LoggerFactory.getLogger(AckTracker.class);

    static final Duration DEFAULT_DEADLINE = Duration.ofHours(1);

    private final IAckStore store;
    private final MetricsService metricsService;
    private final Clock clock;

    public AckTracker(IAckStore store, MetricsService metricsService, Clock clock) {
        this.store = store;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    public Mono<AckTracking> register(UpdateEvent event) {
        Instant now = clock.instant();
        AckTracking tracking = AckTracking.builder()
            .updateEventId(event.getId())
            .toolId(event.getToolId())
            .deploymentId(event.getDeploymentId())
            .requiredAcks(event.getAffectedUsers())
            .receivedAcks(List.of())
            .ackDeadline(event.getExpiresAt() != null ? event.getExpiresAt() : now.plus(DEFAULT_DEADLINE))
            .createdAt(now)
            .status(AckStatus.PENDING)
            .build();

        return store.save(tracking)
            .thenReturn(tracking)
            .doOnSuccess(t -> log.debug("Ack tracking registered for {} ({} required)",
                event.getId(), t.getRequiredAcks().size()));
    }

    public Mono<AckTracking> recordAck(String updateEventId, String userId) {
        return store.find(updateEventId)
            .switchIfEmpty(Mono.error(() -> ToolSyncException.notFound("Update event not tracked")))
            .flatMap(tracking -> store.addReceived(updateEventId, userId))
            .then(Mono.defer(() -> store.find(updateEventId)))
            .flatMap(this::settle)
            .doOnSuccess(t -> {
                metricsService.recordAck();
                log.debug("Ack from {} for {}: {}", userId, updateEventId, t.getStatus());
            });
    }

    public Mono<AckTracking> get(String updateEventId) {
        return store.find(updateEventId)
            .switchIfEmpty(Mono.error(() -> ToolSyncException.notFound("Update event not tracked")))
            .flatMap(this::settle);
    }

    /**
     * Applies the due status transition of a pending tracking and persists it.
     */
    private Mono<AckTracking> settle(AckTracking tracking) {
        AckStatus next = nextStatus(tracking, clock.instant());
        if (next == tracking.getStatus()) {
            return Mono.just(tracking);
        }
        AckTracking updated = tracking.withStatus(next);
        return store.save(updated).thenReturn(updated);
    }

    static AckStatus nextStatus(AckTracking tracking, Instant now) {
        if (tracking.getStatus() != AckStatus.PENDING) {
            return tracking.getStatus();
        }
        if (tracking.isPastDeadline(now)) {
            return AckStatus.EXPIRED;
        }
        return tracking.isSatisfied() ? AckStatus.COMPLETE : AckStatus.PENDING;
    }
}
