package com.qqsuccubus.toolsync.sync.broadcast;

import com.qqsuccubus.toolsync.core.model.EventIds;
import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import com.qqsuccubus.toolsync.core.msg.BroadcastMessage;
import com.qqsuccubus.toolsync.core.msg.Channels;
import com.qqsuccubus.toolsync.sync.metrics.MetricsService;
import com.qqsuccubus.toolsync.sync.store.IBroadcastOutbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Delivers an accepted update to each of its broadcast channels.
 * <p>
 * Per channel: append a {@link BroadcastMessage} to the channel outbox, then publish it to
 * the broker. Failures are logged, counted and dropped; they never fail the write that
 * produced the event.
 * </p>
 * <p>
 * Sync and conflict-resolution events have no broadcast channels. They are only
 * {@link #relay relayed} to the broker on the tool channel so that live streams on other
 * nodes see them.
 * </p>
 */
public class BroadcastFanOut {
    private static final Logger log = LoggerFactory.getLogger(BroadcastFanOut.class);

    private static final String SENDER_SYSTEM = "system";
    private static final String PRIORITY_NORMAL = "normal";

    private final IBroadcastOutbox outbox;
    private final IBroadcastPublisher publisher;
    private final MetricsService metricsService;
    private final String nodeId;
    private final Clock clock;

    public BroadcastFanOut(IBroadcastOutbox outbox,
                           IBroadcastPublisher publisher,
                           MetricsService metricsService,
                           String nodeId,
                           Clock clock) {
        this.outbox = outbox;
        this.publisher = publisher;
        this.metricsService = metricsService;
        this.nodeId = nodeId;
        this.clock = clock;
    }

    /**
     * @return number of channels whose outbox append succeeded
     */
    public Mono<Long> fanOut(UpdateEvent event) {
        return Flux.fromIterable(event.getBroadcastChannels())
            .concatMap(channel -> deliver(event, channel))
            .filter(Boolean::booleanValue)
            .count()
            .doOnNext(delivered -> log.debug("Update {} broadcast to {}/{} channels",
                event.getId(), delivered, event.getBroadcastChannels().size()));
    }

    /**
     * Publishes the event on its tool channel to the broker only; no outbox append.
     */
    public Mono<Void> relay(UpdateEvent event) {
        String channel = Channels.tool(event.getToolId());
        return publisher.publish(toMessage(event, channel, nodeId, clock.instant()))
            .doOnSuccess(v -> log.debug("Update {} relayed on {}", event.getId(), channel))
            .onErrorResume(err -> {
                metricsService.recordBroadcastFailure("publish");
                log.warn("Failed to relay update {} on {}: {}", event.getId(), channel, err.toString());
                return Mono.empty();
            });
    }

    private Mono<Boolean> deliver(UpdateEvent event, String channel) {
        BroadcastMessage message = toMessage(event, channel, nodeId, clock.instant());

        Mono<Void> publish = publisher.publish(message)
            .onErrorResume(err -> {
                metricsService.recordBroadcastFailure("publish");
                log.warn("Failed to publish update {} on {}: {}", event.getId(), channel, err.toString());
                return Mono.empty();
            });

        return outbox.append(channel, message)
            .doOnSuccess(v -> metricsService.recordBroadcast("outbox"))
            .then(publish)
            .thenReturn(true)
            .onErrorResume(err -> {
                metricsService.recordBroadcastFailure("outbox");
                log.error("Failed to broadcast update {} on {}", event.getId(), channel, err);
                return Mono.just(false);
            });
    }

    public static BroadcastMessage toMessage(UpdateEvent event, String channel, String originNodeId, Instant now) {
        return BroadcastMessage.builder()
            .id(EventIds.broadcast(event.getId(), now))
            .type(BroadcastMessage.TYPE_TOOL_UPDATE)
            .channel(channel)
            .senderId(SENDER_SYSTEM)
            .originNodeId(originNodeId)
            .content(BroadcastMessage.Content.builder()
                .action(BroadcastMessage.ACTION_TOOL_UPDATED)
                .updateEvent(BroadcastMessage.EventView.builder()
                    .id(event.getId())
                    .toolId(event.getToolId())
                    .deploymentId(event.getDeploymentId())
                    .userId(event.getUserId())
                    .updateType(event.getUpdateType())
                    .timestamp(event.getTimestamp())
                    .sequenceNumber(event.getSequenceNumber())
                    .eventData(event.getEventData())
                    .build())
                .build())
            .metadata(BroadcastMessage.Metadata.builder()
                .timestamp(now)
                .priority(PRIORITY_NORMAL)
                .requiresAck(event.isRequiresAck())
                .expiresAt(event.getExpiresAt())
                .retryCount(0)
                .build())
            .delivery(BroadcastMessage.Delivery.empty())
            .build();
    }
}
