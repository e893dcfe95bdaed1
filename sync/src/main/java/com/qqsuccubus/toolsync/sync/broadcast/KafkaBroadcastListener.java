package com.qqsuccubus.toolsync.sync.broadcast;

import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import com.qqsuccubus.toolsync.core.msg.BroadcastMessage;
import com.qqsuccubus.toolsync.core.msg.Channels;
import com.qqsuccubus.toolsync.core.util.JsonUtils;
import com.qqsuccubus.toolsync.sync.config.SyncConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Relays updates committed on other nodes into the local {@link UpdateHub}.
 * <p>
 * Every node consumes the whole broadcast topic under its own consumer group. An update is
 * published once per channel; only the tool-channel copy is relayed, and copies that
 * originated on this node are skipped because the hub already saw them at commit time.
 * </p>
 */
public class KafkaBroadcastListener {
    private static final Logger log = LoggerFactory.getLogger(KafkaBroadcastListener.class);

    private final SyncConfig config;
    private final UpdateHub hub;
    private Disposable subscription;

    public KafkaBroadcastListener(SyncConfig config, UpdateHub hub) {
        this.config = config;
        this.hub = hub;
    }

    public void start() {
        Map<String, Object> consumerProps = new HashMap<>();
        consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, "tool-sync-broadcast-" + config.getNodeId());
        consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

        ReceiverOptions<String, String> options = ReceiverOptions.<String, String>create(consumerProps)
            .subscription(Collections.singleton(config.getBroadcastTopic()));

        subscription = KafkaReceiver.create(options).receive()
            .flatMap(record -> {
                try {
                    BroadcastMessage message = JsonUtils.readValue(record.value(), BroadcastMessage.class);
                    toRelayedEvent(message, config.getNodeId()).ifPresent(event -> {
                        log.debug("Relaying update {} from node {}", event.getId(), message.getOriginNodeId());
                        hub.publish(event);
                    });
                } catch (Exception e) {
                    log.error("Failed to process broadcast record at offset {}", record.offset(), e);
                }
                record.receiverOffset().acknowledge(); // also skips bad records
                return Mono.empty();
            })
            .onErrorContinue((err, obj) -> log.error("Error in broadcast consumer loop", err))
            .subscribe();

        log.info("Node {} listening on broadcast topic {}", config.getNodeId(), config.getBroadcastTopic());
    }

    public void stop() {
        if (subscription != null) {
            subscription.dispose();
        }
        log.info("Kafka broadcast listener stopped");
    }

    /**
     * Rebuilds the relayed view of an update from a broadcast message.
     *
     * @return empty for messages from this node and for non-tool channel copies
     */
    static Optional<UpdateEvent> toRelayedEvent(BroadcastMessage message, String localNodeId) {
        if (localNodeId.equals(message.getOriginNodeId()) || !Channels.isToolChannel(message.getChannel())) {
            return Optional.empty();
        }
        if (message.getContent() == null || message.getContent().getUpdateEvent() == null) {
            return Optional.empty();
        }
        BroadcastMessage.EventView view = message.getContent().getUpdateEvent();
        return Optional.of(UpdateEvent.builder()
            .id(view.getId())
            .toolId(view.getToolId())
            .deploymentId(view.getDeploymentId())
            .userId(view.getUserId())
            .updateType(view.getUpdateType())
            .eventData(view.getEventData())
            .timestamp(view.getTimestamp())
            .sequenceNumber(view.getSequenceNumber())
            .build());
    }
}
