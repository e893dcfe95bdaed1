package com.qqsuccubus.toolsync.sync.broadcast;

import com.qqsuccubus.toolsync.core.msg.BroadcastMessage;
import com.qqsuccubus.toolsync.core.util.JsonUtils;
import com.qqsuccubus.toolsync.sync.config.SyncConfig;
import com.qqsuccubus.toolsync.sync.metrics.MetricsService;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.HashMap;
import java.util.Map;

/**
 * Publishes broadcast messages to the shared broadcast topic.
 * <p>
 * The record key is the channel id: all messages of a channel go to one partition and are
 * consumed in publish order. No order holds between channels.
 * </p>
 */
public class KafkaBroadcastPublisher implements IBroadcastPublisher {
    private static final Logger log = LoggerFactory.getLogger(KafkaBroadcastPublisher.class);

    private final SyncConfig config;
    private final MetricsService metricsService;
    private final KafkaSender<String, String> sender;

    public KafkaBroadcastPublisher(SyncConfig config, MetricsService metricsService) {
        this.config = config;
        this.metricsService = metricsService;

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.CLIENT_ID_CONFIG, "tool-sync-" + config.getNodeId());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all"); // Required for idempotent producer
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        producerProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "5");

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));
        log.info("Kafka broadcast producer initialized for topic {}", config.getBroadcastTopic());
    }

    @Override
    public Mono<Void> publish(BroadcastMessage message) {
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(message))
            .flatMap(json -> {
                ProducerRecord<String, String> record = new ProducerRecord<>(
                    config.getBroadcastTopic(),
                    message.getChannel(),
                    json
                );
                return sender.send(Mono.just(SenderRecord.create(record, message.getId())))
                    .retry(3)
                    .doOnNext(result -> {
                        metricsService.recordBroadcast("publish");
                        log.debug("Published {} to channel {}", result.correlationMetadata(), message.getChannel());
                    })
                    .then();
            });
    }

    @Override
    public Mono<Void> stop() {
        sender.close();
        log.info("Kafka broadcast producer stopped");
        return Mono.empty();
    }
}
