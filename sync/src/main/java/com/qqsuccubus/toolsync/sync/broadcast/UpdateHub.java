package com.qqsuccubus.toolsync.sync.broadcast;

import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Duration;

/**
 * In-process feed of committed update events, local and relayed from other nodes.
 * <p>
 * Hot and best-effort: subscribers only see events emitted after they subscribed, and a
 * subscriber that cannot keep up misses events instead of slowing down writers.
 * </p>
 */
public class UpdateHub {
    private static final Logger log = LoggerFactory.getLogger(UpdateHub.class);

    private final Sinks.Many<UpdateEvent> sink = Sinks.many().multicast().directBestEffort();

    public void publish(UpdateEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result == Sinks.EmitResult.FAIL_NON_SERIALIZED) {
            // concurrent emitters, spin until the other one is done
            try {
                sink.emitNext(event, Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100)));
            } catch (Sinks.EmissionException e) {
                log.warn("Update {} not emitted to live streams: {}", event.getId(), e.getReason());
            }
        } else if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Update {} not emitted to live streams: {}", event.getId(), result);
        }
    }

    public Flux<UpdateEvent> events() {
        return sink.asFlux();
    }

    public void complete() {
        sink.tryEmitComplete();
    }
}
