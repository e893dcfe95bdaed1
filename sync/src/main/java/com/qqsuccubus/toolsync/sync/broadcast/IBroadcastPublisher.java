package com.qqsuccubus.toolsync.sync.broadcast;

import com.qqsuccubus.toolsync.core.msg.BroadcastMessage;
import reactor.core.publisher.Mono;

/**
 * Hands broadcast messages to the broker that carries them to other nodes.
 */
public interface IBroadcastPublisher {

    Mono<Void> publish(BroadcastMessage message);

    default Mono<Void> stop() {
        return Mono.empty();
    }

    /**
     * Publisher for single-node setups without a broker.
     */
    static IBroadcastPublisher local() {
        return message -> Mono.empty();
    }
}
