package com.qqsuccubus.toolsync.sync.store;

import com.qqsuccubus.toolsync.core.msg.BroadcastMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Capped per-channel outbox of broadcast messages.
 * <p>
 * The sync node only appends. Outboxes are drained by whatever delivers to end clients, which
 * runs outside this service; {@link #read} is the read side it uses, and the one tests inspect.
 * </p>
 */
public interface IBroadcastOutbox {

    Mono<Void> append(String channel, BroadcastMessage message);

    /**
     * @return up to {@code count} retained messages of the channel, oldest first
     */
    Flux<BroadcastMessage> read(String channel, int count);
}
