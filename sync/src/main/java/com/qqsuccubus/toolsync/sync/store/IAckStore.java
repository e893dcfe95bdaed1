package com.qqsuccubus.toolsync.sync.store;

import com.qqsuccubus.toolsync.core.model.AckTracking;
import reactor.core.publisher.Mono;

public interface IAckStore {

    Mono<Void> save(AckTracking tracking);

    /**
     * @return the tracking document with every recorded ack in {@code receivedAcks},
     * or empty if none exists for the event
     */
    Mono<AckTracking> find(String updateEventId);

    /**
     * Records one user's ack. Concurrent acks for the same event never overwrite each other.
     */
    Mono<Void> addReceived(String updateEventId, String userId);
}
