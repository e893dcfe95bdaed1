package com.qqsuccubus.toolsync.sync.store;

import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Append-only update event log. Appends happen through {@link ISnapshotStore#commit(Commit)}.
 */
public interface IEventLog {

    Mono<UpdateEvent> findById(String eventId);

    Flux<UpdateEvent> query(EventQuery query);

    /**
     * @return true if the event existed and was removed
     */
    Mono<Boolean> delete(String eventId);

    /**
     * Removes a tool's events with a timestamp before {@code cutoff}, optionally only those of
     * one deployment.
     *
     * @return number of removed events
     */
    Mono<Long> deleteOlderThan(String toolId, String deploymentId, Instant cutoff);
}
