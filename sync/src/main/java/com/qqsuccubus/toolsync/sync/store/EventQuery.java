package com.qqsuccubus.toolsync.sync.store;

import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Event-log filter. Results are ordered newest first, as given by {@link #newestFirst()}, and
 * truncated to {@code limit}.
 * <p>
 * Either {@code toolId} or {@code deploymentId} must be set. Without a deployment the query
 * spans every deployment of the tool.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class EventQuery {
    String toolId;
    String deploymentId;
    String spaceId;
    /**
     * Exclusive lower bound on the event timestamp.
     */
    Instant since;
    /**
     * Exclusive upper bound on the event timestamp.
     */
    Instant before;
    int limit;

    /**
     * Sequence numbers only count within one key. A deployment-scoped query reads a single key
     * and orders by sequence; a tool-wide query orders by timestamp, sequence breaking ties.
     */
    public Comparator<UpdateEvent> newestFirst() {
        Comparator<UpdateEvent> bySequence = Comparator.comparingLong(UpdateEvent::getSequenceNumber);
        if (deploymentId != null) {
            return bySequence.reversed();
        }
        return Comparator.comparing(UpdateEvent::getTimestamp).thenComparing(bySequence).reversed();
    }

    public boolean matches(UpdateEvent event) {
        if (toolId != null && !toolId.equals(event.getToolId())) {
            return false;
        }
        if (deploymentId != null && !deploymentId.equals(event.getDeploymentId())) {
            return false;
        }
        if (spaceId != null && !Objects.equals(spaceId, event.getSpaceId())) {
            return false;
        }
        if (since != null && !event.getTimestamp().isAfter(since)) {
            return false;
        }
        return before == null || event.getTimestamp().isBefore(before);
    }
}
