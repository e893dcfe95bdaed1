package com.qqsuccubus.toolsync.sync.conflict;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.toolsync.core.model.ConflictDescriptor;
import com.qqsuccubus.toolsync.core.model.ConflictStrategy;
import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of resolving one sync conflict.
 */
@Value
@Builder
public class Resolution {
    ConflictStrategy strategy;
    JsonNode resolvedState;
    List<ConflictDescriptor> conflicts;
    /**
     * The configuration_change event recording the resolution, sequenced at server version + 1.
     */
    UpdateEvent event;

    public long newVersion() {
        return event.getSequenceNumber();
    }
}
