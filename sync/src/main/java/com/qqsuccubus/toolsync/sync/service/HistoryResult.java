package com.qqsuccubus.toolsync.sync.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.qqsuccubus.toolsync.core.model.StateSnapshot;
import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@Builder(toBuilder = true)
public class HistoryResult {
    /**
     * Oldest first.
     */
    @Builder.Default
    List<UpdateEvent> updates = List.of();
    /**
     * Present only when requested and readable.
     */
    StateSnapshot stateSnapshot;
    SyncStatusView syncStatus;
    boolean hasMore;
    long lastSequenceNumber;
}
