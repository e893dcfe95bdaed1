package com.qqsuccubus.toolsync.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Payload of an {@link UpdateEvent}. States are opaque JSON trees.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventData {
    JsonNode previousState;

    JsonNode newState;

    /**
     * Top-level fields that differ between {@link #previousState} and {@link #newState}.
     */
    @Builder.Default
    List<String> changedFields = List.of();

    JsonNode executionResult;

    String errorMessage;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    /**
     * True when the event carries a replacement state. JSON {@code null} counts as absent.
     */
    public boolean hasNewState() {
        return newState != null && !newState.isNull() && !newState.isMissingNode();
    }
}
