package com.qqsuccubus.toolsync.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A top-level field that both sides of a sync conflict set to different values.
 */
@Value
@Builder
@Jacksonized
public class ConflictDescriptor {
    String field;
    JsonNode serverValue;
    JsonNode clientValue;
    JsonNode resolvedValue;
}
