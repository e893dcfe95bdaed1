package com.qqsuccubus.toolsync.core.msg;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.toolsync.core.model.UpdateType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Frame written on a live update stream.
 * <p>
 * Protocol (server → client):
 * <ul>
 *   <li>connected: {deploymentId, timestamp}</li>
 *   <li>heartbeat: {timestamp}</li>
 *   <li>state_update: {state, updateType, timestamp, triggeredBy, sequenceNumber}</li>
 * </ul>
 * </p>
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamFrame {
    public static final String CONNECTED = "connected";
    public static final String HEARTBEAT = "heartbeat";
    public static final String STATE_UPDATE = "state_update";

    String type;

    String deploymentId;

    JsonNode state;

    UpdateType updateType;

    Instant timestamp;

    String triggeredBy;

    Long sequenceNumber;

    public static StreamFrame connected(String deploymentId, Instant now) {
        return StreamFrame.builder().type(CONNECTED).deploymentId(deploymentId).timestamp(now).build();
    }

    public static StreamFrame heartbeat(Instant now) {
        return StreamFrame.builder().type(HEARTBEAT).timestamp(now).build();
    }
}
