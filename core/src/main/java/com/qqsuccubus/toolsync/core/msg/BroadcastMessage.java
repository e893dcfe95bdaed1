package com.qqsuccubus.toolsync.core.msg;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.qqsuccubus.toolsync.core.model.EventData;
import com.qqsuccubus.toolsync.core.model.UpdateType;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Message appended to a channel outbox (and published to the broker) for one update event.
 * <p>
 * Carries a reduced view of the event plus delivery bookkeeping. Delivery is
 * at-most-once per message; subscribers deduplicate by {@code content.updateEvent.id}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BroadcastMessage {
    public static final String TYPE_TOOL_UPDATE = "tool_update";
    public static final String ACTION_TOOL_UPDATED = "tool_updated";

    String id;

    String type;

    String channel;

    String senderId;

    /**
     * Node that accepted the update. Used to skip our own messages when consuming the topic.
     */
    String originNodeId;

    Content content;

    Metadata metadata;

    Delivery delivery;

    @Value
    @Builder
    @Jacksonized
    public static class Content {
        String action;
        EventView updateEvent;
    }

    /**
     * Reduced view of an update event.
     */
    @Value
    @Builder
    @Jacksonized
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class EventView {
        String id;
        String toolId;
        String deploymentId;
        String userId;
        UpdateType updateType;
        Instant timestamp;
        long sequenceNumber;
        EventData eventData;
    }

    @Value
    @Builder
    @Jacksonized
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Metadata {
        Instant timestamp;
        String priority;
        boolean requiresAck;
        Instant expiresAt;
        int retryCount;
    }

    /**
     * Per-recipient delivery tracking lists, all empty when the message is created.
     */
    @Value
    @Builder
    @Jacksonized
    public static class Delivery {
        @Builder.Default
        List<String> sent = List.of();
        @Builder.Default
        List<String> delivered = List.of();
        @Builder.Default
        List<String> read = List.of();
        @Builder.Default
        List<String> failed = List.of();

        public static Delivery empty() {
            return Delivery.builder().build();
        }
    }
}
