package com.qqsuccubus.toolsync.sync.stream;

import lombok.Getter;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One open live stream: who is listening to which deployment, and what was already sent.
 */
public class StreamConnection {
    @Getter
    private final String connectionId = UUID.randomUUID().toString();
    @Getter
    private final String userId;
    @Getter
    private final String deploymentId;
    @Getter
    private final String toolId;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final AtomicLong lastSequence = new AtomicLong();

    public StreamConnection(String userId, String deploymentId, String toolId) {
        this.userId = userId;
        this.deploymentId = deploymentId;
        this.toolId = toolId;
    }

    public ConnectionState state() {
        return state.get();
    }

    /**
     * @return true if the connection moved from connecting to streaming
     */
    boolean markStreaming() {
        return state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.STREAMING);
    }

    /**
     * @return true on the first call
     */
    boolean markClosed() {
        return state.getAndSet(ConnectionState.CLOSED) != ConnectionState.CLOSED;
    }

    /**
     * Claims a sequence number for delivery.
     *
     * @return false if an equal or newer sequence number was already delivered
     */
    boolean admit(long sequenceNumber) {
        return lastSequence.getAndAccumulate(sequenceNumber, Math::max) < sequenceNumber;
    }
}
