package com.qqsuccubus.toolsync.sync.stream;

public enum ConnectionState {
    CONNECTING,
    STREAMING,
    CLOSED
}
