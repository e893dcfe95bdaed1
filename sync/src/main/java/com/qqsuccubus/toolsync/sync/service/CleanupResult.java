package com.qqsuccubus.toolsync.sync.service;

import lombok.Value;

@Value
public class CleanupResult {
    long deletedCount;
    String message;

    public static CleanupResult of(long deletedCount) {
        return new CleanupResult(deletedCount, "Cleaned up " + deletedCount + " tool update events");
    }
}
