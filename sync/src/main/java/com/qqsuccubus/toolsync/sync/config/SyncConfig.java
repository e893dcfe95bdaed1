package com.qqsuccubus.toolsync.sync.config;

import com.qqsuccubus.toolsync.core.msg.Topics;
import com.qqsuccubus.toolsync.sync.stream.StreamMode;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration for a sync node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SyncConfig {

    public enum StoreMode {
        REDIS,
        MEMORY
    }

    String nodeId;
    int httpPort;
    StoreMode storeMode;
    String redisUrl;
    String kafkaBootstrap;      // blank = no broker bridge
    String broadcastTopic;

    // Channel outboxes
    int outboxMax;
    int outboxTtlSec;

    // Live streams
    StreamMode streamMode;
    Duration heartbeatInterval;
    Duration pollInterval;
    Duration pollWindow;
    int pollMaxEvents;

    // Compare-and-set commit
    int commitMaxRetries;
    Duration commitBackoff;

    String toolDirectoryPath;
    boolean useVirtualThreads;

    public boolean isKafkaEnabled() {
        return kafkaBootstrap != null && !kafkaBootstrap.isBlank();
    }

    public static SyncConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static SyncConfig fromEnv(Map<String, String> env) {
        return SyncConfig.builder()
            .nodeId(getEnv(env, "NODE_ID", "sync-node-1"))
            .httpPort(Integer.parseInt(getEnv(env, "HTTP_PORT", "8080")))
            .storeMode(StoreMode.valueOf(getEnv(env, "STORE_MODE", "redis").toUpperCase(Locale.ROOT)))
            .redisUrl(getEnv(env, "REDIS_URL", "redis://localhost:6379"))
            .kafkaBootstrap(getEnv(env, "KAFKA_BOOTSTRAP", "localhost:9092"))
            .broadcastTopic(getEnv(env, "BROADCAST_TOPIC", Topics.TOOL_BROADCAST))
            .outboxMax(Integer.parseInt(getEnv(env, "OUTBOX_MAX", "1000")))
            .outboxTtlSec(Integer.parseInt(getEnv(env, "OUTBOX_TTL_SEC", "86400")))
            .streamMode(StreamMode.parse(getEnv(env, "STREAM_MODE", "subscribe")))
            .heartbeatInterval(Duration.ofSeconds(Integer.parseInt(getEnv(env, "STREAM_HEARTBEAT_INTERVAL_SEC", "30"))))
            .pollInterval(Duration.ofMillis(Long.parseLong(getEnv(env, "STREAM_POLL_INTERVAL_MS", "2000"))))
            .pollWindow(Duration.ofMillis(Long.parseLong(getEnv(env, "STREAM_POLL_WINDOW_MS", "5000"))))
            .pollMaxEvents(Integer.parseInt(getEnv(env, "STREAM_POLL_MAX_EVENTS", "5")))
            .commitMaxRetries(Integer.parseInt(getEnv(env, "COMMIT_MAX_RETRIES", "5")))
            .commitBackoff(Duration.ofMillis(Long.parseLong(getEnv(env, "COMMIT_BACKOFF_MS", "10"))))
            .toolDirectoryPath(getEnv(env, "TOOL_DIRECTORY_PATH", ""))
            .useVirtualThreads(Boolean.parseBoolean(getEnv(env, "useVirtualThreads", "false")))
            .build();
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value != null ? value : defaultValue;
    }
}
