package com.qqsuccubus.toolsync.sync;

import com.qqsuccubus.toolsync.sync.access.CallerResolver;
import com.qqsuccubus.toolsync.sync.access.IToolDirectory;
import com.qqsuccubus.toolsync.sync.access.InMemoryToolDirectory;
import com.qqsuccubus.toolsync.sync.access.ToolAccessPolicy;
import com.qqsuccubus.toolsync.sync.ack.AckTracker;
import com.qqsuccubus.toolsync.sync.broadcast.BroadcastFanOut;
import com.qqsuccubus.toolsync.sync.broadcast.IBroadcastPublisher;
import com.qqsuccubus.toolsync.sync.broadcast.KafkaBroadcastListener;
import com.qqsuccubus.toolsync.sync.broadcast.KafkaBroadcastPublisher;
import com.qqsuccubus.toolsync.sync.broadcast.UpdateHub;
import com.qqsuccubus.toolsync.sync.config.SyncConfig;
import com.qqsuccubus.toolsync.sync.conflict.ConflictResolver;
import com.qqsuccubus.toolsync.sync.http.HttpServer;
import com.qqsuccubus.toolsync.sync.http.ToolUpdatesHandler;
import com.qqsuccubus.toolsync.sync.metrics.MetricsService;
import com.qqsuccubus.toolsync.sync.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.toolsync.sync.service.ToolUpdateService;
import com.qqsuccubus.toolsync.sync.state.SnapshotService;
import com.qqsuccubus.toolsync.sync.store.IAckStore;
import com.qqsuccubus.toolsync.sync.store.IBroadcastOutbox;
import com.qqsuccubus.toolsync.sync.store.IEventLog;
import com.qqsuccubus.toolsync.sync.store.ISnapshotStore;
import com.qqsuccubus.toolsync.sync.store.InMemoryStateRepository;
import com.qqsuccubus.toolsync.sync.store.RedisStateRepository;
import com.qqsuccubus.toolsync.sync.stream.StreamingChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point for a tool-sync node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve the tool-update API at /api/v1/tool-updates (submit, history, stream, sync, cleanup, acks)</li>
 *   <li>Keep snapshots, the event log, ack tracking and channel outboxes in Redis</li>
 *   <li>Publish broadcasts to Kafka and relay other nodes' updates to local streams</li>
 *   <li>Expose /healthz and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class SyncApp {
    private static final Logger log = LoggerFactory.getLogger(SyncApp.class);

    public static void main(String[] args) {
        SyncConfig config = SyncConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        if (config.isUseVirtualThreads()) {
            System.setProperty("reactor.schedulers.defaultBoundedElasticOnVirtualThreads", "true");
            log.info("reactor.schedulers.defaultBoundedElasticOnVirtualThreads = true");
        }

        log.info("Starting sync node: {}", config.getNodeId());
        log.info("  Store: {}", config.getStoreMode());
        log.info("  Kafka: {}", config.isKafkaEnabled() ? config.getKafkaBootstrap() : "disabled");
        log.info("  Stream mode: {}", config.getStreamMode());

        Clock clock = Clock.systemUTC();
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        ISnapshotStore snapshotStore;
        IEventLog eventLog;
        IAckStore ackStore;
        IBroadcastOutbox outbox;
        AutoCloseable storeHandle;
        if (config.getStoreMode() == SyncConfig.StoreMode.MEMORY) {
            InMemoryStateRepository memory = new InMemoryStateRepository(config.getOutboxMax());
            snapshotStore = memory;
            eventLog = memory;
            ackStore = memory;
            outbox = memory;
            storeHandle = () -> { };
        } else {
            RedisStateRepository redis = new RedisStateRepository(config, clock);
            snapshotStore = redis;
            eventLog = redis;
            ackStore = redis;
            outbox = redis;
            storeHandle = redis;
        }

        IToolDirectory directory = config.getToolDirectoryPath() == null || config.getToolDirectoryPath().isBlank()
            ? new InMemoryToolDirectory()
            : InMemoryToolDirectory.fromFile(Path.of(config.getToolDirectoryPath()));

        UpdateHub hub = new UpdateHub();
        IBroadcastPublisher publisher = config.isKafkaEnabled()
            ? new KafkaBroadcastPublisher(config, metricsService)
            : IBroadcastPublisher.local();
        KafkaBroadcastListener listener = config.isKafkaEnabled()
            ? new KafkaBroadcastListener(config, hub)
            : null;

        SnapshotService snapshotService = new SnapshotService(snapshotStore, config, metricsService, clock);
        StreamingChannel streamingChannel = new StreamingChannel(
            config, eventLog, snapshotService, hub, metricsService, clock
        );
        ToolUpdateService toolUpdateService = new ToolUpdateService(
            directory,
            new ToolAccessPolicy(directory),
            snapshotService,
            eventLog,
            new ConflictResolver(),
            new BroadcastFanOut(outbox, publisher, metricsService, config.getNodeId(), clock),
            new AckTracker(ackStore, metricsService, clock),
            hub,
            streamingChannel,
            metricsService,
            clock
        );

        if (listener != null) {
            listener.start();
        }

        HttpServer httpServer = new HttpServer(
            config,
            new ToolUpdatesHandler(toolUpdateService, new CallerResolver()),
            metricsExporter
        );
        httpServer.start();

        log.info("Sync node {} is ready", config.getNodeId());

        handleShutdown(config, httpServer, listener, publisher, hub, storeHandle, metricsExporter);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(SyncConfig config,
                                       HttpServer httpServer,
                                       KafkaBroadcastListener listener,
                                       IBroadcastPublisher publisher,
                                       UpdateHub hub,
                                       AutoCloseable storeHandle,
                                       PrometheusMetricsExporter metricsExporter) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");
            MDC.put("nodeId", config.getNodeId());

            httpServer.stop();
            hub.complete();

            if (listener != null) {
                listener.stop();
            }
            publisher.stop().block(Duration.ofSeconds(10));

            try {
                storeHandle.close();
            } catch (Exception e) {
                log.warn("Failed to close store cleanly", e);
            }
            metricsExporter.close();

            log.info("Shutdown complete");
        }));
    }
}
