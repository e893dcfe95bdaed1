package com.qqsuccubus.toolsync.sync.metrics;

import com.qqsuccubus.toolsync.core.metrics.MetricsNames;
import com.qqsuccubus.toolsync.core.metrics.MetricsTags;
import com.qqsuccubus.toolsync.core.model.ConflictStrategy;
import com.qqsuccubus.toolsync.core.model.UpdateType;
import com.qqsuccubus.toolsync.sync.config.SyncConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics service for the sync node.
 * <p>
 * Tagged counters are looked up on each call; Micrometer returns the already registered
 * meter for a known name and tag set.
 * </p>
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String nodeId;

    private final Counter commitRetries;
    private final Counter acks;
    private final Timer commitLatency;
    private final AtomicInteger openStreams = new AtomicInteger();

    public MetricsService(MeterRegistry registry, SyncConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        commitRetries = Counter.builder(MetricsNames.COMMIT_RETRIES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Commits retried after a version conflict")
            .register(registry);

        acks = Counter.builder(MetricsNames.ACKS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Acknowledgments recorded")
            .register(registry);

        commitLatency = Timer.builder(MetricsNames.COMMIT_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Read-sequence-commit latency including retries")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(5),
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(500)
            )
            .register(registry);

        Gauge.builder(MetricsNames.STREAM_CONNECTIONS, openStreams, AtomicInteger::get)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Open live update streams")
            .register(registry);
    }

    public void recordUpdate(UpdateType type) {
        Counter.builder(MetricsNames.UPDATES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, type.wire())
            .register(registry)
            .increment();
    }

    public void recordSync(String result) {
        Counter.builder(MetricsNames.SYNCS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.RESULT, result)
            .register(registry)
            .increment();
    }

    public void recordConflict(ConflictStrategy strategy) {
        Counter.builder(MetricsNames.CONFLICTS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.STRATEGY, strategy.wire())
            .register(registry)
            .increment();
    }

    public void recordCommitRetry() {
        commitRetries.increment();
    }

    public void recordCommitLatency(long startNanos) {
        commitLatency.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param type outbox or publish
     */
    public void recordBroadcast(String type) {
        Counter.builder(MetricsNames.BROADCAST_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, type)
            .register(registry)
            .increment();
    }

    public void recordBroadcastFailure(String reason) {
        Counter.builder(MetricsNames.BROADCAST_FAILURES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, reason)
            .register(registry)
            .increment();
    }

    public void recordAck() {
        acks.increment();
    }

    public void recordStreamFrame(String frameType) {
        Counter.builder(MetricsNames.STREAM_FRAMES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, frameType)
            .register(registry)
            .increment();
    }

    public void streamOpened() {
        openStreams.incrementAndGet();
    }

    public void streamClosed() {
        openStreams.decrementAndGet();
    }

    public int openStreams() {
        return openStreams.get();
    }
}
