package com.qqsuccubus.toolsync.sync.metrics;

import com.qqsuccubus.toolsync.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

import java.util.List;

/**
 * Serves a sync node's meters in the Prometheus text format on {@code /metrics}.
 * <p>
 * The scrape registry is attached to Reactor Netty's global composite, so the HTTP server's
 * own meters and the tool-sync meters land in one scrape. Every series carries the node id
 * and the service name.
 * </p>
 */
public class PrometheusMetricsExporter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";
    static final String SERVICE = "tool-sync";

    private final String nodeId;
    private final PrometheusMeterRegistry scrapeRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this.nodeId = nodeId;
        this.scrapeRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        scrapeRegistry.config().commonTags(List.of(
            Tag.of(MetricsTags.NODE_ID, nodeId),
            Tag.of("service", SERVICE)));

        if (Metrics.REGISTRY instanceof CompositeMeterRegistry global) {
            global.add(scrapeRegistry);
        } else {
            log.warn("Global meter registry is not composite, node {} exposes tool-sync meters only", nodeId);
        }
    }

    /**
     * Registry the node's meters are written to.
     */
    public MeterRegistry getRegistry() {
        return Metrics.REGISTRY instanceof CompositeMeterRegistry ? Metrics.REGISTRY : scrapeRegistry;
    }

    public String scrape() {
        return scrapeRegistry.scrape();
    }

    /**
     * Detaches from the global composite and releases the scrape registry.
     */
    @Override
    public void close() {
        if (Metrics.REGISTRY instanceof CompositeMeterRegistry global) {
            global.remove(scrapeRegistry);
        }
        scrapeRegistry.close();
        log.info("Metrics exporter of node {} closed", nodeId);
    }
}
