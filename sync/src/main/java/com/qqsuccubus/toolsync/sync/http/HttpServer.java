package com.qqsuccubus.toolsync.sync.http;

import com.qqsuccubus.toolsync.sync.config.SyncConfig;
import com.qqsuccubus.toolsync.sync.metrics.PrometheusMetricsExporter;
import io.netty.handler.codec.http.HttpHeaderNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;

/**
 * HTTP server of a sync node: the tool-update API plus health and metrics endpoints.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    static final String TOOL_UPDATES = "/api/v1/tool-updates";
    static final String ACKS = TOOL_UPDATES + "/acks";

    private final SyncConfig config;
    private final ToolUpdatesHandler handler;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public HttpServer(SyncConfig config, ToolUpdatesHandler handler, PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.handler = handler;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Binds the server. Port 0 binds an ephemeral port, see {@link #port()}.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .metrics(true, HttpServer::pathOnly)
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    /**
     * Drops the query string so that meter tags stay bounded.
     */
    static String pathOnly(String uri) {
        int query = uri.indexOf('?');
        return query < 0 ? uri : uri.substring(0, query);
    }

    public int port() {
        return server.port();
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            .get("/metrics", (req, res) ->
                res.header(HttpHeaderNames.CONTENT_TYPE, PrometheusMetricsExporter.CONTENT_TYPE)
                    .sendString(Mono.fromCallable(metricsExporter::scrape))
            )
            .post(ACKS, handler::acknowledge)
            .get(ACKS, handler::ackStatus)
            .post(TOOL_UPDATES, handler::submit)
            .get(TOOL_UPDATES, handler::get)
            .put(TOOL_UPDATES, handler::sync)
            .delete(TOOL_UPDATES, handler::cleanup);
    }
}
