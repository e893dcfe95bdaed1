package com.qqsuccubus.toolsync.sync.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.toolsync.core.util.JsonUtils;
import com.qqsuccubus.toolsync.sync.access.CallerResolver;
import com.qqsuccubus.toolsync.sync.access.DeploymentRecord;
import com.qqsuccubus.toolsync.sync.access.InMemoryToolDirectory;
import com.qqsuccubus.toolsync.sync.access.SpaceMember;
import com.qqsuccubus.toolsync.sync.access.ToolAccessPolicy;
import com.qqsuccubus.toolsync.sync.access.ToolRecord;
import com.qqsuccubus.toolsync.sync.ack.AckTracker;
import com.qqsuccubus.toolsync.sync.broadcast.BroadcastFanOut;
import com.qqsuccubus.toolsync.sync.broadcast.IBroadcastPublisher;
import com.qqsuccubus.toolsync.sync.broadcast.UpdateHub;
import com.qqsuccubus.toolsync.sync.config.SyncConfig;
import com.qqsuccubus.toolsync.sync.conflict.ConflictResolver;
import com.qqsuccubus.toolsync.sync.metrics.MetricsService;
import com.qqsuccubus.toolsync.sync.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.toolsync.sync.service.ToolUpdateService;
import com.qqsuccubus.toolsync.sync.state.SnapshotService;
import com.qqsuccubus.toolsync.sync.store.InMemoryStateRepository;
import com.qqsuccubus.toolsync.sync.stream.StreamingChannel;
import com.qqsuccubus.toolsync.sync.support.TestConfigs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.handler.codec.http.HttpHeaderNames;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpServerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private PrometheusMetricsExporter metricsExporter;
    private HttpServer server;
    private HttpClient client;

    @BeforeEach
    void setUp() {
        SyncConfig config = TestConfigs.memory();
        Clock clock = Clock.systemUTC();
        InMemoryStateRepository store = new InMemoryStateRepository(config.getOutboxMax());
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry(), config);
        UpdateHub hub = new UpdateHub();

        InMemoryToolDirectory directory = new InMemoryToolDirectory()
            .putTool(ToolRecord.builder().id("tool-1").name("Counter").authorId("author").build())
            .putDeployment(DeploymentRecord.builder()
                .id("dep-1").toolId("tool-1").deployedBy("author").spaceId("space-1").build())
            .putMember(SpaceMember.builder().spaceId("space-1").userId("viewer").build());

        SnapshotService snapshotService = new SnapshotService(store, config, metricsService, clock);
        ToolUpdateService service = new ToolUpdateService(
            directory,
            new ToolAccessPolicy(directory),
            snapshotService,
            store,
            new ConflictResolver(),
            new BroadcastFanOut(store, IBroadcastPublisher.local(), metricsService, config.getNodeId(), clock),
            new AckTracker(store, metricsService, clock),
            hub,
            new StreamingChannel(config, store, snapshotService, hub, metricsService, clock),
            metricsService,
            clock
        );

        metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        server = new HttpServer(config, new ToolUpdatesHandler(service, new CallerResolver()), metricsExporter);
        server.start();
        client = HttpClient.create().port(server.port());
    }

    @AfterEach
    void tearDown() {
        server.stop();
        metricsExporter.close();
    }

    @Test
    void testHealthz_Ok() {
        Response response = call("GET", "/healthz", null, null);

        assertEquals(200, response.status);
        assertEquals("OK", response.body);
    }

    @Test
    void testMetrics_ScrapeTaggedWithNode() {
        metricsExporter.getRegistry().counter("rtc.toolsync.test.scrape").increment();

        Response response = call("GET", "/metrics", null, null);

        assertEquals(200, response.status);
        assertTrue(response.body.contains("rtc.toolsync.test.scrape_total"));
        assertTrue(response.body.contains("node_id=\"sync-test\""));
    }

    @Test
    void testPathOnly_QueryDroppedFromMeterTags() {
        assertEquals(HttpServer.TOOL_UPDATES, HttpServer.pathOnly(HttpServer.TOOL_UPDATES + "?toolId=tool-1&limit=5"));
        assertEquals("/healthz", HttpServer.pathOnly("/healthz"));
    }

    @Test
    void testSubmitThenHistory_RoundTrip() {
        Response submitted = call("POST", HttpServer.TOOL_UPDATES, "author",
            "{\"toolId\":\"tool-1\",\"deploymentId\":\"dep-1\",\"updateType\":\"value_update\","
                + "\"eventData\":{\"newState\":{\"count\":1}}}");

        assertEquals(200, submitted.status);
        JsonNode created = submitted.json();
        assertTrue(created.get("success").asBoolean());
        assertEquals(1L, created.get("updateEvent").get("sequenceNumber").asLong());
        assertEquals("value_update", created.get("updateEvent").get("updateType").asText());

        Response history = call("GET", HttpServer.TOOL_UPDATES
            + "?toolId=tool-1&deploymentId=dep-1&includeSnapshot=true", "viewer", null);

        assertEquals(200, history.status);
        JsonNode body = history.json();
        assertEquals(1, body.get("updates").size());
        assertEquals(1L, body.get("lastSequenceNumber").asLong());
        assertFalse(body.get("hasMore").asBoolean());
        assertEquals(1, body.get("stateSnapshot").get("currentState").get("count").asInt());
        assertEquals("synced", body.get("syncStatus").get("status").asText());
    }

    @Test
    void testSync_BootstrapsState() {
        Response response = call("PUT", HttpServer.TOOL_UPDATES, "viewer",
            "{\"toolId\":\"tool-1\",\"deploymentId\":\"dep-1\",\"clientVersion\":0,\"clientState\":{\"a\":1}}");

        assertEquals(200, response.status);
        assertEquals("client_state_accepted", response.json().get("syncResult").asText());
        assertEquals(1L, response.json().get("serverVersion").asLong());
    }

    @Test
    void testMissingCaller_Unauthorized() {
        Response response = call("GET", HttpServer.TOOL_UPDATES + "?toolId=tool-1", null, null);

        assertEquals(401, response.status);
        JsonNode body = response.json();
        assertFalse(body.get("success").asBoolean());
        assertEquals("UNAUTHORIZED", body.get("error").get("code").asText());
    }

    @Test
    void testErrors_MappedToStatusAndEnvelope() {
        Response forbidden = call("POST", HttpServer.TOOL_UPDATES, "viewer",
            "{\"toolId\":\"tool-1\",\"updateType\":\"value_update\",\"eventData\":{}}");
        assertEquals(403, forbidden.status);
        assertEquals("FORBIDDEN", forbidden.json().get("error").get("code").asText());

        Response missingTool = call("POST", HttpServer.TOOL_UPDATES, "author",
            "{\"toolId\":\"tool-9\",\"updateType\":\"value_update\",\"eventData\":{}}");
        assertEquals(404, missingTool.status);

        Response malformed = call("POST", HttpServer.TOOL_UPDATES, "author", "{not json");
        assertEquals(400, malformed.status);
        assertEquals("INVALID_INPUT", malformed.json().get("error").get("code").asText());

        Response badTime = call("GET", HttpServer.TOOL_UPDATES + "?toolId=tool-1&since=yesterday", "author", null);
        assertEquals(400, badTime.status);
    }

    @Test
    void testCleanup_RequiresCriteria() {
        Response response = call("DELETE", HttpServer.TOOL_UPDATES + "?toolId=tool-1", "author", null);

        assertEquals(400, response.status);
        assertEquals("Either eventId or olderThan is required",
            response.json().get("error").get("message").asText());
    }

    @Test
    void testAcks_UnknownEventNotFound() {
        Response response = call("GET", HttpServer.ACKS + "?updateEventId=missing", "u1", null);

        assertEquals(404, response.status);
    }

    @Test
    void testStream_FirstFrameIsConnected() {
        String firstChunk = client
            .headers(h -> h.add(CallerResolver.USER_HEADER, "viewer")
                .add(HttpHeaderNames.ACCEPT, ToolUpdatesHandler.EVENT_STREAM))
            .get()
            .uri(HttpServer.TOOL_UPDATES + "?deploymentId=dep-1")
            .responseContent()
            .asString()
            .next()
            .block(TIMEOUT);

        assertTrue(firstChunk.startsWith("data: "));
        assertTrue(firstChunk.contains("\"type\":\"connected\""));
        assertTrue(firstChunk.contains("\"deploymentId\":\"dep-1\""));
    }

    private Response call(String method, String uri, String userId, String body) {
        HttpClient target = userId == null
            ? client
            : client.headers(h -> h.add(CallerResolver.USER_HEADER, userId));

        HttpClient.ResponseReceiver<?> request;
        switch (method) {
            case "POST":
                request = target.post().uri(uri).send(ByteBufFlux.fromString(Mono.just(body)));
                break;
            case "PUT":
                request = target.put().uri(uri).send(ByteBufFlux.fromString(Mono.just(body)));
                break;
            case "DELETE":
                request = target.delete().uri(uri);
                break;
            default:
                request = target.get().uri(uri);
        }

        return request
            .responseSingle((res, content) -> content.asString()
                .defaultIfEmpty("")
                .map(text -> new Response(res.status().code(), text)))
            .block(TIMEOUT);
    }

    private static class Response {
        final int status;
        final String body;

        Response(int status, String body) {
            this.status = status;
            this.body = body;
        }

        JsonNode json() {
            return JsonUtils.readTree(body);
        }
    }
}
