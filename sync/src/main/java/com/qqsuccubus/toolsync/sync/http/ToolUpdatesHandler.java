package com.qqsuccubus.toolsync.sync.http;

import com.qqsuccubus.toolsync.core.msg.StreamFrame;
import com.qqsuccubus.toolsync.core.util.JsonUtils;
import com.qqsuccubus.toolsync.sync.access.CallerResolver;
import com.qqsuccubus.toolsync.sync.error.ErrorCode;
import com.qqsuccubus.toolsync.sync.error.ToolSyncException;
import com.qqsuccubus.toolsync.sync.service.AckRequest;
import com.qqsuccubus.toolsync.sync.service.CleanupRequest;
import com.qqsuccubus.toolsync.sync.service.HistoryRequest;
import com.qqsuccubus.toolsync.sync.service.SubmitUpdateRequest;
import com.qqsuccubus.toolsync.sync.service.SyncRequest;
import com.qqsuccubus.toolsync.sync.service.ToolUpdateService;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * HTTP bindings of {@link ToolUpdateService}.
 * <p>
 * Every handler resolves the caller first ({@code UNAUTHORIZED} when none), decodes the
 * request, runs the operation and writes the JSON envelope from {@link ApiResponses}.
 * </p>
 */
public class ToolUpdatesHandler {
    private static final Logger log = LoggerFactory.getLogger(ToolUpdatesHandler.class);

    static final String APPLICATION_JSON = "application/json";
    static final String NDJSON = "application/x-ndjson";
    static final String EVENT_STREAM = "text/event-stream";

    private final ToolUpdateService service;
    private final CallerResolver callerResolver;

    public ToolUpdatesHandler(ToolUpdateService service, CallerResolver callerResolver) {
        this.service = service;
        this.callerResolver = callerResolver;
    }

    public Publisher<Void> submit(HttpServerRequest req, HttpServerResponse res) {
        return handle(req, res, userId -> readBody(req, SubmitUpdateRequest.class)
            .flatMap(body -> service.submit(userId, body))
            .map(result -> ApiResponses.success("updateEvent", result)));
    }

    /**
     * History as JSON, or the live stream when the client accepts a streaming type and names
     * a deployment.
     */
    public Publisher<Void> get(HttpServerRequest req, HttpServerResponse res) {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        String deploymentId = param(query, "deploymentId");
        String accept = req.requestHeaders().get(HttpHeaderNames.ACCEPT, "");
        boolean sse = accept.contains(EVENT_STREAM);
        boolean ndjson = accept.contains(NDJSON);

        if ((sse || ndjson) && deploymentId != null) {
            return stream(req, res, deploymentId, param(query, "toolId"), sse);
        }

        return handle(req, res, userId -> Mono.fromCallable(() -> HistoryRequest.builder()
                .toolId(param(query, "toolId"))
                .deploymentId(deploymentId)
                .spaceId(param(query, "spaceId"))
                .since(parseTime(param(query, "since"), "since"))
                .limit(parseLimit(param(query, "limit")))
                .includeSnapshot(Boolean.parseBoolean(param(query, "includeSnapshot")))
                .build())
            .flatMap(request -> service.history(userId, request))
            .map(ApiResponses::success));
    }

    public Publisher<Void> sync(HttpServerRequest req, HttpServerResponse res) {
        return handle(req, res, userId -> readBody(req, SyncRequest.class)
            .flatMap(body -> service.sync(userId, body))
            .map(ApiResponses::success));
    }

    public Publisher<Void> cleanup(HttpServerRequest req, HttpServerResponse res) {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        return handle(req, res, userId -> Mono.fromCallable(() -> CleanupRequest.builder()
                .toolId(param(query, "toolId"))
                .deploymentId(param(query, "deploymentId"))
                .eventId(param(query, "eventId"))
                .olderThan(parseTime(param(query, "olderThan"), "olderThan"))
                .build())
            .flatMap(request -> service.cleanup(userId, request))
            .map(ApiResponses::success));
    }

    public Publisher<Void> acknowledge(HttpServerRequest req, HttpServerResponse res) {
        return handle(req, res, userId -> readBody(req, AckRequest.class)
            .flatMap(body -> service.acknowledge(userId, body.getUpdateEventId()))
            .map(tracking -> ApiResponses.success("ackTracking", tracking)));
    }

    public Publisher<Void> ackStatus(HttpServerRequest req, HttpServerResponse res) {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        return handle(req, res, userId -> service.ackStatus(param(query, "updateEventId"))
            .map(tracking -> ApiResponses.success("ackTracking", tracking)));
    }

    private Publisher<Void> stream(HttpServerRequest req,
                                   HttpServerResponse res,
                                   String deploymentId,
                                   String toolId,
                                   boolean sse) {
        String userId = callerResolver.resolve(req.requestHeaders()).orElse(null);
        if (userId == null) {
            return sendError(res, ToolSyncException.unauthorized());
        }

        return service.openStream(userId, deploymentId, toolId)
            .flatMap(frames -> {
                Flux<String> body = frames
                    .map(frame -> encode(frame, sse))
                    .onErrorResume(err -> {
                        log.error("Stream of deployment {} for {} failed", deploymentId, userId, err);
                        return Flux.empty();
                    });
                return res.status(HttpResponseStatus.OK)
                    .header(HttpHeaderNames.CONTENT_TYPE, sse ? EVENT_STREAM : NDJSON)
                    .header(HttpHeaderNames.CACHE_CONTROL, "no-cache, no-transform")
                    .header("X-Accel-Buffering", "no")
                    .sendString(body)
                    .then();
            })
            .onErrorResume(err -> sendError(res, err));
    }

    static String encode(StreamFrame frame, boolean sse) {
        String json = JsonUtils.writeValueAsString(frame);
        return sse ? "data: " + json + "\n\n" : json + "\n";
    }

    /**
     * Resolves the caller, runs {@code operation} and writes its JSON (200) or the mapped error.
     */
    private Mono<Void> handle(HttpServerRequest req,
                              HttpServerResponse res,
                              Function<String, Mono<String>> operation) {
        String userId = callerResolver.resolve(req.requestHeaders()).orElse(null);
        if (userId == null) {
            return sendError(res, ToolSyncException.unauthorized());
        }

        return Mono.defer(() -> operation.apply(userId))
            .flatMap(json -> res.status(HttpResponseStatus.OK)
                .header(HttpHeaderNames.CONTENT_TYPE, APPLICATION_JSON)
                .sendString(Mono.just(json))
                .then())
            .onErrorResume(err -> sendError(res, err));
    }

    private static Mono<Void> sendError(HttpServerResponse res, Throwable err) {
        ToolSyncException failure = ApiResponses.toClientError(err);
        if (failure.getCode() == ErrorCode.INTERNAL_ERROR) {
            log.error("Request failed: {}", err.getMessage(), err);
        } else {
            log.debug("Request rejected: {} {}", failure.getCode(), failure.getMessage());
        }
        return res.status(failure.getCode().status())
            .header(HttpHeaderNames.CONTENT_TYPE, APPLICATION_JSON)
            .sendString(Mono.just(ApiResponses.error(failure.getCode(), failure.getMessage())))
            .then();
    }

    private static <T> Mono<T> readBody(HttpServerRequest req, Class<T> type) {
        return req.receive()
            .aggregate()
            .asString()
            .filter(body -> !body.isBlank())
            .switchIfEmpty(Mono.error(() -> ToolSyncException.invalidInput("Request body is required")))
            .map(body -> decode(body, type));
    }

    static <T> T decode(String body, Class<T> type) {
        try {
            return JsonUtils.readValue(body, type);
        } catch (IllegalArgumentException e) {
            throw ToolSyncException.invalidInput("Request body is not valid " + type.getSimpleName() + " JSON");
        }
    }

    static String param(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }

    /**
     * Accepts ISO-8601 instants and epoch milliseconds.
     */
    static Instant parseTime(String value, String name) {
        if (value == null) {
            return null;
        }
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Instant.ofEpochMilli(Long.parseLong(value));
            }
            return Instant.parse(value);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw ToolSyncException.invalidInput(name + " must be an ISO-8601 timestamp or epoch millis");
        }
    }

    static Integer parseLimit(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw ToolSyncException.invalidInput("limit must be a number");
        }
    }
}
