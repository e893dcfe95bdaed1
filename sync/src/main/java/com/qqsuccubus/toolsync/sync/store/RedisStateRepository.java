package com.qqsuccubus.toolsync.sync.store;

import com.qqsuccubus.toolsync.core.model.AckTracking;
import com.qqsuccubus.toolsync.core.model.StateSnapshot;
import com.qqsuccubus.toolsync.core.model.ToolStateKey;
import com.qqsuccubus.toolsync.core.model.UpdateEvent;
import com.qqsuccubus.toolsync.core.msg.BroadcastMessage;
import com.qqsuccubus.toolsync.core.redis.Keys;
import com.qqsuccubus.toolsync.core.util.JsonUtils;
import com.qqsuccubus.toolsync.sync.config.SyncConfig;
import com.qqsuccubus.toolsync.sync.error.VersionConflictException;
import io.lettuce.core.KeyValue;
import io.lettuce.core.Limit;
import io.lettuce.core.Range;
import io.lettuce.core.RedisClient;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.StreamMessage;
import io.lettuce.core.XAddArgs;
import io.lettuce.core.XTrimArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reactive Redis store for snapshots, the event log, ack tracking and channel outboxes.
 * <p>
 * All operations are non-blocking using the Lettuce reactive API. A commit is a single Lua
 * script, so the version check, the snapshot write, the event write and both index updates
 * land together or not at all.
 * </p>
 */
public class RedisStateRepository implements ISnapshotStore, IEventLog, IAckStore, IBroadcastOutbox, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RedisStateRepository.class);

    /**
     * KEYS: snapshot, events hash, tool index, [deployment index]
     * ARGV: expected version, new version, snapshot json, event id ('' = none), event json, score
     * Returns 1 when written, 0 on version mismatch.
     */
    static final String COMMIT_SCRIPT = String.join("\n",
        "local current = tonumber(redis.call('HGET', KEYS[1], 'version') or '0')",
        "if current ~= tonumber(ARGV[1]) then",
        "  return 0",
        "end",
        "redis.call('HSET', KEYS[1], 'version', ARGV[2], 'json', ARGV[3])",
        "if ARGV[4] ~= '' then",
        "  redis.call('HSET', KEYS[2], ARGV[4], ARGV[5])",
        "  redis.call('ZADD', KEYS[3], ARGV[6], ARGV[4])",
        "  if #KEYS > 3 then",
        "    redis.call('ZADD', KEYS[4], ARGV[6], ARGV[4])",
        "  end",
        "end",
        "return 1");

    /**
     * Upper bound on index entries read per query before ordering and truncating.
     */
    private static final int QUERY_SCAN_MAX = 1000;

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final SyncConfig config;
    private final Clock clock;

    public RedisStateRepository(SyncConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    @Override
    public Mono<StateSnapshot> get(ToolStateKey key) {
        return commands.hget(Keys.snapshot(key.id()), "json")
            .map(json -> JsonUtils.readValue(json, StateSnapshot.class))
            .doOnError(err -> log.error("Failed to read snapshot {}", key, err));
    }

    @Override
    public Mono<Void> commit(Commit commit) {
        UpdateEvent event = commit.getEvent();
        List<String> keys = new ArrayList<>(4);
        keys.add(Keys.snapshot(commit.getKey().id()));
        keys.add(Keys.events());
        keys.add(Keys.toolEvents(commit.getKey().getToolId()));
        if (commit.getKey().hasDeployment()) {
            keys.add(Keys.deploymentEvents(commit.getKey().getDeploymentId()));
        }

        String[] args = {
            String.valueOf(commit.getExpectedVersion()),
            String.valueOf(commit.getSnapshot().getVersion()),
            JsonUtils.writeValueAsString(commit.getSnapshot()),
            event == null ? "" : event.getId(),
            event == null ? "" : JsonUtils.writeValueAsString(event),
            event == null ? "0" : String.valueOf(event.getTimestamp().toEpochMilli())
        };

        return commands.<Long>eval(COMMIT_SCRIPT, ScriptOutputType.INTEGER, keys.toArray(String[]::new), args)
            .next()
            .flatMap(written -> written == 1L
                ? Mono.<Void>empty()
                : Mono.<Void>error(new VersionConflictException(commit.getKey(), commit.getExpectedVersion())))
            .doOnError(err -> !(err instanceof VersionConflictException),
                err -> log.error("Failed to commit snapshot {}", commit.getKey(), err));
    }

    @Override
    public Mono<UpdateEvent> findById(String eventId) {
        return commands.hget(Keys.events(), eventId)
            .map(json -> JsonUtils.readValue(json, UpdateEvent.class))
            .doOnError(err -> log.error("Failed to read event {}", eventId, err));
    }

    @Override
    public Flux<UpdateEvent> query(EventQuery query) {
        String index = query.getDeploymentId() != null
            ? Keys.deploymentEvents(query.getDeploymentId())
            : Keys.toolEvents(query.getToolId());

        Range.Boundary<Long> lower = query.getSince() != null
            ? Range.Boundary.excluding(query.getSince().toEpochMilli())
            : Range.Boundary.unbounded();
        Range.Boundary<Long> upper = query.getBefore() != null
            ? Range.Boundary.excluding(query.getBefore().toEpochMilli())
            : Range.Boundary.unbounded();
        Range<Long> window = Range.from(lower, upper);

        return commands.zrevrangebyscore(index, window, Limit.create(0, QUERY_SCAN_MAX))
            .collectList()
            .flatMapMany(this::loadEvents)
            .filter(query::matches)
            .sort(query.newestFirst())
            .take(query.getLimit())
            .doOnError(err -> log.error("Failed to query events {}", query, err));
    }

    @Override
    public Mono<Boolean> delete(String eventId) {
        return findById(eventId)
            .flatMap(event -> unindex(event).thenReturn(true))
            .defaultIfEmpty(false);
    }

    @Override
    public Mono<Long> deleteOlderThan(String toolId, String deploymentId, Instant cutoff) {
        Range.Boundary<Long> upper = Range.Boundary.excluding(cutoff.toEpochMilli());
        Range<Long> older = Range.from(Range.Boundary.unbounded(), upper);
        EventQuery scope = EventQuery.builder().toolId(toolId).deploymentId(deploymentId).before(cutoff).build();

        return commands.zrangebyscore(Keys.toolEvents(toolId), older)
            .collectList()
            .flatMapMany(this::loadEvents)
            .filter(scope::matches)
            .concatMap(event -> unindex(event).thenReturn(event.getId()))
            .count()
            .doOnSuccess(count -> log.info("Removed {} events of tool {} older than {}", count, toolId, cutoff))
            .doOnError(err -> log.error("Failed to clean up events of tool {}", toolId, err));
    }

    private Flux<UpdateEvent> loadEvents(List<String> ids) {
        if (ids.isEmpty()) {
            return Flux.empty();
        }
        return commands.hmget(Keys.events(), ids.toArray(String[]::new))
            .filter(KeyValue::hasValue)
            .map(kv -> JsonUtils.readValue(kv.getValue(), UpdateEvent.class));
    }

    /**
     * Removes the event, its index entries and its ack tracking.
     */
    private Mono<Void> unindex(UpdateEvent event) {
        Mono<Long> deploymentIndex = event.getDeploymentId() == null
            ? Mono.just(0L)
            : commands.zrem(Keys.deploymentEvents(event.getDeploymentId()), event.getId());
        return commands.hdel(Keys.events(), event.getId())
            .then(commands.zrem(Keys.toolEvents(event.getToolId()), event.getId()))
            .then(deploymentIndex)
            .then(commands.hdel(Keys.acks(), event.getId()))
            .then(commands.del(Keys.ackReceived(event.getId())))
            .then();
    }

    @Override
    public Mono<Void> save(AckTracking tracking) {
        return commands.hset(Keys.acks(), tracking.getUpdateEventId(), JsonUtils.writeValueAsString(tracking))
            .then()
            .doOnError(err -> log.error("Failed to save ack tracking {}", tracking.getUpdateEventId(), err));
    }

    @Override
    public Mono<AckTracking> find(String updateEventId) {
        return commands.hget(Keys.acks(), updateEventId)
            .map(json -> JsonUtils.readValue(json, AckTracking.class))
            .flatMap(tracking -> commands.smembers(Keys.ackReceived(updateEventId))
                .collectList()
                .map(recorded -> {
                    Set<String> users = new LinkedHashSet<>(tracking.getReceivedAcks());
                    users.addAll(recorded);
                    return tracking.withReceivedAcks(List.copyOf(users));
                }))
            .doOnError(err -> log.error("Failed to read ack tracking {}", updateEventId, err));
    }

    @Override
    public Mono<Void> addReceived(String updateEventId, String userId) {
        return commands.sadd(Keys.ackReceived(updateEventId), userId)
            .then()
            .doOnError(err -> log.error("Failed to record ack of {} for {}", userId, updateEventId, err));
    }

    /**
     * Appends a message to the channel outbox using Redis Streams (XADD).
     * <p>
     * Trimmed both by count (MAXLEN ~) and by age (MINID derived from the outbox TTL); the
     * stream key itself expires after the TTL without appends.
     * </p>
     */
    @Override
    public Mono<Void> append(String channel, BroadcastMessage message) {
        String streamKey = Keys.outbox(channel);
        long minTimestamp = clock.millis() - config.getOutboxTtlSec() * 1000L;
        String minId = minTimestamp + "-0";

        XAddArgs args = XAddArgs.Builder
            .maxlen(config.getOutboxMax())
            .approximateTrimming();

        return commands.xadd(streamKey, args, Map.of("msg", JsonUtils.writeValueAsString(message)))
            .then(commands.xtrim(streamKey, XTrimArgs.Builder.minId(minId).approximateTrimming()))
            .then(commands.expire(streamKey, config.getOutboxTtlSec()))
            .then()
            .doOnSuccess(v -> log.debug("Appended {} to outbox {}", message.getId(), channel))
            .doOnError(err -> log.error("Failed to append to outbox {}", channel, err));
    }

    @Override
    public Flux<BroadcastMessage> read(String channel, int count) {
        return commands.xrange(Keys.outbox(channel), Range.unbounded(), Limit.from(count))
            .map(StreamMessage::getBody)
            .map(body -> JsonUtils.readValue(body.get("msg"), BroadcastMessage.class))
            .doOnError(err -> log.error("Failed to read outbox {}", channel, err));
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
