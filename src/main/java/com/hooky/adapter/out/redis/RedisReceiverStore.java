package com.hooky.adapter.out.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hooky.application.port.out.ReceiverStore;
import com.hooky.domain.model.CapturedEvent;
import com.hooky.domain.model.Receiver;
import com.hooky.domain.model.ReceiverId;
import com.hooky.infrastructure.config.AppProperties;
import com.hooky.infrastructure.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis-backed store. Key layout:
 * <ul>
 *   <li>{@code endpoint:{id}} - receiver JSON, expired natively by Redis</li>
 *   <li>{@code events:{id}} - list of event JSON, newest at the head, capped</li>
 *   <li>{@code endpoints} - set of every id ever created, pruned lazily and by the sweep</li>
 *   <li>{@code pub:{id}} - pub/sub channel carrying each appended event</li>
 * </ul>
 */
public class RedisReceiverStore implements ReceiverStore {

    private static final Logger log = LoggerFactory.getLogger(RedisReceiverStore.class);

    public static final String RECEIVER_KEY_PREFIX = "endpoint:";
    public static final String EVENTS_KEY_PREFIX = "events:";
    public static final String INDEX_KEY = "endpoints";
    public static final String CHANNEL_PREFIX = "pub:";

    // KEYS: receiver, events. ARGV: event json, cap, channel.
    private static final RedisScript<Long> APPEND_SCRIPT = new DefaultRedisScript<>("""
        if redis.call('EXISTS', KEYS[1]) == 0 then
          return 0
        end
        redis.call('LPUSH', KEYS[2], ARGV[1])
        redis.call('LTRIM', KEYS[2], 0, tonumber(ARGV[2]) - 1)
        local ttl = redis.call('PTTL', KEYS[1])
        if ttl > 0 then
          redis.call('PEXPIRE', KEYS[2], ttl)
        end
        redis.call('PUBLISH', ARGV[3], ARGV[1])
        return 1
        """, Long.class);

    // KEYS: receiver, events, index. ARGV: id.
    private static final RedisScript<Long> DELETE_SCRIPT = new DefaultRedisScript<>("""
        local existed = redis.call('DEL', KEYS[1])
        redis.call('DEL', KEYS[2])
        redis.call('SREM', KEYS[3], ARGV[1])
        return existed
        """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ValueOperations<String, String> valueOps;
    private final ListOperations<String, String> listOps;
    private final SetOperations<String, String> setOps;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    public RedisReceiverStore(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            AppProperties appProperties) {
        this.redisTemplate = redisTemplate;
        this.valueOps = redisTemplate.opsForValue();
        this.listOps = redisTemplate.opsForList();
        this.setOps = redisTemplate.opsForSet();
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
    }

    public static String channelFor(ReceiverId id) {
        return CHANNEL_PREFIX + id.value();
    }

    @Override
    public boolean save(Receiver receiver) {
        String json = toJson(StoredReceiver.from(receiver));
        Duration keyTtl = receiver.ttl().plusSeconds(appProperties.getStore().getExpiryGraceSeconds());
        Boolean stored = execute("save", () -> valueOps.setIfAbsent(receiverKey(receiver.id()), json, keyTtl));
        if (!Boolean.TRUE.equals(stored)) {
            return false;
        }
        execute("index", () -> setOps.add(INDEX_KEY, receiver.id().value()));
        log.debug("Saved receiver {} with key ttl {}", receiver.id(), keyTtl);
        return true;
    }

    @Override
    public Optional<Receiver> find(ReceiverId id) {
        String raw = execute("find", () -> valueOps.get(receiverKey(id)));
        return Optional.ofNullable(raw).map(this::toReceiver);
    }

    @Override
    public List<Receiver> findAll() {
        Set<String> ids = execute("findAll", () -> setOps.members(INDEX_KEY));
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<String> orderedIds = List.copyOf(ids);
        List<String> keys = orderedIds.stream().map(id -> RECEIVER_KEY_PREFIX + id).toList();
        List<String> values = execute("findAll", () -> valueOps.multiGet(keys));

        List<Receiver> receivers = new ArrayList<>();
        List<String> stale = new ArrayList<>();
        for (int i = 0; i < orderedIds.size(); i++) {
            String raw = values != null && i < values.size() ? values.get(i) : null;
            if (raw == null) {
                stale.add(orderedIds.get(i));
            } else {
                receivers.add(toReceiver(raw));
            }
        }
        if (!stale.isEmpty()) {
            execute("prune", () -> setOps.remove(INDEX_KEY, stale.toArray()));
            log.debug("Pruned {} stale index entries while listing", stale.size());
        }
        return receivers;
    }

    @Override
    public boolean delete(ReceiverId id) {
        Long existed = execute("delete", () -> redisTemplate.execute(
            DELETE_SCRIPT, List.of(receiverKey(id), eventsKey(id), INDEX_KEY), id.value()));
        return existed != null && existed > 0;
    }

    @Override
    public boolean append(ReceiverId id, CapturedEvent event) {
        String json = toJson(event);
        Long appended = execute("append", () -> redisTemplate.execute(
            APPEND_SCRIPT,
            List.of(receiverKey(id), eventsKey(id)),
            json,
            String.valueOf(appProperties.getReceiver().getMaxEvents()),
            channelFor(id)));
        return appended != null && appended == 1L;
    }

    @Override
    public List<CapturedEvent> findEvents(ReceiverId id) {
        int maxEvents = appProperties.getReceiver().getMaxEvents();
        List<String> rows = execute("findEvents", () -> listOps.range(eventsKey(id), 0, maxEvents - 1));
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        return rows.stream().map(this::toEvent).toList();
    }

    @Override
    public long countEvents(ReceiverId id) {
        Long size = execute("countEvents", () -> listOps.size(eventsKey(id)));
        return size != null ? size : 0;
    }

    /**
     * Redis expires the data itself; only index entries pointing at vanished records are dropped here.
     */
    @Override
    public List<ReceiverId> sweep() {
        Set<String> ids = execute("sweep", () -> setOps.members(INDEX_KEY));
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<ReceiverId> removed = new ArrayList<>();
        for (String value : ids) {
            ReceiverId id = ReceiverId.fromTrusted(value);
            Boolean present = execute("sweep", () -> redisTemplate.hasKey(receiverKey(id)));
            if (!Boolean.TRUE.equals(present)) {
                execute("sweep", () -> setOps.remove(INDEX_KEY, value));
                execute("sweep", () -> redisTemplate.delete(eventsKey(id)));
                removed.add(id);
            }
        }
        return removed;
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(operation, e);
        }
    }

    private Receiver toReceiver(String raw) {
        try {
            return objectMapper.readValue(raw, StoredReceiver.class).toReceiver();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted receiver record in Redis: " + raw, e);
        }
    }

    private CapturedEvent toEvent(String raw) {
        try {
            return objectMapper.readValue(raw, CapturedEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted event in Redis: " + raw, e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static String receiverKey(ReceiverId id) {
        return RECEIVER_KEY_PREFIX + id.value();
    }

    private static String eventsKey(ReceiverId id) {
        return EVENTS_KEY_PREFIX + id.value();
    }

    /**
     * Wire shape of the receiver record; times are epoch millis.
     */
    public record StoredReceiver(String id, long createdAt, long expiresAt) {

        static StoredReceiver from(Receiver receiver) {
            return new StoredReceiver(
                receiver.id().value(),
                receiver.createdAt().toEpochMilli(),
                receiver.expiresAt().toEpochMilli());
        }

        Receiver toReceiver() {
            return new Receiver(
                ReceiverId.fromTrusted(id),
                Instant.ofEpochMilli(createdAt),
                Instant.ofEpochMilli(expiresAt));
        }
    }
}
