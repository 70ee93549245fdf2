package com.statecore.engine.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.EntityType;
import com.statecore.core.model.StateEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Shared L2 tier in Redis. Each entity is one string key holding a JSON document
 * with the Redis TTL set to the tier TTL.
 *
 * Key format: {prefix}{entityType}:{entityId}
 *
 * Errors propagate to {@link CacheManager}, which bypasses the tier.
 */
public class RedisCacheTier implements CacheTier {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheTier.class);

    public static final String NAME = "l2";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;
    private final String keyPrefix;

    public RedisCacheTier(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                          Clock clock, Duration ttl, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ttl = ttl;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<CacheEntry> get(EntityKey key) {
        String json = redisTemplate.opsForValue().get(redisKey(key));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, CachedSnapshot.class).toEntry());
        } catch (JsonProcessingException | RuntimeException e) {
            // Unreadable entries are dropped and refetched from the store
            log.warn("Discarding unreadable L2 entry {}: {}", key, e.getMessage());
            redisTemplate.delete(redisKey(key));
            return Optional.empty();
        }
    }

    @Override
    public void put(EntitySnapshot snapshot) {
        Instant now = clock.instant();
        CachedSnapshot document = CachedSnapshot.of(snapshot, now, now.plus(ttl));
        String json;
        try {
            json = objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cache entry for " + snapshot.key(), e);
        }
        redisTemplate.opsForValue().set(redisKey(snapshot.key()), json, ttl);
    }

    @Override
    public void evict(EntityKey key) {
        redisTemplate.delete(redisKey(key));
    }

    @Override
    public Set<EntityKey> keys() {
        ScanOptions options = ScanOptions.scanOptions().match(keyPrefix + "*").count(500).build();
        Set<EntityKey> keys = redisTemplate.execute((RedisCallback<Set<EntityKey>>) connection -> {
            Set<EntityKey> found = new HashSet<>();
            try (Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
                while (cursor.hasNext()) {
                    String redisKey = new String(cursor.next(), StandardCharsets.UTF_8);
                    parseKey(redisKey).ifPresent(found::add);
                }
            }
            return found;
        });
        return keys != null ? keys : Set.of();
    }

    @Override
    public void clear() {
        Set<EntityKey> keys = keys();
        if (!keys.isEmpty()) {
            redisTemplate.delete(keys.stream().map(this::redisKey).toList());
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (RuntimeException e) {
            log.debug("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    String redisKey(EntityKey key) {
        return keyPrefix + key.lockKey();
    }

    private Optional<EntityKey> parseKey(String redisKey) {
        if (!redisKey.startsWith(keyPrefix)) {
            return Optional.empty();
        }
        try {
            return Optional.of(EntityKey.parse(redisKey.substring(keyPrefix.length())));
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring foreign key {} under cache prefix", redisKey);
            return Optional.empty();
        }
    }

    /**
     * JSON document stored per entity.
     */
    public record CachedSnapshot(
        String entityType,
        String entityId,
        long version,
        ObjectNode payload,
        String committedAt,
        String actor,
        String eventType,
        String checksum,
        int sizeBytes,
        String cachedAt,
        String expiresAt
    ) {
        static CachedSnapshot of(EntitySnapshot snapshot, Instant cachedAt, Instant expiresAt) {
            return new CachedSnapshot(
                snapshot.entityType().code(),
                snapshot.entityId(),
                snapshot.version(),
                snapshot.payload(),
                snapshot.committedAt().toString(),
                snapshot.actor(),
                snapshot.eventType().wireName(),
                snapshot.checksum(),
                snapshot.sizeBytes(),
                cachedAt.toString(),
                expiresAt.toString()
            );
        }

        CacheEntry toEntry() {
            EntitySnapshot snapshot = new EntitySnapshot(
                EntityType.fromCode(entityType),
                entityId,
                version,
                payload,
                Instant.parse(committedAt),
                actor,
                StateEventType.fromWireName(eventType),
                checksum,
                sizeBytes
            );
            return new CacheEntry(snapshot, Instant.parse(cachedAt), Instant.parse(expiresAt));
        }
    }
}
