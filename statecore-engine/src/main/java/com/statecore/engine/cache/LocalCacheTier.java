package com.statecore.engine.cache;

import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Process-local L1 cache with a TTL and least-recently-used eviction at a size bound.
 */
public class LocalCacheTier implements CacheTier {

    public static final String NAME = "l1";

    private final Clock clock;
    private final Duration ttl;
    private final int maxSize;
    private final LinkedHashMap<EntityKey, CacheEntry> entries;

    public LocalCacheTier(Clock clock, Duration ttl, int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1");
        }
        this.clock = clock;
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<EntityKey, CacheEntry> eldest) {
                return size() > LocalCacheTier.this.maxSize;
            }
        };
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public synchronized Optional<CacheEntry> get(EntityKey key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.instant())) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public synchronized void put(EntitySnapshot snapshot) {
        Instant now = clock.instant();
        entries.put(snapshot.key(), new CacheEntry(snapshot, now, now.plus(ttl)));
    }

    @Override
    public synchronized void evict(EntityKey key) {
        entries.remove(key);
    }

    @Override
    public synchronized Set<EntityKey> keys() {
        return Set.copyOf(entries.keySet());
    }

    @Override
    public synchronized void clear() {
        entries.clear();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    public synchronized int size() {
        return entries.size();
    }

    public int maxSize() {
        return maxSize;
    }
}
