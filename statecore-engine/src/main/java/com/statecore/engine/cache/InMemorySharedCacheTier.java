package com.statecore.engine.cache;

import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory stand-in for the shared L2 tier, for single-process deployments and tests.
 */
public class InMemorySharedCacheTier implements CacheTier {

    public static final String NAME = "l2";

    private final Map<EntityKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public InMemorySharedCacheTier(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<CacheEntry> get(EntityKey key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public void put(EntitySnapshot snapshot) {
        Instant now = clock.instant();
        entries.put(snapshot.key(), new CacheEntry(snapshot, now, now.plus(ttl)));
    }

    @Override
    public void evict(EntityKey key) {
        entries.remove(key);
    }

    @Override
    public Set<EntityKey> keys() {
        return Set.copyOf(entries.keySet());
    }

    @Override
    public void clear() {
        entries.clear();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
