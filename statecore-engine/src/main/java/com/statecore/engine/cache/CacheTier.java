package com.statecore.engine.cache;

import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;

import java.util.Optional;
import java.util.Set;

/**
 * One level of the read-through cache.
 * Implementations may throw on infrastructure failure; {@link CacheManager} treats that as a miss.
 */
public interface CacheTier {

    /**
     * Short name used in logs and metric tags.
     */
    String name();

    /**
     * Get an unexpired entry.
     */
    Optional<CacheEntry> get(EntityKey key);

    /**
     * Store a snapshot under the tier's own TTL.
     */
    void put(EntitySnapshot snapshot);

    void evict(EntityKey key);

    /**
     * Keys currently held, for reconciliation sweeps.
     */
    Set<EntityKey> keys();

    void clear();

    boolean isAvailable();
}
