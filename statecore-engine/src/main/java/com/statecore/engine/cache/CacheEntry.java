package com.statecore.engine.cache;

import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;

import java.time.Instant;

/**
 * Cached snapshot tagged with the version it was read at.
 */
public record CacheEntry(EntitySnapshot snapshot, Instant cachedAt, Instant expiresAt) {

    public EntityKey key() {
        return snapshot.key();
    }

    public long version() {
        return snapshot.version();
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
