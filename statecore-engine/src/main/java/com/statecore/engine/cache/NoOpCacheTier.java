package com.statecore.engine.cache;

import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;

import java.util.Optional;
import java.util.Set;

/**
 * L2 tier used when the shared cache is disabled.
 */
public class NoOpCacheTier implements CacheTier {

    public static final String NAME = "none";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<CacheEntry> get(EntityKey key) {
        return Optional.empty();
    }

    @Override
    public void put(EntitySnapshot snapshot) {
    }

    @Override
    public void evict(EntityKey key) {
    }

    @Override
    public Set<EntityKey> keys() {
        return Set.of();
    }

    @Override
    public void clear() {
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
