package com.statecore.engine.persistence;

import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.EntityType;
import com.statecore.core.model.VersionInfo;
import com.statecore.core.repository.VersionRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * In-memory implementation of VersionRepository.
 * Snapshots become visible only when {@link InMemoryStateStore} applies a committed session.
 */
public class InMemoryVersionRepository implements VersionRepository {

    private final Map<EntityKey, List<EntitySnapshot>> versions = new HashMap<>();
    private final Lock readLock;

    InMemoryVersionRepository(Lock readLock) {
        this.readLock = readLock;
    }

    @Override
    public Optional<EntitySnapshot> findLatest(EntityType entityType, String entityId) {
        readLock.lock();
        try {
            return Optional.ofNullable(latest(EntityKey.of(entityType, entityId)));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Optional<EntitySnapshot> findVersion(EntityType entityType, String entityId, long version) {
        readLock.lock();
        try {
            List<EntitySnapshot> history = versions.get(EntityKey.of(entityType, entityId));
            if (history == null || version < 1 || version > history.size()) {
                return Optional.empty();
            }
            return Optional.of(history.get((int) version - 1));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Optional<EntitySnapshot> findAtTime(EntityType entityType, String entityId, Instant atTime) {
        readLock.lock();
        try {
            List<EntitySnapshot> history = versions.getOrDefault(EntityKey.of(entityType, entityId), List.of());
            for (int i = history.size() - 1; i >= 0; i--) {
                EntitySnapshot snapshot = history.get(i);
                if (!snapshot.committedAt().isAfter(atTime)) {
                    return Optional.of(snapshot);
                }
            }
            return Optional.empty();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public long currentVersion(EntityType entityType, String entityId) {
        readLock.lock();
        try {
            return currentVersion(EntityKey.of(entityType, entityId));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public List<VersionInfo> listVersions(EntityType entityType, String entityId) {
        readLock.lock();
        try {
            return versions.getOrDefault(EntityKey.of(entityType, entityId), List.of()).stream()
                .map(EntitySnapshot::versionInfo)
                .toList();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public List<EntitySnapshot> listLatest(EntityType entityType, int limit, int offset, boolean includeDeleted) {
        readLock.lock();
        try {
            return versions.entrySet().stream()
                .filter(e -> e.getKey().entityType() == entityType)
                .map(e -> e.getValue().get(e.getValue().size() - 1))
                .filter(s -> includeDeleted || !s.isDeleted())
                .sorted(Comparator.comparing(EntitySnapshot::entityId))
                .skip(offset)
                .limit(limit)
                .toList();
        } finally {
            readLock.unlock();
        }
    }

    // Caller holds the store's write lock or commit lock.
    long currentVersion(EntityKey key) {
        List<EntitySnapshot> history = versions.get(key);
        return history == null ? 0L : history.size();
    }

    EntitySnapshot latest(EntityKey key) {
        List<EntitySnapshot> history = versions.get(key);
        return history == null || history.isEmpty() ? null : history.get(history.size() - 1);
    }

    // Caller holds the store's write lock; versions were validated by the session.
    void applyAll(Collection<EntitySnapshot> snapshots) {
        for (EntitySnapshot snapshot : snapshots) {
            versions.computeIfAbsent(snapshot.key(), k -> new ArrayList<>()).add(snapshot);
        }
    }
}
