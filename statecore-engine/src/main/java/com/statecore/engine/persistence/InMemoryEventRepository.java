package com.statecore.engine.persistence;

import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntityType;
import com.statecore.core.model.StateEvent;
import com.statecore.core.repository.EventRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;

/**
 * In-memory implementation of EventRepository.
 * Events become visible only when {@link InMemoryStateStore} applies a committed session.
 */
public class InMemoryEventRepository implements EventRepository {

    private final Map<EntityKey, List<StateEvent>> eventsByEntity = new HashMap<>();
    private final Map<UUID, StateEvent> eventsById = new HashMap<>();
    private final Lock readLock;

    InMemoryEventRepository(Lock readLock) {
        this.readLock = readLock;
    }

    @Override
    public List<StateEvent> findByEntity(EntityType entityType, String entityId) {
        readLock.lock();
        try {
            return List.copyOf(eventsByEntity.getOrDefault(EntityKey.of(entityType, entityId), List.of()));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public List<StateEvent> findByEntityUpTo(EntityType entityType, String entityId, long upToVersion) {
        return findByEntity(entityType, entityId).stream()
            .filter(e -> e.version() <= upToVersion)
            .toList();
    }

    @Override
    public List<StateEvent> findByEntityBetween(EntityType entityType, String entityId, Instant from, Instant to) {
        return findByEntity(entityType, entityId).stream()
            .filter(e -> !e.committedAt().isBefore(from) && !e.committedAt().isAfter(to))
            .toList();
    }

    @Override
    public Optional<StateEvent> findById(UUID eventId) {
        readLock.lock();
        try {
            return Optional.ofNullable(eventsById.get(eventId));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Optional<StateEvent> findByVersion(EntityType entityType, String entityId, long version) {
        List<StateEvent> events = findByEntity(entityType, entityId);
        if (version < 1 || version > events.size()) {
            return Optional.empty();
        }
        return Optional.of(events.get((int) version - 1));
    }

    // Caller holds the store's commit lock.
    long lastVersion(EntityKey key) {
        List<StateEvent> events = eventsByEntity.get(key);
        return events == null ? 0L : events.size();
    }

    // Caller holds the store's write lock; versions were validated by the session.
    void applyAll(Collection<StateEvent> events) {
        for (StateEvent event : events) {
            eventsByEntity.computeIfAbsent(event.key(), k -> new ArrayList<>()).add(event);
            eventsById.put(event.eventId(), event);
        }
    }
}
