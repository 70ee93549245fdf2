package com.statecore.core.repository;

import com.statecore.core.model.EntityType;
import com.statecore.core.model.StateEvent;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for the append-only event log.
 * Events are ordered by version within each entity and never change once written.
 * Appends happen only through a {@link StoreSession}.
 */
public interface EventRepository {

    /**
     * Get all events for an entity in version order.
     */
    List<StateEvent> findByEntity(EntityType entityType, String entityId);

    /**
     * Get events for an entity with version at most {@code upToVersion}, in version order.
     */
    List<StateEvent> findByEntityUpTo(EntityType entityType, String entityId, long upToVersion);

    /**
     * Get events for an entity committed within [from, to], in version order.
     */
    List<StateEvent> findByEntityBetween(EntityType entityType, String entityId, Instant from, Instant to);

    /**
     * Find an event by ID.
     */
    Optional<StateEvent> findById(UUID eventId);

    /**
     * Find the event that produced a given version.
     */
    Optional<StateEvent> findByVersion(EntityType entityType, String entityId, long version);
}
