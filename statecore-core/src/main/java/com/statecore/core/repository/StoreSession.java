package com.statecore.core.repository;

import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.StateEvent;
import java.util.Optional;

/**
 * Write access to the version store and event log inside one atomic unit.
 *
 * All writes made through a session become visible together when the session's
 * work returns normally, and none become visible if it throws.
 * Callers touching several entities must call {@link #lockCurrentVersion}
 * in canonical {@link EntityKey} order.
 */
public interface StoreSession {

    /**
     * Read the current version of an entity and hold it stable until the session ends.
     *
     * @return Current version, 0 if the entity does not exist
     */
    long lockCurrentVersion(EntityKey key);

    /**
     * Read the current snapshot as seen by this session.
     */
    Optional<EntitySnapshot> findLatest(EntityKey key);

    /**
     * Write a new snapshot. Its version must be exactly current + 1.
     *
     * @throws com.statecore.core.exception.VersionConflictException otherwise
     */
    void putVersion(EntitySnapshot snapshot);

    /**
     * Append the event describing a new version.
     *
     * @throws com.statecore.core.exception.VersionConflictException if the version is already logged
     */
    void appendEvent(StateEvent event);
}
