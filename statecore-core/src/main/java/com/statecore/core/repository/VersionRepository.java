package com.statecore.core.repository;

import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.EntityType;
import com.statecore.core.model.VersionInfo;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for entity snapshots, keyed by (entityType, entityId, version),
 * with a current-version index per entity.
 *
 * Read methods may be called by anyone. Writes happen only through a
 * {@link StoreSession} opened by the transaction manager.
 */
public interface VersionRepository {

    /**
     * Get the highest committed version of an entity.
     *
     * @return The current snapshot if the entity exists
     */
    Optional<EntitySnapshot> findLatest(EntityType entityType, String entityId);

    /**
     * Get a specific version of an entity.
     */
    Optional<EntitySnapshot> findVersion(EntityType entityType, String entityId, long version);

    /**
     * Get the snapshot whose commit time is the greatest value at or before {@code atTime}.
     */
    Optional<EntitySnapshot> findAtTime(EntityType entityType, String entityId, Instant atTime);

    /**
     * Get the current version number of an entity.
     *
     * @return Current version, 0 if the entity has never been written
     */
    long currentVersion(EntityType entityType, String entityId);

    /**
     * List version metadata for an entity, ascending by version.
     */
    List<VersionInfo> listVersions(EntityType entityType, String entityId);

    /**
     * List the current snapshot of each entity of a type, ordered by entity id.
     *
     * @param includeDeleted whether soft-deleted entities are included
     */
    List<EntitySnapshot> listLatest(EntityType entityType, int limit, int offset, boolean includeDeleted);
}
