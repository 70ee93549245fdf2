package com.statecore.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable state of one entity at one committed version.
 *
 * Primary Key: (entityType, entityId, version)
 *
 * Invariants:
 * - version starts at 1 and is gapless per entity
 * - committedAt is assigned by the transaction manager, never by callers
 * - the payload is copied on the way in and on the way out, so neither the
 *   writer nor any reader can change a stored version
 */
public record EntitySnapshot(
    EntityType entityType,
    String entityId,
    long version,
    ObjectNode payload,
    Instant committedAt,
    String actor,
    StateEventType eventType,
    String checksum,
    int sizeBytes
) {
    public static final String STATUS_FIELD = "status";
    public static final String DELETED_STATUS = "deleted";

    public EntitySnapshot {
        Objects.requireNonNull(payload, "payload");
        payload = payload.deepCopy();
    }

    /**
     * Copy of the payload. Mutating it does not affect this snapshot.
     */
    @Override
    public ObjectNode payload() {
        return payload.deepCopy();
    }

    public EntityKey key() {
        return new EntityKey(entityType, entityId);
    }

    /**
     * Deep copy of the payload, safe to hand to a mutator.
     */
    public ObjectNode payloadCopy() {
        return payload.deepCopy();
    }

    /**
     * Check if the entity has been soft-deleted at this version.
     */
    public boolean isDeleted() {
        JsonNode status = payload.get(STATUS_FIELD);
        return status != null && DELETED_STATUS.equals(status.asText());
    }

    /**
     * Text value of a top-level payload field, or null.
     */
    public String field(String name) {
        JsonNode node = payload.get(name);
        return node == null || node.isNull() ? null : node.asText();
    }

    public VersionInfo versionInfo() {
        return new VersionInfo(version, committedAt, actor, eventType, checksum, sizeBytes);
    }
}
