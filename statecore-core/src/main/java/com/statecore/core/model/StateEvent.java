package com.statecore.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one committed mutation.
 * Append-only; the payload at version N is the fold of events 1..N.
 *
 * Primary Key: eventId
 * Unique: (entityType, entityId, version)
 *
 * Invariants:
 * - exactly one event per committed version
 * - events are never deleted or modified; delta and metadata are copied
 *   on construction and on access
 */
public record StateEvent(
    UUID eventId,
    UUID transactionId,

    EntityType entityType,
    String entityId,
    long version,

    StateEventType eventType,
    ObjectNode delta,
    ObjectNode metadata,

    String actor,
    Instant committedAt
) {
    public StateEvent {
        delta = copyOf(delta);
        metadata = copyOf(metadata);
    }

    @Override
    public ObjectNode delta() {
        return copyOf(delta);
    }

    @Override
    public ObjectNode metadata() {
        return copyOf(metadata);
    }

    private static ObjectNode copyOf(ObjectNode node) {
        return node == null ? null : node.deepCopy();
    }

    public EntityKey key() {
        return new EntityKey(entityType, entityId);
    }

    /**
     * Projection published on the outbound event stream.
     */
    public StateChangeNotice toNotice() {
        return new StateChangeNotice(entityType, entityId, version, eventType.wireName(), actor, committedAt);
    }
}
