package com.statecore.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a tracked entity: (entityType, entityId).
 *
 * Natural ordering is lexicographic on the lock key, which is the canonical
 * order used whenever several entities are locked or row-locked together.
 */
public record EntityKey(EntityType entityType, String entityId) implements Comparable<EntityKey> {

    private static final Comparator<EntityKey> CANONICAL =
        Comparator.comparing(EntityKey::lockKey);

    public EntityKey {
        Objects.requireNonNull(entityType, "entityType");
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId must not be blank");
        }
    }

    public static EntityKey of(EntityType entityType, String entityId) {
        return new EntityKey(entityType, entityId);
    }

    /**
     * Parse a key of the form {@code type:id}. The id may itself contain colons.
     */
    public static EntityKey parse(String lockKey) {
        int separator = lockKey == null ? -1 : lockKey.indexOf(':');
        if (separator <= 0 || separator == lockKey.length() - 1) {
            throw new IllegalArgumentException("Malformed entity key: " + lockKey);
        }
        return new EntityKey(
            EntityType.fromCode(lockKey.substring(0, separator)),
            lockKey.substring(separator + 1)
        );
    }

    /**
     * Logical lock key, {@code task:T1}.
     */
    public String lockKey() {
        return entityType.code() + ":" + entityId;
    }

    @Override
    public int compareTo(EntityKey other) {
        return CANONICAL.compare(this, other);
    }

    @Override
    public String toString() {
        return lockKey();
    }
}
