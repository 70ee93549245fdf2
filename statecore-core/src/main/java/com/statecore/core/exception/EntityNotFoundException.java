package com.statecore.core.exception;

import com.statecore.core.model.EntityType;
import java.time.Instant;

/**
 * Thrown when an entity, or the requested version of it, does not exist.
 */
public class EntityNotFoundException extends StateCoreException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public EntityNotFoundException(EntityType entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType.code(), entityId
        ));
    }

    public EntityNotFoundException(EntityType entityType, String entityId, long version) {
        super(ERROR_CODE, String.format(
            "%s[%s] has no version %d",
            entityType.code(), entityId, version
        ));
    }

    public EntityNotFoundException(EntityType entityType, String entityId, Instant atTime) {
        super(ERROR_CODE, String.format(
            "%s[%s] has no version committed at or before %s",
            entityType.code(), entityId, atTime
        ));
    }
}
