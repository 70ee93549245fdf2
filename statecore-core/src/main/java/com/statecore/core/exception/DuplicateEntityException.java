package com.statecore.core.exception;

import com.statecore.core.model.EntityType;

/**
 * Thrown when creating an entity whose id is already taken.
 */
public class DuplicateEntityException extends StateCoreException {

    public static final String ERROR_CODE = "DUPLICATE_ENTITY";

    private final long existingVersion;

    public DuplicateEntityException(EntityType entityType, String entityId, long existingVersion) {
        super(ERROR_CODE, String.format(
            "%s already exists: %s (version %d)",
            entityType.code(), entityId, existingVersion
        ));
        this.existingVersion = existingVersion;
    }

    public long getExistingVersion() {
        return existingVersion;
    }
}
