package com.statecore.core.exception;

import com.statecore.core.model.EntityKey;

/**
 * Raised from an optimistic conflict result when the caller asks for exception semantics.
 */
public class OptimisticConflictException extends StateCoreException {

    public static final String ERROR_CODE = "OPTIMISTIC_CONFLICT";

    private final EntityKey entityKey;
    private final long expectedVersion;
    private final long actualVersion;

    public OptimisticConflictException(EntityKey entityKey, long expectedVersion, long actualVersion) {
        super(ERROR_CODE, String.format(
            "Optimistic conflict on %s: expected version %d, actual version %d",
            entityKey, expectedVersion, actualVersion
        ));
        this.entityKey = entityKey;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public EntityKey getEntityKey() {
        return entityKey;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
