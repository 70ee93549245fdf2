package com.statecore.core.exception;

import com.statecore.core.model.EntityKey;

/**
 * Thrown when a snapshot write would break the gapless version sequence.
 * Indicates a bug: only the transaction manager writes versions, in order.
 */
public class VersionConflictException extends StateCoreException {

    public static final String ERROR_CODE = "VERSION_CONFLICT";

    public VersionConflictException(EntityKey key, long currentVersion, long attemptedVersion) {
        super(ERROR_CODE, String.format(
            "Non-sequential version write on %s: current version %d, attempted %d",
            key, currentVersion, attemptedVersion
        ));
    }

    public VersionConflictException(String message) {
        super(ERROR_CODE, message);
    }
}
