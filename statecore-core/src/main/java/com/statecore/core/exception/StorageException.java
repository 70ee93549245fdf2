package com.statecore.core.exception;

/**
 * Thrown when the backing store is unavailable or a commit outcome is unknown.
 *
 * When {@link #isOutcomeUnknown()} is true the commit may or may not have been
 * applied; callers must re-read state before deciding to retry.
 */
public class StorageException extends StateCoreException {

    public static final String ERROR_CODE = "STORAGE_ERROR";

    private final boolean outcomeUnknown;

    public StorageException(String message, Throwable cause, boolean outcomeUnknown) {
        super(ERROR_CODE, message, cause);
        this.outcomeUnknown = outcomeUnknown;
    }

    public StorageException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public boolean isOutcomeUnknown() {
        return outcomeUnknown;
    }
}
