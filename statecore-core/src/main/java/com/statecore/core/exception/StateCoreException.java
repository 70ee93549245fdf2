package com.statecore.core.exception;

/**
 * Base exception for all state core errors.
 */
public class StateCoreException extends RuntimeException {

    private final String errorCode;

    public StateCoreException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StateCoreException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether a caller may retry automatically (with backoff) after this error.
     */
    public boolean isRetryable() {
        return false;
    }
}
