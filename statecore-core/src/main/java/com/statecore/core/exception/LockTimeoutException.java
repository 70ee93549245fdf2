package com.statecore.core.exception;

import java.time.Duration;

/**
 * Thrown when an exclusive lock could not be acquired before its deadline.
 */
public class LockTimeoutException extends StateCoreException {

    public static final String ERROR_CODE = "LOCK_TIMEOUT";

    private final String lockKey;

    public LockTimeoutException(String lockKey, Duration timeout, String currentHolder) {
        super(ERROR_CODE, String.format(
            "Failed to acquire lock '%s' within %d ms: currently held by %s",
            lockKey, timeout.toMillis(), currentHolder
        ));
        this.lockKey = lockKey;
    }

    public String getLockKey() {
        return lockKey;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
