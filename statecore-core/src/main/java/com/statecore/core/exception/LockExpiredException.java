package com.statecore.core.exception;

/**
 * Raised when a transaction's lock lease lapsed before commit. The transaction must abort.
 */
public class LockExpiredException extends StateCoreException {

    public static final String ERROR_CODE = "LOCK_EXPIRED";

    private final String lockKey;

    public LockExpiredException(String lockKey) {
        super(ERROR_CODE, String.format(
            "Lock '%s' is no longer held by this transaction",
            lockKey
        ));
        this.lockKey = lockKey;
    }

    public String getLockKey() {
        return lockKey;
    }
}
