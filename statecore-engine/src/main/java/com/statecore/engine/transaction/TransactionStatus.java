package com.statecore.engine.transaction;

/**
 * Lifecycle of a transaction handle.
 *
 * ACTIVE -> COMMITTING -> COMMITTED | FAILED
 * ACTIVE -> ABORTED
 */
public enum TransactionStatus {
    ACTIVE,
    COMMITTING,
    COMMITTED,
    ABORTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ABORTED || this == FAILED;
    }
}
