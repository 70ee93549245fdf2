package com.statecore.core.model;

/**
 * Concurrency mode chosen per transaction.
 */
public enum AccessMode {
    /** Version tokens checked at commit; no lock held between read and commit. */
    OPTIMISTIC,
    /** Exclusive locks held for the whole transaction. */
    PESSIMISTIC
}
