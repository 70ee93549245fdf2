package com.statecore.engine.service;

import com.statecore.core.model.AccessMode;
import com.statecore.engine.transaction.CommitResult;
import com.statecore.engine.transaction.Transaction;

import java.time.Duration;
import java.util.Collection;
import java.util.UUID;

/**
 * Service for multi-entity transactions over the version store and event log.
 */
public interface TransactionService {

    /**
     * Begin a transaction.
     *
     * @param mode  optimistic (version tokens checked at commit) or pessimistic (exclusive locks)
     * @param actor identity recorded on every version and event the transaction writes
     * @return an active transaction handle
     */
    Transaction begin(AccessMode mode, String actor);

    /**
     * Begin a transaction with its own lock acquisition timeout.
     */
    Transaction begin(AccessMode mode, String actor, Duration lockTimeout);

    /**
     * Commit all staged writes atomically.
     *
     * @return Committed, OptimisticConflict or LockExpired; locks are released in every case
     * @throws com.statecore.core.exception.StorageException if the store fails or times out
     * @throws com.statecore.core.exception.TransactionStateException if the handle is not active
     */
    CommitResult commit(Transaction transaction);

    /**
     * Discard staged writes and release locks. Always succeeds; a finished handle is left as is.
     */
    void abort(Transaction transaction);

    /**
     * Transactions begun and not yet finished.
     */
    Collection<Transaction> activeTransactions();

    /**
     * Abort every active transaction.
     *
     * @return Number of transactions aborted
     */
    int abortAll(String reason);

    default int activeTransactionCount() {
        return activeTransactions().size();
    }

    default boolean isActive(UUID transactionId) {
        return activeTransactions().stream().anyMatch(t -> t.id().equals(transactionId));
    }
}
