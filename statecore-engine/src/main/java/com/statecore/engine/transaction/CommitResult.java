package com.statecore.engine.transaction;

import com.statecore.core.exception.LockExpiredException;
import com.statecore.core.exception.OptimisticConflictException;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of a commit that reached the backing store.
 * Storage failures are thrown as exceptions instead.
 */
public sealed interface CommitResult
    permits CommitResult.Committed, CommitResult.OptimisticConflict, CommitResult.LockExpired {

    UUID transactionId();

    default boolean isCommitted() {
        return this instanceof Committed;
    }

    /**
     * Only optimistic conflicts are retried automatically.
     */
    default boolean isRetryable() {
        return this instanceof OptimisticConflict;
    }

    /**
     * Return the committed result or throw the matching exception.
     */
    default Committed orThrow() {
        if (this instanceof Committed committed) {
            return committed;
        }
        if (this instanceof OptimisticConflict conflict) {
            throw new OptimisticConflictException(
                conflict.entityKey(), conflict.expectedVersion(), conflict.actualVersion());
        }
        throw new LockExpiredException(((LockExpired) this).lockKey());
    }

    /**
     * All staged writes were persisted.
     *
     * @param snapshots new versions in canonical key order
     */
    record Committed(UUID transactionId, Instant committedAt, List<EntitySnapshot> snapshots)
        implements CommitResult {

        public Committed {
            snapshots = List.copyOf(snapshots);
        }

        public Optional<EntitySnapshot> snapshot(EntityKey key) {
            return snapshots.stream().filter(s -> s.key().equals(key)).findFirst();
        }

        /**
         * New version of an entity written by this commit, or -1 if it was not written.
         */
        public long version(EntityKey key) {
            return snapshot(key).map(EntitySnapshot::version).orElse(-1L);
        }
    }

    /**
     * An entity read or written by the transaction changed after it was read. Nothing was written.
     */
    record OptimisticConflict(UUID transactionId, EntityKey entityKey, long expectedVersion, long actualVersion)
        implements CommitResult {
    }

    /**
     * A pessimistic lease expired before the commit. Nothing was written.
     */
    record LockExpired(UUID transactionId, String lockKey) implements CommitResult {
    }
}
