package com.statecore.core.repository;

import com.statecore.core.model.LockLease;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for exclusive lock leases.
 * A lease is granted to at most one holder at a time; expired leases can be taken over.
 */
public interface LockRepository {

    /**
     * Try to acquire a lock without waiting.
     * Succeeds if the key is free, expired, or already held by the same holder.
     *
     * @return The granted lease, with its fence token, or empty if held by someone else
     */
    Optional<LockLease> tryAcquire(String lockKey, UUID holderId, String holderName,
                                   Duration leaseDuration, Instant now);

    /**
     * Extend an unexpired lease.
     *
     * @return true if renewal succeeded, false if the lease was lost
     */
    boolean renew(String lockKey, UUID holderId, Instant newExpiresAt, Instant now);

    /**
     * Release a lease.
     *
     * @return true if the holder still owned the lease
     */
    boolean release(String lockKey, UUID holderId);

    /**
     * Check that a holder still owns an unexpired lease with the given fence token.
     */
    boolean isHeld(String lockKey, UUID holderId, long fenceToken, Instant now);

    /**
     * Find a lease by key.
     */
    Optional<LockLease> findByKey(String lockKey);

    /**
     * Find all leases held by a holder.
     */
    List<LockLease> findByHolder(UUID holderId);

    /**
     * Count unexpired leases.
     */
    int countActive(Instant now);

    /**
     * Delete leases that expired before the given time.
     *
     * @return Number of deleted leases
     */
    int deleteExpiredBefore(Instant expiredBefore);
}
