package com.statecore.core.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Exclusive lock on a logical key, held by one transaction under a liveness lease.
 *
 * Primary Key: lockKey
 *
 * Invariants:
 * - Only one unexpired lease per lockKey
 * - fenceToken increases on every acquisition of the key
 * - An expired lease may be taken over by any requester
 */
public record LockLease(
    // Primary key, commonly {entityType}:{entityId}
    String lockKey,

    // Ownership
    UUID holderId,
    String holderName,

    // Timing
    Instant acquiredAt,
    Instant expiresAt,
    Duration leaseDuration,
    int renewalCount,

    // Fencing
    long fenceToken
) {
    /**
     * Default lease duration: 30 seconds.
     */
    public static final Duration DEFAULT_LEASE_DURATION = Duration.ofSeconds(30);

    /**
     * Create a new lease starting now.
     */
    public static LockLease create(
            String lockKey,
            UUID holderId,
            String holderName,
            Duration duration,
            long fenceToken,
            Clock clock) {
        Instant now = clock.instant();
        return new LockLease(
            lockKey,
            holderId,
            holderName,
            now,
            now.plus(duration),
            duration,
            0,
            fenceToken
        );
    }

    public boolean isValidAt(Instant now) {
        return expiresAt.isAfter(now);
    }

    public boolean isExpiredAt(Instant now) {
        return !isValidAt(now);
    }

    /**
     * Get the remaining time on this lease.
     */
    public Duration remainingTime(Instant now) {
        Duration remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Create a renewed lease with extended expiration.
     */
    public LockLease renew(Instant now) {
        return new LockLease(
            lockKey,
            holderId,
            holderName,
            acquiredAt,
            now.plus(leaseDuration),
            leaseDuration,
            renewalCount + 1,
            fenceToken
        );
    }

    public boolean isHeldBy(UUID holder) {
        return holderId != null && holderId.equals(holder);
    }

    /**
     * A lease can be acquired if it has no holder, is already held by the
     * requester, or has expired.
     */
    public boolean canBeAcquiredBy(UUID requestingHolder, Instant now) {
        if (holderId == null) {
            return true;
        }
        if (holderId.equals(requestingHolder)) {
            return true;
        }
        return isExpiredAt(now);
    }
}
