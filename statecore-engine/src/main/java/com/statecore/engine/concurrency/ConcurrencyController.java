package com.statecore.engine.concurrency;

import com.statecore.core.exception.LockTimeoutException;
import com.statecore.core.model.LockLease;
import com.statecore.core.repository.LockRepository;
import com.statecore.engine.metrics.StateMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Grants exclusive, lease-based locks on logical keys.
 *
 * Keys requested together are acquired in sorted order, and a failed batch
 * releases whatever it took, so two transactions never wait on each other
 * while holding part of the same batch. Waiting is a poll against the lock
 * repository; the deadline uses elapsed wall time while lease timestamps use
 * the injected clock.
 */
public class ConcurrencyController {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyController.class);

    private final LockRepository lockRepository;
    private final Clock clock;
    private final Duration leaseDuration;
    private final Duration pollInterval;
    private final StateMetrics metrics;

    public ConcurrencyController(LockRepository lockRepository,
                                 Clock clock,
                                 Duration leaseDuration,
                                 Duration pollInterval,
                                 StateMetrics metrics) {
        if (leaseDuration.isNegative() || leaseDuration.isZero()) {
            throw new IllegalArgumentException("leaseDuration must be positive");
        }
        this.lockRepository = lockRepository;
        this.clock = clock;
        this.leaseDuration = leaseDuration;
        this.pollInterval = pollInterval;
        this.metrics = metrics;
    }

    /**
     * Acquire every key not yet held by {@code grant}, in canonical order.
     *
     * @param timeout how long to wait for each busy key overall; zero fails fast
     * @throws LockTimeoutException if a key is still held by someone else at the deadline.
     *         Keys acquired by this call are released first; keys held before the call are kept.
     */
    public void acquire(LockGrant grant, Collection<String> lockKeys, Duration timeout) {
        TreeSet<String> wanted = new TreeSet<>(lockKeys);
        wanted.removeIf(grant::holds);
        if (wanted.isEmpty()) {
            return;
        }

        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + timeout.toNanos();
        List<String> acquiredNow = new ArrayList<>();

        for (String lockKey : wanted) {
            LockLease lease = acquireOne(grant, lockKey, timeout, deadlineNanos, acquiredNow);
            grant.put(lease);
            acquiredNow.add(lockKey);
        }

        Duration waited = Duration.ofNanos(System.nanoTime() - startNanos);
        metrics.lockAcquired(waited);
        log.debug("{} acquired {} lock(s) {} after {} ms",
            grant.holderName(), acquiredNow.size(), acquiredNow, waited.toMillis());
    }

    private LockLease acquireOne(LockGrant grant, String lockKey, Duration timeout,
                                 long deadlineNanos, List<String> acquiredNow) {
        while (true) {
            Optional<LockLease> lease = lockRepository.tryAcquire(
                lockKey, grant.holderId(), grant.holderName(), leaseDuration, clock.instant());
            if (lease.isPresent()) {
                return lease.get();
            }

            long remainingNanos = deadlineNanos - System.nanoTime();
            if (remainingNanos <= 0) {
                String holder = lockRepository.findByKey(lockKey)
                    .map(LockLease::holderName)
                    .orElse("unknown");
                releaseKeys(grant, acquiredNow);
                metrics.lockTimedOut();
                log.info("{} timed out waiting for lock {} held by {}", grant.holderName(), lockKey, holder);
                throw new LockTimeoutException(lockKey, timeout, holder);
            }

            try {
                Thread.sleep(Math.max(1, Math.min(jitteredPollMillis(), remainingNanos / 1_000_000)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                releaseKeys(grant, acquiredNow);
                throw new LockTimeoutException(lockKey, timeout, "interrupted");
            }
        }
    }

    /**
     * Find the first lock in the grant that is no longer validly held.
     *
     * @return the lock key of an expired or stolen lease, if any
     */
    public Optional<String> findLostLock(LockGrant grant) {
        Instant now = clock.instant();
        for (String lockKey : grant.lockKeys()) {
            Optional<LockLease> lease = grant.lease(lockKey);
            if (lease.isEmpty() || !lockRepository.isHeld(lockKey, grant.holderId(), lease.get().fenceToken(), now)) {
                return Optional.of(lockKey);
            }
        }
        return Optional.empty();
    }

    /**
     * Extend every lease in the grant by a full lease duration.
     *
     * @return false if any lease had already been lost
     */
    public boolean renew(LockGrant grant) {
        Instant now = clock.instant();
        boolean allRenewed = true;
        for (String lockKey : new ArrayList<>(grant.lockKeys())) {
            Optional<LockLease> lease = grant.lease(lockKey);
            if (lease.isPresent() && lockRepository.renew(lockKey, grant.holderId(), now.plus(leaseDuration), now)) {
                grant.put(lease.get().renew(now));
            } else {
                log.warn("Lease on {} lost before renewal by {}", lockKey, grant.holderName());
                allRenewed = false;
            }
        }
        return allRenewed;
    }

    /**
     * Release every lease in the grant. Leases already lost are skipped.
     * Failures are logged; an unreleased lease frees itself when it expires.
     */
    public void release(LockGrant grant) {
        List<String> keys = new ArrayList<>(grant.lockKeys());
        releaseKeys(grant, keys);
        grant.clear();
    }

    private void releaseKeys(LockGrant grant, List<String> lockKeys) {
        for (String lockKey : lockKeys) {
            try {
                lockRepository.release(lockKey, grant.holderId());
            } catch (RuntimeException e) {
                log.warn("Failed to release lock {} for {}; it will expire: {}",
                    lockKey, grant.holderName(), e.getMessage());
            }
            grant.remove(lockKey);
        }
    }

    public Optional<LockLease> inspect(String lockKey) {
        return lockRepository.findByKey(lockKey)
            .filter(lease -> lease.isValidAt(clock.instant()));
    }

    public int activeLockCount() {
        return lockRepository.countActive(clock.instant());
    }

    public int purgeExpired(Duration gracePeriod) {
        return lockRepository.deleteExpiredBefore(clock.instant().minus(gracePeriod));
    }

    public Duration leaseDuration() {
        return leaseDuration;
    }

    private long jitteredPollMillis() {
        long base = Math.max(1, pollInterval.toMillis());
        return base + ThreadLocalRandom.current().nextLong(base / 2 + 1);
    }
}
