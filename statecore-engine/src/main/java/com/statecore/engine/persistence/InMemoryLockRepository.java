package com.statecore.engine.persistence;

import com.statecore.core.model.LockLease;
import com.statecore.core.repository.LockRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of LockRepository.
 * Lock state lives only in this process.
 */
public class InMemoryLockRepository implements LockRepository {

    private final Map<String, LockLease> leases = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> fenceTokens = new ConcurrentHashMap<>();

    @Override
    public Optional<LockLease> tryAcquire(String lockKey, UUID holderId, String holderName,
                                          Duration leaseDuration, Instant now) {
        synchronized (leases) {
            LockLease existing = leases.get(lockKey);
            if (existing != null && !existing.canBeAcquiredBy(holderId, now)) {
                // Lease still held by someone else
                return Optional.empty();
            }

            if (existing != null && existing.isHeldBy(holderId) && existing.isValidAt(now)) {
                // Re-entrant acquisition keeps the fence token
                LockLease renewed = existing.renew(now);
                leases.put(lockKey, renewed);
                return Optional.of(renewed);
            }

            long fenceToken = fenceTokens
                .computeIfAbsent(lockKey, k -> new AtomicLong(0))
                .incrementAndGet();
            LockLease lease = new LockLease(
                lockKey,
                holderId,
                holderName,
                now,
                now.plus(leaseDuration),
                leaseDuration,
                0,
                fenceToken
            );
            leases.put(lockKey, lease);
            return Optional.of(lease);
        }
    }

    @Override
    public boolean renew(String lockKey, UUID holderId, Instant newExpiresAt, Instant now) {
        synchronized (leases) {
            LockLease existing = leases.get(lockKey);
            if (existing == null || !existing.isHeldBy(holderId)) {
                return false;
            }

            if (existing.isExpiredAt(now)) {
                // Lease already expired
                return false;
            }

            LockLease renewed = new LockLease(
                existing.lockKey(),
                existing.holderId(),
                existing.holderName(),
                existing.acquiredAt(),
                newExpiresAt,
                existing.leaseDuration(),
                existing.renewalCount() + 1,
                existing.fenceToken()
            );
            leases.put(lockKey, renewed);
            return true;
        }
    }

    @Override
    public boolean release(String lockKey, UUID holderId) {
        synchronized (leases) {
            LockLease existing = leases.get(lockKey);
            if (existing == null || !existing.isHeldBy(holderId)) {
                return false;
            }
            leases.remove(lockKey);
            return true;
        }
    }

    @Override
    public boolean isHeld(String lockKey, UUID holderId, long fenceToken, Instant now) {
        LockLease existing = leases.get(lockKey);
        return existing != null
            && existing.isHeldBy(holderId)
            && existing.fenceToken() == fenceToken
            && existing.isValidAt(now);
    }

    @Override
    public Optional<LockLease> findByKey(String lockKey) {
        return Optional.ofNullable(leases.get(lockKey));
    }

    @Override
    public List<LockLease> findByHolder(UUID holderId) {
        return leases.values().stream()
            .filter(l -> l.isHeldBy(holderId))
            .collect(Collectors.toList());
    }

    @Override
    public int countActive(Instant now) {
        return (int) leases.values().stream()
            .filter(l -> l.isValidAt(now))
            .count();
    }

    @Override
    public int deleteExpiredBefore(Instant expiredBefore) {
        synchronized (leases) {
            List<String> toRemove = leases.entrySet().stream()
                .filter(e -> e.getValue().expiresAt().isBefore(expiredBefore))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());

            toRemove.forEach(leases::remove);
            return toRemove.size();
        }
    }
}
