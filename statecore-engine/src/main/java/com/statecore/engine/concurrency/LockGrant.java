package com.statecore.engine.concurrency;

import com.statecore.core.model.LockLease;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Set of leases held by one transaction, keyed by lock key in canonical order.
 * Mutated by the owning transaction; an abort from another thread may clear it.
 */
public final class LockGrant {

    private final UUID holderId;
    private final String holderName;
    private final Map<String, LockLease> leases = new TreeMap<>();

    public LockGrant(UUID holderId, String holderName) {
        this.holderId = holderId;
        this.holderName = holderName;
    }

    public UUID holderId() {
        return holderId;
    }

    public String holderName() {
        return holderName;
    }

    public synchronized boolean holds(String lockKey) {
        return leases.containsKey(lockKey);
    }

    public synchronized Optional<LockLease> lease(String lockKey) {
        return Optional.ofNullable(leases.get(lockKey));
    }

    public synchronized Set<String> lockKeys() {
        return Collections.unmodifiableSet(new TreeSet<>(leases.keySet()));
    }

    public synchronized boolean isEmpty() {
        return leases.isEmpty();
    }

    synchronized void put(LockLease lease) {
        leases.put(lease.lockKey(), lease);
    }

    synchronized void remove(String lockKey) {
        leases.remove(lockKey);
    }

    synchronized void clear() {
        leases.clear();
    }
}
