package com.statecore.core.repository;

import java.time.Duration;
import java.util.function.Function;

/**
 * Co-located version store and event log offering all-or-nothing multi-entity writes.
 */
public interface StateStore {

    /**
     * Run {@code work} inside one atomic unit of the backing store.
     *
     * @param work    reads and writes through the session; throwing discards every write
     * @param timeout budget for the whole unit, including the backing store's commit
     * @return the value returned by {@code work}
     * @throws com.statecore.core.exception.StorageException if the store fails or the
     *         commit times out (outcome unknown)
     */
    <T> T executeAtomically(Function<StoreSession, T> work, Duration timeout);

    /**
     * Cheap reachability probe for health checks.
     */
    boolean isAvailable();
}
