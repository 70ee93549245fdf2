package com.statecore.engine.metrics;

import io.micrometer.core.instrument.*;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer metrics for the state core.
 *
 * Metrics exposed:
 * - Commit outcomes and latency by access mode
 * - Lock acquisitions, wait time and timeouts
 * - Cache hits, misses, tier errors, invalidations and reconciliation evictions
 * - Rollbacks by entity type
 */
public class StateMetrics {

    // Metric names
    public static final String TRANSACTIONS_ACTIVE = "statecore.transactions.active";
    public static final String COMMITS = "statecore.commits";
    public static final String COMMIT_DURATION = "statecore.commit.duration";
    public static final String COMMITTED_ENTITIES = "statecore.commit.entities";

    public static final String LOCK_ACQUISITIONS = "statecore.lock.acquisitions";
    public static final String LOCK_WAIT = "statecore.lock.wait";
    public static final String LOCK_TIMEOUTS = "statecore.lock.timeouts";
    public static final String LOCKS_ACTIVE = "statecore.locks.active";

    public static final String CACHE_REQUESTS = "statecore.cache.requests";
    public static final String CACHE_ERRORS = "statecore.cache.errors";
    public static final String CACHE_INVALIDATIONS = "statecore.cache.invalidations";
    public static final String CACHE_RECONCILE_EVICTIONS = "statecore.cache.reconcile.evictions";

    public static final String ROLLBACKS = "statecore.rollbacks";
    public static final String RETRIES = "statecore.transaction.retries";

    private final MeterRegistry registry;

    public StateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void registerActiveTransactions(Supplier<Number> activeCount) {
        Gauge.builder(TRANSACTIONS_ACTIVE, activeCount)
            .description("Transactions begun but not yet finished")
            .register(registry);
    }

    public void registerActiveLocks(Supplier<Number> activeCount) {
        Gauge.builder(LOCKS_ACTIVE, activeCount)
            .description("Unexpired lock leases")
            .register(registry);
    }

    // ========== Commit Metrics ==========

    public void commitSucceeded(String mode, int entityCount, Duration duration) {
        commitOutcome(mode, "committed");
        Timer.builder(COMMIT_DURATION)
            .tag("mode", mode)
            .description("Commit latency")
            .register(registry)
            .record(duration);
        DistributionSummary.builder(COMMITTED_ENTITIES)
            .tag("mode", mode)
            .description("Entities written per commit")
            .register(registry)
            .record(entityCount);
    }

    public void commitConflicted(String mode) {
        commitOutcome(mode, "conflict");
    }

    public void commitLockExpired(String mode) {
        commitOutcome(mode, "lock_expired");
    }

    public void commitFailed(String mode, String errorCode) {
        Counter.builder(COMMITS)
            .tag("mode", mode)
            .tag("outcome", "failed")
            .tag("error", errorCode)
            .description("Commit attempts by outcome")
            .register(registry)
            .increment();
    }

    public void transactionRetried(String reason) {
        Counter.builder(RETRIES)
            .tag("reason", reason)
            .description("Transactions retried after a retryable outcome")
            .register(registry)
            .increment();
    }

    private void commitOutcome(String mode, String outcome) {
        Counter.builder(COMMITS)
            .tag("mode", mode)
            .tag("outcome", outcome)
            .tag("error", "none")
            .description("Commit attempts by outcome")
            .register(registry)
            .increment();
    }

    // ========== Lock Metrics ==========

    public void lockAcquired(Duration waited) {
        Counter.builder(LOCK_ACQUISITIONS)
            .description("Locks acquired")
            .register(registry)
            .increment();
        Timer.builder(LOCK_WAIT)
            .description("Time spent waiting for locks")
            .register(registry)
            .record(waited);
    }

    public void lockTimedOut() {
        Counter.builder(LOCK_TIMEOUTS)
            .description("Lock acquisitions that hit their deadline")
            .register(registry)
            .increment();
    }

    // ========== Cache Metrics ==========

    public void cacheHit(String tier) {
        cacheRequest(tier, "hit");
    }

    public void cacheMiss(String tier) {
        cacheRequest(tier, "miss");
    }

    public void cacheError(String tier) {
        Counter.builder(CACHE_ERRORS)
            .tag("tier", tier)
            .description("Cache tier operations that failed and were bypassed")
            .register(registry)
            .increment();
    }

    public void cacheInvalidated(int keys) {
        Counter.builder(CACHE_INVALIDATIONS)
            .description("Cache keys invalidated after commits")
            .register(registry)
            .increment(keys);
    }

    public void reconcileEvicted(String tier, int keys) {
        Counter.builder(CACHE_RECONCILE_EVICTIONS)
            .tag("tier", tier)
            .description("Stale cache entries removed by reconciliation")
            .register(registry)
            .increment(keys);
    }

    private void cacheRequest(String tier, String result) {
        Counter.builder(CACHE_REQUESTS)
            .tag("tier", tier)
            .tag("result", result)
            .description("Cache lookups by tier and result")
            .register(registry)
            .increment();
    }

    // ========== Rollback Metrics ==========

    public void rollbackCompleted(String entityType) {
        Counter.builder(ROLLBACKS)
            .tag("entity_type", entityType)
            .description("Rollbacks committed")
            .register(registry)
            .increment();
    }
}
