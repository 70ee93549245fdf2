package com.statecore.engine.health;

import com.statecore.core.repository.StateStore;
import com.statecore.engine.cache.CacheManager;
import com.statecore.engine.concurrency.ConcurrencyController;
import com.statecore.engine.service.TransactionService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for the state core.
 * Reports health status based on:
 * - Backing store reachability (DOWN if unreachable)
 * - Shared cache tier reachability (reported, never DOWN: the cache fails open)
 * - Active transaction and lock counts
 */
public class StateCoreHealthIndicator implements HealthIndicator {

    private final StateStore stateStore;
    private final CacheManager cacheManager;
    private final TransactionService transactionService;
    private final ConcurrencyController concurrencyController;

    public StateCoreHealthIndicator(StateStore stateStore,
                                    CacheManager cacheManager,
                                    TransactionService transactionService,
                                    ConcurrencyController concurrencyController) {
        this.stateStore = stateStore;
        this.cacheManager = cacheManager;
        this.transactionService = transactionService;
        this.concurrencyController = concurrencyController;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try {
            boolean storeHealthy = stateStore.isAvailable();
            details.put("store", storeHealthy ? "connected" : "unreachable");
            if (!storeHealthy) {
                return Health.down()
                    .withDetails(details)
                    .build();
            }

            boolean sharedCacheHealthy = cacheManager.probeSharedTier();
            details.put("sharedCache", cacheManager.sharedTierName());
            details.put("sharedCacheStatus", sharedCacheHealthy ? "connected" : "bypassed");

            details.put("activeTransactions", transactionService.activeTransactionCount());
            details.put("activeLocks", concurrencyController.activeLockCount());

            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
