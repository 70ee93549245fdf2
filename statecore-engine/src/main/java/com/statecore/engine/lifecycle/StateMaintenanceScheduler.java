package com.statecore.engine.lifecycle;

import com.statecore.engine.cache.CacheManager;
import com.statecore.engine.cache.ReconciliationReport;
import com.statecore.engine.concurrency.ConcurrencyController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

/**
 * Periodic background work: cache reconciliation and purging of expired lock rows.
 */
public class StateMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(StateMaintenanceScheduler.class);

    private final CacheManager cacheManager;
    private final ConcurrencyController concurrencyController;
    private final Duration lockRetention;

    public StateMaintenanceScheduler(CacheManager cacheManager,
                                     ConcurrencyController concurrencyController,
                                     Duration lockRetention) {
        this.cacheManager = cacheManager;
        this.concurrencyController = concurrencyController;
        this.lockRetention = lockRetention;
    }

    /**
     * Evict cache entries whose version tag no longer matches the store.
     * Bounds staleness left by L2 evictions that failed during an outage.
     */
    @Scheduled(
        initialDelayString = "${statecore.maintenance.reconcile-interval-ms:30000}",
        fixedDelayString = "${statecore.maintenance.reconcile-interval-ms:30000}")
    public void reconcileCache() {
        try {
            ReconciliationReport report = cacheManager.reconcile();
            log.debug("Cache reconciliation checked {} L1 and {} L2 entries",
                report.l1Checked(), report.l2Checked());
        } catch (RuntimeException e) {
            log.error("Cache reconciliation failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Delete lock rows that expired longer ago than the retention window.
     */
    @Scheduled(
        initialDelayString = "${statecore.maintenance.lock-purge-interval-ms:300000}",
        fixedDelayString = "${statecore.maintenance.lock-purge-interval-ms:300000}")
    public void purgeExpiredLocks() {
        try {
            int purged = concurrencyController.purgeExpired(lockRetention);
            if (purged > 0) {
                log.info("Purged {} expired locks", purged);
            }
        } catch (RuntimeException e) {
            log.error("Expired lock purge failed: {}", e.getMessage(), e);
        }
    }
}
