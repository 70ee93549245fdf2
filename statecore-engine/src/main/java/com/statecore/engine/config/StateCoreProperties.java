package com.statecore.engine.config;

import com.statecore.core.model.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the state core.
 *
 * <pre>
 * statecore:
 *   storage: jdbc
 *   transaction:
 *     lock-timeout: 10s
 *   cache:
 *     l2: redis
 * </pre>
 */
@ConfigurationProperties(prefix = "statecore")
public class StateCoreProperties {

    /**
     * Backing store for versions, events and locks: memory or jdbc.
     */
    private String storage = "memory";

    /**
     * Run db/statecore-schema.sql against the data source at startup (jdbc storage only).
     */
    private boolean initializeSchema = true;

    private TransactionProperties transaction = new TransactionProperties();
    private RetryProperties retry = new RetryProperties();
    private CacheProperties cache = new CacheProperties();
    private EventProperties events = new EventProperties();
    private MaintenanceProperties maintenance = new MaintenanceProperties();

    public String getStorage() {
        return storage;
    }

    public void setStorage(String storage) {
        this.storage = storage;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public TransactionProperties getTransaction() {
        return transaction;
    }

    public void setTransaction(TransactionProperties transaction) {
        this.transaction = transaction;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }

    public CacheProperties getCache() {
        return cache;
    }

    public void setCache(CacheProperties cache) {
        this.cache = cache;
    }

    public EventProperties getEvents() {
        return events;
    }

    public void setEvents(EventProperties events) {
        this.events = events;
    }

    public MaintenanceProperties getMaintenance() {
        return maintenance;
    }

    public void setMaintenance(MaintenanceProperties maintenance) {
        this.maintenance = maintenance;
    }

    /**
     * Timeouts for commits and locks.
     */
    public static class TransactionProperties {

        private Duration commitTimeout = Duration.ofSeconds(5);
        private Duration lockTimeout = Duration.ofSeconds(10);
        private Duration leaseDuration = Duration.ofSeconds(30);
        private Duration lockPollInterval = Duration.ofMillis(25);

        public Duration getCommitTimeout() {
            return commitTimeout;
        }

        public void setCommitTimeout(Duration commitTimeout) {
            this.commitTimeout = commitTimeout;
        }

        public Duration getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
        }

        public Duration getLeaseDuration() {
            return leaseDuration;
        }

        public void setLeaseDuration(Duration leaseDuration) {
            this.leaseDuration = leaseDuration;
        }

        public Duration getLockPollInterval() {
            return lockPollInterval;
        }

        public void setLockPollInterval(Duration lockPollInterval) {
            this.lockPollInterval = lockPollInterval;
        }
    }

    /**
     * Backoff for automatically retried transactions.
     */
    public static class RetryProperties {

        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(50);
        private Duration maxBackoff = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private double jitter = 0.2;

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .initialBackoff(initialBackoff)
                .maxBackoff(maxBackoff)
                .backoffMultiplier(multiplier)
                .jitterFactor(jitter)
                .build();
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    /**
     * Cache tiers and invalidation dependencies.
     */
    public static class CacheProperties {

        private Duration l1Ttl = Duration.ofSeconds(300);
        private int l1MaxSize = 10_000;
        private Duration l2Ttl = Duration.ofSeconds(3600);

        /**
         * Shared tier: memory, redis or none.
         */
        private String l2 = "memory";
        private String keyPrefix = "statecore:cache:";

        /**
         * Rules of the form "source.field->target".
         */
        private List<String> dependencies = new ArrayList<>(List.of(
            "task.workflow_id->workflow",
            "task.assigned_agent->agent",
            "resource.allocated_to->agent"
        ));

        public Duration getL1Ttl() {
            return l1Ttl;
        }

        public void setL1Ttl(Duration l1Ttl) {
            this.l1Ttl = l1Ttl;
        }

        public int getL1MaxSize() {
            return l1MaxSize;
        }

        public void setL1MaxSize(int l1MaxSize) {
            this.l1MaxSize = l1MaxSize;
        }

        public Duration getL2Ttl() {
            return l2Ttl;
        }

        public void setL2Ttl(Duration l2Ttl) {
            this.l2Ttl = l2Ttl;
        }

        public String getL2() {
            return l2;
        }

        public void setL2(String l2) {
            this.l2 = l2;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public List<String> getDependencies() {
            return dependencies;
        }

        public void setDependencies(List<String> dependencies) {
            this.dependencies = dependencies;
        }
    }

    /**
     * Outbound change stream.
     */
    public static class EventProperties {

        private int dispatchThreads = 1;

        public int getDispatchThreads() {
            return dispatchThreads;
        }

        public void setDispatchThreads(int dispatchThreads) {
            this.dispatchThreads = dispatchThreads;
        }
    }

    /**
     * Background jobs and shutdown.
     */
    public static class MaintenanceProperties {

        private long reconcileIntervalMs = 30_000;
        private long lockPurgeIntervalMs = 300_000;
        private Duration lockRetention = Duration.ofHours(1);
        private Duration shutdownDrainTimeout = Duration.ofSeconds(30);

        public long getReconcileIntervalMs() {
            return reconcileIntervalMs;
        }

        public void setReconcileIntervalMs(long reconcileIntervalMs) {
            this.reconcileIntervalMs = reconcileIntervalMs;
        }

        public long getLockPurgeIntervalMs() {
            return lockPurgeIntervalMs;
        }

        public void setLockPurgeIntervalMs(long lockPurgeIntervalMs) {
            this.lockPurgeIntervalMs = lockPurgeIntervalMs;
        }

        public Duration getLockRetention() {
            return lockRetention;
        }

        public void setLockRetention(Duration lockRetention) {
            this.lockRetention = lockRetention;
        }

        public Duration getShutdownDrainTimeout() {
            return shutdownDrainTimeout;
        }

        public void setShutdownDrainTimeout(Duration shutdownDrainTimeout) {
            this.shutdownDrainTimeout = shutdownDrainTimeout;
        }
    }
}
