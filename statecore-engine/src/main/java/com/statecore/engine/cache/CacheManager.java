package com.statecore.engine.cache;

import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.EntityType;
import com.statecore.core.repository.VersionRepository;
import com.statecore.engine.metrics.StateMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Two-tier read-through cache in front of the version store.
 *
 * Read path: L1 (process-local), then L2 (shared), then the version store,
 * populating the tiers on the way back. Every commit raises a per-key version
 * floor before evicting; entries below the floor are never served, and a
 * populate that lands after an invalidation removes itself. L2 failures are
 * treated as misses. Entries left stale by a missed L2 eviction are removed
 * by {@link #reconcile()}.
 */
public class CacheManager {

    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);

    private final CacheTier localTier;
    private final CacheTier sharedTier;
    private final VersionRepository versionRepository;
    private final CacheDependencyTable dependencies;
    private final StateMetrics metrics;

    private final ConcurrentHashMap<EntityKey, Long> versionFloors = new ConcurrentHashMap<>();
    private final AtomicBoolean sharedTierDegraded = new AtomicBoolean(false);

    public CacheManager(CacheTier localTier,
                        CacheTier sharedTier,
                        VersionRepository versionRepository,
                        CacheDependencyTable dependencies,
                        StateMetrics metrics) {
        this.localTier = localTier;
        this.sharedTier = sharedTier;
        this.versionRepository = versionRepository;
        this.dependencies = dependencies;
        this.metrics = metrics;
    }

    // ========== Reads ==========

    public Optional<EntitySnapshot> read(EntityType entityType, String entityId) {
        return read(EntityKey.of(entityType, entityId));
    }

    public Optional<EntitySnapshot> read(EntityKey key) {
        long floor = floor(key);

        Optional<CacheEntry> local = localTier.get(key);
        if (local.isPresent()) {
            if (local.get().version() >= floor) {
                metrics.cacheHit(localTier.name());
                return Optional.of(local.get().snapshot());
            }
            localTier.evict(key);
        }
        metrics.cacheMiss(localTier.name());

        Optional<CacheEntry> shared = guarded("get", () -> sharedTier.get(key)).flatMap(e -> e);
        if (shared.isPresent()) {
            if (shared.get().version() >= floor) {
                metrics.cacheHit(sharedTier.name());
                EntitySnapshot snapshot = shared.get().snapshot();
                populate(localTier, snapshot);
                return Optional.of(snapshot);
            }
            guarded("evict", () -> {
                sharedTier.evict(key);
                return null;
            });
        }
        metrics.cacheMiss(sharedTier.name());

        Optional<EntitySnapshot> stored = versionRepository.findLatest(key.entityType(), key.entityId());
        stored.ifPresent(snapshot -> {
            guarded("put", () -> {
                populate(sharedTier, snapshot);
                return null;
            });
            populate(localTier, snapshot);
        });
        return stored;
    }

    private void populate(CacheTier tier, EntitySnapshot snapshot) {
        tier.put(snapshot);
        // Put-then-check: an invalidation racing this put either sees the entry or raised the floor first
        if (snapshot.version() < floor(snapshot.key())) {
            tier.evict(snapshot.key());
        }
    }

    // ========== Invalidation ==========

    /**
     * Invalidate keys written by a commit, and the keys that depend on them.
     * Called after the commit is durable.
     */
    public void invalidateCommitted(Collection<CommittedChange> changes) {
        Set<EntityKey> evicted = new TreeSet<>();
        for (CommittedChange change : changes) {
            versionFloors.merge(change.key(), change.version(), Math::max);
            evicted.add(change.key());
            evicted.addAll(dependencies.dependentsOf(
                change.key(), change.previousPayload(), change.snapshot().payload()));
        }
        evicted.forEach(this::evictEverywhere);
        metrics.cacheInvalidated(evicted.size());
        log.debug("Invalidated {} cache keys", evicted.size());
    }

    /**
     * Drop one key from both tiers.
     */
    public void invalidate(EntityKey key) {
        evictEverywhere(key);
        metrics.cacheInvalidated(1);
    }

    private void evictEverywhere(EntityKey key) {
        localTier.evict(key);
        guarded("evict", () -> {
            sharedTier.evict(key);
            return null;
        });
    }

    // ========== Reconciliation ==========

    /**
     * Compare every cached version tag with the store and evict mismatches.
     */
    public ReconciliationReport reconcile() {
        int l1Checked = 0;
        int l1Evicted = 0;
        for (EntityKey key : localTier.keys()) {
            Optional<CacheEntry> entry = localTier.get(key);
            if (entry.isEmpty()) {
                continue;
            }
            l1Checked++;
            if (entry.get().version() != versionRepository.currentVersion(key.entityType(), key.entityId())) {
                localTier.evict(key);
                l1Evicted++;
            }
        }

        int l2Checked = 0;
        int l2Evicted = 0;
        Optional<Set<EntityKey>> sharedKeys = guarded("scan", sharedTier::keys);
        for (EntityKey key : sharedKeys.orElse(Set.of())) {
            Optional<CacheEntry> entry = guarded("get", () -> sharedTier.get(key)).flatMap(e -> e);
            if (entry.isEmpty()) {
                continue;
            }
            l2Checked++;
            if (entry.get().version() != versionRepository.currentVersion(key.entityType(), key.entityId())) {
                guarded("evict", () -> {
                    sharedTier.evict(key);
                    return null;
                });
                l2Evicted++;
            }
        }

        // Floors only guard populates racing an invalidation; keep them for keys still cached locally
        Set<EntityKey> cachedLocally = localTier.keys();
        versionFloors.keySet().removeIf(key -> !cachedLocally.contains(key));

        if (l1Evicted > 0) {
            metrics.reconcileEvicted(localTier.name(), l1Evicted);
        }
        if (l2Evicted > 0) {
            metrics.reconcileEvicted(sharedTier.name(), l2Evicted);
        }
        ReconciliationReport report = new ReconciliationReport(
            l1Checked, l1Evicted, l2Checked, l2Evicted, sharedKeys.isPresent());
        if (report.totalEvicted() > 0) {
            log.info("Cache reconciliation evicted {} stale entries (l1={}, l2={})",
                report.totalEvicted(), l1Evicted, l2Evicted);
        }
        return report;
    }

    /**
     * Drop everything from both tiers.
     */
    public void clear() {
        localTier.clear();
        guarded("clear", () -> {
            sharedTier.clear();
            return null;
        });
    }

    public boolean isSharedTierDegraded() {
        return sharedTierDegraded.get();
    }

    public String sharedTierName() {
        return sharedTier.name();
    }

    public boolean probeSharedTier() {
        boolean available;
        try {
            available = sharedTier.isAvailable();
        } catch (RuntimeException e) {
            available = false;
        }
        if (available && sharedTierDegraded.compareAndSet(true, false)) {
            log.info("Shared cache tier {} recovered", sharedTier.name());
        }
        return available;
    }

    private long floor(EntityKey key) {
        return versionFloors.getOrDefault(key, 0L);
    }

    /**
     * Run an L2 operation, treating any failure as a miss.
     *
     * @return the call's result, or empty if it returned null or failed
     */
    private <T> Optional<T> guarded(String operation, Supplier<T> call) {
        try {
            T value = call.get();
            if (sharedTierDegraded.compareAndSet(true, false)) {
                log.info("Shared cache tier {} recovered", sharedTier.name());
            }
            return Optional.ofNullable(value);
        } catch (RuntimeException e) {
            metrics.cacheError(sharedTier.name());
            if (sharedTierDegraded.compareAndSet(false, true)) {
                log.warn("Shared cache tier {} failed on {}; bypassing it: {}",
                    sharedTier.name(), operation, e.getMessage());
            } else {
                log.debug("Shared cache tier {} still failing on {}: {}",
                    sharedTier.name(), operation, e.getMessage());
            }
            return Optional.empty();
        }
    }
}
