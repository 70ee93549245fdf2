package com.statecore.engine.transaction;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statecore.core.exception.EntityNotFoundException;
import com.statecore.core.exception.StateCoreException;
import com.statecore.core.exception.TransactionStateException;
import com.statecore.core.fold.PayloadChecksums;
import com.statecore.core.fold.PayloadDelta;
import com.statecore.core.model.AccessMode;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.LockLease;
import com.statecore.core.model.StateEvent;
import com.statecore.core.model.StateEventType;
import com.statecore.core.repository.StateStore;
import com.statecore.core.repository.StoreSession;
import com.statecore.core.repository.VersionRepository;
import com.statecore.engine.cache.CacheManager;
import com.statecore.engine.cache.CommittedChange;
import com.statecore.engine.concurrency.ConcurrencyController;
import com.statecore.engine.events.StateChangeStream;
import com.statecore.engine.logging.LoggingContext;
import com.statecore.engine.metrics.StateMetrics;
import com.statecore.engine.service.TransactionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transaction manager: validates, applies and publishes multi-entity commits.
 *
 * Commit runs validation, payload computation and the event and version writes
 * inside one {@link StateStore} atomic unit, so a failed check for any entity
 * leaves every entity untouched. Cache invalidation, change notices and lock
 * release happen after the unit returns.
 */
public class TransactionCoordinator implements TransactionService {

    private static final Logger log = LoggerFactory.getLogger(TransactionCoordinator.class);

    private final StateStore stateStore;
    private final VersionRepository versionRepository;
    private final ConcurrencyController concurrencyController;
    private final CacheManager cacheManager;
    private final StateChangeStream changeStream;
    private final StateMetrics metrics;
    private final Clock clock;
    private final Duration commitTimeout;
    private final Duration defaultLockTimeout;

    private final Map<UUID, Transaction> activeTransactions = new ConcurrentHashMap<>();

    public TransactionCoordinator(
            StateStore stateStore,
            VersionRepository versionRepository,
            ConcurrencyController concurrencyController,
            CacheManager cacheManager,
            StateChangeStream changeStream,
            StateMetrics metrics,
            Clock clock,
            Duration commitTimeout,
            Duration defaultLockTimeout) {
        this.stateStore = stateStore;
        this.versionRepository = versionRepository;
        this.concurrencyController = concurrencyController;
        this.cacheManager = cacheManager;
        this.changeStream = changeStream;
        this.metrics = metrics;
        this.clock = clock;
        this.commitTimeout = commitTimeout;
        this.defaultLockTimeout = defaultLockTimeout;
        metrics.registerActiveTransactions(activeTransactions::size);
    }

    @Override
    public Transaction begin(AccessMode mode, String actor) {
        return begin(mode, actor, defaultLockTimeout);
    }

    @Override
    public Transaction begin(AccessMode mode, String actor, Duration lockTimeout) {
        Objects.requireNonNull(mode, "mode");
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor must not be blank");
        }
        Transaction transaction = new Transaction(
            UUID.randomUUID(), mode, actor, clock.instant(), lockTimeout, this);
        activeTransactions.put(transaction.id(), transaction);
        log.debug("Began {} transaction {} for {}", mode, transaction.id(), actor);
        return transaction;
    }

    // ========== Handle callbacks ==========

    Optional<EntitySnapshot> read(Transaction transaction, EntityKey key) {
        Optional<EntitySnapshot> snapshot = transaction.mode() == AccessMode.PESSIMISTIC
            ? readBehindCommits(key)
            : versionRepository.findLatest(key.entityType(), key.entityId());
        transaction.recordRead(key, snapshot.map(EntitySnapshot::version).orElse(0L));
        return snapshot;
    }

    /**
     * Read through the store's serialization point. A commit that passed its lease
     * check before the caller's lock was granted finishes first, so the version
     * recorded here is the one the locked commit will validate against.
     */
    private Optional<EntitySnapshot> readBehindCommits(EntityKey key) {
        return stateStore.executeAtomically(session -> {
            session.lockCurrentVersion(key);
            return session.findLatest(key);
        }, commitTimeout);
    }

    void lock(Transaction transaction, Collection<String> lockKeys) {
        concurrencyController.acquire(transaction.lockGrant(), lockKeys, transaction.lockTimeout());
        if (!transaction.isActive()) {
            // Aborted from another thread while waiting
            concurrencyController.release(transaction.lockGrant());
            transaction.ensureActive("lock");
        }
    }

    boolean renewLocks(Transaction transaction) {
        return concurrencyController.renew(transaction.lockGrant());
    }

    // ========== Commit ==========

    @Override
    public CommitResult commit(Transaction transaction) {
        if (!transaction.transition(TransactionStatus.ACTIVE, TransactionStatus.COMMITTING)) {
            throw new TransactionStateException(transaction.id(), transaction.status().name(), "commit");
        }

        long startNanos = System.nanoTime();
        String mode = transaction.mode().name();
        try (LoggingContext ctx = LoggingContext.forTransaction(
                transaction.id(), transaction.mode(), transaction.actor())) {
            try {
                Applied applied = stateStore.executeAtomically(
                    session -> apply(transaction, session), commitTimeout);
                CommitResult result = applied.result();

                if (result instanceof CommitResult.Committed committed) {
                    transaction.transition(TransactionStatus.COMMITTING, TransactionStatus.COMMITTED);
                    afterCommit(applied.changes());
                    metrics.commitSucceeded(mode, committed.snapshots().size(),
                        Duration.ofNanos(System.nanoTime() - startNanos));
                    log.info("Committed {} entities", committed.snapshots().size());
                } else if (result instanceof CommitResult.OptimisticConflict conflict) {
                    transaction.transition(TransactionStatus.COMMITTING, TransactionStatus.ABORTED);
                    metrics.commitConflicted(mode);
                    log.info("Optimistic conflict on {}: expected version {}, found {}",
                        conflict.entityKey(), conflict.expectedVersion(), conflict.actualVersion());
                } else if (result instanceof CommitResult.LockExpired expired) {
                    transaction.transition(TransactionStatus.COMMITTING, TransactionStatus.ABORTED);
                    metrics.commitLockExpired(mode);
                    log.warn("Lock {} expired before commit", expired.lockKey());
                }
                return result;
            } catch (RuntimeException e) {
                transaction.transition(TransactionStatus.COMMITTING, TransactionStatus.FAILED);
                String errorCode = e instanceof StateCoreException sce
                    ? sce.getErrorCode() : e.getClass().getSimpleName();
                metrics.commitFailed(mode, errorCode);
                log.error("Commit failed ({}): {}", errorCode, e.getMessage());
                throw e;
            } finally {
                activeTransactions.remove(transaction.id());
                concurrencyController.release(transaction.lockGrant());
            }
        }
    }

    private Applied apply(Transaction transaction, StoreSession session) {
        Map<EntityKey, StagedWrite> staged = transaction.stagedWrites();
        Map<EntityKey, Long> reads = transaction.readVersions();

        // Row-lock every involved entity in canonical order
        TreeSet<EntityKey> involved = new TreeSet<>(reads.keySet());
        involved.addAll(staged.keySet());
        Map<EntityKey, Long> current = new HashMap<>();
        for (EntityKey key : involved) {
            current.put(key, session.lockCurrentVersion(key));
        }

        if (transaction.mode() == AccessMode.PESSIMISTIC) {
            Optional<String> lost = concurrencyController.findLostLock(transaction.lockGrant());
            if (lost.isPresent()) {
                return Applied.rejected(new CommitResult.LockExpired(transaction.id(), lost.get()));
            }
        }

        for (Map.Entry<EntityKey, Long> read : new TreeMap<>(reads).entrySet()) {
            long actual = current.get(read.getKey());
            if (actual != read.getValue()) {
                return Applied.rejected(new CommitResult.OptimisticConflict(
                    transaction.id(), read.getKey(), read.getValue(), actual));
            }
        }

        if (transaction.mode() == AccessMode.OPTIMISTIC) {
            // Optimistic writers yield to entities locked by pessimistic transactions
            for (EntityKey key : new TreeSet<>(staged.keySet())) {
                Optional<LockLease> lease = concurrencyController.inspect(key.lockKey());
                if (lease.isPresent() && !lease.get().isHeldBy(transaction.id())) {
                    long version = current.get(key);
                    return Applied.rejected(new CommitResult.OptimisticConflict(
                        transaction.id(), key, reads.getOrDefault(key, version), version));
                }
            }
        }

        Instant committedAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
        List<EntitySnapshot> snapshots = new ArrayList<>();
        List<CommittedChange> changes = new ArrayList<>();

        for (EntityKey key : new TreeSet<>(staged.keySet())) {
            StagedWrite write = staged.get(key);
            long currentVersion = current.get(key);
            Optional<EntitySnapshot> previous = session.findLatest(key);

            StateEventType eventType = write.eventType() != null
                ? write.eventType()
                : (currentVersion == 0 ? StateEventType.CREATED : StateEventType.UPDATED);
            if (currentVersion == 0 && eventType != StateEventType.CREATED) {
                throw new EntityNotFoundException(key.entityType(), key.entityId());
            }

            ObjectNode before = previous.map(EntitySnapshot::payload).orElse(null);
            ObjectNode base = previous.map(EntitySnapshot::payloadCopy)
                .orElseGet(JsonNodeFactory.instance::objectNode);
            ObjectNode next = write.mutator().apply(base);
            if (next == null) {
                throw new IllegalArgumentException("Mutator for " + key + " returned null");
            }
            next = next.deepCopy();

            ObjectNode delta = eventType.replacesPayload()
                ? PayloadDelta.replace(next)
                : PayloadDelta.diff(before, next);

            // Keep commit times non-decreasing per entity even if the clock steps back
            Instant entityCommittedAt = previous
                .map(p -> p.committedAt().isAfter(committedAt) ? p.committedAt() : committedAt)
                .orElse(committedAt);

            PayloadChecksums.Digest digest = PayloadChecksums.digest(next);
            EntitySnapshot snapshot = new EntitySnapshot(
                key.entityType(),
                key.entityId(),
                currentVersion + 1,
                next,
                entityCommittedAt,
                transaction.actor(),
                eventType,
                digest.checksum(),
                digest.sizeBytes()
            );
            StateEvent event = new StateEvent(
                UUID.randomUUID(),
                transaction.id(),
                key.entityType(),
                key.entityId(),
                snapshot.version(),
                eventType,
                delta,
                write.metadata().deepCopy(),
                transaction.actor(),
                entityCommittedAt
            );

            session.appendEvent(event);
            session.putVersion(snapshot);
            snapshots.add(snapshot);
            changes.add(new CommittedChange(key, before, snapshot, event));
        }

        return new Applied(new CommitResult.Committed(transaction.id(), committedAt, snapshots), changes);
    }

    private void afterCommit(List<CommittedChange> changes) {
        if (changes.isEmpty()) {
            return;
        }
        cacheManager.invalidateCommitted(changes);
        changeStream.publish(changes.stream().map(CommittedChange::event).toList());
    }

    // ========== Abort ==========

    @Override
    public void abort(Transaction transaction) {
        if (!transaction.transition(TransactionStatus.ACTIVE, TransactionStatus.ABORTED)) {
            log.debug("Abort ignored for {} in state {}", transaction.id(), transaction.status());
            return;
        }
        activeTransactions.remove(transaction.id());
        concurrencyController.release(transaction.lockGrant());
        log.debug("Aborted transaction {} ({} staged writes discarded)",
            transaction.id(), transaction.stagedWrites().size());
    }

    @Override
    public Collection<Transaction> activeTransactions() {
        return List.copyOf(activeTransactions.values());
    }

    @Override
    public int abortAll(String reason) {
        int aborted = 0;
        for (Transaction transaction : activeTransactions()) {
            if (transaction.isActive()) {
                abort(transaction);
                aborted++;
            }
        }
        if (aborted > 0) {
            log.warn("Aborted {} active transactions: {}", aborted, reason);
        }
        return aborted;
    }

    private record Applied(CommitResult result, List<CommittedChange> changes) {
        static Applied rejected(CommitResult result) {
            return new Applied(result, List.of());
        }
    }
}
