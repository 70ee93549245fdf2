package com.statecore.engine.transaction;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statecore.core.exception.TransactionStateException;
import com.statecore.core.model.AccessMode;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.EntityType;
import com.statecore.core.model.StateEventType;
import com.statecore.engine.concurrency.LockGrant;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Handle for one transaction.
 *
 * Reads return committed state and record the version seen. Writes are staged
 * as mutators and applied to the committed payload at commit time, so staged
 * writes are not visible through {@link #readEntity}. In pessimistic mode every
 * entity read or staged is locked first, and the read waits for any commit
 * already writing that entity.
 *
 * Implicit locks are taken one key at a time, in call order. A pessimistic
 * transaction touching several entities should call {@link #lock(EntityKey...)}
 * with all of them before its first read or write; two transactions that lock
 * the same keys implicitly in opposite orders wait on each other until one
 * hits its lock timeout.
 *
 * A handle is used by one thread. It can be closed with try-with-resources,
 * which aborts it if it was never committed.
 */
public class Transaction implements AutoCloseable {

    private final UUID id;
    private final AccessMode mode;
    private final String actor;
    private final Instant startedAt;
    private final Duration lockTimeout;
    private final TransactionCoordinator coordinator;
    private final LockGrant lockGrant;
    private final AtomicReference<TransactionStatus> status = new AtomicReference<>(TransactionStatus.ACTIVE);

    private final Map<EntityKey, Long> readVersions = new LinkedHashMap<>();
    private final Map<EntityKey, StagedWrite> stagedWrites = new LinkedHashMap<>();

    Transaction(UUID id, AccessMode mode, String actor, Instant startedAt,
                Duration lockTimeout, TransactionCoordinator coordinator) {
        this.id = id;
        this.mode = mode;
        this.actor = actor;
        this.startedAt = startedAt;
        this.lockTimeout = lockTimeout;
        this.coordinator = coordinator;
        this.lockGrant = new LockGrant(id, actor + "/" + id);
    }

    // ========== Reads ==========

    /**
     * Read the latest committed snapshot and remember its version.
     *
     * @return empty if the entity does not exist
     */
    public Optional<EntitySnapshot> readEntity(EntityType entityType, String entityId) {
        return readEntity(EntityKey.of(entityType, entityId));
    }

    public Optional<EntitySnapshot> readEntity(EntityKey key) {
        ensureActive("read");
        if (mode == AccessMode.PESSIMISTIC) {
            coordinator.lock(this, List.of(key.lockKey()));
        }
        return coordinator.read(this, key);
    }

    // ========== Staging ==========

    /**
     * Stage a change. The mutator receives a copy of the committed payload
     * (an empty object for a new entity) and returns the new payload.
     * Several writes to the same entity compose in staging order.
     */
    public Transaction stageWrite(EntityType entityType, String entityId, UnaryOperator<ObjectNode> mutator) {
        return stage(new StagedWrite(EntityKey.of(entityType, entityId), mutator, null, emptyMetadata()));
    }

    /**
     * Stage a write that replaces the whole payload.
     */
    public Transaction stagePayload(EntityType entityType, String entityId, ObjectNode payload) {
        ObjectNode copy = payload.deepCopy();
        return stageWrite(entityType, entityId, current -> copy.deepCopy());
    }

    /**
     * Stage a soft delete: the entity's status field becomes "deleted".
     */
    public Transaction stageDelete(EntityType entityType, String entityId) {
        return stage(new StagedWrite(
            EntityKey.of(entityType, entityId),
            payload -> payload.put(EntitySnapshot.STATUS_FIELD, EntitySnapshot.DELETED_STATUS),
            StateEventType.DELETED,
            emptyMetadata()
        ));
    }

    /**
     * Stage a full-payload restore recorded as a rollback event.
     */
    public Transaction stageRestore(EntityKey key, ObjectNode payload, ObjectNode metadata) {
        ObjectNode copy = payload.deepCopy();
        return stage(new StagedWrite(key, current -> copy.deepCopy(), StateEventType.ROLLBACK, metadata.deepCopy()));
    }

    private Transaction stage(StagedWrite write) {
        ensureActive("stage");
        EntityKey key = write.key();
        if (mode == AccessMode.PESSIMISTIC) {
            coordinator.lock(this, List.of(key.lockKey()));
        }
        if (!readVersions.containsKey(key)) {
            // Blind writes still validate against the version current at staging time
            coordinator.read(this, key);
        }
        stagedWrites.merge(key, write, StagedWrite::then);
        return this;
    }

    // ========== Locks ==========

    /**
     * Acquire exclusive locks on entities, in canonical order. Pessimistic mode only.
     *
     * @throws com.statecore.core.exception.LockTimeoutException if a lock is not granted in time
     */
    public void lock(EntityKey... keys) {
        List<String> lockKeys = new ArrayList<>();
        for (EntityKey key : keys) {
            lockKeys.add(key.lockKey());
        }
        lockKeys(lockKeys);
    }

    /**
     * Acquire exclusive locks on arbitrary lock keys, in canonical order. Pessimistic mode only.
     */
    public void lockKeys(Collection<String> lockKeys) {
        ensureActive("lock");
        if (mode != AccessMode.PESSIMISTIC) {
            throw new TransactionStateException(
                "Explicit locks require PESSIMISTIC mode; transaction " + id + " is " + mode);
        }
        coordinator.lock(this, lockKeys);
    }

    /**
     * Extend every held lease by a full lease duration.
     *
     * @return false if any lease had already expired
     */
    public boolean renewLocks() {
        ensureActive("renew locks");
        return coordinator.renewLocks(this);
    }

    // ========== Completion ==========

    public CommitResult commit() {
        return coordinator.commit(this);
    }

    public void abort() {
        coordinator.abort(this);
    }

    @Override
    public void close() {
        if (status.get() == TransactionStatus.ACTIVE) {
            coordinator.abort(this);
        }
    }

    // ========== Accessors ==========

    public UUID id() {
        return id;
    }

    public AccessMode mode() {
        return mode;
    }

    public String actor() {
        return actor;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Duration lockTimeout() {
        return lockTimeout;
    }

    public TransactionStatus status() {
        return status.get();
    }

    public boolean isActive() {
        return status.get() == TransactionStatus.ACTIVE;
    }

    public Set<EntityKey> stagedKeys() {
        return Collections.unmodifiableSet(new TreeSet<>(stagedWrites.keySet()));
    }

    /**
     * Version observed by the first read of an entity, 0 if it did not exist.
     */
    public OptionalLong readVersion(EntityKey key) {
        Long version = readVersions.get(key);
        return version == null ? OptionalLong.empty() : OptionalLong.of(version);
    }

    public Set<String> heldLockKeys() {
        return lockGrant.lockKeys();
    }

    // ========== Coordinator access ==========

    LockGrant lockGrant() {
        return lockGrant;
    }

    Map<EntityKey, Long> readVersions() {
        return readVersions;
    }

    Map<EntityKey, StagedWrite> stagedWrites() {
        return stagedWrites;
    }

    void recordRead(EntityKey key, long version) {
        readVersions.putIfAbsent(key, version);
    }

    boolean transition(TransactionStatus expected, TransactionStatus next) {
        return status.compareAndSet(expected, next);
    }

    void ensureActive(String operation) {
        TransactionStatus current = status.get();
        if (current != TransactionStatus.ACTIVE) {
            throw new TransactionStateException(id, current.name(), operation);
        }
    }

    private static ObjectNode emptyMetadata() {
        return JsonNodeFactory.instance.objectNode();
    }

    @Override
    public String toString() {
        return "Transaction[" + id + ", " + mode + ", " + status.get() + "]";
    }
}
