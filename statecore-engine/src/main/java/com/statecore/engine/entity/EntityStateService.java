package com.statecore.engine.entity;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statecore.core.exception.DuplicateEntityException;
import com.statecore.core.exception.EntityNotFoundException;
import com.statecore.core.exception.OptimisticConflictException;
import com.statecore.core.model.AccessMode;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.EntityType;
import com.statecore.engine.cache.CacheManager;
import com.statecore.engine.service.TransactionService;
import com.statecore.engine.transaction.CommitResult;
import com.statecore.engine.transaction.Transaction;
import com.statecore.engine.transaction.TransactionRetrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-entity operations for callers that do not need a multi-entity transaction.
 * Each call runs its own optimistic transaction, retried on conflict.
 */
public class EntityStateService {

    private static final Logger log = LoggerFactory.getLogger(EntityStateService.class);

    private final TransactionService transactionService;
    private final TransactionRetrier retrier;
    private final CacheManager cacheManager;

    public EntityStateService(TransactionService transactionService,
                              TransactionRetrier retrier,
                              CacheManager cacheManager) {
        this.transactionService = transactionService;
        this.retrier = retrier;
        this.cacheManager = cacheManager;
    }

    /**
     * Create an entity at version 1.
     *
     * @throws DuplicateEntityException if the id is already taken, even by a deleted entity
     */
    public EntitySnapshot create(EntityType entityType, String entityId, ObjectNode payload, String actor) {
        EntityKey key = EntityKey.of(entityType, entityId);
        CommitResult.Committed committed = retrier.execute(AccessMode.OPTIMISTIC, actor, tx -> {
            tx.readEntity(key).ifPresent(existing -> {
                throw new DuplicateEntityException(entityType, entityId, existing.version());
            });
            tx.stagePayload(entityType, entityId, payload);
        });
        log.info("Created {}", key);
        return committed.snapshot(key).orElseThrow();
    }

    /**
     * Merge top-level fields into an existing entity.
     *
     * @throws EntityNotFoundException if the entity does not exist or is deleted
     */
    public EntitySnapshot update(EntityType entityType, String entityId, ObjectNode fields, String actor) {
        EntityKey key = EntityKey.of(entityType, entityId);
        CommitResult.Committed committed = retrier.execute(AccessMode.OPTIMISTIC, actor, tx -> {
            requireLive(tx, key);
            tx.stageWrite(entityType, entityId, current -> current.setAll(fields.deepCopy()));
        });
        return committed.snapshot(key).orElseThrow();
    }

    /**
     * Merge fields only if the entity is still at {@code expectedVersion}. Not retried.
     *
     * @throws OptimisticConflictException if the entity has moved past the expected version
     */
    public EntitySnapshot update(EntityType entityType, String entityId, ObjectNode fields,
                                 long expectedVersion, String actor) {
        EntityKey key = EntityKey.of(entityType, entityId);
        try (Transaction tx = transactionService.begin(AccessMode.OPTIMISTIC, actor)) {
            EntitySnapshot current = requireLive(tx, key);
            if (current.version() != expectedVersion) {
                throw new OptimisticConflictException(key, expectedVersion, current.version());
            }
            tx.stageWrite(entityType, entityId, payload -> payload.setAll(fields.deepCopy()));
            return tx.commit().orThrow().snapshot(key).orElseThrow();
        }
    }

    /**
     * Soft delete. Deleting an already deleted entity returns its current snapshot.
     *
     * @throws EntityNotFoundException if the entity never existed
     */
    public EntitySnapshot delete(EntityType entityType, String entityId, String actor) {
        EntityKey key = EntityKey.of(entityType, entityId);
        AtomicReference<EntitySnapshot> alreadyDeleted = new AtomicReference<>();
        CommitResult.Committed committed = retrier.execute(AccessMode.OPTIMISTIC, actor, tx -> {
            EntitySnapshot current = tx.readEntity(key)
                .orElseThrow(() -> new EntityNotFoundException(entityType, entityId));
            if (current.isDeleted()) {
                alreadyDeleted.set(current);
                return;
            }
            alreadyDeleted.set(null);
            tx.stageDelete(entityType, entityId);
        });
        if (alreadyDeleted.get() != null) {
            return alreadyDeleted.get();
        }
        log.info("Deleted {}", key);
        return committed.snapshot(key).orElseThrow();
    }

    /**
     * Current state through the cache, empty if absent or deleted.
     */
    public Optional<EntitySnapshot> get(EntityType entityType, String entityId) {
        return cacheManager.read(entityType, entityId).filter(snapshot -> !snapshot.isDeleted());
    }

    private static EntitySnapshot requireLive(Transaction tx, EntityKey key) {
        return tx.readEntity(key)
            .filter(snapshot -> !snapshot.isDeleted())
            .orElseThrow(() -> new EntityNotFoundException(key.entityType(), key.entityId()));
    }
}
