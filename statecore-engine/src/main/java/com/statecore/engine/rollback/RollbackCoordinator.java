package com.statecore.engine.rollback;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statecore.core.exception.EntityNotFoundException;
import com.statecore.core.fold.EventFold;
import com.statecore.core.model.AccessMode;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.EntityType;
import com.statecore.core.model.StateEvent;
import com.statecore.core.repository.EventRepository;
import com.statecore.core.repository.VersionRepository;
import com.statecore.engine.logging.LoggingContext;
import com.statecore.engine.metrics.StateMetrics;
import com.statecore.engine.service.RollbackService;
import com.statecore.engine.service.TransactionService;
import com.statecore.engine.transaction.CommitResult;
import com.statecore.engine.transaction.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Restores entities by writing a reconstructed payload as a new version.
 *
 * The write goes through a pessimistic transaction holding the entity's lock,
 * so optimistic writers cannot commit over it while it is in flight.
 */
public class RollbackCoordinator implements RollbackService {

    private static final Logger log = LoggerFactory.getLogger(RollbackCoordinator.class);

    public static final String SOURCE_VERSION = "source_version";
    public static final String TARGET_TIME = "target_time";
    public static final String PREVIOUS_VERSION = "previous_version";
    public static final String REASON = "reason";

    private final TransactionService transactionService;
    private final VersionRepository versionRepository;
    private final EventRepository eventRepository;
    private final StateMetrics metrics;

    public RollbackCoordinator(TransactionService transactionService,
                               VersionRepository versionRepository,
                               EventRepository eventRepository,
                               StateMetrics metrics) {
        this.transactionService = transactionService;
        this.versionRepository = versionRepository;
        this.eventRepository = eventRepository;
        this.metrics = metrics;
    }

    @Override
    public RollbackResult rollbackTo(EntityType entityType, String entityId, RollbackTarget target,
                                     String reason, String actor) {
        EntityKey key = EntityKey.of(entityType, entityId);
        try (LoggingContext ctx = LoggingContext.forEntity(key, actor)) {
            Resolved resolved = resolve(key, target);

            Transaction transaction = transactionService.begin(AccessMode.PESSIMISTIC, actor);
            CommitResult.Committed committed;
            long previousVersion;
            try {
                transaction.lock(key);
                EntitySnapshot current = transaction.readEntity(key)
                    .orElseThrow(() -> new EntityNotFoundException(entityType, entityId));
                previousVersion = current.version();

                ObjectNode metadata = JsonNodeFactory.instance.objectNode();
                metadata.put(SOURCE_VERSION, resolved.sourceVersion());
                if (target instanceof RollbackTarget.ToTime toTime) {
                    metadata.put(TARGET_TIME, toTime.atTime().toString());
                }
                metadata.put(PREVIOUS_VERSION, previousVersion);
                if (reason != null) {
                    metadata.put(REASON, reason);
                }

                transaction.stageRestore(key, resolved.payload(), metadata);
                committed = transaction.commit().orThrow();
            } finally {
                transaction.close();
            }

            EntitySnapshot snapshot = committed.snapshot(key).orElseThrow();
            metrics.rollbackCompleted(entityType.code());
            log.info("Rolled back {} from version {} to the state of version {} as version {}",
                key, previousVersion, resolved.sourceVersion(), snapshot.version());
            return new RollbackResult(previousVersion, resolved.sourceVersion(), snapshot);
        }
    }

    private Resolved resolve(EntityKey key, RollbackTarget target) {
        if (target instanceof RollbackTarget.ToVersion toVersion) {
            EntitySnapshot snapshot = versionRepository
                .findVersion(key.entityType(), key.entityId(), toVersion.version())
                .orElseThrow(() -> new EntityNotFoundException(
                    key.entityType(), key.entityId(), toVersion.version()));
            return new Resolved(snapshot.payloadCopy(), snapshot.version());
        }

        RollbackTarget.ToTime toTime = (RollbackTarget.ToTime) target;
        List<StateEvent> events = eventRepository.findByEntity(key.entityType(), key.entityId());
        ObjectNode payload = EventFold.foldToTime(events, toTime.atTime());
        if (payload == null) {
            throw new EntityNotFoundException(key.entityType(), key.entityId(), toTime.atTime());
        }
        long sourceVersion = events.stream()
            .filter(e -> !e.committedAt().isAfter(toTime.atTime()))
            .mapToLong(StateEvent::version)
            .max()
            .orElseThrow();
        return new Resolved(payload, sourceVersion);
    }

    private record Resolved(ObjectNode payload, long sourceVersion) {
    }
}
