package com.statecore.engine.service;

import com.statecore.core.model.EntityType;
import com.statecore.engine.rollback.RollbackResult;
import com.statecore.engine.rollback.RollbackTarget;

/**
 * Service for restoring an entity to an earlier state.
 * A rollback appends a new version; history is never rewritten.
 */
public interface RollbackService {

    /**
     * Restore an entity to the payload it had at a version or point in time.
     *
     * @param reason free text recorded on the rollback event
     * @param actor  identity recorded on the new version
     * @return the new version and what it was restored from
     * @throws com.statecore.core.exception.EntityNotFoundException if the target does not resolve
     * @throws com.statecore.core.exception.LockTimeoutException if the entity stays locked past the timeout
     */
    RollbackResult rollbackTo(EntityType entityType, String entityId, RollbackTarget target,
                              String reason, String actor);
}
