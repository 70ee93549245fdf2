package com.statecore.engine.rollback;

import com.statecore.core.model.EntitySnapshot;

/**
 * Outcome of a committed rollback.
 *
 * @param previousVersion version that was current before the rollback
 * @param sourceVersion   version whose payload was restored
 * @param snapshot        the new version written by the rollback
 */
public record RollbackResult(long previousVersion, long sourceVersion, EntitySnapshot snapshot) {

    public long newVersion() {
        return snapshot.version();
    }
}
