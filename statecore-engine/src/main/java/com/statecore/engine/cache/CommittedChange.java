package com.statecore.engine.cache;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.StateEvent;

/**
 * One entity written by a commit, with the payload it replaced.
 *
 * @param previousPayload payload before the commit, null for a new entity
 */
public record CommittedChange(EntityKey key, ObjectNode previousPayload, EntitySnapshot snapshot, StateEvent event) {

    public long version() {
        return snapshot.version();
    }
}
