package com.statecore.engine.transaction;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.StateEventType;

import java.util.function.UnaryOperator;

/**
 * Pending change to one entity, applied to the committed payload at commit time.
 *
 * @param eventType explicit event type, or null to derive created/updated from the current version
 * @param metadata  extra fields recorded on the event
 */
record StagedWrite(
    EntityKey key,
    UnaryOperator<ObjectNode> mutator,
    StateEventType eventType,
    ObjectNode metadata
) {
    /**
     * Compose with a later write to the same entity. The later explicit event type wins.
     */
    StagedWrite then(StagedWrite next) {
        UnaryOperator<ObjectNode> first = mutator;
        UnaryOperator<ObjectNode> second = next.mutator;
        ObjectNode mergedMetadata = metadata.deepCopy();
        mergedMetadata.setAll(next.metadata);
        return new StagedWrite(
            key,
            payload -> second.apply(first.apply(payload)),
            next.eventType != null ? next.eventType : eventType,
            mergedMetadata
        );
    }
}
