package com.statecore.core.fold;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statecore.core.exception.VersionConflictException;
import com.statecore.core.model.StateEvent;

import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Pure reconstruction of entity payloads from the event log.
 *
 * {@code apply} never mutates its inputs, so it can be used on live snapshots and
 * tested without any storage.
 */
public final class EventFold {

    private EventFold() {
    }

    /**
     * Apply one event to a payload, returning the next payload.
     *
     * @param payload current payload, or null before the first event
     * @param event   the event to apply
     */
    public static ObjectNode apply(ObjectNode payload, StateEvent event) {
        ObjectNode delta = event.delta();
        if (delta.has(PayloadDelta.REPLACE)) {
            JsonNode replacement = delta.get(PayloadDelta.REPLACE);
            if (!replacement.isObject()) {
                throw new IllegalArgumentException("Replace delta of " + event.key()
                    + " v" + event.version() + " is not an object");
            }
            return ((ObjectNode) replacement).deepCopy();
        }

        ObjectNode next = payload == null ? JsonNodeFactory.instance.objectNode() : payload.deepCopy();
        JsonNode set = delta.get(PayloadDelta.SET);
        if (set != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = set.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                next.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        JsonNode unset = delta.get(PayloadDelta.UNSET);
        if (unset != null) {
            for (JsonNode name : unset) {
                next.remove(name.asText());
            }
        }
        return next;
    }

    /**
     * Fold an ordered event history. Versions must run 1, 2, 3... without gaps.
     *
     * @return the payload after the last event, or null for an empty history
     */
    public static ObjectNode fold(List<StateEvent> events) {
        ObjectNode payload = null;
        long expected = 1;
        for (StateEvent event : events) {
            if (event.version() != expected) {
                throw new VersionConflictException(String.format(
                    "Event history of %s is not contiguous: expected version %d, found %d",
                    event.key(), expected, event.version()));
            }
            payload = apply(payload, event);
            expected++;
        }
        return payload;
    }

    /**
     * Fold events up to and including {@code upToVersion}.
     */
    public static ObjectNode foldToVersion(List<StateEvent> events, long upToVersion) {
        return fold(events.stream()
            .filter(e -> e.version() <= upToVersion)
            .toList());
    }

    /**
     * Fold events committed at or before {@code atTime}.
     */
    public static ObjectNode foldToTime(List<StateEvent> events, Instant atTime) {
        return fold(events.stream()
            .filter(e -> !e.committedAt().isAfter(atTime))
            .toList());
    }
}
