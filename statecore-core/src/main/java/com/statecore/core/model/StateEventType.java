package com.statecore.core.model;

import java.util.Locale;

/**
 * Kind of mutation recorded in the event log.
 */
public enum StateEventType {
    /** First version of a previously unseen entity. */
    CREATED,
    UPDATED,
    /** Soft delete: the payload moves to the terminal deleted status. */
    DELETED,
    /** A prior payload re-committed as a new version. */
    ROLLBACK;

    /**
     * Name stored in the event log and published on the event stream.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static StateEventType fromWireName(String wireName) {
        return StateEventType.valueOf(wireName.toUpperCase(Locale.ROOT));
    }

    /**
     * Whether the delta of this event carries the full payload.
     */
    public boolean replacesPayload() {
        return this == CREATED || this == ROLLBACK;
    }
}
