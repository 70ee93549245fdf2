package com.statecore.engine.rollback;

import java.time.Instant;

/**
 * Point in an entity's history to restore.
 */
public sealed interface RollbackTarget permits RollbackTarget.ToVersion, RollbackTarget.ToTime {

    static RollbackTarget version(long version) {
        return new ToVersion(version);
    }

    static RollbackTarget time(Instant atTime) {
        return new ToTime(atTime);
    }

    /**
     * Restore the payload of a specific version.
     */
    record ToVersion(long version) implements RollbackTarget {
        public ToVersion {
            if (version < 1) {
                throw new IllegalArgumentException("version must be >= 1");
            }
        }
    }

    /**
     * Restore the payload as of a timestamp, reconstructed from the event log.
     */
    record ToTime(Instant atTime) implements RollbackTarget {
        public ToTime {
            if (atTime == null) {
                throw new IllegalArgumentException("atTime is required");
            }
        }
    }
}
