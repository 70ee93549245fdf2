package com.statecore.engine.history;

import com.statecore.core.model.EntityKey;

import java.util.List;

/**
 * Result of checking an entity's stored versions against its event log.
 *
 * @param mismatchedVersions versions whose payload or checksum disagrees with the fold of events
 * @param problems           human-readable description of each finding
 */
public record IntegrityReport(
    EntityKey key,
    long versionCount,
    long eventCount,
    List<Long> mismatchedVersions,
    List<String> problems
) {
    public IntegrityReport {
        mismatchedVersions = List.copyOf(mismatchedVersions);
        problems = List.copyOf(problems);
    }

    public boolean isConsistent() {
        return problems.isEmpty();
    }
}
