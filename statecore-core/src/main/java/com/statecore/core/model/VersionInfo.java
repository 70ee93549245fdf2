package com.statecore.core.model;

import java.time.Instant;

/**
 * Lightweight description of one committed version, for history listings.
 */
public record VersionInfo(
    long version,
    Instant committedAt,
    String actor,
    StateEventType eventType,
    String checksum,
    int sizeBytes
) {
}
