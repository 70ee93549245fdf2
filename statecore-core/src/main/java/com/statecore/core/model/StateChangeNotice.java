package com.statecore.core.model;

import java.time.Instant;

/**
 * Tuple published for every committed version, consumed by audit export and dashboards.
 */
public record StateChangeNotice(
    EntityType entityType,
    String entityId,
    long version,
    String eventType,
    String actor,
    Instant committedAt
) {
}
