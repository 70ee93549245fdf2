package com.statecore.engine.history;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statecore.core.exception.EntityNotFoundException;
import com.statecore.core.fold.EventFold;
import com.statecore.core.fold.PayloadChecksums;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.EntityType;
import com.statecore.core.model.StateEvent;
import com.statecore.core.model.VersionInfo;
import com.statecore.core.repository.EventRepository;
import com.statecore.core.repository.VersionRepository;
import com.statecore.engine.cache.CacheManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to entity state and history.
 *
 * Provides:
 * - Current state through the cache
 * - Version listing and point-in-time reads from the version store
 * - Event listing and replay from the event log
 * - Integrity checks of stored versions against the event log
 */
public class EntityHistoryService {

    private static final Logger log = LoggerFactory.getLogger(EntityHistoryService.class);

    public static final int MAX_PAGE_SIZE = 1000;

    private final VersionRepository versionRepository;
    private final EventRepository eventRepository;
    private final CacheManager cacheManager;

    public EntityHistoryService(VersionRepository versionRepository,
                                EventRepository eventRepository,
                                CacheManager cacheManager) {
        this.versionRepository = versionRepository;
        this.eventRepository = eventRepository;
        this.cacheManager = cacheManager;
    }

    /**
     * Current snapshot through L1, L2 and the version store.
     */
    public Optional<EntitySnapshot> readEntity(EntityType entityType, String entityId) {
        return cacheManager.read(entityType, entityId);
    }

    /**
     * Current snapshot straight from the version store.
     *
     * @throws EntityNotFoundException if the entity was never written
     */
    public EntitySnapshot getLatest(EntityType entityType, String entityId) {
        return versionRepository.findLatest(entityType, entityId)
            .orElseThrow(() -> new EntityNotFoundException(entityType, entityId));
    }

    /**
     * Version metadata in ascending order.
     *
     * @throws EntityNotFoundException if the entity was never written
     */
    public List<VersionInfo> getHistory(EntityType entityType, String entityId) {
        List<VersionInfo> versions = versionRepository.listVersions(entityType, entityId);
        if (versions.isEmpty()) {
            throw new EntityNotFoundException(entityType, entityId);
        }
        return versions;
    }

    public EntitySnapshot getEntityAtVersion(EntityType entityType, String entityId, long version) {
        return versionRepository.findVersion(entityType, entityId, version)
            .orElseThrow(() -> new EntityNotFoundException(entityType, entityId, version));
    }

    /**
     * Snapshot current at {@code atTime}: the greatest commit time at or before it.
     *
     * @throws EntityNotFoundException if the entity did not exist yet
     */
    public EntitySnapshot getEntityAtTime(EntityType entityType, String entityId, Instant atTime) {
        return versionRepository.findAtTime(entityType, entityId, atTime)
            .orElseThrow(() -> new EntityNotFoundException(entityType, entityId, atTime));
    }

    public List<StateEvent> listEvents(EntityType entityType, String entityId) {
        return eventRepository.findByEntity(entityType, entityId);
    }

    /**
     * Events committed within [from, to], in version order.
     */
    public List<StateEvent> listEvents(EntityType entityType, String entityId, Instant from, Instant to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        return eventRepository.findByEntityBetween(entityType, entityId, from, to);
    }

    /**
     * Rebuild the payload at a version by folding the event log.
     */
    public ObjectNode replay(EntityType entityType, String entityId, long upToVersion) {
        ObjectNode payload = EventFold.fold(eventRepository.findByEntityUpTo(entityType, entityId, upToVersion));
        if (payload == null) {
            throw new EntityNotFoundException(entityType, entityId, upToVersion);
        }
        return payload;
    }

    /**
     * Rebuild the payload as of a point in time by folding the event log.
     */
    public ObjectNode replayToTime(EntityType entityType, String entityId, Instant atTime) {
        ObjectNode payload = EventFold.foldToTime(eventRepository.findByEntity(entityType, entityId), atTime);
        if (payload == null) {
            throw new EntityNotFoundException(entityType, entityId, atTime);
        }
        return payload;
    }

    /**
     * Current snapshots of one entity type, ordered by id.
     */
    public List<EntitySnapshot> listEntities(EntityType entityType, int limit, int offset, boolean includeDeleted) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        return versionRepository.listLatest(entityType, limit, offset, includeDeleted);
    }

    /**
     * Check every stored version against the fold of the event log and its recorded checksum.
     */
    public IntegrityReport verifyIntegrity(EntityType entityType, String entityId) {
        EntityKey key = EntityKey.of(entityType, entityId);
        List<StateEvent> events = eventRepository.findByEntity(entityType, entityId);
        List<VersionInfo> versions = versionRepository.listVersions(entityType, entityId);
        if (events.isEmpty() && versions.isEmpty()) {
            throw new EntityNotFoundException(entityType, entityId);
        }

        List<Long> mismatched = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        if (events.size() != versions.size()) {
            problems.add(String.format("%d versions but %d events", versions.size(), events.size()));
        }

        ObjectNode folded = null;
        long expected = 1;
        for (StateEvent event : events) {
            if (event.version() != expected) {
                problems.add(String.format("event log gap: expected version %d, found %d", expected, event.version()));
                break;
            }
            folded = EventFold.apply(folded, event);
            long version = event.version();
            Optional<EntitySnapshot> stored = versionRepository.findVersion(entityType, entityId, version);
            if (stored.isEmpty()) {
                mismatched.add(version);
                problems.add("version " + version + " missing from the version store");
            } else if (!stored.get().payload().equals(folded)) {
                mismatched.add(version);
                problems.add("version " + version + " payload differs from the event fold");
            } else if (!PayloadChecksums.digest(stored.get().payload()).checksum().equals(stored.get().checksum())) {
                mismatched.add(version);
                problems.add("version " + version + " checksum does not match its payload");
            }
            expected++;
        }

        IntegrityReport report = new IntegrityReport(key, versions.size(), events.size(), mismatched, problems);
        if (!report.isConsistent()) {
            log.warn("Integrity check failed for {}: {}", key, problems);
        }
        return report;
    }
}
