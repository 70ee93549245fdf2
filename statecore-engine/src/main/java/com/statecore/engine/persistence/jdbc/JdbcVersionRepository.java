package com.statecore.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.statecore.core.exception.VersionConflictException;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.EntityType;
import com.statecore.core.model.StateEventType;
import com.statecore.core.model.VersionInfo;
import com.statecore.core.repository.VersionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of VersionRepository.
 *
 * Snapshots live in entity_versions; entity_heads holds one row per entity with
 * its current version and serves as the row lock for writers.
 */
public class JdbcVersionRepository implements VersionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcVersionRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final SnapshotRowMapper rowMapper = new SnapshotRowMapper();

    public JdbcVersionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
    }

    @Override
    public Optional<EntitySnapshot> findLatest(EntityType entityType, String entityId) {
        String sql = """
            SELECT v.* FROM entity_versions v
            JOIN entity_heads h
              ON h.entity_type = v.entity_type
             AND h.entity_id = v.entity_id
             AND h.current_version = v.version
            WHERE v.entity_type = ? AND v.entity_id = ?
            """;
        return first(jdbcTemplate.query(sql, rowMapper, entityType.code(), entityId));
    }

    @Override
    public Optional<EntitySnapshot> findVersion(EntityType entityType, String entityId, long version) {
        String sql = """
            SELECT * FROM entity_versions
            WHERE entity_type = ? AND entity_id = ? AND version = ?
            """;
        return first(jdbcTemplate.query(sql, rowMapper, entityType.code(), entityId, version));
    }

    @Override
    public Optional<EntitySnapshot> findAtTime(EntityType entityType, String entityId, Instant atTime) {
        String sql = """
            SELECT * FROM entity_versions
            WHERE entity_type = ? AND entity_id = ? AND committed_at <= ?
            ORDER BY version DESC
            LIMIT 1
            """;
        return first(jdbcTemplate.query(sql, rowMapper, entityType.code(), entityId, Timestamp.from(atTime)));
    }

    @Override
    public long currentVersion(EntityType entityType, String entityId) {
        String sql = "SELECT current_version FROM entity_heads WHERE entity_type = ? AND entity_id = ?";
        List<Long> versions = jdbcTemplate.queryForList(sql, Long.class, entityType.code(), entityId);
        return versions.isEmpty() ? 0L : versions.get(0);
    }

    @Override
    public List<VersionInfo> listVersions(EntityType entityType, String entityId) {
        String sql = """
            SELECT version, committed_at, actor, event_type, checksum, size_bytes
            FROM entity_versions
            WHERE entity_type = ? AND entity_id = ?
            ORDER BY version ASC
            """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new VersionInfo(
            rs.getLong("version"),
            rs.getTimestamp("committed_at").toInstant(),
            rs.getString("actor"),
            StateEventType.fromWireName(rs.getString("event_type")),
            rs.getString("checksum"),
            rs.getInt("size_bytes")
        ), entityType.code(), entityId);
    }

    @Override
    public List<EntitySnapshot> listLatest(EntityType entityType, int limit, int offset, boolean includeDeleted) {
        String sql = """
            SELECT v.* FROM entity_versions v
            JOIN entity_heads h
              ON h.entity_type = v.entity_type
             AND h.entity_id = v.entity_id
             AND h.current_version = v.version
            WHERE v.entity_type = ? AND (? OR h.deleted = FALSE)
            ORDER BY v.entity_id ASC
            LIMIT ? OFFSET ?
            """;
        return jdbcTemplate.query(sql, rowMapper, entityType.code(), includeDeleted, limit, offset);
    }

    /**
     * Ensure a head row exists and lock it until the surrounding transaction ends.
     */
    long lockHead(EntityKey key, Instant now) {
        jdbcTemplate.update("""
            INSERT INTO entity_heads (entity_type, entity_id, current_version, updated_at, deleted)
            VALUES (?, ?, 0, ?, FALSE)
            ON CONFLICT (entity_type, entity_id) DO NOTHING
            """, key.entityType().code(), key.entityId(), Timestamp.from(now));

        Long current = jdbcTemplate.queryForObject("""
            SELECT current_version FROM entity_heads
            WHERE entity_type = ? AND entity_id = ?
            FOR UPDATE
            """, Long.class, key.entityType().code(), key.entityId());
        return current != null ? current : 0L;
    }

    /**
     * Insert a snapshot and advance the head. The head row must already be locked.
     */
    void insert(EntitySnapshot snapshot) {
        int advanced = jdbcTemplate.update("""
            UPDATE entity_heads
            SET current_version = ?, updated_at = ?, deleted = ?
            WHERE entity_type = ? AND entity_id = ? AND current_version = ?
            """,
            snapshot.version(),
            Timestamp.from(snapshot.committedAt()),
            snapshot.isDeleted(),
            snapshot.entityType().code(),
            snapshot.entityId(),
            snapshot.version() - 1
        );
        if (advanced == 0) {
            throw new VersionConflictException(
                "Head of " + snapshot.key() + " is not at version " + (snapshot.version() - 1));
        }

        jdbcTemplate.update("""
            INSERT INTO entity_versions (
                entity_type, entity_id, version, payload, committed_at,
                actor, event_type, checksum, size_bytes
            ) VALUES (?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?)
            """,
            snapshot.entityType().code(),
            snapshot.entityId(),
            snapshot.version(),
            json.write(snapshot.payload()),
            Timestamp.from(snapshot.committedAt()),
            snapshot.actor(),
            snapshot.eventType().wireName(),
            snapshot.checksum(),
            snapshot.sizeBytes()
        );
        log.debug("Inserted {} version {}", snapshot.key(), snapshot.version());
    }

    private static <T> Optional<T> first(List<T> results) {
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private class SnapshotRowMapper implements RowMapper<EntitySnapshot> {
        @Override
        public EntitySnapshot mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new EntitySnapshot(
                EntityType.fromCode(rs.getString("entity_type")),
                rs.getString("entity_id"),
                rs.getLong("version"),
                json.read(rs.getString("payload")),
                rs.getTimestamp("committed_at").toInstant(),
                rs.getString("actor"),
                StateEventType.fromWireName(rs.getString("event_type")),
                rs.getString("checksum"),
                rs.getInt("size_bytes")
            );
        }
    }
}
