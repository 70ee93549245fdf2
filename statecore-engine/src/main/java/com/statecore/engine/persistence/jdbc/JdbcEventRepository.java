package com.statecore.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.statecore.core.exception.VersionConflictException;
import com.statecore.core.model.EntityType;
import com.statecore.core.model.StateEvent;
import com.statecore.core.model.StateEventType;
import com.statecore.core.repository.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of EventRepository.
 * Append-only; a unique constraint on (entity_type, entity_id, version) rejects duplicate versions.
 */
public class JdbcEventRepository implements EventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final EventRowMapper rowMapper = new EventRowMapper();

    public JdbcEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
    }

    @Override
    public List<StateEvent> findByEntity(EntityType entityType, String entityId) {
        String sql = """
            SELECT * FROM state_events
            WHERE entity_type = ? AND entity_id = ?
            ORDER BY version ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, entityType.code(), entityId);
    }

    @Override
    public List<StateEvent> findByEntityUpTo(EntityType entityType, String entityId, long upToVersion) {
        String sql = """
            SELECT * FROM state_events
            WHERE entity_type = ? AND entity_id = ? AND version <= ?
            ORDER BY version ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, entityType.code(), entityId, upToVersion);
    }

    @Override
    public List<StateEvent> findByEntityBetween(EntityType entityType, String entityId, Instant from, Instant to) {
        String sql = """
            SELECT * FROM state_events
            WHERE entity_type = ? AND entity_id = ? AND committed_at >= ? AND committed_at <= ?
            ORDER BY version ASC
            """;
        return jdbcTemplate.query(sql, rowMapper,
            entityType.code(), entityId, Timestamp.from(from), Timestamp.from(to));
    }

    @Override
    public Optional<StateEvent> findById(UUID eventId) {
        String sql = "SELECT * FROM state_events WHERE event_id = ?";
        List<StateEvent> results = jdbcTemplate.query(sql, rowMapper, eventId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<StateEvent> findByVersion(EntityType entityType, String entityId, long version) {
        String sql = "SELECT * FROM state_events WHERE entity_type = ? AND entity_id = ? AND version = ?";
        List<StateEvent> results = jdbcTemplate.query(sql, rowMapper, entityType.code(), entityId, version);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Append an event inside the caller's transaction.
     */
    void append(StateEvent event) {
        String sql = """
            INSERT INTO state_events (
                event_id, transaction_id, entity_type, entity_id, version,
                event_type, delta, metadata, actor, committed_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql,
                event.eventId(),
                event.transactionId(),
                event.entityType().code(),
                event.entityId(),
                event.version(),
                event.eventType().wireName(),
                json.write(event.delta()),
                json.write(event.metadata()),
                event.actor(),
                Timestamp.from(event.committedAt())
            );
        } catch (DuplicateKeyException e) {
            throw new VersionConflictException(
                "Event for " + event.key() + " version " + event.version() + " is already logged");
        }
        log.debug("Appended {} event for {} version {}",
            event.eventType().wireName(), event.key(), event.version());
    }

    private class EventRowMapper implements RowMapper<StateEvent> {
        @Override
        public StateEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new StateEvent(
                rs.getObject("event_id", UUID.class),
                rs.getObject("transaction_id", UUID.class),
                EntityType.fromCode(rs.getString("entity_type")),
                rs.getString("entity_id"),
                rs.getLong("version"),
                StateEventType.fromWireName(rs.getString("event_type")),
                json.read(rs.getString("delta")),
                json.read(rs.getString("metadata")),
                rs.getString("actor"),
                rs.getTimestamp("committed_at").toInstant()
            );
        }
    }
}
