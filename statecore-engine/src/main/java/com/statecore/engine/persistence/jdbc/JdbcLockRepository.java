package com.statecore.engine.persistence.jdbc;

import com.statecore.core.model.LockLease;
import com.statecore.core.repository.LockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of LockRepository.
 *
 * Acquisition is a single upsert that only takes over a row when it is free,
 * expired, or already owned by the requester. Each takeover increments the
 * row's fence token.
 */
public class JdbcLockRepository implements LockRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcLockRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final LeaseRowMapper rowMapper = new LeaseRowMapper();

    public JdbcLockRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<LockLease> tryAcquire(String lockKey, UUID holderId, String holderName,
                                          Duration leaseDuration, Instant now) {
        String sql = """
            INSERT INTO state_locks (
                lock_key, holder_id, holder_name, acquired_at, expires_at,
                lease_duration_ms, renewal_count, fence_token
            ) VALUES (?, ?, ?, ?, ?, ?, 0, 1)
            ON CONFLICT (lock_key) DO UPDATE SET
                holder_id = EXCLUDED.holder_id,
                holder_name = EXCLUDED.holder_name,
                acquired_at = CASE WHEN state_locks.holder_id = EXCLUDED.holder_id
                                    AND state_locks.expires_at > ?
                                   THEN state_locks.acquired_at ELSE EXCLUDED.acquired_at END,
                expires_at = EXCLUDED.expires_at,
                lease_duration_ms = EXCLUDED.lease_duration_ms,
                renewal_count = CASE WHEN state_locks.holder_id = EXCLUDED.holder_id
                                      AND state_locks.expires_at > ?
                                     THEN state_locks.renewal_count + 1 ELSE 0 END,
                fence_token = CASE WHEN state_locks.holder_id = EXCLUDED.holder_id
                                    AND state_locks.expires_at > ?
                                   THEN state_locks.fence_token ELSE state_locks.fence_token + 1 END
            WHERE state_locks.holder_id IS NULL
               OR state_locks.expires_at <= ?
               OR state_locks.holder_id = EXCLUDED.holder_id
            RETURNING *
            """;

        Timestamp nowTs = Timestamp.from(now);
        List<LockLease> granted = jdbcTemplate.query(sql, rowMapper,
            lockKey,
            holderId,
            holderName,
            nowTs,
            Timestamp.from(now.plus(leaseDuration)),
            leaseDuration.toMillis(),
            nowTs,
            nowTs,
            nowTs,
            nowTs
        );

        if (granted.isEmpty()) {
            log.debug("Lock {} is held by another holder", lockKey);
            return Optional.empty();
        }
        LockLease lease = granted.get(0);
        log.debug("Acquired lock {} for {} (fence={})", lockKey, holderName, lease.fenceToken());
        return Optional.of(lease);
    }

    @Override
    public boolean renew(String lockKey, UUID holderId, Instant newExpiresAt, Instant now) {
        String sql = """
            UPDATE state_locks
            SET expires_at = ?, renewal_count = renewal_count + 1
            WHERE lock_key = ? AND holder_id = ? AND expires_at > ?
            """;
        int updated = jdbcTemplate.update(sql,
            Timestamp.from(newExpiresAt), lockKey, holderId, Timestamp.from(now));
        return updated > 0;
    }

    @Override
    public boolean release(String lockKey, UUID holderId) {
        // Keep the row so the fence token survives for the next holder
        String sql = """
            UPDATE state_locks
            SET holder_id = NULL, holder_name = NULL, expires_at = acquired_at
            WHERE lock_key = ? AND holder_id = ?
            """;
        return jdbcTemplate.update(sql, lockKey, holderId) > 0;
    }

    @Override
    public boolean isHeld(String lockKey, UUID holderId, long fenceToken, Instant now) {
        String sql = """
            SELECT COUNT(*) FROM state_locks
            WHERE lock_key = ? AND holder_id = ? AND fence_token = ? AND expires_at > ?
            """;
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class,
            lockKey, holderId, fenceToken, Timestamp.from(now));
        return count != null && count > 0;
    }

    @Override
    public Optional<LockLease> findByKey(String lockKey) {
        String sql = "SELECT * FROM state_locks WHERE lock_key = ? AND holder_id IS NOT NULL";
        List<LockLease> results = jdbcTemplate.query(sql, rowMapper, lockKey);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<LockLease> findByHolder(UUID holderId) {
        String sql = "SELECT * FROM state_locks WHERE holder_id = ? ORDER BY lock_key";
        return jdbcTemplate.query(sql, rowMapper, holderId);
    }

    @Override
    public int countActive(Instant now) {
        String sql = "SELECT COUNT(*) FROM state_locks WHERE holder_id IS NOT NULL AND expires_at > ?";
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class, Timestamp.from(now));
        return count != null ? count : 0;
    }

    @Override
    public int deleteExpiredBefore(Instant expiredBefore) {
        String sql = "DELETE FROM state_locks WHERE expires_at < ?";
        int deleted = jdbcTemplate.update(sql, Timestamp.from(expiredBefore));
        if (deleted > 0) {
            log.info("Purged {} expired lock rows", deleted);
        }
        return deleted;
    }

    private static class LeaseRowMapper implements RowMapper<LockLease> {
        @Override
        public LockLease mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new LockLease(
                rs.getString("lock_key"),
                rs.getObject("holder_id", UUID.class),
                rs.getString("holder_name"),
                rs.getTimestamp("acquired_at").toInstant(),
                rs.getTimestamp("expires_at").toInstant(),
                Duration.ofMillis(rs.getLong("lease_duration_ms")),
                rs.getInt("renewal_count"),
                rs.getLong("fence_token")
            );
        }
    }
}
