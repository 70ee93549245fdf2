package com.statecore.engine.persistence.jdbc;

import com.statecore.core.exception.StorageException;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.StateEvent;
import com.statecore.core.repository.StateStore;
import com.statecore.core.repository.StoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * PostgreSQL-backed state store.
 *
 * Each atomic unit is one database transaction. Writers lock entity_heads rows
 * with SELECT ... FOR UPDATE, so concurrent commits touching the same entity
 * serialize on the row lock while readers keep reading committed rows.
 */
public class JdbcStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcStateStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final PlatformTransactionManager transactionManager;
    private final JdbcVersionRepository versionRepository;
    private final JdbcEventRepository eventRepository;
    private final Clock clock;

    public JdbcStateStore(JdbcTemplate jdbcTemplate,
                          PlatformTransactionManager transactionManager,
                          JdbcVersionRepository versionRepository,
                          JdbcEventRepository eventRepository,
                          Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionManager = transactionManager;
        this.versionRepository = versionRepository;
        this.eventRepository = eventRepository;
        this.clock = clock;
    }

    @Override
    public <T> T executeAtomically(Function<StoreSession, T> work, Duration timeout) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout((int) Math.max(1, (timeout.toMillis() + 999) / 1000));

        try {
            return template.execute(status -> {
                JdbcSession session = new JdbcSession();
                T result = work.apply(session);
                if (!session.hasWrites()) {
                    // Nothing to persist; drop the placeholder head rows as well
                    status.setRollbackOnly();
                }
                return result;
            });
        } catch (TransactionTimedOutException | QueryTimeoutException | TransactionSystemException e) {
            log.error("Commit outcome unknown: {}", e.getMessage());
            throw new StorageException("Commit outcome unknown", e, true);
        } catch (CannotCreateTransactionException e) {
            throw new StorageException("Backing store unavailable", e, false);
        } catch (DataAccessException | TransactionException e) {
            log.error("Atomic unit failed and was rolled back: {}", e.getMessage());
            throw new StorageException("Atomic unit failed", e, false);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (DataAccessException e) {
            log.warn("State store health probe failed: {}", e.getMessage());
            return false;
        }
    }

    private final class JdbcSession implements StoreSession {

        private final Map<EntityKey, EntitySnapshot> written = new HashMap<>();
        private int writes;

        @Override
        public long lockCurrentVersion(EntityKey key) {
            EntitySnapshot pending = written.get(key);
            if (pending != null) {
                return pending.version();
            }
            return versionRepository.lockHead(key, clock.instant());
        }

        @Override
        public Optional<EntitySnapshot> findLatest(EntityKey key) {
            EntitySnapshot pending = written.get(key);
            if (pending != null) {
                return Optional.of(pending);
            }
            return versionRepository.findLatest(key.entityType(), key.entityId());
        }

        @Override
        public void putVersion(EntitySnapshot snapshot) {
            versionRepository.insert(snapshot);
            written.put(snapshot.key(), snapshot);
            writes++;
        }

        @Override
        public void appendEvent(StateEvent event) {
            eventRepository.append(event);
            writes++;
        }

        boolean hasWrites() {
            return writes > 0;
        }
    }
}
