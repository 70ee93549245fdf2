package com.statecore.engine.persistence;

import com.statecore.core.exception.StorageException;
import com.statecore.core.exception.VersionConflictException;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.StateEvent;
import com.statecore.core.repository.EventRepository;
import com.statecore.core.repository.StateStore;
import com.statecore.core.repository.StoreSession;
import com.statecore.core.repository.VersionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * In-memory version store and event log sharing one atomic commit path.
 *
 * Atomic units run one at a time under a fair commit lock. Writes are buffered
 * in the session and applied to both repositories under a short write lock,
 * so readers see all of a commit or none of it.
 */
public class InMemoryStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStateStore.class);

    private final ReentrantLock commitLock = new ReentrantLock(true);
    private final ReadWriteLock visibilityLock = new ReentrantReadWriteLock();
    private final InMemoryVersionRepository versionRepository;
    private final InMemoryEventRepository eventRepository;

    public InMemoryStateStore() {
        this.versionRepository = new InMemoryVersionRepository(visibilityLock.readLock());
        this.eventRepository = new InMemoryEventRepository(visibilityLock.readLock());
    }

    public VersionRepository versionRepository() {
        return versionRepository;
    }

    public EventRepository eventRepository() {
        return eventRepository;
    }

    @Override
    public <T> T executeAtomically(Function<StoreSession, T> work, Duration timeout) {
        boolean acquired;
        try {
            acquired = commitLock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting for the commit lock", e);
        }
        if (!acquired) {
            throw new StorageException(
                "Commit lock not acquired within " + timeout.toMillis() + " ms", null);
        }

        try {
            BufferedSession session = new BufferedSession();
            T result = work.apply(session);
            session.apply();
            return result;
        } finally {
            commitLock.unlock();
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    /**
     * Session that validates writes against committed state plus its own buffer.
     * Only used by the thread holding the commit lock.
     */
    private final class BufferedSession implements StoreSession {

        private final Map<EntityKey, EntitySnapshot> pendingVersions = new HashMap<>();
        private final Map<EntityKey, Long> pendingEventVersions = new HashMap<>();
        private final List<EntitySnapshot> snapshots = new ArrayList<>();
        private final List<StateEvent> events = new ArrayList<>();

        @Override
        public long lockCurrentVersion(EntityKey key) {
            EntitySnapshot pending = pendingVersions.get(key);
            return pending != null ? pending.version() : versionRepository.currentVersion(key);
        }

        @Override
        public Optional<EntitySnapshot> findLatest(EntityKey key) {
            EntitySnapshot pending = pendingVersions.get(key);
            return pending != null ? Optional.of(pending) : Optional.ofNullable(versionRepository.latest(key));
        }

        @Override
        public void putVersion(EntitySnapshot snapshot) {
            long current = lockCurrentVersion(snapshot.key());
            if (snapshot.version() != current + 1) {
                throw new VersionConflictException(snapshot.key(), current, snapshot.version());
            }
            pendingVersions.put(snapshot.key(), snapshot);
            snapshots.add(snapshot);
        }

        @Override
        public void appendEvent(StateEvent event) {
            long lastLogged = pendingEventVersions.getOrDefault(event.key(), eventRepository.lastVersion(event.key()));
            if (event.version() != lastLogged + 1) {
                throw new VersionConflictException(event.key(), lastLogged, event.version());
            }
            pendingEventVersions.put(event.key(), event.version());
            events.add(event);
        }

        void apply() {
            if (snapshots.isEmpty() && events.isEmpty()) {
                return;
            }
            visibilityLock.writeLock().lock();
            try {
                eventRepository.applyAll(events);
                versionRepository.applyAll(snapshots);
            } finally {
                visibilityLock.writeLock().unlock();
            }
            log.debug("Applied {} versions and {} events", snapshots.size(), events.size());
        }
    }
}
