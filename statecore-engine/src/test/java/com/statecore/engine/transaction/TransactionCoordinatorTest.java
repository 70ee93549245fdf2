package com.statecore.engine.transaction;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statecore.core.exception.StorageException;
import com.statecore.core.exception.TransactionStateException;
import com.statecore.core.fold.EventFold;
import com.statecore.core.model.AccessMode;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.EntityType;
import com.statecore.core.model.StateChangeNotice;
import com.statecore.core.model.StateEvent;
import com.statecore.core.model.StateEventType;
import com.statecore.core.model.VersionInfo;
import com.statecore.core.repository.VersionRepository;
import com.statecore.engine.rollback.RollbackResult;
import com.statecore.engine.rollback.RollbackTarget;
import com.statecore.engine.test.StateCoreFixture;
import com.statecore.engine.test.TimeController;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionCoordinatorTest {

    private static final EntityKey T1 = EntityKey.of(EntityType.TASK, "T1");
    private static final EntityKey W1 = EntityKey.of(EntityType.WORKFLOW, "W1");

    private TimeController time;
    private StateCoreFixture core;
    private TransactionCoordinator coordinator;
    private VersionRepository versions;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        time = TimeController.frozen();
        core = new StateCoreFixture(time);
        coordinator = core.coordinator;
        versions = core.store.versionRepository();
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        core.close();
    }

    private static ObjectNode status(String value) {
        return JsonNodeFactory.instance.objectNode().put("status", value);
    }

    private EntitySnapshot seed(EntityKey key, ObjectNode payload) {
        Transaction tx = coordinator.begin(AccessMode.OPTIMISTIC, "seed");
        tx.stagePayload(key.entityType(), key.entityId(), payload);
        return tx.commit().orThrow().snapshot(key).orElseThrow();
    }

    private String currentStatus(EntityKey key) {
        return versions.findLatest(key.entityType(), key.entityId()).orElseThrow().field("status");
    }

    // ========== Basic commits ==========

    @Test
    void commit_createsVersionOneWithCreatedEvent() {
        EntitySnapshot created = seed(T1, status("pending"));

        assertThat(created.version()).isEqualTo(1);
        assertThat(created.eventType()).isEqualTo(StateEventType.CREATED);
        assertThat(created.actor()).isEqualTo("seed");
        assertThat(core.store.eventRepository().findByEntity(EntityType.TASK, "T1"))
            .singleElement()
            .satisfies(event -> {
                assertThat(event.version()).isEqualTo(1);
                assertThat(event.eventType()).isEqualTo(StateEventType.CREATED);
            });
    }

    @Test
    @DisplayName("Staged writes stay invisible until commit and vanish on abort")
    void stagedWrites_invisibleUntilCommit() {
        seed(T1, status("pending"));

        Transaction tx = coordinator.begin(AccessMode.OPTIMISTIC, "agent-1");
        tx.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "running"));

        assertThat(currentStatus(T1)).isEqualTo("pending");
        assertThat(tx.readEntity(T1)).hasValueSatisfying(s -> assertThat(s.field("status")).isEqualTo("pending"));

        tx.abort();

        assertThat(tx.status()).isEqualTo(TransactionStatus.ABORTED);
        assertThat(versions.currentVersion(EntityType.TASK, "T1")).isEqualTo(1);
        assertThat(coordinator.activeTransactionCount()).isZero();
    }

    @Test
    void stageWrite_composesMultipleMutationsOfOneEntity() {
        seed(T1, status("pending"));

        Transaction tx = coordinator.begin(AccessMode.OPTIMISTIC, "agent-1");
        tx.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "running"));
        tx.stageWrite(EntityType.TASK, "T1", p -> p.put("progress", 10));
        EntitySnapshot written = tx.commit().orThrow().snapshot(T1).orElseThrow();

        assertThat(written.version()).isEqualTo(2);
        assertThat(written.field("status")).isEqualTo("running");
        assertThat(written.payload().get("progress").asInt()).isEqualTo(10);
    }

    @Test
    void commit_twiceIsRejected() {
        Transaction tx = coordinator.begin(AccessMode.OPTIMISTIC, "agent-1");
        tx.stagePayload(EntityType.TASK, "T1", status("pending"));
        tx.commit();

        assertThatThrownBy(tx::commit).isInstanceOf(TransactionStateException.class);
        assertThatThrownBy(() -> tx.stageDelete(EntityType.TASK, "T1"))
            .isInstanceOf(TransactionStateException.class);
    }

    @Test
    void lock_requiresPessimisticMode() {
        Transaction tx = coordinator.begin(AccessMode.OPTIMISTIC, "agent-1");

        assertThatThrownBy(() -> tx.lock(T1)).isInstanceOf(TransactionStateException.class);
    }

    @Test
    void begin_rejectsBlankActor() {
        assertThatThrownBy(() -> coordinator.begin(AccessMode.OPTIMISTIC, " "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ========== Optimistic concurrency ==========

    @Test
    @DisplayName("Task T1: conflicting writers, retry, history and rollback")
    void taskLifecycleScenario() {
        seed(T1, status("pending"));

        Transaction a = coordinator.begin(AccessMode.OPTIMISTIC, "agent-a");
        Transaction b = coordinator.begin(AccessMode.OPTIMISTIC, "agent-b");
        assertThat(a.readEntity(T1)).hasValueSatisfying(s -> assertThat(s.version()).isEqualTo(1));
        assertThat(b.readEntity(T1)).hasValueSatisfying(s -> assertThat(s.version()).isEqualTo(1));
        a.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "running"));
        b.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "running"));

        CommitResult first = a.commit();
        CommitResult second = b.commit();

        assertThat(first).isInstanceOfSatisfying(CommitResult.Committed.class,
            c -> assertThat(c.version(T1)).isEqualTo(2));
        assertThat(second).isInstanceOfSatisfying(CommitResult.OptimisticConflict.class, c -> {
            assertThat(c.entityKey()).isEqualTo(T1);
            assertThat(c.expectedVersion()).isEqualTo(1);
            assertThat(c.actualVersion()).isEqualTo(2);
        });
        assertThat(b.status()).isEqualTo(TransactionStatus.ABORTED);

        Transaction retry = coordinator.begin(AccessMode.OPTIMISTIC, "agent-b");
        assertThat(retry.readEntity(T1)).hasValueSatisfying(s -> assertThat(s.version()).isEqualTo(2));
        retry.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "cancelled"));
        assertThat(retry.commit().orThrow().version(T1)).isEqualTo(3);

        assertThat(core.historyService.getHistory(EntityType.TASK, "T1"))
            .extracting(VersionInfo::version)
            .containsExactly(1L, 2L, 3L);

        RollbackResult rollback = core.rollbackCoordinator.rollbackTo(
            EntityType.TASK, "T1", RollbackTarget.version(1), "operator request", "ops");

        assertThat(rollback.newVersion()).isEqualTo(4);
        assertThat(rollback.snapshot().field("status")).isEqualTo("pending");
        assertThat(rollback.snapshot().eventType()).isEqualTo(StateEventType.ROLLBACK);
    }

    @Test
    @DisplayName("Two optimistic writers racing on one version: exactly one commits")
    void concurrentOptimisticWriters_exactlyOneSucceeds() throws Exception {
        seed(T1, status("pending"));
        CountDownLatch bothRead = new CountDownLatch(2);

        List<Future<CommitResult>> futures = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            String actor = "agent-" + i;
            futures.add(executor.submit(() -> {
                Transaction tx = coordinator.begin(AccessMode.OPTIMISTIC, actor);
                tx.readEntity(T1);
                tx.stageWrite(EntityType.TASK, "T1", p -> p.put("status", actor));
                bothRead.countDown();
                bothRead.await();
                return tx.commit();
            }));
        }

        List<CommitResult> results = new ArrayList<>();
        for (Future<CommitResult> future : futures) {
            results.add(future.get(5, TimeUnit.SECONDS));
        }

        assertThat(results).filteredOn(CommitResult::isCommitted).hasSize(1);
        assertThat(results).filteredOn(r -> r instanceof CommitResult.OptimisticConflict).hasSize(1);
        assertThat(versions.currentVersion(EntityType.TASK, "T1")).isEqualTo(2);
    }

    @Test
    @DisplayName("Concurrent writers leave a gap-free version sequence")
    void concurrentRetriedWriters_produceGapFreeVersions() throws Exception {
        ObjectNode initial = status("running").put("counter", 0);
        seed(T1, initial);
        int writers = 8;
        int incrementsEach = 10;

        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            String actor = "writer-" + w;
            futures.add(executor.submit(() -> {
                for (int i = 0; i < incrementsEach; i++) {
                    core.retrier.execute(AccessMode.OPTIMISTIC, actor, tx -> {
                        int counter = tx.readEntity(T1).orElseThrow().payload().get("counter").asInt();
                        tx.stageWrite(EntityType.TASK, "T1", p -> p.put("counter", counter + 1));
                    });
                }
                return null;
            }));
        }
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }

        long expectedVersions = 1L + (long) writers * incrementsEach;
        List<VersionInfo> history = versions.listVersions(EntityType.TASK, "T1");
        assertThat(history).hasSize((int) expectedVersions);
        for (int i = 0; i < history.size(); i++) {
            assertThat(history.get(i).version()).isEqualTo(i + 1L);
        }
        assertThat(versions.findLatest(EntityType.TASK, "T1").orElseThrow().payload().get("counter").asInt())
            .isEqualTo(writers * incrementsEach);
        assertThat(core.store.eventRepository().findByEntity(EntityType.TASK, "T1"))
            .extracting(StateEvent::version)
            .doesNotHaveDuplicates()
            .hasSize((int) expectedVersions);
    }

    @Test
    void blindWrite_conflictsWhenEntityMovesAfterStaging() {
        seed(T1, status("pending"));

        Transaction blind = coordinator.begin(AccessMode.OPTIMISTIC, "agent-1");
        blind.stageWrite(EntityType.TASK, "T1", p -> p.put("priority", 5));

        Transaction other = coordinator.begin(AccessMode.OPTIMISTIC, "agent-2");
        other.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "running"));
        other.commit().orThrow();

        assertThat(blind.commit()).isInstanceOf(CommitResult.OptimisticConflict.class);
    }

    // ========== Pessimistic concurrency ==========

    @Test
    @DisplayName("Pessimistic holder blocks a second pessimistic transaction until it commits")
    void pessimisticLock_blocksSecondTransactionUntilRelease() throws Exception {
        seed(T1, status("pending"));

        Transaction holder = coordinator.begin(AccessMode.PESSIMISTIC, "scheduler");
        holder.readEntity(T1);
        holder.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "running"));

        CountDownLatch started = new CountDownLatch(1);
        Future<EntitySnapshot> waiter = executor.submit(() -> {
            Transaction tx = coordinator.begin(AccessMode.PESSIMISTIC, "agent-1", Duration.ofSeconds(5));
            started.countDown();
            EntitySnapshot seen = tx.readEntity(T1).orElseThrow();
            tx.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "completed"));
            tx.commit().orThrow();
            return seen;
        });

        started.await();
        Thread.sleep(100);
        assertThat(waiter.isDone()).isFalse();

        holder.commit().orThrow();
        EntitySnapshot seenByWaiter = waiter.get(5, TimeUnit.SECONDS);

        assertThat(seenByWaiter.version()).isEqualTo(2);
        assertThat(seenByWaiter.field("status")).isEqualTo("running");
        assertThat(currentStatus(T1)).isEqualTo("completed");
        assertThat(core.concurrencyController.activeLockCount()).isZero();
    }

    @Test
    void pessimisticAbort_releasesLocks() {
        Transaction holder = coordinator.begin(AccessMode.PESSIMISTIC, "scheduler");
        holder.lock(T1, W1);
        assertThat(holder.heldLockKeys()).containsExactlyInAnyOrder(T1.lockKey(), W1.lockKey());

        holder.abort();

        assertThat(core.concurrencyController.activeLockCount()).isZero();
        Transaction next = coordinator.begin(AccessMode.PESSIMISTIC, "agent-1", Duration.ZERO);
        next.lock(T1);
        assertThat(next.heldLockKeys()).containsExactly(T1.lockKey());
        next.abort();
    }

    @Test
    @DisplayName("Commit after the lease lapsed returns LockExpired and writes nothing")
    void pessimisticCommit_afterLeaseExpiry_reportsLockExpired() {
        seed(T1, status("pending"));

        Transaction tx = coordinator.begin(AccessMode.PESSIMISTIC, "scheduler");
        tx.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "running"));
        time.advanceSeconds(31);

        CommitResult result = tx.commit();

        assertThat(result).isInstanceOfSatisfying(CommitResult.LockExpired.class,
            r -> assertThat(r.lockKey()).isEqualTo(T1.lockKey()));
        assertThat(tx.status()).isEqualTo(TransactionStatus.ABORTED);
        assertThat(versions.currentVersion(EntityType.TASK, "T1")).isEqualTo(1);
    }

    @Test
    void renewLocks_keepsLeaseAliveAcrossLongWork() {
        seed(T1, status("pending"));

        Transaction tx = coordinator.begin(AccessMode.PESSIMISTIC, "scheduler");
        tx.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "running"));
        time.advanceSeconds(20);
        assertThat(tx.renewLocks()).isTrue();
        time.advanceSeconds(20);

        assertThat(tx.commit().isCommitted()).isTrue();
    }

    @Test
    @DisplayName("Optimistic writer yields to an entity locked by a pessimistic transaction")
    void optimisticCommit_onLockedEntity_conflicts() {
        seed(T1, status("pending"));
        Transaction pessimistic = coordinator.begin(AccessMode.PESSIMISTIC, "rollback");
        pessimistic.lock(T1);

        Transaction optimistic = coordinator.begin(AccessMode.OPTIMISTIC, "agent-1");
        optimistic.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "running"));

        assertThat(optimistic.commit()).isInstanceOf(CommitResult.OptimisticConflict.class);
        assertThat(versions.currentVersion(EntityType.TASK, "T1")).isEqualTo(1);
        pessimistic.abort();
    }

    @Test
    @DisplayName("A lock granted while an optimistic commit is writing reads the version that commit produces")
    void pessimisticRead_waitsForInFlightOptimisticCommit() throws Exception {
        seed(T1, status("pending"));
        CountDownLatch writing = new CountDownLatch(1);
        CountDownLatch releaseWrite = new CountDownLatch(1);
        core.failingStore.pauseNextWriteTo(T1, writing, releaseWrite);

        Transaction optimistic = coordinator.begin(AccessMode.OPTIMISTIC, "agent-1");
        optimistic.readEntity(T1);
        optimistic.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "running"));
        Future<CommitResult> optimisticCommit = executor.submit(optimistic::commit);
        assertThat(writing.await(5, TimeUnit.SECONDS)).isTrue();

        // Lease checks of the optimistic commit are done; the lock is free
        CountDownLatch locked = new CountDownLatch(1);
        Future<CommitResult> pessimisticCommit = executor.submit(() -> {
            Transaction pessimistic = coordinator.begin(AccessMode.PESSIMISTIC, "operator");
            pessimistic.lock(T1);
            locked.countDown();
            pessimistic.readEntity(T1);
            pessimistic.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "cancelled"));
            return pessimistic.commit();
        });
        assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        releaseWrite.countDown();

        CommitResult first = optimisticCommit.get(5, TimeUnit.SECONDS);
        CommitResult second = pessimisticCommit.get(5, TimeUnit.SECONDS);

        assertThat(first).isInstanceOf(CommitResult.Committed.class);
        assertThat(second).isInstanceOf(CommitResult.Committed.class);
        assertThat(second.orThrow().snapshot(T1).orElseThrow().version()).isEqualTo(3);
        assertThat(currentStatus(T1)).isEqualTo("cancelled");
    }

    // ========== Multi-entity atomicity ==========

    @Test
    void multiEntityCommit_writesAllEntitiesAtOnce() {
        seed(T1, status("pending").put("workflow_id", "W1"));
        seed(W1, status("running"));

        Transaction tx = coordinator.begin(AccessMode.OPTIMISTIC, "engine");
        tx.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "completed"));
        tx.stageWrite(EntityType.WORKFLOW, "W1", p -> p.put("completed_tasks", 1));
        CommitResult.Committed committed = tx.commit().orThrow();

        assertThat(committed.snapshots()).extracting(EntitySnapshot::key).containsExactly(T1, W1);
        assertThat(committed.snapshots()).allSatisfy(s -> {
            assertThat(s.version()).isEqualTo(2);
            assertThat(s.committedAt()).isEqualTo(committed.committedAt());
        });
        List<StateEvent> taskEvents = core.store.eventRepository().findByEntity(EntityType.TASK, "T1");
        List<StateEvent> workflowEvents = core.store.eventRepository().findByEntity(EntityType.WORKFLOW, "W1");
        assertThat(taskEvents.get(1).transactionId()).isEqualTo(workflowEvents.get(1).transactionId());
    }

    @Test
    @DisplayName("A conflict on one entity leaves every entity in the transaction untouched")
    void multiEntityCommit_conflictOnOneEntity_writesNothing() {
        seed(T1, status("pending"));
        seed(W1, status("running"));

        Transaction tx = coordinator.begin(AccessMode.OPTIMISTIC, "engine");
        tx.readEntity(T1);
        tx.readEntity(W1);
        tx.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "completed"));
        tx.stageWrite(EntityType.WORKFLOW, "W1", p -> p.put("status", "completed"));

        Transaction interloper = coordinator.begin(AccessMode.OPTIMISTIC, "agent-2");
        interloper.stageWrite(EntityType.WORKFLOW, "W1", p -> p.put("status", "paused"));
        interloper.commit().orThrow();

        assertThat(tx.commit()).isInstanceOfSatisfying(CommitResult.OptimisticConflict.class,
            c -> assertThat(c.entityKey()).isEqualTo(W1));
        assertThat(versions.currentVersion(EntityType.TASK, "T1")).isEqualTo(1);
        assertThat(currentStatus(W1)).isEqualTo("paused");
    }

    @Test
    @DisplayName("A storage failure mid-commit leaves every entity untouched")
    void multiEntityCommit_storageFailure_writesNothing() {
        seed(T1, status("pending"));
        seed(W1, status("running"));

        Transaction tx = coordinator.begin(AccessMode.OPTIMISTIC, "engine");
        tx.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "completed"));
        tx.stageWrite(EntityType.WORKFLOW, "W1", p -> p.put("status", "completed"));
        core.failingStore.failNextWriteTo(W1);

        assertThatThrownBy(tx::commit).isInstanceOf(StorageException.class);

        assertThat(tx.status()).isEqualTo(TransactionStatus.FAILED);
        assertThat(versions.currentVersion(EntityType.TASK, "T1")).isEqualTo(1);
        assertThat(versions.currentVersion(EntityType.WORKFLOW, "W1")).isEqualTo(1);
        assertThat(core.store.eventRepository().findByEntity(EntityType.TASK, "T1")).hasSize(1);
        assertThat(coordinator.activeTransactionCount()).isZero();
    }

    // ========== Event log ==========

    @Test
    @DisplayName("Folding the event log reproduces every stored version")
    void eventFold_reproducesEveryStoredVersion() {
        seed(T1, status("pending").put("priority", 3).put("note", "initial"));
        update(p -> p.put("status", "running"));
        update(p -> {
            p.remove("note");
            return p.put("progress", 50);
        });
        core.entityService.delete(EntityType.TASK, "T1", "ops");
        core.rollbackCoordinator.rollbackTo(EntityType.TASK, "T1", RollbackTarget.version(2), null, "ops");

        List<StateEvent> events = core.store.eventRepository().findByEntity(EntityType.TASK, "T1");
        assertThat(events).hasSize(5);
        for (VersionInfo info : versions.listVersions(EntityType.TASK, "T1")) {
            ObjectNode stored = versions.findVersion(EntityType.TASK, "T1", info.version()).orElseThrow().payload();
            assertThat(EventFold.foldToVersion(events, info.version())).isEqualTo(stored);
        }
        assertThat(core.historyService.verifyIntegrity(EntityType.TASK, "T1").isConsistent()).isTrue();
    }

    private void update(UnaryOperator<ObjectNode> mutator) {
        Transaction tx = coordinator.begin(AccessMode.OPTIMISTIC, "agent-1");
        tx.stageWrite(EntityType.TASK, "T1", mutator);
        tx.commit().orThrow();
    }

    @Test
    void commitTime_neverMovesBackwardsForAnEntity() {
        EntitySnapshot first = seed(T1, status("pending"));
        time.rewind(Duration.ofMinutes(5));

        update(p -> p.put("status", "running"));

        EntitySnapshot second = versions.findLatest(EntityType.TASK, "T1").orElseThrow();
        assertThat(second.committedAt()).isEqualTo(first.committedAt());
    }

    @Test
    void commit_publishesChangeNotices() throws InterruptedException {
        List<StateChangeNotice> received = new CopyOnWriteArrayList<>();
        CountDownLatch delivered = new CountDownLatch(2);
        core.changeStream.subscribe(notice -> {
            received.add(notice);
            delivered.countDown();
        });

        seed(T1, status("pending"));
        update(p -> p.put("status", "running"));

        assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(received).extracting(StateChangeNotice::version).containsExactly(1L, 2L);
        assertThat(received.get(1).eventType()).isEqualTo(StateEventType.UPDATED.wireName());
        assertThat(received.get(1).actor()).isEqualTo("agent-1");
    }

    @Test
    void abortAll_abortsOpenTransactions() {
        Transaction one = coordinator.begin(AccessMode.OPTIMISTIC, "agent-1");
        Transaction two = coordinator.begin(AccessMode.PESSIMISTIC, "agent-2");
        two.lock(T1);

        assertThat(coordinator.abortAll("shutdown")).isEqualTo(2);

        assertThat(one.status()).isEqualTo(TransactionStatus.ABORTED);
        assertThat(two.status()).isEqualTo(TransactionStatus.ABORTED);
        assertThat(core.concurrencyController.activeLockCount()).isZero();
    }
}
