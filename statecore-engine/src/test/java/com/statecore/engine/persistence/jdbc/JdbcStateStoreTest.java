package com.statecore.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statecore.core.exception.StorageException;
import com.statecore.core.model.AccessMode;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntitySnapshot;
import com.statecore.core.model.EntityType;
import com.statecore.core.model.LockLease;
import com.statecore.core.model.RetryPolicy;
import com.statecore.core.model.StateEvent;
import com.statecore.core.model.StateEventType;
import com.statecore.core.model.VersionInfo;
import com.statecore.engine.cache.CacheDependencyTable;
import com.statecore.engine.cache.CacheManager;
import com.statecore.engine.cache.InMemorySharedCacheTier;
import com.statecore.engine.cache.LocalCacheTier;
import com.statecore.engine.concurrency.ConcurrencyController;
import com.statecore.engine.events.StateChangeStream;
import com.statecore.engine.history.EntityHistoryService;
import com.statecore.engine.metrics.StateMetrics;
import com.statecore.engine.rollback.RollbackCoordinator;
import com.statecore.engine.rollback.RollbackResult;
import com.statecore.engine.rollback.RollbackTarget;
import com.statecore.engine.test.FailingStateStore;
import com.statecore.engine.transaction.CommitResult;
import com.statecore.engine.transaction.Transaction;
import com.statecore.engine.transaction.TransactionCoordinator;
import com.statecore.engine.transaction.TransactionRetrier;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Commit path against a real PostgreSQL instance.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class JdbcStateStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("statecore_test")
        .withUsername("test")
        .withPassword("test");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.systemUTC();

    private HikariDataSource dataSource;
    private JdbcTemplate jdbcTemplate;
    private JdbcVersionRepository versionRepository;
    private JdbcEventRepository eventRepository;
    private JdbcLockRepository lockRepository;
    private FailingStateStore store;
    private TransactionCoordinator coordinator;
    private TransactionRetrier retrier;
    private RollbackCoordinator rollbackCoordinator;
    private EntityHistoryService historyService;
    private StateChangeStream changeStream;
    private ExecutorService executor;

    @BeforeAll
    void setUpStore() {
        dataSource = new HikariDataSource();
        dataSource.setJdbcUrl(postgres.getJdbcUrl());
        dataSource.setUsername(postgres.getUsername());
        dataSource.setPassword(postgres.getPassword());
        dataSource.setMaximumPoolSize(10);
        new ResourceDatabasePopulator(new ClassPathResource("db/statecore-schema.sql")).execute(dataSource);

        jdbcTemplate = new JdbcTemplate(dataSource);
        versionRepository = new JdbcVersionRepository(jdbcTemplate, objectMapper);
        eventRepository = new JdbcEventRepository(jdbcTemplate, objectMapper);
        lockRepository = new JdbcLockRepository(jdbcTemplate);
        store = new FailingStateStore(new JdbcStateStore(jdbcTemplate,
            new DataSourceTransactionManager(dataSource), versionRepository, eventRepository, clock));

        StateMetrics metrics = new StateMetrics(new SimpleMeterRegistry());
        CacheManager cacheManager = new CacheManager(
            new LocalCacheTier(clock, Duration.ofMinutes(5), 1000),
            new InMemorySharedCacheTier(clock, Duration.ofHours(1)),
            versionRepository, CacheDependencyTable.defaults(), metrics);
        ConcurrencyController concurrencyController = new ConcurrencyController(
            lockRepository, clock, Duration.ofSeconds(30), Duration.ofMillis(10), metrics);
        changeStream = new StateChangeStream(1);
        coordinator = new TransactionCoordinator(store, versionRepository, concurrencyController, cacheManager,
            changeStream, metrics, clock, Duration.ofSeconds(5), Duration.ofSeconds(5));
        retrier = new TransactionRetrier(coordinator, RetryPolicy.builder()
            .maxAttempts(100)
            .initialBackoff(Duration.ofMillis(2))
            .maxBackoff(Duration.ofMillis(50))
            .build(), metrics);
        rollbackCoordinator = new RollbackCoordinator(coordinator, versionRepository, eventRepository, metrics);
        historyService = new EntityHistoryService(versionRepository, eventRepository, cacheManager);
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterAll
    void tearDownStore() {
        executor.shutdownNow();
        changeStream.close();
        dataSource.close();
    }

    @BeforeEach
    void cleanTables() {
        jdbcTemplate.update("TRUNCATE entity_heads, entity_versions, state_events, state_locks");
        store.setUnavailable(false);
    }

    private ObjectNode json() {
        return objectMapper.createObjectNode();
    }

    private EntitySnapshot write(EntityKey key, ObjectNode fields) {
        return retrier.execute(AccessMode.OPTIMISTIC, "test", tx ->
            tx.stageWrite(key.entityType(), key.entityId(), p -> p.setAll(fields.deepCopy())))
            .snapshot(key).orElseThrow();
    }

    // ========== Commit path ==========

    @Test
    void commit_persistsVersionEventAndHead() {
        EntityKey key = EntityKey.of(EntityType.TASK, "T1");

        EntitySnapshot created = write(key, json().put("status", "pending").put("workflow_id", "W1"));
        EntitySnapshot updated = write(key, json().put("status", "running"));

        assertThat(versionRepository.currentVersion(EntityType.TASK, "T1")).isEqualTo(2);
        assertThat(versionRepository.findLatest(EntityType.TASK, "T1")).contains(updated);
        assertThat(versionRepository.findVersion(EntityType.TASK, "T1", 1)).contains(created);

        List<StateEvent> events = eventRepository.findByEntity(EntityType.TASK, "T1");
        assertThat(events).extracting(StateEvent::version).containsExactly(1L, 2L);
        assertThat(events).extracting(StateEvent::eventType)
            .containsExactly(StateEventType.CREATED, StateEventType.UPDATED);
        assertThat(eventRepository.findById(events.get(1).eventId())).contains(events.get(1));
        assertThat(historyService.verifyIntegrity(EntityType.TASK, "T1").isConsistent()).isTrue();
    }

    @Test
    void readOnlyTransaction_leavesNoHeadRows() {
        Transaction tx = coordinator.begin(AccessMode.OPTIMISTIC, "reader");
        tx.readEntity(EntityType.TASK, "ghost");

        CommitResult result = tx.commit();

        assertThat(result.isCommitted()).isTrue();
        Integer heads = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM entity_heads", Integer.class);
        assertThat(heads).isZero();
    }

    @Test
    @DisplayName("A failure writing the second entity rolls back the first")
    void multiEntityCommit_failureRollsBackEverything() {
        EntityKey task = EntityKey.of(EntityType.TASK, "T1");
        EntityKey workflow = EntityKey.of(EntityType.WORKFLOW, "W1");
        write(task, json().put("status", "pending"));
        write(workflow, json().put("status", "running"));

        Transaction tx = coordinator.begin(AccessMode.OPTIMISTIC, "engine");
        tx.stageWrite(EntityType.TASK, "T1", p -> p.put("status", "completed"));
        tx.stageWrite(EntityType.WORKFLOW, "W1", p -> p.put("status", "completed"));
        store.failNextWriteTo(workflow);

        assertThatThrownBy(tx::commit).isInstanceOf(StorageException.class);

        assertThat(versionRepository.currentVersion(EntityType.TASK, "T1")).isEqualTo(1);
        assertThat(eventRepository.findByEntity(EntityType.TASK, "T1")).hasSize(1);
        assertThat(versionRepository.currentVersion(EntityType.WORKFLOW, "W1")).isEqualTo(1);
    }

    @Test
    @DisplayName("Concurrent writers produce a gap-free version sequence")
    void concurrentWriters_gapFree() throws Exception {
        EntityKey key = EntityKey.of(EntityType.TASK, "T1");
        write(key, json().put("counter", 0));

        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < 4; w++) {
            futures.add(executor.submit(() -> {
                for (int i = 0; i < 5; i++) {
                    retrier.execute(AccessMode.OPTIMISTIC, "writer", tx -> {
                        int counter = tx.readEntity(key).orElseThrow().payload().get("counter").asInt();
                        tx.stageWrite(EntityType.TASK, "T1", p -> p.put("counter", counter + 1));
                    });
                }
                return null;
            }));
        }
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }

        List<VersionInfo> versions = versionRepository.listVersions(EntityType.TASK, "T1");
        assertThat(versions).extracting(VersionInfo::version)
            .containsExactlyElementsOf(LongStream.rangeClosed(1, 21).boxed().toList());
        assertThat(versionRepository.findLatest(EntityType.TASK, "T1").orElseThrow().payload().get("counter").asInt())
            .isEqualTo(20);
    }

    // ========== History ==========

    @Test
    void rollbackAndTimeLookup_workAgainstPostgres() throws InterruptedException {
        EntityKey key = EntityKey.of(EntityType.AGENT, "A1");
        write(key, json().put("status", "idle"));
        Thread.sleep(20);
        Instant afterFirst = Instant.now();
        Thread.sleep(20);
        write(key, json().put("status", "busy"));

        assertThat(historyService.getEntityAtTime(EntityType.AGENT, "A1", afterFirst).version()).isEqualTo(1);

        RollbackResult result = rollbackCoordinator.rollbackTo(
            EntityType.AGENT, "A1", RollbackTarget.time(afterFirst), "reset", "ops");

        assertThat(result.newVersion()).isEqualTo(3);
        assertThat(result.snapshot().field("status")).isEqualTo("idle");
        assertThat(eventRepository.findByVersion(EntityType.AGENT, "A1", 3))
            .hasValueSatisfying(e -> assertThat(e.eventType()).isEqualTo(StateEventType.ROLLBACK));
        assertThat(historyService.verifyIntegrity(EntityType.AGENT, "A1").isConsistent()).isTrue();
    }

    @Test
    void listLatest_excludesDeletedUnlessAsked() {
        write(EntityKey.of(EntityType.AGENT, "A1"), json().put("status", "idle"));
        write(EntityKey.of(EntityType.AGENT, "A2"), json().put("status", "deleted"));

        assertThat(versionRepository.listLatest(EntityType.AGENT, 10, 0, false))
            .extracting(EntitySnapshot::entityId).containsExactly("A1");
        assertThat(versionRepository.listLatest(EntityType.AGENT, 10, 0, true))
            .extracting(EntitySnapshot::entityId).containsExactly("A1", "A2");
    }

    // ========== Locks ==========

    @Test
    void lockRepository_fencesTakeoverAndKeepsTokenAcrossRelease() {
        Instant now = Instant.now();
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();

        LockLease lease = lockRepository.tryAcquire("task:T1", first, "first", Duration.ofSeconds(30), now)
            .orElseThrow();
        assertThat(lockRepository.tryAcquire("task:T1", second, "second", Duration.ofSeconds(30), now)).isEmpty();

        LockLease reentrant = lockRepository.tryAcquire("task:T1", first, "first", Duration.ofSeconds(30), now)
            .orElseThrow();
        assertThat(reentrant.fenceToken()).isEqualTo(lease.fenceToken());

        LockLease takeover = lockRepository.tryAcquire(
            "task:T1", second, "second", Duration.ofSeconds(30), now.plusSeconds(31)).orElseThrow();
        assertThat(takeover.fenceToken()).isGreaterThan(lease.fenceToken());
        assertThat(lockRepository.isHeld("task:T1", first, lease.fenceToken(), now.plusSeconds(31))).isFalse();

        assertThat(lockRepository.release("task:T1", second)).isTrue();
        LockLease next = lockRepository.tryAcquire("task:T1", first, "first", Duration.ofSeconds(30), now.plusSeconds(32))
            .orElseThrow();
        assertThat(next.fenceToken()).isGreaterThan(takeover.fenceToken());
    }

    @Test
    void isAvailable_probesDatabase() {
        assertThat(store.isAvailable()).isTrue();
    }
}
