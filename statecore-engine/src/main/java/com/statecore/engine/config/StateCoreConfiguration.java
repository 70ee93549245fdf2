package com.statecore.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.statecore.core.repository.EventRepository;
import com.statecore.core.repository.LockRepository;
import com.statecore.core.repository.StateStore;
import com.statecore.core.repository.VersionRepository;
import com.statecore.engine.cache.CacheDependencyTable;
import com.statecore.engine.cache.CacheManager;
import com.statecore.engine.cache.CacheTier;
import com.statecore.engine.cache.DependencyRule;
import com.statecore.engine.cache.InMemorySharedCacheTier;
import com.statecore.engine.cache.LocalCacheTier;
import com.statecore.engine.cache.NoOpCacheTier;
import com.statecore.engine.cache.RedisCacheTier;
import com.statecore.engine.concurrency.ConcurrencyController;
import com.statecore.engine.entity.EntityStateService;
import com.statecore.engine.events.StateChangeStream;
import com.statecore.engine.health.StateCoreHealthIndicator;
import com.statecore.engine.history.EntityHistoryService;
import com.statecore.engine.lifecycle.GracefulShutdownHandler;
import com.statecore.engine.lifecycle.StateMaintenanceScheduler;
import com.statecore.engine.metrics.StateMetrics;
import com.statecore.engine.persistence.InMemoryLockRepository;
import com.statecore.engine.persistence.InMemoryStateStore;
import com.statecore.engine.persistence.jdbc.JdbcEventRepository;
import com.statecore.engine.persistence.jdbc.JdbcLockRepository;
import com.statecore.engine.persistence.jdbc.JdbcStateStore;
import com.statecore.engine.persistence.jdbc.JdbcVersionRepository;
import com.statecore.engine.rollback.RollbackCoordinator;
import com.statecore.engine.transaction.TransactionCoordinator;
import com.statecore.engine.transaction.TransactionRetrier;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Wires the state core. Storage and the shared cache tier are chosen by
 * {@code statecore.storage} and {@code statecore.cache.l2}.
 */
@Configuration
@EnableConfigurationProperties(StateCoreProperties.class)
public class StateCoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StateCoreConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "statecore");
    }

    @Bean
    public StateMetrics stateMetrics(MeterRegistry meterRegistry) {
        return new StateMetrics(meterRegistry);
    }

    // ========== Storage ==========

    @Configuration
    @ConditionalOnProperty(prefix = "statecore", name = "storage", havingValue = "memory", matchIfMissing = true)
    static class InMemoryStorageConfiguration {

        @Bean
        public InMemoryStateStore stateStore() {
            log.info("Using in-memory state storage");
            return new InMemoryStateStore();
        }

        @Bean
        public VersionRepository versionRepository(InMemoryStateStore stateStore) {
            return stateStore.versionRepository();
        }

        @Bean
        public EventRepository eventRepository(InMemoryStateStore stateStore) {
            return stateStore.eventRepository();
        }

        @Bean
        public LockRepository lockRepository() {
            return new InMemoryLockRepository();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "statecore", name = "storage", havingValue = "jdbc")
    static class JdbcStorageConfiguration {

        @Bean
        @ConditionalOnProperty(prefix = "statecore", name = "initialize-schema", havingValue = "true", matchIfMissing = true)
        public DataSourceInitializer stateCoreSchemaInitializer(DataSource dataSource) {
            DataSourceInitializer initializer = new DataSourceInitializer();
            initializer.setDataSource(dataSource);
            initializer.setDatabasePopulator(
                new ResourceDatabasePopulator(new ClassPathResource("db/statecore-schema.sql")));
            return initializer;
        }

        @Bean
        public JdbcVersionRepository versionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcVersionRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public JdbcEventRepository eventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcEventRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public LockRepository lockRepository(JdbcTemplate jdbcTemplate) {
            return new JdbcLockRepository(jdbcTemplate);
        }

        @Bean
        public StateStore stateStore(JdbcTemplate jdbcTemplate,
                                     PlatformTransactionManager transactionManager,
                                     JdbcVersionRepository versionRepository,
                                     JdbcEventRepository eventRepository,
                                     Clock clock) {
            log.info("Using PostgreSQL state storage");
            return new JdbcStateStore(jdbcTemplate, transactionManager, versionRepository, eventRepository, clock);
        }
    }

    // ========== Shared cache tier ==========

    @Bean
    @ConditionalOnProperty(prefix = "statecore.cache", name = "l2", havingValue = "redis")
    public CacheTier redisCacheTier(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                    Clock clock, StateCoreProperties properties) {
        StateCoreProperties.CacheProperties cache = properties.getCache();
        log.info("Using Redis shared cache tier (prefix={}, ttl={})", cache.getKeyPrefix(), cache.getL2Ttl());
        return new RedisCacheTier(redisTemplate, objectMapper, clock, cache.getL2Ttl(), cache.getKeyPrefix());
    }

    @Bean
    @ConditionalOnProperty(prefix = "statecore.cache", name = "l2", havingValue = "memory", matchIfMissing = true)
    public CacheTier inMemorySharedCacheTier(Clock clock, StateCoreProperties properties) {
        return new InMemorySharedCacheTier(clock, properties.getCache().getL2Ttl());
    }

    @Bean
    @ConditionalOnProperty(prefix = "statecore.cache", name = "l2", havingValue = "none")
    public CacheTier noOpCacheTier() {
        log.info("Shared cache tier disabled");
        return new NoOpCacheTier();
    }

    @Bean
    public CacheDependencyTable cacheDependencyTable(StateCoreProperties properties) {
        return new CacheDependencyTable(properties.getCache().getDependencies().stream()
            .map(DependencyRule::parse)
            .toList());
    }

    @Bean
    public CacheManager cacheManager(CacheTier sharedCacheTier,
                                     VersionRepository versionRepository,
                                     CacheDependencyTable cacheDependencyTable,
                                     StateMetrics stateMetrics,
                                     Clock clock,
                                     StateCoreProperties properties) {
        StateCoreProperties.CacheProperties cache = properties.getCache();
        LocalCacheTier localTier = new LocalCacheTier(clock, cache.getL1Ttl(), cache.getL1MaxSize());
        return new CacheManager(localTier, sharedCacheTier, versionRepository, cacheDependencyTable, stateMetrics);
    }

    // ========== Transactions ==========

    @Bean
    public ConcurrencyController concurrencyController(LockRepository lockRepository,
                                                       Clock clock,
                                                       StateMetrics stateMetrics,
                                                       StateCoreProperties properties) {
        StateCoreProperties.TransactionProperties tx = properties.getTransaction();
        ConcurrencyController controller = new ConcurrencyController(
            lockRepository, clock, tx.getLeaseDuration(), tx.getLockPollInterval(), stateMetrics);
        stateMetrics.registerActiveLocks(controller::activeLockCount);
        return controller;
    }

    @Bean
    public StateChangeStream stateChangeStream(StateCoreProperties properties) {
        return new StateChangeStream(properties.getEvents().getDispatchThreads());
    }

    @Bean
    public TransactionCoordinator transactionCoordinator(StateStore stateStore,
                                                         VersionRepository versionRepository,
                                                         ConcurrencyController concurrencyController,
                                                         CacheManager cacheManager,
                                                         StateChangeStream stateChangeStream,
                                                         StateMetrics stateMetrics,
                                                         Clock clock,
                                                         StateCoreProperties properties) {
        StateCoreProperties.TransactionProperties tx = properties.getTransaction();
        return new TransactionCoordinator(stateStore, versionRepository, concurrencyController,
            cacheManager, stateChangeStream, stateMetrics, clock, tx.getCommitTimeout(), tx.getLockTimeout());
    }

    @Bean
    public TransactionRetrier transactionRetrier(TransactionCoordinator transactionCoordinator,
                                                 StateMetrics stateMetrics,
                                                 StateCoreProperties properties) {
        return new TransactionRetrier(transactionCoordinator, properties.getRetry().toPolicy(), stateMetrics);
    }

    @Bean
    public RollbackCoordinator rollbackCoordinator(TransactionCoordinator transactionCoordinator,
                                                   VersionRepository versionRepository,
                                                   EventRepository eventRepository,
                                                   StateMetrics stateMetrics) {
        return new RollbackCoordinator(transactionCoordinator, versionRepository, eventRepository, stateMetrics);
    }

    @Bean
    public EntityHistoryService entityHistoryService(VersionRepository versionRepository,
                                                     EventRepository eventRepository,
                                                     CacheManager cacheManager) {
        return new EntityHistoryService(versionRepository, eventRepository, cacheManager);
    }

    @Bean
    public EntityStateService entityStateService(TransactionCoordinator transactionCoordinator,
                                                 TransactionRetrier transactionRetrier,
                                                 CacheManager cacheManager) {
        return new EntityStateService(transactionCoordinator, transactionRetrier, cacheManager);
    }

    // ========== Operations ==========

    @Bean(name = "stateCoreHealthIndicator")
    public StateCoreHealthIndicator stateCoreHealthIndicator(StateStore stateStore,
                                                             CacheManager cacheManager,
                                                             TransactionCoordinator transactionCoordinator,
                                                             ConcurrencyController concurrencyController) {
        return new StateCoreHealthIndicator(stateStore, cacheManager, transactionCoordinator, concurrencyController);
    }

    @Bean
    public StateMaintenanceScheduler stateMaintenanceScheduler(CacheManager cacheManager,
                                                               ConcurrencyController concurrencyController,
                                                               StateCoreProperties properties) {
        return new StateMaintenanceScheduler(
            cacheManager, concurrencyController, properties.getMaintenance().getLockRetention());
    }

    @Bean
    public GracefulShutdownHandler gracefulShutdownHandler(TransactionCoordinator transactionCoordinator,
                                                           StateChangeStream stateChangeStream,
                                                           StateCoreProperties properties) {
        return new GracefulShutdownHandler(
            transactionCoordinator, stateChangeStream, properties.getMaintenance().getShutdownDrainTimeout());
    }
}
