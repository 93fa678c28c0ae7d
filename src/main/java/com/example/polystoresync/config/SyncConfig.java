package com.example.polystoresync.config;

import com.example.polystoresync.breaker.CircuitBreakerManager;
import com.example.polystoresync.breaker.CircuitBreakerSettings;
import com.example.polystoresync.model.StoreRole;
import com.example.polystoresync.service.ConsistencyValidator;
import com.example.polystoresync.service.PerformanceSla;
import com.example.polystoresync.service.SlaPolicy;
import com.example.polystoresync.service.StoreCallExecutor;
import com.example.polystoresync.service.SyncCoordinator;
import com.example.polystoresync.service.TransactionRegistry;
import com.example.polystoresync.store.InMemoryVectorStore;
import com.example.polystoresync.store.JdbcRelationalStore;
import com.example.polystoresync.store.MongoGraphStore;
import com.example.polystoresync.store.RedisCacheStore;
import com.example.polystoresync.store.StoreTopology;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the sync engine from {@code app.sync.*} properties.
 */
@Configuration
public class SyncConfig {

    @Value("${app.sync.store-call-timeout-ms:1000}")
    private long storeCallTimeoutMs;

    @Value("${app.sync.rollback-settle-timeout-ms:5000}")
    private long rollbackSettleTimeoutMs;

    @Value("${app.sync.max-store-call-threads:16}")
    private int maxStoreCallThreads;

    @Value("${app.sync.max-dispatch-threads:8}")
    private int maxDispatchThreads;

    @Value("${app.sync.breaker.failure-threshold:3}")
    private int failureThreshold;

    @Value("${app.sync.breaker.success-threshold:2}")
    private int successThreshold;

    @Value("${app.sync.breaker.graph-recovery-timeout-sec:60}")
    private long graphRecoveryTimeoutSec;

    @Value("${app.sync.breaker.cache-recovery-timeout-sec:30}")
    private long cacheRecoveryTimeoutSec;

    @Value("${app.sync.sla.single-operation-ms:500}")
    private long singleOperationMs;

    @Value("${app.sync.sla.query-operation-ms:2000}")
    private long queryOperationMs;

    @Value("${app.sync.sla.batch-operation-ms:5000}")
    private long batchOperationMs;

    @Value("${app.sync.sla.critical-failure-detection-ms:500}")
    private long criticalFailureDetectionMs;

    @Value("${app.sync.sla.circuit-breaker-short-circuit-ms:100}")
    private long circuitBreakerShortCircuitMs;

    @Bean(destroyMethod = "close")
    public StoreCallExecutor storeCallExecutor() {
        return new StoreCallExecutor(storeCallTimeoutMs, rollbackSettleTimeoutMs, maxStoreCallThreads);
    }

    @Bean
    public CircuitBreakerManager circuitBreakerManager() {
        Map<StoreRole, CircuitBreakerSettings> settings = new EnumMap<>(StoreRole.class);
        settings.put(StoreRole.GRAPH, new CircuitBreakerSettings(
                failureThreshold, Duration.ofSeconds(graphRecoveryTimeoutSec), successThreshold));
        settings.put(StoreRole.CACHE, new CircuitBreakerSettings(
                failureThreshold, Duration.ofSeconds(cacheRecoveryTimeoutSec), successThreshold));
        return new CircuitBreakerManager(settings);
    }

    @Bean
    public StoreTopology storeTopology(JdbcRelationalStore relationalStore, InMemoryVectorStore vectorStore,
                                       MongoGraphStore graphStore, RedisCacheStore cacheStore) {
        return new StoreTopology(relationalStore, vectorStore, graphStore, cacheStore);
    }

    @Bean
    public SlaPolicy slaPolicy() {
        Map<PerformanceSla, Long> limits = new EnumMap<>(PerformanceSla.class);
        limits.put(PerformanceSla.SINGLE_OPERATION, singleOperationMs);
        limits.put(PerformanceSla.QUERY_OPERATION, queryOperationMs);
        limits.put(PerformanceSla.BATCH_OPERATION, batchOperationMs);
        limits.put(PerformanceSla.CRITICAL_FAILURE_DETECTION, criticalFailureDetectionMs);
        limits.put(PerformanceSla.CIRCUIT_BREAKER_SHORT_CIRCUIT, circuitBreakerShortCircuitMs);
        return new SlaPolicy(limits);
    }

    @Bean
    public TransactionRegistry transactionRegistry() {
        return new TransactionRegistry();
    }

    @Bean
    public ConsistencyValidator consistencyValidator(StoreTopology storeTopology, StoreCallExecutor storeCallExecutor) {
        return new ConsistencyValidator(storeTopology, storeCallExecutor);
    }

    @Bean(destroyMethod = "close")
    public SyncCoordinator syncCoordinator(StoreTopology storeTopology,
                                           CircuitBreakerManager circuitBreakerManager,
                                           TransactionRegistry transactionRegistry,
                                           StoreCallExecutor storeCallExecutor,
                                           ConsistencyValidator consistencyValidator,
                                           SlaPolicy slaPolicy) {
        return new SyncCoordinator(storeTopology, circuitBreakerManager, transactionRegistry, storeCallExecutor,
                consistencyValidator, slaPolicy, createDispatchExecutor());
    }

    private ExecutorService createDispatchExecutor() {
        int threadCount = maxDispatchThreads > 0 ? maxDispatchThreads : 8;
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threadCount, r -> {
            Thread t = new Thread(r, "sync-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
