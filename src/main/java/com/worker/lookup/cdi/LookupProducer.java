package com.worker.lookup.cdi;

import com.worker.lookup.api.SearchOptions;
import com.worker.lookup.api.SearchOrchestrator;
import com.worker.lookup.cache.CacheConfig;
import com.worker.lookup.cache.SearchCache;
import com.worker.lookup.cache.SearchCaches;
import com.worker.lookup.core.model.RankedResult;
import com.worker.lookup.core.model.Worker;
import com.worker.lookup.health.HealthCheckRegistry;
import com.worker.lookup.health.SearchCacheHealthCheck;
import com.worker.lookup.health.SearchErrorRateHealthCheck;
import com.worker.lookup.metrics.MetricsService;
import com.worker.lookup.metrics.MicrometerMetricsService;
import com.worker.lookup.metrics.MonitorConfig;
import com.worker.lookup.metrics.NoOpMetricsService;
import com.worker.lookup.metrics.PerformanceMonitor;
import com.worker.lookup.store.InMemoryWorkerStore;
import com.worker.lookup.store.RecordStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * CDI producer that wires the worker lookup from MicroProfile Config properties.
 *
 * <pre>
 * worker-lookup.search.max-results=10
 * worker-lookup.cache.provider=bounded
 * worker-lookup.cache.ttl-seconds=120
 * </pre>
 *
 * <p>The in-memory worker store is only a default; applications backed by a
 * database produce their own {@code RecordStore<Worker>} as an alternative.</p>
 */
@ApplicationScoped
public class LookupProducer {

    private static final Logger log = LoggerFactory.getLogger(LookupProducer.class);

    // ── Search ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "worker-lookup.search.min-query-length", defaultValue = "3")
    int minQueryLength;

    @Inject
    @ConfigProperty(name = "worker-lookup.search.max-query-length", defaultValue = "100")
    int maxQueryLength;

    @Inject
    @ConfigProperty(name = "worker-lookup.search.max-results", defaultValue = "10")
    int maxResults;

    @Inject
    @ConfigProperty(name = "worker-lookup.search.store-timeout-ms", defaultValue = "2000")
    long storeTimeoutMs;

    @Inject
    @ConfigProperty(name = "worker-lookup.search.debounce-delay-ms", defaultValue = "300")
    long debounceDelayMs;

    @Inject
    @ConfigProperty(name = "worker-lookup.search.slow-api-threshold-ms", defaultValue = "1000")
    long slowApiThresholdMs;

    @Inject
    @ConfigProperty(name = "worker-lookup.search.slow-store-threshold-ms", defaultValue = "500")
    long slowStoreThresholdMs;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "worker-lookup.cache.provider", defaultValue = "bounded")
    String cacheProvider;

    @Inject
    @ConfigProperty(name = "worker-lookup.cache.max-size", defaultValue = "500")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "worker-lookup.cache.ttl-seconds", defaultValue = "120")
    int cacheTtlSeconds;

    @Inject
    @ConfigProperty(name = "worker-lookup.cache.sweep-interval-seconds", defaultValue = "60")
    int cacheSweepIntervalSeconds;

    // ── Monitor ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "worker-lookup.monitor.capacity", defaultValue = "1000")
    int monitorCapacity;

    @Inject
    @ConfigProperty(name = "worker-lookup.monitor.stats-log-enabled", defaultValue = "false")
    boolean statsLogEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public PerformanceMonitor performanceMonitor() {
        MonitorConfig config = MonitorConfig.defaults()
                .withCapacity(monitorCapacity)
                .withSlowThresholds(slowApiThresholdMs, slowStoreThresholdMs)
                .withStatsLogEnabled(statsLogEnabled);
        PerformanceMonitor monitor = new PerformanceMonitor(config, Clock.systemUTC());
        monitor.init();
        return monitor;
    }

    public void stopMonitor(@Disposes PerformanceMonitor monitor) {
        monitor.shutdown();
    }

    @Produces
    @ApplicationScoped
    public SearchCache<String, List<RankedResult<Worker>>> searchCache() {
        CacheConfig config = new CacheConfig(CacheConfig.Provider.fromString(cacheProvider),
                cacheMaxSize, cacheTtlSeconds, cacheSweepIntervalSeconds);
        log.info("Producing search cache: provider={} maxSize={} ttlSeconds={}",
                config.provider(), config.maxSize(), config.ttlSeconds());
        SearchCache<String, List<RankedResult<Worker>>> cache =
                SearchCaches.create("worker-search", config, Clock.systemUTC());
        cache.init();
        return cache;
    }

    public void stopCache(@Disposes SearchCache<String, List<RankedResult<Worker>>> cache) {
        cache.shutdown();
    }

    @Produces
    @ApplicationScoped
    public RecordStore<Worker> workerStore() {
        return new InMemoryWorkerStore();
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (meterRegistry.isResolvable()) {
            log.info("Exporting search metrics to Micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public SearchOrchestrator<Worker> searchOrchestrator(RecordStore<Worker> store,
                                                         SearchCache<String, List<RankedResult<Worker>>> cache,
                                                         PerformanceMonitor monitor,
                                                         MetricsService metricsService) {
        SearchOptions options = SearchOptions.builder()
                .minQueryLength(minQueryLength)
                .maxQueryLength(maxQueryLength)
                .maxResults(maxResults)
                .cacheTtl(Duration.ofSeconds(cacheTtlSeconds))
                .storeTimeout(Duration.ofMillis(storeTimeoutMs))
                .debounceDelay(Duration.ofMillis(debounceDelayMs))
                .build();

        log.info("Producing SearchOrchestrator: store={} maxResults={} storeTimeoutMs={}",
                store.getName(), maxResults, storeTimeoutMs);

        return SearchOrchestrator.forWorkers(store)
                .cache(cache)
                .monitor(monitor)
                .metricsService(metricsService)
                .options(options)
                .build();
    }

    public void closeOrchestrator(@Disposes SearchOrchestrator<Worker> orchestrator) {
        log.info("Closing SearchOrchestrator");
        orchestrator.close();
    }

    @Produces
    @ApplicationScoped
    public HealthCheckRegistry healthCheckRegistry(PerformanceMonitor monitor,
                                                   SearchCache<String, List<RankedResult<Worker>>> cache) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(new SearchErrorRateHealthCheck(monitor));
        registry.register(new SearchCacheHealthCheck(cache));
        return registry;
    }
}
