package com.worker.lookup.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code worker.search.duration}: Timer (tag: outcome)</li>
 *   <li>{@code worker.search.cache.hit}: Counter</li>
 *   <li>{@code worker.search.cache.miss}: Counter</li>
 *   <li>{@code worker.search.store.failure}: Counter</li>
 *   <li>{@code worker.search.results}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Map<SearchOutcome, Timer> timers = new EnumMap<>(SearchOutcome.class);
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter storeFailureCounter;
    private final DistributionSummary resultCountSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        for (SearchOutcome outcome : SearchOutcome.values()) {
            timers.put(outcome, Timer.builder("worker.search.duration")
                    .description("Duration of worker search requests")
                    .tag("outcome", outcome.tag())
                    .register(registry));
        }
        this.cacheHitCounter = Counter.builder("worker.search.cache.hit")
                .description("Number of search cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("worker.search.cache.miss")
                .description("Number of search cache misses")
                .register(registry);
        this.storeFailureCounter = Counter.builder("worker.search.store.failure")
                .description("Number of failed or timed out record store calls")
                .register(registry);
        this.resultCountSummary = DistributionSummary.builder("worker.search.results")
                .description("Number of ranked results returned per search")
                .register(registry);
    }

    @Override
    public void recordSearchDuration(SearchOutcome outcome, Duration duration) {
        timers.get(outcome).record(duration);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void incrementStoreFailure() {
        storeFailureCounter.increment();
    }

    @Override
    public void recordResultCount(int count) {
        resultCountSummary.record(count);
    }
}
