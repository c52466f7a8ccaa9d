package com.worker.lookup.metrics;

import java.time.Duration;

/**
 * Exports search metrics to an external metrics system.
 * The default {@link NoOpMetricsService} does nothing, so lookups work without
 * any registry configured. The in-process dashboard numbers come from
 * {@link PerformanceMonitor}, not from here.
 */
public interface MetricsService {

    void recordSearchDuration(SearchOutcome outcome, Duration duration);

    void recordCacheHit();

    void recordCacheMiss();

    void incrementStoreFailure();

    void recordResultCount(int count);
}
