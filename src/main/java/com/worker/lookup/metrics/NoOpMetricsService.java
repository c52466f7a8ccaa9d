package com.worker.lookup.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordSearchDuration(SearchOutcome outcome, Duration duration) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void incrementStoreFailure() {
    }

    @Override
    public void recordResultCount(int count) {
    }
}
