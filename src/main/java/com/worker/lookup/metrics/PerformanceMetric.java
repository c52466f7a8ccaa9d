package com.worker.lookup.metrics;

/**
 * One timed operation as recorded by the {@link PerformanceMonitor}.
 *
 * @param name        operation name, e.g. {@code search.fetched} or {@code store: john}
 * @param durationMs  elapsed milliseconds
 * @param timestamp   epoch milliseconds at which the metric was recorded
 * @param success     whether the operation succeeded
 * @param error       failure description; {@code null} on success
 */
public record PerformanceMetric(String name, long durationMs, long timestamp, boolean success, String error) {

    public PerformanceMetric {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be >= 0");
        }
    }
}
