package com.worker.lookup.metrics;

import java.util.List;

/**
 * Rolling statistics over the metrics recorded within a time window.
 * Percentages are rounded to the nearest integer.
 *
 * @param windowMinutes       the window the snapshot covers
 * @param totalRequests       metrics in the window
 * @param successRate         successful share, 0..100; 100 for an empty window
 * @param averageResponseTime mean duration in milliseconds
 * @param slowRequests        metrics above the slow-operation threshold
 * @param errorRate           failed share, 0..100
 * @param topSlowEndpoints    up to ten operation names, slowest average first
 */
public record PerformanceSnapshot(
        int windowMinutes,
        long totalRequests,
        long successRate,
        long averageResponseTime,
        long slowRequests,
        long errorRate,
        List<EndpointStats> topSlowEndpoints
) {
    public PerformanceSnapshot {
        topSlowEndpoints = topSlowEndpoints != null ? List.copyOf(topSlowEndpoints) : List.of();
    }

    static PerformanceSnapshot empty(int windowMinutes) {
        return new PerformanceSnapshot(windowMinutes, 0, 100, 0, 0, 0, List.of());
    }
}
