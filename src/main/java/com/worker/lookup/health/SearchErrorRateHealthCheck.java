package com.worker.lookup.health;

import com.worker.lookup.health.HealthStatus.Status;
import com.worker.lookup.metrics.PerformanceMonitor;
import com.worker.lookup.metrics.PerformanceSnapshot;

/**
 * Reports DEGRADED or DOWN when too many recent operations failed.
 * Windows with fewer than {@value #MIN_REQUESTS} operations are always UP.
 */
public class SearchErrorRateHealthCheck implements HealthCheck {

    static final int WINDOW_MINUTES = 5;
    static final int MIN_REQUESTS = 10;
    static final long DEGRADED_ERROR_RATE = 25;
    static final long DOWN_ERROR_RATE = 50;

    private final PerformanceMonitor monitor;

    public SearchErrorRateHealthCheck(PerformanceMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public String getName() {
        return "search-error-rate";
    }

    @Override
    public HealthStatus check() {
        PerformanceSnapshot stats = monitor.stats(WINDOW_MINUTES);

        HealthStatus base;
        if (stats.totalRequests() < MIN_REQUESTS) {
            base = HealthStatus.of(Status.UP, "Not enough traffic to judge");
        } else if (stats.errorRate() >= DOWN_ERROR_RATE) {
            base = HealthStatus.of(Status.DOWN, "Error rate critical: " + stats.errorRate() + "%");
        } else if (stats.errorRate() >= DEGRADED_ERROR_RATE) {
            base = HealthStatus.of(Status.DEGRADED, "Error rate high: " + stats.errorRate() + "%");
        } else {
            base = HealthStatus.up();
        }

        return base
                .withDetail("windowMinutes", WINDOW_MINUTES)
                .withDetail("requests", stats.totalRequests())
                .withDetail("errorRate", stats.errorRate())
                .withDetail("slowRequests", stats.slowRequests())
                .withDetail("averageResponseTime", stats.averageResponseTime());
    }
}
