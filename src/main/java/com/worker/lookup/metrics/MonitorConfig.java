package com.worker.lookup.metrics;

import java.time.Duration;

/**
 * Configuration for the {@link PerformanceMonitor}.
 *
 * @param capacity               ring buffer size
 * @param retention              metrics older than this are pruned by cleanup
 * @param slowApiThresholdMs     request-level duration above which a warning is logged
 * @param slowStoreThresholdMs   store-level duration above which a warning is logged
 * @param cleanupInterval        period of the background retention cleanup
 * @param statsLogInterval       period of the summary log line
 * @param statsLogEnabled        whether the summary log line is emitted
 */
public record MonitorConfig(
        int capacity,
        Duration retention,
        long slowApiThresholdMs,
        long slowStoreThresholdMs,
        Duration cleanupInterval,
        Duration statsLogInterval,
        boolean statsLogEnabled
) {
    public MonitorConfig {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        if (retention == null || retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be > 0");
        }
        if (slowApiThresholdMs < 0 || slowStoreThresholdMs < 0) {
            throw new IllegalArgumentException("slow thresholds must be >= 0");
        }
        if (cleanupInterval == null || cleanupInterval.isNegative()) {
            throw new IllegalArgumentException("cleanupInterval must be >= 0");
        }
        if (statsLogInterval == null || statsLogInterval.isNegative()) {
            throw new IllegalArgumentException("statsLogInterval must be >= 0");
        }
    }

    /**
     * 1000 metrics, 24h retention, 1000ms / 500ms slow thresholds, hourly cleanup,
     * summary logging every 10 minutes (off).
     */
    public static MonitorConfig defaults() {
        return new MonitorConfig(1000, Duration.ofHours(24), 1000, 500,
                Duration.ofHours(1), Duration.ofMinutes(10), false);
    }

    public MonitorConfig withCapacity(int newCapacity) {
        return new MonitorConfig(newCapacity, retention, slowApiThresholdMs, slowStoreThresholdMs,
                cleanupInterval, statsLogInterval, statsLogEnabled);
    }

    public MonitorConfig withStatsLogEnabled(boolean enabled) {
        return new MonitorConfig(capacity, retention, slowApiThresholdMs, slowStoreThresholdMs,
                cleanupInterval, statsLogInterval, enabled);
    }

    public MonitorConfig withSlowThresholds(long apiMs, long storeMs) {
        return new MonitorConfig(capacity, retention, apiMs, storeMs,
                cleanupInterval, statsLogInterval, statsLogEnabled);
    }
}
