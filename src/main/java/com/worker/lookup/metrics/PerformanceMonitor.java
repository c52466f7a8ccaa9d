package com.worker.lookup.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Records operation timings in a fixed-size ring buffer and computes rolling statistics.
 *
 * <p>Two entry points feed it with different slow thresholds:
 * {@link #recordApiCall} for request-level timings and {@link #recordStoreQuery}
 * for record store calls. Both log a warning when the threshold is exceeded.</p>
 *
 * <p>When full, the oldest metric is dropped. {@link #cleanup()} prunes metrics
 * older than the retention window; {@link #init()} schedules it.</p>
 */
public class PerformanceMonitor {
    private static final Logger log = LoggerFactory.getLogger(PerformanceMonitor.class);

    static final int TOP_SLOW_ENDPOINTS = 10;
    static final int STORE_NAME_LENGTH = 50;
    static final int STORE_LOG_LENGTH = 100;
    static final int STATS_LOG_WINDOW_MINUTES = 10;

    private final MonitorConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<PerformanceMetric> metrics;

    private ScheduledExecutorService scheduler;
    private final List<ScheduledFuture<?>> scheduledTasks = new ArrayList<>();

    public PerformanceMonitor() {
        this(MonitorConfig.defaults(), Clock.systemUTC());
    }

    public PerformanceMonitor(MonitorConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.metrics = new ArrayDeque<>(config.capacity());
    }

    /**
     * Appends a metric, dropping the oldest one when the buffer is full.
     */
    public void record(String name, long durationMs, boolean success, String error) {
        PerformanceMetric metric = new PerformanceMetric(name, durationMs, clock.millis(), success, error);
        lock.lock();
        try {
            if (metrics.size() >= config.capacity()) {
                metrics.pollFirst();
            }
            metrics.addLast(metric);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a request-level timing; warns above the API threshold.
     */
    public void recordApiCall(String name, long durationMs, boolean success, String error) {
        record(name, durationMs, success, error);
        if (durationMs > config.slowApiThresholdMs()) {
            log.warn("slow.api name={} durationMs={}", name, durationMs);
        }
    }

    /**
     * Records a record store timing; warns above the store threshold.
     * The metric name is {@code store: } plus the first 50 characters of the query.
     */
    public void recordStoreQuery(String query, long durationMs, boolean success, String error) {
        record("store: " + truncate(query, STORE_NAME_LENGTH), durationMs, success, error);
        if (durationMs > config.slowStoreThresholdMs()) {
            log.warn("slow.store query='{}' durationMs={}", truncate(query, STORE_LOG_LENGTH), durationMs);
        }
    }

    /**
     * Records a request-level call that started at {@code startMillis} (clock millis).
     */
    public void trackApiCall(String name, long startMillis, boolean success, String error) {
        recordApiCall(name, Math.max(0, clock.millis() - startMillis), success, error);
    }

    /**
     * Records a store call that started at {@code startMillis} (clock millis).
     */
    public void trackStoreQuery(String query, long startMillis, boolean success, String error) {
        recordStoreQuery(query, Math.max(0, clock.millis() - startMillis), success, error);
    }

    /**
     * Computes statistics over metrics recorded in the last {@code windowMinutes}.
     */
    public PerformanceSnapshot stats(int windowMinutes) {
        if (windowMinutes <= 0) {
            throw new IllegalArgumentException("windowMinutes must be > 0");
        }
        long cutoff = clock.millis() - TimeUnit.MINUTES.toMillis(windowMinutes);
        List<PerformanceMetric> recent = new ArrayList<>();
        lock.lock();
        try {
            for (PerformanceMetric m : metrics) {
                if (m.timestamp() >= cutoff) {
                    recent.add(m);
                }
            }
        } finally {
            lock.unlock();
        }

        if (recent.isEmpty()) {
            return PerformanceSnapshot.empty(windowMinutes);
        }

        long total = recent.size();
        long successful = 0;
        long slow = 0;
        long totalDuration = 0;
        Map<String, long[]> byName = new LinkedHashMap<>();
        for (PerformanceMetric m : recent) {
            if (m.success()) {
                successful++;
            }
            if (m.durationMs() > config.slowApiThresholdMs()) {
                slow++;
            }
            totalDuration += m.durationMs();
            long[] agg = byName.computeIfAbsent(m.name(), k -> new long[2]);
            agg[0] += m.durationMs();
            agg[1]++;
        }

        List<EndpointStats> topSlow = byName.entrySet().stream()
                .map(e -> new EndpointStats(e.getKey(),
                        Math.round((double) e.getValue()[0] / e.getValue()[1]),
                        e.getValue()[1]))
                .sorted(Comparator.comparingLong(EndpointStats::avgDuration).reversed())
                .limit(TOP_SLOW_ENDPOINTS)
                .toList();

        return new PerformanceSnapshot(
                windowMinutes,
                total,
                Math.round(successful * 100.0 / total),
                Math.round((double) totalDuration / total),
                slow,
                Math.round((total - successful) * 100.0 / total),
                topSlow
        );
    }

    /**
     * Returns the last {@code limit} failed metrics, most recent first.
     */
    public List<PerformanceMetric> recentErrors(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<PerformanceMetric> errors = new ArrayList<>(Math.min(limit, 64));
        lock.lock();
        try {
            Iterator<PerformanceMetric> it = metrics.descendingIterator();
            while (it.hasNext() && errors.size() < limit) {
                PerformanceMetric m = it.next();
                if (!m.success()) {
                    errors.add(m);
                }
            }
        } finally {
            lock.unlock();
        }
        return errors;
    }

    /**
     * Drops metrics older than the retention window.
     *
     * @return the number of metrics removed
     */
    public int cleanup() {
        long cutoff = clock.millis() - config.retention().toMillis();
        lock.lock();
        try {
            int before = metrics.size();
            metrics.removeIf(m -> m.timestamp() < cutoff);
            int removed = before - metrics.size();
            if (removed > 0) {
                log.debug("monitor.cleanup removed={} remaining={}", removed, metrics.size());
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns every buffered metric, oldest first.
     */
    public List<PerformanceMetric> snapshot() {
        lock.lock();
        try {
            return List.copyOf(metrics);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return metrics.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            metrics.clear();
        } finally {
            lock.unlock();
        }
    }

    public MonitorConfig getConfig() {
        return config;
    }

    /**
     * Schedules retention cleanup and, if enabled, the periodic summary log line.
     */
    public synchronized void init() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "performance-monitor");
            t.setDaemon(true);
            return t;
        });
        long cleanupMs = config.cleanupInterval().toMillis();
        if (cleanupMs > 0) {
            scheduledTasks.add(scheduler.scheduleAtFixedRate(
                    () -> runSafely("cleanup", this::cleanup), cleanupMs, cleanupMs, TimeUnit.MILLISECONDS));
        }
        long statsMs = config.statsLogInterval().toMillis();
        if (config.statsLogEnabled() && statsMs > 0) {
            scheduledTasks.add(scheduler.scheduleAtFixedRate(
                    () -> runSafely("statsLog", this::logStats), statsMs, statsMs, TimeUnit.MILLISECONDS));
        }
        log.info("PerformanceMonitor initialized: capacity={}, slowApiMs={}, slowStoreMs={}",
                config.capacity(), config.slowApiThresholdMs(), config.slowStoreThresholdMs());
    }

    /**
     * Cancels scheduled tasks. Recorded metrics are kept.
     */
    public synchronized void shutdown() {
        scheduledTasks.forEach(task -> task.cancel(false));
        scheduledTasks.clear();
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.info("PerformanceMonitor stopped");
        }
    }

    synchronized int scheduledTaskCount() {
        return (int) scheduledTasks.stream().filter(t -> !t.isCancelled()).count();
    }

    void logStats() {
        PerformanceSnapshot stats = stats(STATS_LOG_WINDOW_MINUTES);
        if (stats.totalRequests() > 0) {
            log.info("performance.stats window={}m requests={} successRate={}% avgMs={} slow={} errorRate={}%",
                    STATS_LOG_WINDOW_MINUTES, stats.totalRequests(), stats.successRate(),
                    stats.averageResponseTime(), stats.slowRequests(), stats.errorRate());
        }
    }

    private void runSafely(String task, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("monitor.{}.failed error={}", task, e.getMessage(), e);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}
