package com.worker.lookup.metrics;

import com.worker.lookup.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PerformanceMonitor Tests")
class PerformanceMonitorTest {

    private MutableClock clock;
    private PerformanceMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        monitor = new PerformanceMonitor(MonitorConfig.defaults(), clock);
    }

    @AfterEach
    void tearDown() {
        monitor.shutdown();
    }

    @Nested
    @DisplayName("Recording")
    class RecordingTests {

        @Test
        @DisplayName("Buffer should keep only the newest metrics at capacity")
        void ringBuffer() {
            for (int i = 0; i < 1500; i++) {
                monitor.record("op" + i, 10, true, null);
            }

            List<PerformanceMetric> all = monitor.snapshot();
            assertEquals(1000, all.size());
            assertEquals("op500", all.get(0).name());
            assertEquals("op1499", all.get(999).name());
        }

        @Test
        @DisplayName("Store queries should be named after the first 50 characters")
        void storeQueryName() {
            String longQuery = "workers.search " + "x".repeat(100);
            monitor.recordStoreQuery(longQuery, 20, true, null);

            PerformanceMetric metric = monitor.snapshot().get(0);
            assertEquals("store: " + longQuery.substring(0, 50), metric.name());
        }

        @Test
        @DisplayName("track* should measure from the given start time")
        void trackElapsed() {
            long start = clock.millis();
            clock.advanceMillis(1500);
            monitor.trackApiCall("search.fetched", start, true, null);
            monitor.trackStoreQuery("workers.search john", start, false, "timeout");

            List<PerformanceMetric> all = monitor.snapshot();
            assertEquals(1500, all.get(0).durationMs());
            assertEquals("store: workers.search john", all.get(1).name());
            assertFalse(all.get(1).success());
            assertEquals("timeout", all.get(1).error());
        }

        @Test
        @DisplayName("clear() should empty the buffer")
        void clear() {
            monitor.record("op", 1, true, null);
            monitor.clear();
            assertEquals(0, monitor.size());
        }
    }

    @Nested
    @DisplayName("Statistics")
    class StatsTests {

        @Test
        @DisplayName("Empty window should report 100% success and zeros")
        void emptyWindow() {
            PerformanceSnapshot stats = monitor.stats(60);

            assertEquals(0, stats.totalRequests());
            assertEquals(100, stats.successRate());
            assertEquals(0, stats.errorRate());
            assertEquals(0, stats.averageResponseTime());
            assertTrue(stats.topSlowEndpoints().isEmpty());
        }

        @Test
        @DisplayName("Rates should be rounded to whole percents")
        void rounding() {
            monitor.record("a", 100, true, null);
            monitor.record("a", 101, true, null);
            monitor.record("b", 300, false, "boom");

            PerformanceSnapshot stats = monitor.stats(60);
            assertEquals(3, stats.totalRequests());
            assertEquals(67, stats.successRate());
            assertEquals(33, stats.errorRate());
            assertEquals(167, stats.averageResponseTime());
        }

        @Test
        @DisplayName("Only durations above 1000ms should count as slow")
        void slowThreshold() {
            monitor.record("a", 1000, true, null);
            monitor.record("a", 1001, true, null);

            assertEquals(1, monitor.stats(60).slowRequests());
        }

        @Test
        @DisplayName("Window should include metrics exactly at the cutoff")
        void windowBoundary() {
            monitor.record("old", 10, true, null);
            clock.advance(Duration.ofMinutes(60));
            monitor.record("new", 10, true, null);

            assertEquals(2, monitor.stats(60).totalRequests());

            clock.advanceMillis(1);
            assertEquals(1, monitor.stats(60).totalRequests());
        }

        @Test
        @DisplayName("Top slow endpoints should be limited to ten, slowest first")
        void topSlowEndpoints() {
            for (int i = 0; i < 12; i++) {
                monitor.record("op" + i, i * 10L, true, null);
                monitor.record("op" + i, i * 10L + 2, true, null);
            }

            List<EndpointStats> top = monitor.stats(60).topSlowEndpoints();
            assertEquals(10, top.size());
            assertEquals("op11", top.get(0).name());
            assertEquals(111, top.get(0).avgDuration());
            assertEquals(2, top.get(0).count());
            assertEquals("op2", top.get(9).name());
        }

        @Test
        @DisplayName("Window must be positive")
        void invalidWindow() {
            assertThrows(IllegalArgumentException.class, () -> monitor.stats(0));
        }
    }

    @Nested
    @DisplayName("Errors and retention")
    class RetentionTests {

        @Test
        @DisplayName("Recent errors should be failures only, most recent first")
        void recentErrors() {
            monitor.record("a", 1, false, "first");
            monitor.record("b", 1, true, null);
            monitor.record("c", 1, false, "second");
            monitor.record("d", 1, false, "third");

            List<PerformanceMetric> errors = monitor.recentErrors(2);
            assertEquals(List.of("third", "second"), errors.stream().map(PerformanceMetric::error).toList());
            assertTrue(monitor.recentErrors(0).isEmpty());
        }

        @Test
        @DisplayName("Cleanup should drop metrics older than 24 hours")
        void cleanup() {
            monitor.record("old", 1, true, null);
            clock.advance(Duration.ofHours(25));
            monitor.record("new", 1, true, null);

            assertEquals(1, monitor.cleanup());
            assertEquals("new", monitor.snapshot().get(0).name());
        }

        @Test
        @DisplayName("init should schedule cleanup and, when enabled, the stats log")
        void scheduling() {
            monitor.init();
            assertEquals(1, monitor.scheduledTaskCount());
            monitor.shutdown();
            assertEquals(0, monitor.scheduledTaskCount());

            PerformanceMonitor logging = new PerformanceMonitor(
                    MonitorConfig.defaults().withStatsLogEnabled(true), clock);
            try {
                logging.init();
                assertEquals(2, logging.scheduledTaskCount());
            } finally {
                logging.shutdown();
            }
        }

        @Test
        @DisplayName("Stats log should tolerate an empty buffer")
        void logStatsEmpty() {
            assertDoesNotThrow(monitor::logStats);
            monitor.record("a", 5, true, null);
            assertDoesNotThrow(monitor::logStats);
        }
    }

    @Nested
    @DisplayName("MonitorConfig")
    class ConfigTests {

        @Test
        @DisplayName("Defaults should match the lookup's thresholds")
        void defaults() {
            MonitorConfig config = MonitorConfig.defaults();
            assertEquals(1000, config.capacity());
            assertEquals(Duration.ofHours(24), config.retention());
            assertEquals(1000, config.slowApiThresholdMs());
            assertEquals(500, config.slowStoreThresholdMs());
            assertFalse(config.statsLogEnabled());
        }

        @Test
        @DisplayName("Should reject non-positive capacity")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> MonitorConfig.defaults().withCapacity(0));
        }
    }
}
