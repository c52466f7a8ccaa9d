package com.worker.lookup.api;

import com.worker.lookup.MutableClock;
import com.worker.lookup.cache.BoundedTtlCache;
import com.worker.lookup.cache.SearchCache;
import com.worker.lookup.core.model.MatchTier;
import com.worker.lookup.core.model.RankedResult;
import com.worker.lookup.core.model.SearchTerm;
import com.worker.lookup.core.model.Worker;
import com.worker.lookup.metrics.MetricsService;
import com.worker.lookup.metrics.PerformanceMetric;
import com.worker.lookup.metrics.SearchOutcome;
import com.worker.lookup.store.RecordStore;
import com.worker.lookup.store.StoreUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SearchOrchestrator Tests")
class SearchOrchestratorTest {

    private static final Worker JANE = new Worker(1, "Jane", "Doe", "jane.doe@acme.com", "555-0101");
    private static final Worker JOHN = new Worker(2, "John", "Smith", "jsmith@acme.com", "555-0102");
    private static final Worker JOHNNY = new Worker(3, "Johnny", "Appleseed", "johnny@acme.com", "555-0103");

    @Mock
    private RecordStore<Worker> store;

    @Mock
    private MetricsService metrics;

    private MutableClock clock;
    private SearchOrchestrator<Worker> orchestrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        orchestrator = newOrchestrator(SearchOptions.defaults());
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    private SearchOrchestrator<Worker> newOrchestrator(SearchOptions options) {
        return SearchOrchestrator.forWorkers(store)
                .metricsService(metrics)
                .options(options)
                .clock(clock)
                .build();
    }

    private static List<String> names(SearchResponse<Worker> response) {
        return response.results().stream().map(r -> r.item().fullName()).toList();
    }

    private List<String> recordedNames() {
        return orchestrator.getMonitor().snapshot().stream().map(PerformanceMetric::name).toList();
    }

    @Nested
    @DisplayName("End-to-end")
    class EndToEndTests {

        @Test
        @DisplayName("Should rank, drop non-matches and serve the repeat from cache")
        void rankAndCache() {
            when(store.search("john", 10)).thenReturn(List.of(JANE, JOHN, JOHNNY));

            SearchResponse<Worker> first = orchestrator.search("john");

            assertEquals(List.of("John Smith", "Johnny Appleseed"), names(first));
            assertEquals(List.of(80, 80), first.results().stream().map(RankedResult::score).toList());
            assertEquals(MatchTier.PREFIX, first.results().get(0).matchTier());
            assertEquals(2, first.totalCount());
            assertEquals("john", first.searchTerm());
            assertFalse(first.cached());

            SearchResponse<Worker> second = orchestrator.search("  John ");

            assertTrue(second.cached());
            assertEquals(names(first), names(second));
            verify(store, times(1)).search("john", 10);
            verify(metrics).recordCacheMiss();
            verify(metrics).recordCacheHit();
            verify(metrics).recordSearchDuration(eq(SearchOutcome.FETCHED), any(Duration.class));
            verify(metrics).recordSearchDuration(eq(SearchOutcome.CACHED), any(Duration.class));
        }

        @Test
        @DisplayName("Should query the store with the normalized term and configured limit")
        void normalizedTermAndLimit() {
            orchestrator.close();
            orchestrator = newOrchestrator(SearchOptions.builder().maxResults(25).build());
            when(store.search("john smith", 25)).thenReturn(List.of(JOHN));

            SearchResponse<Worker> response = orchestrator.search("John   SMITH!");

            assertEquals(List.of("John Smith"), names(response));
            assertEquals(MatchTier.EXACT, response.results().get(0).matchTier());
            assertEquals(List.of("Search by full name"), response.suggestions());
        }

        @Test
        @DisplayName("Should record request and store metrics in the monitor")
        void monitorMetrics() {
            when(store.search("john", 10)).thenReturn(List.of(JOHN));

            orchestrator.search("john");
            orchestrator.search("john");

            List<String> recorded = recordedNames();
            assertTrue(recorded.contains("search.fetched"));
            assertTrue(recorded.contains("search.cached"));
            assertTrue(recorded.stream().anyMatch(n -> n.startsWith("store: ")));
            assertEquals(3, orchestrator.getStats(60).totalRequests());
            assertEquals(100, orchestrator.getStats(60).successRate());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Short queries should return empty without touching the store")
        void shortQuery() {
            SearchResponse<Worker> response = orchestrator.search("jo");

            assertTrue(response.isEmpty());
            assertEquals(0, response.totalCount());
            assertFalse(response.cached());
            verify(store, never()).search(anyString(), anyInt());
            verify(metrics, never()).recordCacheMiss();
            assertEquals(List.of("search.invalid"), recordedNames());
            assertTrue(orchestrator.getMonitor().snapshot().get(0).success());
        }

        @Test
        @DisplayName("Null and over-long queries should return empty")
        void nullAndLong() {
            assertTrue(orchestrator.search(null).isEmpty());
            assertEquals("", orchestrator.search(null).searchTerm());
            assertTrue(orchestrator.search("a".repeat(101)).isEmpty());
            verify(store, never()).search(anyString(), anyInt());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Store failure should degrade to an empty, uncached response")
        void storeFailure() {
            when(store.search("john", 10))
                    .thenThrow(new StoreUnavailableException("connection refused"))
                    .thenReturn(List.of(JOHN));

            SearchResponse<Worker> failed = orchestrator.search("john");

            assertTrue(failed.isEmpty());
            assertFalse(failed.cached());
            verify(metrics).incrementStoreFailure();
            verify(metrics).recordSearchDuration(eq(SearchOutcome.FAILED), any(Duration.class));

            List<PerformanceMetric> errors = orchestrator.getMonitor().recentErrors(10);
            assertEquals("search.failed", errors.get(0).name());
            assertEquals("connection refused", errors.get(0).error());

            SearchResponse<Worker> retried = orchestrator.search("john");
            assertEquals(List.of("John Smith"), names(retried));
            assertFalse(retried.cached());
        }

        @Test
        @DisplayName("A slow store should time out into an empty response")
        void storeTimeout() {
            orchestrator.close();
            orchestrator = newOrchestrator(SearchOptions.builder().storeTimeout(Duration.ofMillis(100)).build());
            when(store.search("john", 10)).thenAnswer(inv -> {
                Thread.sleep(5_000);
                return List.of(JOHN);
            });

            SearchResponse<Worker> response = orchestrator.search("john");

            assertTrue(response.isEmpty());
            List<PerformanceMetric> errors = orchestrator.getMonitor().recentErrors(1);
            assertEquals("search.failed", errors.get(0).name());
            assertTrue(errors.get(0).error().contains("100ms"));
        }

        @Test
        @DisplayName("A projection that throws should degrade to an empty, uncached response")
        void rankingFailure() {
            SearchOrchestrator<String> broken = SearchOrchestrator.<String>builder()
                    .store((term, limit) -> List.of("john"))
                    .textsOf(s -> {
                        throw new IllegalStateException("projection broke");
                    })
                    .metricsService(metrics)
                    .clock(clock)
                    .build();
            try {
                SearchResponse<String> response = assertDoesNotThrow(() -> broken.search("john"));

                assertTrue(response.isEmpty());
                assertFalse(response.cached());
                assertEquals(0L, broken.getCache().size());
                verify(metrics).recordSearchDuration(eq(SearchOutcome.FAILED), any(Duration.class));

                List<PerformanceMetric> errors = broken.getMonitor().recentErrors(10);
                assertEquals("search.failed", errors.get(0).name());
                assertEquals("projection broke", errors.get(0).error());
            } finally {
                broken.close();
            }
        }

        @Test
        @DisplayName("A cache that throws should be treated as a miss")
        @SuppressWarnings("unchecked")
        void throwingCache() {
            SearchCache<String, List<RankedResult<Worker>>> brokenCache = mock(SearchCache.class);
            when(brokenCache.get("worker_search_john")).thenThrow(new IllegalStateException("corrupt entry"));
            orchestrator.close();
            orchestrator = SearchOrchestrator.forWorkers(store)
                    .cache(brokenCache)
                    .metricsService(metrics)
                    .clock(clock)
                    .build();
            when(store.search("john", 10)).thenReturn(List.of(JOHN));

            SearchResponse<Worker> response = orchestrator.search("john");

            assertEquals(List.of("John Smith"), names(response));
            verify(brokenCache).invalidate("worker_search_john");
            verify(brokenCache).put(eq("worker_search_john"), anyList(), eq(Duration.ofMinutes(2)));
        }

        @Test
        @DisplayName("An unusable cached value should be discarded and refetched")
        void unusableCachedValue() {
            BoundedTtlCache<String, List<RankedResult<Worker>>> cache =
                    new BoundedTtlCache<>("test", 10, Duration.ofMinutes(2), Duration.ZERO, clock);
            cache.put("worker_search_john", Arrays.asList((RankedResult<Worker>) null));
            orchestrator.close();
            orchestrator = SearchOrchestrator.forWorkers(store)
                    .cache(cache)
                    .metricsService(metrics)
                    .clock(clock)
                    .build();
            when(store.search("john", 10)).thenReturn(List.of(JOHN));

            SearchResponse<Worker> response = orchestrator.search("john");

            assertFalse(response.cached());
            assertEquals(List.of("John Smith"), names(response));
            assertEquals(1, cache.get("worker_search_john").orElseThrow().size());
        }
    }

    @Nested
    @DisplayName("Cache keys and invalidation")
    class CacheKeyTests {

        @Test
        @DisplayName("Cache key should be prefix plus normalized term and sorted filters")
        void cacheKey() {
            SearchTerm term = SearchTerm.of("John");
            assertEquals("worker_search_john", orchestrator.cacheKey(term, Map.of()));
            assertEquals("worker_search_john?city=Austin&state=TX",
                    orchestrator.cacheKey(term, Map.of("state", "TX", "city", "Austin")));
        }

        @Test
        @DisplayName("Filtered searches should be cached separately")
        void filteredSearch() {
            Map<String, String> filters = Map.of("state", "TX");
            when(store.search("john", 10)).thenReturn(List.of(JOHN, JOHNNY));
            when(store.search("john", 10, filters)).thenReturn(List.of(JOHN));

            assertEquals(2, orchestrator.search("john").totalCount());
            assertEquals(1, orchestrator.search("john", filters).totalCount());
            assertTrue(orchestrator.search("john", filters).cached());
            assertEquals(2, orchestrator.getCache().size());
        }

        @Test
        @DisplayName("Invalidation should force the next search back to the store")
        void invalidate() {
            when(store.search("john", 10)).thenReturn(List.of(JOHN));
            orchestrator.search("john");

            assertEquals(1, orchestrator.invalidateCachedSearches());

            assertFalse(orchestrator.search("john").cached());
            verify(store, times(2)).search("john", 10);
        }

        @Test
        @DisplayName("Cached entries should expire after the configured TTL")
        void ttl() {
            when(store.search("john", 10)).thenReturn(List.of(JOHN));
            orchestrator.search("john");

            clock.advance(Duration.ofMinutes(2).plusMillis(1));

            assertFalse(orchestrator.search("john").cached());
            verify(store, times(2)).search("john", 10);
        }
    }

    @Nested
    @DisplayName("Async and debounced searches")
    class AsyncTests {

        @Test
        @DisplayName("searchAsync should complete with the search response")
        void searchAsync() throws Exception {
            when(store.search("john", 10)).thenReturn(List.of(JOHN));

            SearchResponse<Worker> response = orchestrator.searchAsync("john").get(2, TimeUnit.SECONDS);

            assertEquals(List.of("John Smith"), names(response));
        }

        @Test
        @DisplayName("Cancelling an async search should interrupt the store fetch")
        void cancelInterruptsFetch() throws Exception {
            CountDownLatch fetching = new CountDownLatch(1);
            CountDownLatch interrupted = new CountDownLatch(1);
            when(store.search("john", 10)).thenAnswer(inv -> {
                fetching.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
                return List.of(JOHN);
            });

            CompletableFuture<SearchResponse<Worker>> future = orchestrator.searchAsync("john");
            assertTrue(fetching.await(2, TimeUnit.SECONDS));

            future.cancel(true);

            assertTrue(interrupted.await(2, TimeUnit.SECONDS));
            assertTrue(future.isCancelled());
        }

        @Test
        @DisplayName("A burst of debounced searches should reach the store once")
        void debouncedBurst() throws Exception {
            orchestrator.close();
            orchestrator = newOrchestrator(SearchOptions.builder().debounceDelay(Duration.ofMillis(200)).build());
            when(store.search(anyString(), anyInt())).thenReturn(List.of(JOHN));

            Function<String, CompletableFuture<SearchResponse<Worker>>> typeahead =
                    orchestrator.debounced("check-in");
            List<CompletableFuture<SearchResponse<Worker>>> futures = new ArrayList<>();
            for (String typed : List.of("joh", "john", "john ", "john s", "john sm")) {
                futures.add(typeahead.apply(typed));
            }

            SearchResponse<Worker> last = futures.get(4).get(2, TimeUnit.SECONDS);

            assertEquals("john sm", last.searchTerm());
            for (int i = 0; i < 4; i++) {
                assertTrue(futures.get(i).isCancelled());
            }
            verify(store, times(1)).search(anyString(), anyInt());
            verify(store).search("john sm", 10);
        }
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("Builder should require a store and a text projection")
        void requiredParts() {
            assertThrows(IllegalStateException.class, () -> SearchOrchestrator.<Worker>builder().build());
            assertThrows(IllegalStateException.class,
                    () -> SearchOrchestrator.<Worker>builder().store(store).build());
        }

        @Test
        @DisplayName("Options should default to the lookup's limits")
        void defaults() {
            SearchOptions options = SearchOptions.defaults();
            assertEquals(3, options.getMinQueryLength());
            assertEquals(100, options.getMaxQueryLength());
            assertEquals(10, options.getMaxResults());
            assertEquals(Duration.ofMinutes(2), options.getCacheTtl());
            assertEquals(Duration.ofSeconds(2), options.getStoreTimeout());
            assertEquals(Duration.ofMillis(300), options.getDebounceDelay());
            assertEquals("worker_search_", options.getCacheKeyPrefix());
        }

        @Test
        @DisplayName("Options should reject inconsistent values")
        void invalidOptions() {
            assertThrows(IllegalArgumentException.class, () -> SearchOptions.builder().maxResults(0));
            assertThrows(IllegalArgumentException.class, () -> SearchOptions.builder().storeTimeout(Duration.ZERO));
            assertThrows(IllegalArgumentException.class,
                    () -> SearchOptions.builder().minQueryLength(10).maxQueryLength(5).build());
        }
    }
}
