package com.worker.lookup.api;

import com.worker.lookup.cache.CacheConfig;
import com.worker.lookup.cache.CacheStats;
import com.worker.lookup.cache.SearchCache;
import com.worker.lookup.cache.SearchCaches;
import com.worker.lookup.core.model.RankedResult;
import com.worker.lookup.core.model.SearchTerm;
import com.worker.lookup.core.model.Worker;
import com.worker.lookup.debounce.QueryDebouncer;
import com.worker.lookup.logging.LogContext;
import com.worker.lookup.metrics.MetricsService;
import com.worker.lookup.metrics.MonitorConfig;
import com.worker.lookup.metrics.NoOpMetricsService;
import com.worker.lookup.metrics.PerformanceMonitor;
import com.worker.lookup.metrics.PerformanceSnapshot;
import com.worker.lookup.metrics.SearchOutcome;
import com.worker.lookup.ranking.ResultRanker;
import com.worker.lookup.store.RecordStore;
import com.worker.lookup.store.StoreUnavailableException;
import com.worker.lookup.store.TrackedRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Entry point for worker lookups. Ties validation, the search cache, the record
 * store, ranking and performance tracking into a single call.
 *
 * <p>A search goes through these steps:</p>
 * <ol>
 *   <li>validate the raw query; invalid input returns an empty response without
 *       touching the cache or the store</li>
 *   <li>look up {@code worker_search_<normalized term>} in the cache; a hit is returned as is</li>
 *   <li>on a miss, fetch at most {@code maxResults} rows from the store, bounded by the store timeout</li>
 *   <li>rank the rows and cache the ranked list for the configured TTL</li>
 * </ol>
 *
 * <p>Every request records a metric named {@code search.<outcome>}. Store failures,
 * timeouts and corrupt cache entries degrade to an empty or uncached response;
 * {@link #search(String)} never throws.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * SearchOrchestrator&lt;Worker&gt; orchestrator = SearchOrchestrator.forWorkers(store)
 *     .options(SearchOptions.builder().maxResults(20).build())
 *     .build();
 * orchestrator.init();
 *
 * SearchResponse&lt;Worker&gt; response = orchestrator.search("john");
 *
 * // Typing in a search box
 * Function&lt;String, CompletableFuture&lt;SearchResponse&lt;Worker&gt;&gt;&gt; typeahead =
 *     orchestrator.debounced("check-in-search");
 * typeahead.apply("joh");
 * typeahead.apply("john").thenAccept(render);
 * </pre>
 *
 * @param <C> candidate type
 */
public class SearchOrchestrator<C> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SearchOrchestrator.class);

    private static final String CACHE_NAME = "worker-search";

    private final RecordStore<C> store;
    private final Function<? super C, ? extends List<String>> textsOf;
    private final ResultRanker ranker;
    private final SearchCache<String, List<RankedResult<C>>> cache;
    private final PerformanceMonitor monitor;
    private final MetricsService metrics;
    private final QueryDebouncer debouncer;
    private final boolean ownsDebouncer;
    private final SearchOptions options;
    private final Clock clock;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private SearchOrchestrator(Builder<C> builder) {
        this.options = builder.options;
        this.clock = builder.clock;
        this.textsOf = builder.textsOf;
        this.ranker = builder.ranker != null ? builder.ranker : new ResultRanker();
        this.monitor = builder.monitor != null
                ? builder.monitor : new PerformanceMonitor(MonitorConfig.defaults(), clock);
        this.metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.cache = builder.cache != null
                ? builder.cache : SearchCaches.create(CACHE_NAME, CacheConfig.defaults(), clock);
        this.store = builder.trackStore ? new TrackedRecordStore<>(builder.store, monitor, clock) : builder.store;

        this.ownsDebouncer = builder.debouncer == null;
        this.debouncer = builder.debouncer != null ? builder.debouncer : new QueryDebouncer(options.getDebounceDelay());

        this.ownsExecutor = builder.executor == null;
        this.executor = builder.executor != null ? builder.executor : newFetchExecutor();

        log.info("SearchOrchestrator initialized with store: {}", store.getName());
    }

    /**
     * Starts background cache sweeps and monitor cleanup.
     */
    public void init() {
        cache.init();
        monitor.init();
    }

    // ========== Search API ==========

    /**
     * Searches for candidates matching the raw query.
     *
     * @param rawQuery the query as typed; may be {@code null}
     * @return ranked results, or an empty response for invalid input or a failed store
     */
    public SearchResponse<C> search(String rawQuery) {
        return search(rawQuery, Map.of());
    }

    /**
     * Searches with additional store filters (admin screens). Filters become part
     * of the cache key.
     */
    public SearchResponse<C> search(String rawQuery, Map<String, String> filters) {
        long start = clock.millis();
        Map<String, String> safeFilters = filters != null ? filters : Map.of();

        SearchTerm.Validation validation = SearchTerm.validate(
                rawQuery, options.getMinQueryLength(), options.getMaxQueryLength());
        if (!validation.isValid()) {
            log.debug("search.invalid error={}", validation.error());
            SearchResponse<C> empty = SearchResponse.empty(trimmed(rawQuery), elapsedSince(start), List.of());
            finish(SearchOutcome.INVALID, start, null);
            return empty;
        }

        SearchTerm term = validation.term();
        String key = cacheKey(term, safeFilters);
        List<String> suggestions = term.suggestions();

        try (LogContext ignored = LogContext.forSearch(LogContext.generateCorrelationId(), key)) {
            Optional<List<RankedResult<C>>> cached = readCache(key);
            if (cached.isPresent()) {
                metrics.recordCacheHit();
                List<RankedResult<C>> results = cached.get();
                metrics.recordResultCount(results.size());
                finish(SearchOutcome.CACHED, start, null);
                log.debug("search.cached term='{}' results={}", term.normalized(), results.size());
                return SearchResponse.of(results, term.raw(), elapsedSince(start), true, suggestions);
            }
            metrics.recordCacheMiss();

            List<C> rows;
            try {
                rows = fetch(term, safeFilters);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("search.cancelled term='{}'", term.normalized());
                finish(SearchOutcome.CANCELLED, start, null);
                return SearchResponse.empty(term.raw(), elapsedSince(start), suggestions);
            } catch (RuntimeException e) {
                String error = describe(e);
                log.warn("search.failed term='{}' error={}", term.normalized(), error);
                metrics.incrementStoreFailure();
                finish(SearchOutcome.FAILED, start, error);
                return SearchResponse.empty(term.raw(), elapsedSince(start), suggestions);
            }

            List<RankedResult<C>> ranked;
            try {
                ranked = ranker.rank(rows, term, textsOf);
            } catch (RuntimeException e) {
                String error = describe(e);
                log.warn("search.rankFailed term='{}' rows={} error={}", term.normalized(), rows.size(), error);
                finish(SearchOutcome.FAILED, start, error);
                return SearchResponse.empty(term.raw(), elapsedSince(start), suggestions);
            }
            writeCache(key, ranked);
            metrics.recordResultCount(ranked.size());
            finish(SearchOutcome.FETCHED, start, null);
            log.debug("search.fetched term='{}' rows={} results={}", term.normalized(), rows.size(), ranked.size());
            return SearchResponse.of(ranked, term.raw(), elapsedSince(start), false, suggestions);
        }
    }

    /**
     * Runs {@link #search(String)} on the fetch executor. Cancelling the returned
     * future interrupts the search and cancels its store fetch.
     */
    public CompletableFuture<SearchResponse<C>> searchAsync(String rawQuery) {
        CompletableFuture<SearchResponse<C>> result = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            try {
                result.complete(search(rawQuery));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((response, error) -> {
            if (result.isCancelled()) {
                task.cancel(true);
            }
        });
        return result;
    }

    /**
     * Returns a search function debounced under {@code key} with the configured delay.
     * Only the last call of a burst reaches the store; earlier futures are cancelled.
     */
    public Function<String, CompletableFuture<SearchResponse<C>>> debounced(String key) {
        return debouncer.<String, SearchResponse<C>>debounce(key, this::searchAsync, options.getDebounceDelay());
    }

    /**
     * Drops every cached search. Call after workers are created, updated or deleted.
     *
     * @return the number of cache entries removed
     */
    public int invalidateCachedSearches() {
        try (LogContext ignored = LogContext.forCacheMaintenance("invalidate-searches")) {
            String prefix = options.getCacheKeyPrefix();
            int removed = cache.invalidateMatching(key -> key.startsWith(prefix));
            log.info("search.cache.invalidated removed={}", removed);
            return removed;
        }
    }

    /**
     * Builds the cache key: prefix plus normalized term, then filters sorted by name.
     */
    public String cacheKey(SearchTerm term, Map<String, String> filters) {
        StringBuilder key = new StringBuilder(options.getCacheKeyPrefix()).append(term.normalized());
        if (filters != null && !filters.isEmpty()) {
            char separator = '?';
            for (Map.Entry<String, String> filter : new TreeMap<>(filters).entrySet()) {
                if (filter.getValue() == null || filter.getValue().isBlank()) {
                    continue;
                }
                key.append(separator).append(filter.getKey()).append('=').append(filter.getValue().trim());
                separator = '&';
            }
        }
        return key.toString();
    }

    // ========== Monitoring API ==========

    public PerformanceSnapshot getStats(int windowMinutes) {
        return monitor.stats(windowMinutes);
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public PerformanceMonitor getMonitor() {
        return monitor;
    }

    public SearchCache<String, List<RankedResult<C>>> getCache() {
        return cache;
    }

    public SearchOptions getOptions() {
        return options;
    }

    /**
     * Stops background work. Executors and debouncers passed to the builder are left running.
     */
    public void shutdown() {
        if (ownsDebouncer) {
            debouncer.shutdown();
        }
        cache.shutdown();
        monitor.shutdown();
        if (ownsExecutor) {
            executor.shutdownNow();
        }
        log.info("SearchOrchestrator stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    // ========== Internals ==========

    private List<C> fetch(SearchTerm term, Map<String, String> filters) throws InterruptedException {
        Future<List<C>> pending = executor.submit(
                () -> store.search(term.normalized(), options.getMaxResults(), filters));
        long timeoutMs = options.getStoreTimeout().toMillis();
        try {
            List<C> rows = pending.get(timeoutMs, TimeUnit.MILLISECONDS);
            return rows != null ? rows : List.of();
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new StoreUnavailableException("Store did not answer within " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new StoreUnavailableException("Store search failed: " + cause.getMessage(), cause);
        }
    }

    private Optional<List<RankedResult<C>>> readCache(String key) {
        try {
            Optional<List<RankedResult<C>>> cached = cache.get(key);
            if (cached.isEmpty()) {
                return Optional.empty();
            }
            List<RankedResult<C>> results = cached.get();
            for (RankedResult<C> result : results) {
                if (result == null) {
                    throw new IllegalStateException("cached result list contains null");
                }
            }
            return cached;
        } catch (RuntimeException e) {
            log.warn("search.cache.corrupt key={} error={}", key, describe(e));
            discard(key);
            return Optional.empty();
        }
    }

    private void discard(String key) {
        try {
            cache.invalidate(key);
        } catch (RuntimeException e) {
            log.warn("search.cache.invalidateFailed key={} error={}", key, describe(e));
        }
    }

    private void writeCache(String key, List<RankedResult<C>> ranked) {
        try {
            cache.put(key, ranked, options.getCacheTtl());
        } catch (RuntimeException e) {
            log.warn("search.cache.writeFailed key={} error={}", key, describe(e));
        }
    }

    private void finish(SearchOutcome outcome, long start, String error) {
        long elapsed = elapsedSince(start);
        boolean success = outcome != SearchOutcome.FAILED;
        monitor.recordApiCall("search." + outcome.tag(), elapsed, success, error);
        metrics.recordSearchDuration(outcome, Duration.ofMillis(elapsed));
    }

    private long elapsedSince(long start) {
        return Math.max(0, clock.millis() - start);
    }

    private static String trimmed(String rawQuery) {
        return rawQuery != null ? rawQuery.trim() : "";
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static ExecutorService newFetchExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "worker-search-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ========== Builder ==========

    public static <C> Builder<C> builder() {
        return new Builder<>();
    }

    /**
     * Builder preconfigured for {@link Worker} candidates.
     */
    public static Builder<Worker> forWorkers(RecordStore<Worker> store) {
        return SearchOrchestrator.<Worker>builder()
                .store(store)
                .textsOf(Worker::searchableTexts);
    }

    public static class Builder<C> {
        private RecordStore<C> store;
        private Function<? super C, ? extends List<String>> textsOf;
        private ResultRanker ranker;
        private SearchCache<String, List<RankedResult<C>>> cache;
        private PerformanceMonitor monitor;
        private MetricsService metricsService;
        private QueryDebouncer debouncer;
        private SearchOptions options = SearchOptions.defaults();
        private Clock clock = Clock.systemUTC();
        private ExecutorService executor;
        private boolean trackStore = true;

        public Builder<C> store(RecordStore<C> store) {
            this.store = store;
            return this;
        }

        /**
         * Projection of a candidate onto the texts it is ranked by.
         */
        public Builder<C> textsOf(Function<? super C, ? extends List<String>> textsOf) {
            this.textsOf = textsOf;
            return this;
        }

        public Builder<C> ranker(ResultRanker ranker) {
            this.ranker = ranker;
            return this;
        }

        public Builder<C> cache(SearchCache<String, List<RankedResult<C>>> cache) {
            this.cache = cache;
            return this;
        }

        public Builder<C> monitor(PerformanceMonitor monitor) {
            this.monitor = monitor;
            return this;
        }

        public Builder<C> metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder<C> debouncer(QueryDebouncer debouncer) {
            this.debouncer = debouncer;
            return this;
        }

        public Builder<C> options(SearchOptions options) {
            this.options = options;
            return this;
        }

        public Builder<C> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Executor for store fetches and async searches. An async search occupies
         * one thread while its fetch runs on another, so a single-threaded executor
         * would time out every async search.
         */
        public Builder<C> executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Whether store calls are reported to the monitor at store level. Defaults to {@code true}.
         */
        public Builder<C> trackStore(boolean trackStore) {
            this.trackStore = trackStore;
            return this;
        }

        public SearchOrchestrator<C> build() {
            if (store == null) {
                throw new IllegalStateException("store is required");
            }
            if (textsOf == null) {
                throw new IllegalStateException("textsOf is required");
            }
            if (options == null || clock == null) {
                throw new IllegalStateException("options and clock are required");
            }
            return new SearchOrchestrator<>(this);
        }
    }
}
