package com.worker.lookup.store;

import com.worker.lookup.metrics.PerformanceMonitor;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Decorator that reports every store call to the {@link PerformanceMonitor} at store level,
 * where the slow threshold is lower than for whole requests. Failures are recorded and rethrown.
 */
public class TrackedRecordStore<C> implements RecordStore<C> {

    private final RecordStore<C> delegate;
    private final PerformanceMonitor monitor;
    private final Clock clock;

    public TrackedRecordStore(RecordStore<C> delegate, PerformanceMonitor monitor) {
        this(delegate, monitor, Clock.systemUTC());
    }

    public TrackedRecordStore(RecordStore<C> delegate, PerformanceMonitor monitor, Clock clock) {
        this.delegate = delegate;
        this.monitor = monitor;
        this.clock = clock;
    }

    @Override
    public List<C> search(String term, int limit) {
        return search(term, limit, Map.of());
    }

    @Override
    public List<C> search(String term, int limit, Map<String, String> filters) {
        long start = clock.millis();
        String query = delegate.getName() + ".search " + term;
        try {
            List<C> rows = filters == null || filters.isEmpty()
                    ? delegate.search(term, limit)
                    : delegate.search(term, limit, filters);
            monitor.recordStoreQuery(query, elapsedSince(start), true, null);
            return rows;
        } catch (RuntimeException e) {
            monitor.recordStoreQuery(query, elapsedSince(start), false,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            throw e;
        }
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    private long elapsedSince(long start) {
        return Math.max(0, clock.millis() - start);
    }
}
