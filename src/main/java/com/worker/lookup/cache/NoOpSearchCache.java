package com.worker.lookup.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * No-op cache implementation. Every lookup misses.
 * Used when caching is disabled.
 */
public class NoOpSearchCache<K, V> implements SearchCache<K, V> {

    @Override
    public Optional<V> get(K key) {
        return Optional.empty();
    }

    @Override
    public void put(K key, V value) {
        // no-op
    }

    @Override
    public void put(K key, V value, Duration ttl) {
        // no-op
    }

    @Override
    public void invalidate(K key) {
        // no-op
    }

    @Override
    public int invalidateMatching(Predicate<? super K> keyFilter) {
        return 0;
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public long size() {
        return 0;
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
