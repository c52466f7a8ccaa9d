package com.worker.lookup.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Key-value cache for search results with per-entry time-to-live.
 *
 * <p>Implementations are shared across concurrent searches and must be thread-safe.</p>
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface SearchCache<K, V> {

    /**
     * Gets a live entry. Expired entries are treated as absent.
     *
     * @param key the cache key
     * @return the cached value, or empty on a miss
     */
    Optional<V> get(K key);

    /**
     * Stores a value with the cache's default time-to-live.
     */
    void put(K key, V value);

    /**
     * Stores a value, replacing any previous entry for the key.
     *
     * @param key   the cache key
     * @param value the value to cache
     * @param ttl   how long the entry stays live
     */
    void put(K key, V value, Duration ttl);

    /**
     * Removes the entry for the given key, if any.
     */
    void invalidate(K key);

    /**
     * Removes every entry whose key matches the filter.
     *
     * @return the number of entries removed
     */
    int invalidateMatching(Predicate<? super K> keyFilter);

    /**
     * Removes all entries.
     */
    void invalidateAll();

    /**
     * Returns the number of stored entries, possibly including expired ones not yet purged.
     */
    long size();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();

    /**
     * Starts background maintenance, if the implementation has any.
     */
    default void init() {
    }

    /**
     * Stops background maintenance started by {@link #init()}.
     */
    default void shutdown() {
    }
}
