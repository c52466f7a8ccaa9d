package com.worker.lookup.cache;

import java.time.Clock;

/**
 * Builds the {@link SearchCache} backend named by a {@link CacheConfig}.
 */
public final class SearchCaches {

    private SearchCaches() {
    }

    public static <K, V> SearchCache<K, V> create(String name, CacheConfig config, Clock clock) {
        return switch (config.provider()) {
            case BOUNDED -> new BoundedTtlCache<>(name, config, clock);
            case CAFFEINE -> new CaffeineSearchCache<>(config, clock);
            case NONE -> new NoOpSearchCache<>();
        };
    }
}
