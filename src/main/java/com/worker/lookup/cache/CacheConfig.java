package com.worker.lookup.cache;

import java.time.Duration;

/**
 * Configuration for the search result cache.
 *
 * @param provider             which backend to build
 * @param maxSize              maximum number of entries
 * @param ttlSeconds           default time-to-live in seconds for each entry
 * @param sweepIntervalSeconds period of the background expiry sweep; 0 disables it
 */
public record CacheConfig(Provider provider, int maxSize, int ttlSeconds, int sweepIntervalSeconds) {

    /**
     * Cache backends.
     */
    public enum Provider {
        /** Insertion-ordered TTL cache that evicts the oldest 20% under pressure. */
        BOUNDED,
        /** Caffeine with per-entry expiry. */
        CAFFEINE,
        /** Caching disabled. */
        NONE;

        public static Provider fromString(String value) {
            if (value == null || value.isBlank()) {
                return BOUNDED;
            }
            return Provider.valueOf(value.trim().toUpperCase());
        }
    }

    public CacheConfig {
        if (provider == null) {
            throw new IllegalArgumentException("provider is required");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
        if (sweepIntervalSeconds < 0) {
            throw new IllegalArgumentException("sweepIntervalSeconds must be >= 0");
        }
    }

    /**
     * Default configuration for worker searches: bounded cache, 500 entries,
     * two-minute TTL, swept every minute.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(Provider.BOUNDED, 500, 120, 60);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(Provider.NONE, 1, 1, 0);
    }

    public boolean enabled() {
        return provider != Provider.NONE;
    }

    public Duration ttl() {
        return Duration.ofSeconds(ttlSeconds);
    }

    public Duration sweepInterval() {
        return Duration.ofSeconds(sweepIntervalSeconds);
    }
}
