package com.worker.lookup.api;

import com.worker.lookup.core.model.SearchTerm;

import java.time.Duration;

/**
 * Options for worker searches: query bounds, result limit, cache TTL,
 * store timeout and debounce delay.
 */
public class SearchOptions {

    private static final int DEFAULT_MAX_RESULTS = 10;
    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(2);
    private static final Duration DEFAULT_STORE_TIMEOUT = Duration.ofSeconds(2);
    private static final Duration DEFAULT_DEBOUNCE_DELAY = Duration.ofMillis(300);
    private static final String DEFAULT_CACHE_KEY_PREFIX = "worker_search_";

    private final int minQueryLength;
    private final int maxQueryLength;
    private final int maxResults;
    private final Duration cacheTtl;
    private final Duration storeTimeout;
    private final Duration debounceDelay;
    private final String cacheKeyPrefix;

    private SearchOptions(Builder builder) {
        this.minQueryLength = builder.minQueryLength;
        this.maxQueryLength = builder.maxQueryLength;
        this.maxResults = builder.maxResults;
        this.cacheTtl = builder.cacheTtl;
        this.storeTimeout = builder.storeTimeout;
        this.debounceDelay = builder.debounceDelay;
        this.cacheKeyPrefix = builder.cacheKeyPrefix;
    }

    public int getMinQueryLength() {
        return minQueryLength;
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public Duration getStoreTimeout() {
        return storeTimeout;
    }

    public Duration getDebounceDelay() {
        return debounceDelay;
    }

    public String getCacheKeyPrefix() {
        return cacheKeyPrefix;
    }

    /**
     * Creates default options.
     */
    public static SearchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int minQueryLength = SearchTerm.DEFAULT_MIN_LENGTH;
        private int maxQueryLength = SearchTerm.DEFAULT_MAX_LENGTH;
        private int maxResults = DEFAULT_MAX_RESULTS;
        private Duration cacheTtl = DEFAULT_CACHE_TTL;
        private Duration storeTimeout = DEFAULT_STORE_TIMEOUT;
        private Duration debounceDelay = DEFAULT_DEBOUNCE_DELAY;
        private String cacheKeyPrefix = DEFAULT_CACHE_KEY_PREFIX;

        public Builder minQueryLength(int minQueryLength) {
            if (minQueryLength < 1) {
                throw new IllegalArgumentException("minQueryLength must be >= 1");
            }
            this.minQueryLength = minQueryLength;
            return this;
        }

        public Builder maxQueryLength(int maxQueryLength) {
            if (maxQueryLength < 1) {
                throw new IllegalArgumentException("maxQueryLength must be >= 1");
            }
            this.maxQueryLength = maxQueryLength;
            return this;
        }

        public Builder maxResults(int maxResults) {
            if (maxResults <= 0) {
                throw new IllegalArgumentException("maxResults must be > 0");
            }
            this.maxResults = maxResults;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            requirePositive(cacheTtl, "cacheTtl");
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder storeTimeout(Duration storeTimeout) {
            requirePositive(storeTimeout, "storeTimeout");
            this.storeTimeout = storeTimeout;
            return this;
        }

        public Builder debounceDelay(Duration debounceDelay) {
            if (debounceDelay == null || debounceDelay.isNegative()) {
                throw new IllegalArgumentException("debounceDelay must be >= 0");
            }
            this.debounceDelay = debounceDelay;
            return this;
        }

        public Builder cacheKeyPrefix(String cacheKeyPrefix) {
            if (cacheKeyPrefix == null || cacheKeyPrefix.isBlank()) {
                throw new IllegalArgumentException("cacheKeyPrefix is required");
            }
            this.cacheKeyPrefix = cacheKeyPrefix;
            return this;
        }

        public SearchOptions build() {
            if (minQueryLength > maxQueryLength) {
                throw new IllegalArgumentException(
                        "minQueryLength (" + minQueryLength + ") must not exceed maxQueryLength (" + maxQueryLength + ")");
            }
            return new SearchOptions(this);
        }

        private static void requirePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
        }
    }
}
