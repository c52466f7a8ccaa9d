package com.worker.lookup.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Caffeine-backed search cache with per-entry expiry.
 *
 * <p>Size eviction follows Caffeine's own policy rather than insertion order, so
 * this backend is an opt-in alternative to {@link BoundedTtlCache}. Maintenance
 * runs on the calling thread, which keeps eviction deterministic.</p>
 */
public class CaffeineSearchCache<K, V> implements SearchCache<K, V> {
    private static final Logger log = LoggerFactory.getLogger(CaffeineSearchCache.class);

    private final Cache<K, Timed<V>> cache;
    private final Duration defaultTtl;
    private final int maxSize;
    private final AtomicLong sizeEvictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    public CaffeineSearchCache(CacheConfig config) {
        this(config, Clock.systemUTC());
    }

    public CaffeineSearchCache(CacheConfig config, Clock clock) {
        this.defaultTtl = config.ttl();
        this.maxSize = config.maxSize();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfter(new PerEntryExpiry<K, V>())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .recordStats()
                .evictionListener((K key, Timed<V> value, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED) {
                        expirations.incrementAndGet();
                    } else if (cause == RemovalCause.SIZE) {
                        sizeEvictions.incrementAndGet();
                    }
                })
                .build();
        log.info("CaffeineSearchCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<V> get(K key) {
        Timed<V> timed = cache.getIfPresent(key);
        return timed == null ? Optional.empty() : Optional.of(timed.value());
    }

    @Override
    public void put(K key, V value) {
        put(key, value, defaultTtl);
    }

    @Override
    public void put(K key, V value, Duration ttl) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("key and value are required");
        }
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        cache.put(key, new Timed<>(value, effectiveTtl.toNanos()));
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public int invalidateMatching(Predicate<? super K> keyFilter) {
        List<K> keys = cache.asMap().keySet().stream()
                .filter(keyFilter)
                .toList();
        cache.invalidateAll(keys);
        log.debug("Invalidated {} cache entries", keys.size());
        return keys.size();
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                sizeEvictions.get(),
                expirations.get(),
                cache.estimatedSize(),
                0,
                maxSize
        );
    }

    @Override
    public void shutdown() {
        cache.cleanUp();
    }

    /**
     * Cached value with the TTL it was stored with.
     */
    record Timed<V>(V value, long ttlNanos) {}

    /**
     * Entries live one nanosecond past their TTL, so a read at exactly the TTL is a
     * hit, as in {@link BoundedTtlCache}.
     */
    private static final class PerEntryExpiry<K, V> implements Expiry<K, Timed<V>> {

        @Override
        public long expireAfterCreate(K key, Timed<V> value, long currentTime) {
            return lifetime(value);
        }

        @Override
        public long expireAfterUpdate(K key, Timed<V> value, long currentTime, long currentDuration) {
            return lifetime(value);
        }

        private static long lifetime(Timed<?> value) {
            long ttl = value.ttlNanos();
            return ttl == Long.MAX_VALUE ? ttl : ttl + 1;
        }

        @Override
        public long expireAfterRead(K key, Timed<V> value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
