package com.worker.lookup.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Bounded cache with per-entry expiry and insertion-time eviction.
 *
 * <p>Reads never change an entry's position: this is not an LRU. When a write finds
 * the cache full it first drops expired entries and, if still full, drops the
 * oldest {@value #EVICTION_FRACTION_PERCENT}% of capacity by creation time. After
 * any {@code put} the size never exceeds capacity.</p>
 *
 * <p>Expired entries are also removed lazily on read and, once {@link #init()} has
 * been called with a non-zero sweep interval, by a background sweep.</p>
 *
 * <p>All mutations run under a single lock.</p>
 */
public class BoundedTtlCache<K, V> implements SearchCache<K, V> {
    private static final Logger log = LoggerFactory.getLogger(BoundedTtlCache.class);

    static final int EVICTION_FRACTION_PERCENT = 20;

    private final int capacity;
    private final Duration defaultTtl;
    private final Duration sweepInterval;
    private final Clock clock;
    private final String name;

    private final ReentrantLock lock = new ReentrantLock();
    // Insertion order; overwrites re-insert so iteration follows creation time
    private final LinkedHashMap<K, CacheEntry<V>> entries = new LinkedHashMap<>();

    private long hitCount;
    private long missCount;
    private long evictionCount;
    private long expirationCount;

    private ScheduledExecutorService sweeper;
    private ScheduledFuture<?> sweepTask;

    public BoundedTtlCache(CacheConfig config) {
        this("search", config, Clock.systemUTC());
    }

    public BoundedTtlCache(String name, CacheConfig config, Clock clock) {
        this(name, config.maxSize(), config.ttl(), config.sweepInterval(), clock);
    }

    public BoundedTtlCache(String name, int capacity, Duration defaultTtl, Duration sweepInterval, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        if (defaultTtl == null || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must be >= 0");
        }
        this.name = name;
        this.capacity = capacity;
        this.defaultTtl = defaultTtl;
        this.sweepInterval = sweepInterval == null ? Duration.ZERO : sweepInterval;
        this.clock = clock;
    }

    @Override
    public Optional<V> get(K key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                missCount++;
                return Optional.empty();
            }
            if (entry.isExpired(clock.millis())) {
                entries.remove(key);
                expirationCount++;
                missCount++;
                return Optional.empty();
            }
            hitCount++;
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
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
        if (effectiveTtl.isNegative()) {
            throw new IllegalArgumentException("ttl must be >= 0");
        }
        lock.lock();
        try {
            if (entries.size() >= capacity) {
                cleanup();
            }
            entries.remove(key);
            entries.put(key, new CacheEntry<>(value, clock.millis(), effectiveTtl.toMillis()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidate(K key) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int invalidateMatching(Predicate<? super K> keyFilter) {
        lock.lock();
        try {
            int removed = 0;
            Iterator<K> it = entries.keySet().iterator();
            while (it.hasNext()) {
                if (keyFilter.test(it.next())) {
                    it.remove();
                    removed++;
                }
            }
            log.debug("cache.invalidated name={} entries={}", name, removed);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidateAll() {
        lock.lock();
        try {
            entries.clear();
            log.debug("cache.cleared name={}", name);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats getStats() {
        lock.lock();
        try {
            long now = clock.millis();
            long stale = entries.values().stream().filter(e -> e.isExpired(now)).count();
            return new CacheStats(hitCount, missCount, evictionCount, expirationCount,
                    entries.size(), stale, capacity);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every expired entry.
     *
     * @return the number of entries removed
     */
    public int purgeExpired() {
        lock.lock();
        try {
            long now = clock.millis();
            int removed = 0;
            Iterator<CacheEntry<V>> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            expirationCount += removed;
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Starts the background expiry sweep when a sweep interval is configured.
     * Calling it twice has no further effect.
     */
    @Override
    public synchronized void init() {
        if (sweepTask != null || sweepInterval.isZero()) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-sweep-" + name);
            t.setDaemon(true);
            return t;
        });
        long periodMs = sweepInterval.toMillis();
        sweepTask = sweeper.scheduleAtFixedRate(this::sweep, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("BoundedTtlCache '{}' initialized: capacity={}, ttl={}s, sweep={}s",
                name, capacity, defaultTtl.toSeconds(), sweepInterval.toSeconds());
    }

    /**
     * Cancels the background sweep. Cached entries are kept.
     */
    @Override
    public synchronized void shutdown() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
            log.info("BoundedTtlCache '{}' sweep stopped", name);
        }
    }

    synchronized boolean isSweeping() {
        return sweepTask != null && !sweepTask.isCancelled();
    }

    private void sweep() {
        try {
            int removed = purgeExpired();
            if (removed > 0) {
                log.debug("cache.sweep name={} expired={}", name, removed);
            }
        } catch (RuntimeException e) {
            // An exception would silently cancel the scheduled task
            log.warn("cache.sweep.failed name={} error={}", name, e.getMessage(), e);
        }
    }

    /**
     * Drops expired entries, then the oldest fifth of capacity if still full.
     * Caller holds the lock.
     */
    private void cleanup() {
        long now = clock.millis();
        int expired = 0;
        Iterator<CacheEntry<V>> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                expired++;
            }
        }
        expirationCount += expired;

        if (entries.size() < capacity) {
            log.debug("cache.cleanup name={} expired={}", name, expired);
            return;
        }

        int toEvict = Math.max(1, capacity * EVICTION_FRACTION_PERCENT / 100);
        List<Map.Entry<K, CacheEntry<V>>> oldestFirst = new ArrayList<>(entries.entrySet());
        // Stable: equal timestamps keep insertion order
        oldestFirst.sort(Comparator.comparingLong(e -> e.getValue().createdAtMillis()));

        List<K> victims = new ArrayList<>(toEvict);
        for (int i = 0; i < toEvict && i < oldestFirst.size(); i++) {
            victims.add(oldestFirst.get(i).getKey());
        }
        victims.forEach(entries::remove);
        evictionCount += victims.size();

        log.debug("cache.cleanup name={} expired={} evicted={} size={}",
                name, expired, victims.size(), entries.size());
    }

    /**
     * Stored value plus the data needed to decide expiry. Never leaves this class.
     */
    private record CacheEntry<V>(V value, long createdAtMillis, long ttlMillis) {

        boolean isExpired(long nowMillis) {
            return nowMillis - createdAtMillis > ttlMillis;
        }
    }
}
