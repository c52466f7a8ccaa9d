package com.worker.lookup.cache;

/**
 * Cache metrics.
 *
 * @param hitCount        number of cache hits
 * @param missCount       number of cache misses, expired reads included
 * @param evictionCount   entries removed to make room
 * @param expirationCount entries removed because their TTL passed
 * @param size            current number of stored entries
 * @param staleEntries    stored entries already past their TTL but not yet purged
 * @param maxSize         configured capacity
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long expirationCount,
                         long size, long staleEntries, long maxSize) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    /**
     * Returns stored entries as a fraction of capacity (0.0 to 1.0).
     */
    public double utilization() {
        return maxSize == 0 ? 0.0 : (double) size / maxSize;
    }

    public long validEntries() {
        return size - staleEntries;
    }

    /**
     * Returns empty stats.
     */
    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0, 0, 0);
    }
}
