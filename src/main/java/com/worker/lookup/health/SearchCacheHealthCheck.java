package com.worker.lookup.health;

import com.worker.lookup.cache.CacheStats;
import com.worker.lookup.cache.SearchCache;

/**
 * Reports search cache utilization and hit rate. DEGRADED when most stored
 * entries are already expired, which means the background sweep is not running.
 */
public class SearchCacheHealthCheck implements HealthCheck {

    private static final long MIN_ENTRIES_FOR_STALENESS = 10;

    private final SearchCache<?, ?> cache;

    public SearchCacheHealthCheck(SearchCache<?, ?> cache) {
        this.cache = cache;
    }

    @Override
    public String getName() {
        return "search-cache";
    }

    @Override
    public HealthStatus check() {
        CacheStats stats = cache.getStats();

        HealthStatus base;
        if (stats.size() >= MIN_ENTRIES_FOR_STALENESS && stats.staleEntries() * 2 > stats.size()) {
            base = HealthStatus.of(HealthStatus.Status.DEGRADED, "Most cached searches are expired: "
                    + stats.staleEntries() + "/" + stats.size());
        } else {
            base = HealthStatus.up();
        }

        return base
                .withDetail("size", stats.size())
                .withDetail("maxSize", stats.maxSize())
                .withDetail("staleEntries", stats.staleEntries())
                .withDetail("utilizationPercent", Math.round(stats.utilization() * 1000.0) / 10.0)
                .withDetail("hitRatePercent", Math.round(stats.hitRate() * 1000.0) / 10.0);
    }
}
