package com.proteincollector.common.cache;

import java.time.Duration;

/**
 * Point-in-time view of {@link ResponseCache} metrics and the settings that shape them.
 */
public record CacheStatistics(
        boolean enabled,
        int totalEntries,
        double totalSizeMb,
        double hitRate,
        double missRate,
        long hits,
        long misses,
        long evictions,
        long expiredRemovals,
        long totalRequests,
        double averageResponseTimeMs,
        int maxEntries,
        long maxMemoryBytes,
        CacheStrategy strategy,
        Duration defaultTtl
) {
}
