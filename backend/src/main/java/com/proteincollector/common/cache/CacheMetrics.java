package com.proteincollector.common.cache;

/**
 * Monotonic cache counters, mutated under the cache lock. Rates are derived on read.
 */
final class CacheMetrics {

    long hits;
    long misses;
    long evictions;
    long expiredRemovals;
    long totalRequests;
    long totalSizeBytes;

    double hitRate() {
        return totalRequests == 0 ? 0.0 : (double) hits / totalRequests;
    }

    double missRate() {
        return 1.0 - hitRate();
    }
}
