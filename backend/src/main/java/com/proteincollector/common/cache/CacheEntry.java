package com.proteincollector.common.cache;

import java.time.Duration;

/**
 * One stored response. Owned by {@link ResponseCache}; access fields change only under the cache lock.
 * Times are {@link com.github.benmanes.caffeine.cache.Ticker} nanoseconds.
 */
final class CacheEntry {

    private final String key;
    private final String apiName;
    private final String endpoint;
    private final byte[] data;
    private final boolean compressed;
    private final long createdAtNanos;
    private final Duration ttl;
    private final long ttlNanos;
    private long lastAccessedNanos;
    private long accessCount;

    CacheEntry(String key, String apiName, String endpoint, byte[] data, boolean compressed,
               long createdAtNanos, Duration ttl) {
        this.key = key;
        this.apiName = apiName;
        this.endpoint = endpoint;
        this.data = data;
        this.compressed = compressed;
        this.createdAtNanos = createdAtNanos;
        this.ttl = ttl;
        this.ttlNanos = saturatedNanos(ttl);
        this.lastAccessedNanos = createdAtNanos;
        this.accessCount = 1;
    }

    boolean isExpired(long nowNanos) {
        return nowNanos - createdAtNanos > ttlNanos;
    }

    /**
     * TTLs beyond the nanosecond range of a long never expire.
     */
    static long saturatedNanos(Duration ttl) {
        if (ttl.getSeconds() >= Long.MAX_VALUE / 1_000_000_000L) {
            return Long.MAX_VALUE;
        }
        return ttl.toNanos();
    }

    void touch(long nowNanos) {
        lastAccessedNanos = nowNanos;
        accessCount++;
    }

    String getKey() {
        return key;
    }

    String getApiName() {
        return apiName;
    }

    String getEndpoint() {
        return endpoint;
    }

    byte[] getData() {
        return data;
    }

    boolean isCompressed() {
        return compressed;
    }

    long getCreatedAtNanos() {
        return createdAtNanos;
    }

    long getLastAccessedNanos() {
        return lastAccessedNanos;
    }

    long getAccessCount() {
        return accessCount;
    }

    Duration getTtl() {
        return ttl;
    }

    int getSizeBytes() {
        return data.length;
    }
}
