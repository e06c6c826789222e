package com.proteincollector.common.cache;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Response cache settings. TTL resolution order: explicit per-call TTL, then per-API TTL, then default.
 */
public final class CacheConfig {

    /** Serialized values above this size are candidates for gzip. */
    public static final int COMPRESSION_THRESHOLD_BYTES = 1024;

    private final boolean enabled;
    private final Duration defaultTtl;
    private final Map<String, Duration> apiTtl;
    private final int maxEntries;
    private final long maxMemoryBytes;
    private final CacheStrategy strategy;
    private final Duration cleanupInterval;
    private final boolean compressionEnabled;
    private final boolean metricsEnabled;

    private CacheConfig(Builder builder) {
        if (builder.defaultTtl == null || builder.defaultTtl.isZero() || builder.defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
        if (builder.maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        if (builder.maxMemoryBytes <= 0) {
            throw new IllegalArgumentException("maxMemoryBytes must be positive");
        }
        if (builder.cleanupInterval == null || builder.cleanupInterval.isZero() || builder.cleanupInterval.isNegative()) {
            throw new IllegalArgumentException("cleanupInterval must be positive");
        }
        this.enabled = builder.enabled;
        this.defaultTtl = builder.defaultTtl;
        this.apiTtl = Map.copyOf(builder.apiTtl);
        this.maxEntries = builder.maxEntries;
        this.maxMemoryBytes = builder.maxMemoryBytes;
        this.strategy = builder.strategy != null ? builder.strategy : CacheStrategy.LRU;
        this.cleanupInterval = builder.cleanupInterval;
        this.compressionEnabled = builder.compressionEnabled;
        this.metricsEnabled = builder.metricsEnabled;
    }

    public Duration ttlFor(String apiName, Duration explicitTtl) {
        if (explicitTtl != null && !explicitTtl.isZero() && !explicitTtl.isNegative()) {
            return explicitTtl;
        }
        return Optional.ofNullable(apiName).map(apiTtl::get).orElse(defaultTtl);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public Map<String, Duration> getApiTtl() {
        return apiTtl;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public long getMaxMemoryBytes() {
        return maxMemoryBytes;
    }

    public CacheStrategy getStrategy() {
        return strategy;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public boolean isCompressionEnabled() {
        return compressionEnabled;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean enabled = true;
        private Duration defaultTtl = Duration.ofHours(1);
        private final Map<String, Duration> apiTtl = new HashMap<>();
        private int maxEntries = 10_000;
        private long maxMemoryBytes = 500L * 1024 * 1024;
        private CacheStrategy strategy = CacheStrategy.LRU;
        private Duration cleanupInterval = Duration.ofMinutes(5);
        private boolean compressionEnabled = true;
        private boolean metricsEnabled = true;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder apiTtl(String apiName, Duration ttl) {
            this.apiTtl.put(apiName, ttl);
            return this;
        }

        public Builder apiTtl(Map<String, Duration> apiTtl) {
            if (apiTtl != null) {
                this.apiTtl.putAll(apiTtl);
            }
            return this;
        }

        public Builder maxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
            return this;
        }

        public Builder maxMemoryBytes(long maxMemoryBytes) {
            this.maxMemoryBytes = maxMemoryBytes;
            return this;
        }

        public Builder maxMemoryMb(int maxMemoryMb) {
            this.maxMemoryBytes = (long) maxMemoryMb * 1024 * 1024;
            return this;
        }

        public Builder strategy(CacheStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder cleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        public Builder compressionEnabled(boolean compressionEnabled) {
            this.compressionEnabled = compressionEnabled;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public CacheConfig build() {
            return new CacheConfig(this);
        }
    }
}
