package com.proteincollector.common.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
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
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * In-memory response cache keyed by (API, endpoint, parameters) with per-entry TTL, optional gzip compression,
 * bounded size and a pluggable eviction policy.
 *
 * <p>All structural state is guarded by one lock. Values are stored as serialized JSON bytes so cached responses are
 * detached from the caller's object graph. Time comes from a Caffeine {@link Ticker}; tests pass a manual one.
 *
 * <p>When enabled, a background sweep removes expired entries every {@code cleanupInterval}. {@link #close()} stops it;
 * a closed cache behaves like a disabled one.
 */
@Slf4j
public class ResponseCache implements AutoCloseable {

    static final double EVICTION_TARGET_RATIO = 0.8;
    static final double MIN_COMPRESSION_SAVING = 0.1;
    static final int RESPONSE_TIME_SAMPLES_MAX = 1000;
    static final int RESPONSE_TIME_SAMPLES_KEEP = 500;

    private final CacheConfig config;
    private final ObjectMapper mapper;
    private final CacheKeyGenerator keyGenerator;
    private final Ticker ticker;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();
    private final LinkedHashMap<String, Boolean> accessOrder = new LinkedHashMap<>(16, 0.75f, true);
    private final Deque<Double> responseTimes = new ArrayDeque<>();
    private final CacheMetrics metrics = new CacheMetrics();

    private final ScheduledExecutorService sweeper;
    private final ScheduledFuture<?> sweepTask;
    private volatile boolean closed;

    public ResponseCache(CacheConfig config, ObjectMapper objectMapper) {
        this(config, objectMapper, Ticker.systemTicker(), true);
    }

    /**
     * @param backgroundSweep whether to schedule periodic expiry cleanup; tests usually call {@link #cleanupExpired()}
     */
    public ResponseCache(CacheConfig config, ObjectMapper objectMapper, Ticker ticker, boolean backgroundSweep) {
        this.config = config;
        this.mapper = objectMapper;
        this.keyGenerator = new CacheKeyGenerator(objectMapper);
        this.ticker = ticker;
        if (config.isEnabled() && backgroundSweep) {
            this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "response-cache-sweep");
                t.setDaemon(true);
                return t;
            });
            long intervalMs = config.getCleanupInterval().toMillis();
            this.sweepTask = sweeper.scheduleAtFixedRate(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        } else {
            this.sweeper = null;
            this.sweepTask = null;
        }
        log.info("Response cache initialized enabled={} strategy={} maxEntries={} maxMemoryBytes={} defaultTtl={}",
                config.isEnabled(), config.getStrategy(), config.getMaxEntries(), config.getMaxMemoryBytes(),
                config.getDefaultTtl());
    }

    public <T> Optional<T> get(String apiName, String endpoint, Map<String, ?> params, Class<T> type) {
        return get(apiName, endpoint, params, mapper.getTypeFactory().constructType(type));
    }

    public <T> Optional<T> get(String apiName, String endpoint, Map<String, ?> params, TypeReference<T> type) {
        return get(apiName, endpoint, params, mapper.getTypeFactory().constructType(type));
    }

    /**
     * Look up a cached response. Expired entries are removed and count as misses. A stored value that no longer
     * deserializes to {@code type} is dropped and reported as a miss.
     */
    public <T> Optional<T> get(String apiName, String endpoint, Map<String, ?> params, JavaType type) {
        if (!config.isEnabled() || closed) {
            return Optional.empty();
        }
        String key = keyGenerator.generate(apiName, endpoint, params);
        CacheEntry entry;
        lock.lock();
        try {
            metrics.totalRequests++;
            entry = entries.get(key);
            long now = ticker.read();
            if (entry == null) {
                metrics.misses++;
                log.debug("Cache miss key={}", key);
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                removeEntry(key);
                metrics.expiredRemovals++;
                metrics.misses++;
                log.debug("Cache entry expired key={}", key);
                return Optional.empty();
            }
            entry.touch(now);
            accessOrder.get(key);
            metrics.hits++;
        } finally {
            lock.unlock();
        }
        try {
            T value = mapper.readValue(decode(entry), type);
            log.debug("Cache hit key={} accessCount={}", key, entry.getAccessCount());
            return Optional.ofNullable(value);
        } catch (IOException e) {
            log.warn("Dropping undecodable cache entry key={} type={}: {}", key, type, e.getMessage());
            dropUndecodable(key, entry);
            return Optional.empty();
        }
    }

    /**
     * Store a response. A value that cannot be serialized is skipped with a warning; caching never fails the caller.
     *
     * @param ttl per-entry TTL; null falls back to the API's TTL, then the default
     */
    public void put(String apiName, String endpoint, Map<String, ?> params, Object value, Duration ttl) {
        if (!config.isEnabled() || closed || value == null) {
            return;
        }
        String key = keyGenerator.generate(apiName, endpoint, params);
        byte[] serialized;
        try {
            serialized = mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to cache response key={} type={}: {}", key, value.getClass().getSimpleName(), e.getMessage());
            return;
        }
        byte[] data = serialized;
        boolean compressed = false;
        if (config.isCompressionEnabled() && serialized.length > CacheConfig.COMPRESSION_THRESHOLD_BYTES) {
            byte[] gzipped = gzip(serialized);
            if (gzipped != null && gzipped.length < serialized.length * (1 - MIN_COMPRESSION_SAVING)) {
                data = gzipped;
                compressed = true;
            }
        }
        Duration effectiveTtl = config.ttlFor(apiName, ttl);
        lock.lock();
        try {
            long now = ticker.read();
            removeEntry(key);
            entries.put(key, new CacheEntry(key, apiName, endpoint, data, compressed, now, effectiveTtl));
            accessOrder.put(key, Boolean.TRUE);
            metrics.totalSizeBytes += data.length;
            evictIfNeeded(now);
        } finally {
            lock.unlock();
        }
        log.debug("Cached response key={} sizeBytes={} compressed={} ttl={}", key, data.length, compressed, effectiveTtl);
    }

    /**
     * Remove entries by scope: everything when {@code apiName} is null, one API when {@code endpoint} is null,
     * one endpoint when {@code params} is null, otherwise the single matching key.
     *
     * @return number of entries removed
     */
    public int invalidate(String apiName, String endpoint, Map<String, ?> params) {
        if (!config.isEnabled() || closed) {
            return 0;
        }
        int removed;
        if (apiName == null) {
            lock.lock();
            try {
                removed = entries.size();
                clearAll();
            } finally {
                lock.unlock();
            }
        } else if (endpoint == null) {
            removed = removeMatching(e -> apiName.equals(e.getApiName()));
        } else if (params == null) {
            removed = removeMatching(e -> apiName.equals(e.getApiName()) && endpoint.equals(e.getEndpoint()));
        } else {
            String key = keyGenerator.generate(apiName, endpoint, params);
            lock.lock();
            try {
                removed = removeEntry(key) ? 1 : 0;
            } finally {
                lock.unlock();
            }
        }
        log.info("Invalidated cache entries api={} endpoint={} removed={}", apiName, endpoint, removed);
        return removed;
    }

    /**
     * Remove every expired entry.
     *
     * @return number of entries removed
     */
    public int cleanupExpired() {
        if (!config.isEnabled() || closed) {
            return 0;
        }
        long now = ticker.read();
        lock.lock();
        try {
            int removed = 0;
            Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                CacheEntry entry = it.next().getValue();
                if (entry.isExpired(now)) {
                    it.remove();
                    accessOrder.remove(entry.getKey());
                    metrics.totalSizeBytes -= entry.getSizeBytes();
                    removed++;
                }
            }
            metrics.expiredRemovals += removed;
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Add an upstream response-time sample in milliseconds. Ignored when metrics are disabled.
     */
    public void recordResponseTime(double millis) {
        if (!config.isMetricsEnabled()) {
            return;
        }
        lock.lock();
        try {
            responseTimes.addLast(millis);
            if (responseTimes.size() > RESPONSE_TIME_SAMPLES_MAX) {
                while (responseTimes.size() > RESPONSE_TIME_SAMPLES_KEEP) {
                    responseTimes.pollFirst();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public CacheStatistics getMetrics() {
        lock.lock();
        try {
            double avgResponse = responseTimes.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            return new CacheStatistics(config.isEnabled(), entries.size(),
                    metrics.totalSizeBytes / (1024.0 * 1024.0), metrics.hitRate(), metrics.missRate(),
                    metrics.hits, metrics.misses, metrics.evictions, metrics.expiredRemovals, metrics.totalRequests,
                    avgResponse, config.getMaxEntries(), config.getMaxMemoryBytes(), config.getStrategy(),
                    config.getDefaultTtl());
        } finally {
            lock.unlock();
        }
    }

    public CacheConfig getConfig() {
        return config;
    }

    Ticker getTicker() {
        return ticker;
    }

    boolean isSweepTerminated() {
        return sweeper == null || sweeper.isTerminated();
    }

    /**
     * Stop the background sweep and drop all entries. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        if (sweeper != null) {
            sweeper.shutdown();
            try {
                if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                    sweeper.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sweeper.shutdownNow();
            }
        }
        lock.lock();
        try {
            clearAll();
        } finally {
            lock.unlock();
        }
        log.info("Response cache closed");
    }

    private void sweep() {
        try {
            int removed = cleanupExpired();
            if (removed > 0) {
                log.debug("Removed {} expired cache entries", removed);
            }
        } catch (RuntimeException e) {
            // keep the schedule alive; the next run retries
            log.error("Cache cleanup failed", e);
        }
    }

    /**
     * Evict in policy order until the entry count is at most 80% of the maximum and total bytes fit the budget.
     * Runs only when one of the two limits is exceeded.
     */
    private void evictIfNeeded(long now) {
        boolean overCount = entries.size() > config.getMaxEntries();
        boolean overMemory = metrics.totalSizeBytes > config.getMaxMemoryBytes();
        if (!overCount && !overMemory) {
            return;
        }
        int target = (int) (config.getMaxEntries() * EVICTION_TARGET_RATIO);
        int evicted = 0;
        for (String key : evictionOrder(now)) {
            if (entries.size() <= target && metrics.totalSizeBytes <= config.getMaxMemoryBytes()) {
                break;
            }
            if (removeEntry(key)) {
                evicted++;
            }
        }
        metrics.evictions += evicted;
        log.debug("Evicted {} cache entries strategy={} remaining={}", evicted, config.getStrategy(), entries.size());
    }

    private List<String> evictionOrder(long now) {
        return switch (config.getStrategy()) {
            case LRU -> new ArrayList<>(accessOrder.keySet());
            case LFU -> keysSortedBy(Comparator.comparingLong(CacheEntry::getAccessCount));
            case FIFO -> keysSortedBy(Comparator.comparingLong(CacheEntry::getCreatedAtNanos));
            case TTL -> keysSortedBy(Comparator.comparing((CacheEntry e) -> !e.isExpired(now))
                    .thenComparingLong(CacheEntry::getCreatedAtNanos));
        };
    }

    private List<String> keysSortedBy(Comparator<CacheEntry> order) {
        return entries.values().stream().sorted(order).map(CacheEntry::getKey).toList();
    }

    private int removeMatching(Predicate<CacheEntry> filter) {
        lock.lock();
        try {
            List<String> keys = entries.values().stream().filter(filter).map(CacheEntry::getKey).toList();
            keys.forEach(this::removeEntry);
            return keys.size();
        } finally {
            lock.unlock();
        }
    }

    private boolean removeEntry(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed == null) {
            return false;
        }
        accessOrder.remove(key);
        metrics.totalSizeBytes -= removed.getSizeBytes();
        return true;
    }

    private void dropUndecodable(String key, CacheEntry entry) {
        lock.lock();
        try {
            // only if it was not replaced meanwhile
            if (entries.get(key) == entry) {
                removeEntry(key);
            }
            metrics.hits--;
            metrics.misses++;
        } finally {
            lock.unlock();
        }
    }

    private void clearAll() {
        entries.clear();
        accessOrder.clear();
        metrics.totalSizeBytes = 0;
    }

    private static InputStream decode(CacheEntry entry) throws IOException {
        InputStream raw = new ByteArrayInputStream(entry.getData());
        return entry.isCompressed() ? new GZIPInputStream(raw) : raw;
    }

    private static byte[] gzip(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length / 2);
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(data);
        } catch (IOException e) {
            log.warn("Compression failed, storing uncompressed: {}", e.getMessage());
            return null;
        }
        return out.toByteArray();
    }
}
