package com.proteincollector.common.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResponseCacheTest {

    private final AtomicLong nanos = new AtomicLong(1_000_000_000L);
    private final Ticker ticker = nanos::get;
    private final ObjectMapper mapper = new ObjectMapper();
    private final List<ResponseCache> opened = new ArrayList<>();

    @AfterEach
    void closeAll() {
        opened.forEach(ResponseCache::close);
    }

    private ResponseCache cache(CacheConfig.Builder config) {
        ResponseCache cache = new ResponseCache(config.build(), mapper, ticker, false);
        opened.add(cache);
        return cache;
    }

    private void advance(Duration d) {
        nanos.addAndGet(d.toNanos());
    }

    private static Map<String, Object> params(String id) {
        return Map.of("id", id);
    }

    @Test
    @DisplayName("put then get returns an equal value")
    void roundTrip() {
        ResponseCache cache = cache(CacheConfig.builder());
        Map<String, Object> value = Map.of("accession", "P04637", "length", 393, "tags", List.of("p53", "tumor"));

        cache.put("UniProt", "/uniprotkb/P04637", params("P04637"), value, Duration.ofMinutes(5));

        assertThat(cache.get("UniProt", "/uniprotkb/P04637", params("P04637"), new TypeReference<Map<String, Object>>() { }))
                .contains(value);
        assertThat(cache.getMetrics().hits()).isEqualTo(1);
    }

    @Test
    @DisplayName("lookup ignores parameter insertion order")
    void paramOrder() {
        ResponseCache cache = cache(CacheConfig.builder());
        Map<String, Object> p1 = new LinkedHashMap<>();
        p1.put("query", "kinase");
        p1.put("size", 10);
        Map<String, Object> p2 = new LinkedHashMap<>();
        p2.put("size", 10);
        p2.put("query", "kinase");

        cache.put("UniProt", "search", p1, "result", null);

        assertThat(cache.get("UniProt", "search", p2, String.class)).contains("result");
    }

    @Test
    @DisplayName("entry expires after its TTL and counts as an expired removal")
    void expiry() {
        ResponseCache cache = cache(CacheConfig.builder());
        cache.put("UniProt", "e", params("1"), "v", Duration.ofSeconds(10));

        advance(Duration.ofSeconds(10));
        assertThat(cache.get("UniProt", "e", params("1"), String.class)).contains("v");

        advance(Duration.ofMillis(1));
        assertThat(cache.get("UniProt", "e", params("1"), String.class)).isEmpty();
        CacheStatistics metrics = cache.getMetrics();
        assertThat(metrics.expiredRemovals()).isEqualTo(1);
        assertThat(metrics.misses()).isEqualTo(1);
        assertThat(metrics.totalEntries()).isZero();
    }

    @Test
    @DisplayName("TTL falls back to the API's TTL, then the default")
    void ttlResolution() {
        ResponseCache cache = cache(CacheConfig.builder()
                .defaultTtl(Duration.ofHours(1))
                .apiTtl("InterPro", Duration.ofHours(2)));
        cache.put("InterPro", "e", params("1"), "interpro", null);
        cache.put("UniProt", "e", params("1"), "uniprot", null);

        advance(Duration.ofMinutes(90));

        assertThat(cache.get("InterPro", "e", params("1"), String.class)).contains("interpro");
        assertThat(cache.get("UniProt", "e", params("1"), String.class)).isEmpty();
    }

    @Test
    @DisplayName("LRU evicts the least recently accessed entries down to 80% of capacity")
    void lruEviction() {
        ResponseCache cache = cache(CacheConfig.builder().maxEntries(5).strategy(CacheStrategy.LRU));
        for (int i = 0; i < 5; i++) {
            cache.put("UniProt", "e", params("k" + i), "v" + i, null);
        }
        cache.get("UniProt", "e", params("k0"), String.class);

        cache.put("UniProt", "e", params("k5"), "v5", null);

        CacheStatistics metrics = cache.getMetrics();
        assertThat(metrics.totalEntries()).isEqualTo(4);
        assertThat(metrics.evictions()).isEqualTo(2);
        assertThat(cache.get("UniProt", "e", params("k1"), String.class)).isEmpty();
        assertThat(cache.get("UniProt", "e", params("k2"), String.class)).isEmpty();
        for (String kept : List.of("k0", "k3", "k4", "k5")) {
            assertThat(cache.get("UniProt", "e", params(kept), String.class)).isPresent();
        }
    }

    @Test
    @DisplayName("entry count never exceeds the maximum")
    void evictionBound() {
        ResponseCache cache = cache(CacheConfig.builder().maxEntries(10));
        for (int i = 0; i < 100; i++) {
            cache.put("UniProt", "e", params("k" + i), "v" + i, null);
            assertThat(cache.getMetrics().totalEntries()).isLessThanOrEqualTo(10);
        }
    }

    @Test
    @DisplayName("LFU evicts the least used entries, oldest first among ties")
    void lfuEviction() {
        ResponseCache cache = cache(CacheConfig.builder().maxEntries(5).strategy(CacheStrategy.LFU));
        for (String k : List.of("a", "b", "c", "d", "e")) {
            cache.put("UniProt", "e", params(k), k, null);
        }
        for (String k : List.of("c", "d", "e")) {
            cache.get("UniProt", "e", params(k), String.class);
        }

        cache.put("UniProt", "e", params("f"), "f", null);

        assertThat(cache.get("UniProt", "e", params("a"), String.class)).isEmpty();
        assertThat(cache.get("UniProt", "e", params("b"), String.class)).isEmpty();
        assertThat(cache.get("UniProt", "e", params("f"), String.class)).contains("f");
        assertThat(cache.get("UniProt", "e", params("c"), String.class)).contains("c");
    }

    @Test
    @DisplayName("FIFO evicts by creation order regardless of access")
    void fifoEviction() {
        ResponseCache cache = cache(CacheConfig.builder().maxEntries(5).strategy(CacheStrategy.FIFO));
        for (int i = 0; i < 5; i++) {
            cache.put("UniProt", "e", params("k" + i), "v" + i, null);
            advance(Duration.ofMillis(1));
        }
        for (int i = 0; i < 3; i++) {
            cache.get("UniProt", "e", params("k0"), String.class);
        }

        cache.put("UniProt", "e", params("k5"), "v5", null);

        assertThat(cache.get("UniProt", "e", params("k0"), String.class)).isEmpty();
        assertThat(cache.get("UniProt", "e", params("k1"), String.class)).isEmpty();
        assertThat(cache.get("UniProt", "e", params("k2"), String.class)).isPresent();
    }

    @Test
    @DisplayName("TTL strategy evicts expired entries first, then the oldest")
    void ttlEviction() {
        ResponseCache cache = cache(CacheConfig.builder().maxEntries(5).strategy(CacheStrategy.TTL));
        for (int i = 0; i < 5; i++) {
            Duration ttl = i == 3 ? Duration.ofSeconds(1) : Duration.ofHours(1);
            cache.put("UniProt", "e", params("k" + i), "v" + i, ttl);
            advance(Duration.ofMillis(1));
        }
        advance(Duration.ofSeconds(2));

        cache.put("UniProt", "e", params("k5"), "v5", null);

        assertThat(cache.getMetrics().evictions()).isEqualTo(2);
        assertThat(cache.get("UniProt", "e", params("k0"), String.class)).isEmpty();
        assertThat(cache.get("UniProt", "e", params("k1"), String.class)).contains("v1");
        assertThat(cache.get("UniProt", "e", params("k4"), String.class)).contains("v4");
        assertThat(cache.getMetrics().expiredRemovals()).isZero();
    }

    @Test
    @DisplayName("memory budget evicts until stored bytes fit")
    void memoryBudget() {
        ResponseCache cache = cache(CacheConfig.builder().maxMemoryBytes(300).compressionEnabled(false));
        String value = "x".repeat(98);
        for (int i = 0; i < 4; i++) {
            cache.put("UniProt", "e", params("k" + i), value, null);
        }

        CacheStatistics metrics = cache.getMetrics();
        assertThat(metrics.totalEntries()).isEqualTo(3);
        assertThat(metrics.evictions()).isEqualTo(1);
        assertThat(metrics.totalSizeMb() * 1024 * 1024).isCloseTo(300.0, within(0.001));
        assertThat(cache.get("UniProt", "e", params("k0"), String.class)).isEmpty();
    }

    @Test
    @DisplayName("invalidate removes only the requested scope")
    void invalidationScoping() {
        ResponseCache cache = cache(CacheConfig.builder());
        cache.put("UniProt", "a", params("1"), "u-a-1", null);
        cache.put("UniProt", "a", params("2"), "u-a-2", null);
        cache.put("UniProt", "b", params("1"), "u-b-1", null);
        cache.put("InterPro", "a", params("1"), "i-a-1", null);

        assertThat(cache.invalidate("UniProt", "a", params("2"))).isEqualTo(1);
        assertThat(cache.invalidate("UniProt", "a", null)).isEqualTo(1);
        assertThat(cache.get("UniProt", "b", params("1"), String.class)).contains("u-b-1");

        assertThat(cache.invalidate("UniProt", null, null)).isEqualTo(1);
        assertThat(cache.get("InterPro", "a", params("1"), String.class)).contains("i-a-1");

        assertThat(cache.invalidate(null, null, null)).isEqualTo(1);
        assertThat(cache.getMetrics().totalEntries()).isZero();
    }

    @Test
    @DisplayName("large compressible values are stored gzipped and read back intact")
    void compression() {
        ResponseCache compressed = cache(CacheConfig.builder());
        ResponseCache plain = cache(CacheConfig.builder().compressionEnabled(false));
        String sequence = "MEEPQSDPSV".repeat(500);

        compressed.put("UniProt", "seq", params("P04637"), sequence, null);
        plain.put("UniProt", "seq", params("P04637"), sequence, null);

        assertThat(compressed.get("UniProt", "seq", params("P04637"), String.class)).contains(sequence);
        assertThat(compressed.getMetrics().totalSizeMb()).isLessThan(plain.getMetrics().totalSizeMb());
        assertThat(plain.getMetrics().totalSizeMb() * 1024 * 1024).isCloseTo(5002.0, within(0.001));
    }

    @Test
    @DisplayName("unserializable values are skipped without failing the caller")
    void unserializableSkipped() {
        ResponseCache cache = cache(CacheConfig.builder());

        cache.put("UniProt", "e", params("1"), new Object(), null);

        assertThat(cache.getMetrics().totalEntries()).isZero();
    }

    @Test
    @DisplayName("value that does not decode to the requested type is dropped as a miss")
    void undecodableIsMiss() {
        ResponseCache cache = cache(CacheConfig.builder());
        cache.put("UniProt", "e", params("1"), "not a number", null);

        assertThat(cache.get("UniProt", "e", params("1"), Integer.class)).isEmpty();
        CacheStatistics metrics = cache.getMetrics();
        assertThat(metrics.totalEntries()).isZero();
        assertThat(metrics.hits()).isZero();
        assertThat(metrics.misses()).isEqualTo(1);
    }

    @Test
    @DisplayName("hit rate and average response time are reported")
    void metrics() {
        ResponseCache cache = cache(CacheConfig.builder());
        cache.put("UniProt", "e", params("1"), "v", null);
        cache.get("UniProt", "e", params("1"), String.class);
        cache.get("UniProt", "e", params("1"), String.class);
        cache.get("UniProt", "e", params("2"), String.class);
        cache.recordResponseTime(100.0);
        cache.recordResponseTime(200.0);

        CacheStatistics metrics = cache.getMetrics();
        assertThat(metrics.totalRequests()).isEqualTo(3);
        assertThat(metrics.hitRate()).isCloseTo(2.0 / 3, within(1e-9));
        assertThat(metrics.missRate()).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(metrics.averageResponseTimeMs()).isEqualTo(150.0);
        assertThat(metrics.strategy()).isEqualTo(CacheStrategy.LRU);
    }

    @Test
    @DisplayName("response time samples keep the newest 500 once above 1000")
    void responseTimeSamplesBounded() {
        ResponseCache cache = cache(CacheConfig.builder());
        for (int i = 0; i < 1000; i++) {
            cache.recordResponseTime(1.0);
        }
        cache.recordResponseTime(1001.0);

        assertThat(cache.getMetrics().averageResponseTimeMs()).isCloseTo((499 + 1001.0) / 500, within(1e-9));
    }

    @Test
    @DisplayName("cleanupExpired removes all expired entries")
    void cleanup() {
        ResponseCache cache = cache(CacheConfig.builder());
        cache.put("UniProt", "e", params("1"), "short", Duration.ofSeconds(1));
        cache.put("UniProt", "e", params("2"), "long", Duration.ofHours(1));
        advance(Duration.ofSeconds(5));

        assertThat(cache.cleanupExpired()).isEqualTo(1);
        assertThat(cache.getMetrics().totalEntries()).isEqualTo(1);
        assertThat(cache.getMetrics().expiredRemovals()).isEqualTo(1);
    }

    @Test
    @DisplayName("disabled cache stores nothing")
    void disabled() {
        ResponseCache cache = cache(CacheConfig.builder().enabled(false));
        cache.put("UniProt", "e", params("1"), "v", null);

        assertThat(cache.get("UniProt", "e", params("1"), String.class)).isEmpty();
        assertThat(cache.invalidate("UniProt", null, null)).isZero();
        assertThat(cache.getMetrics().enabled()).isFalse();
        assertThat(cache.getMetrics().totalRequests()).isZero();
    }

    @Test
    @DisplayName("close stops the sweep, clears entries and is idempotent")
    void close() {
        ResponseCache cache = new ResponseCache(CacheConfig.builder().cleanupInterval(Duration.ofMillis(50)).build(),
                mapper, ticker, true);
        cache.put("UniProt", "e", params("1"), "v", null);

        cache.close();
        cache.close();

        assertThat(cache.getMetrics().totalEntries()).isZero();
        assertThat(cache.isSweepTerminated()).isTrue();
    }

    @Test
    @DisplayName("background sweep removes expired entries without any lookup")
    void backgroundSweep() throws InterruptedException {
        ResponseCache cache = new ResponseCache(CacheConfig.builder().cleanupInterval(Duration.ofMillis(20)).build(),
                mapper, ticker, true);
        opened.add(cache);
        cache.put("UniProt", "e", params("1"), "v", Duration.ofSeconds(1));
        cache.put("UniProt", "e", params("2"), "v", Duration.ofHours(1));

        advance(Duration.ofSeconds(2));
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (cache.getMetrics().expiredRemovals() == 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }

        CacheStatistics stats = cache.getMetrics();
        assertThat(stats.expiredRemovals()).isEqualTo(1);
        assertThat(stats.totalEntries()).isEqualTo(1);
        assertThat(stats.totalRequests()).isZero();

        cache.close();
        assertThat(cache.isSweepTerminated()).isTrue();
        long removalsAtClose = cache.getMetrics().expiredRemovals();
        advance(Duration.ofHours(2));
        Thread.sleep(100);
        assertThat(cache.getMetrics().expiredRemovals()).isEqualTo(removalsAtClose);
    }

    @Test
    @DisplayName("closed cache ignores put, get and invalidate")
    void closedCacheIsInert() {
        ResponseCache cache = cache(CacheConfig.builder());
        cache.close();

        cache.put("UniProt", "e", params("1"), "v", null);

        assertThat(cache.get("UniProt", "e", params("1"), String.class)).isEmpty();
        assertThat(cache.invalidate("UniProt", null, null)).isZero();
        assertThat(cache.getMetrics().totalEntries()).isZero();
        assertThat(cache.getMetrics().totalRequests()).isZero();
    }

    @Test
    @DisplayName("TTLs of several centuries round-trip and never expire")
    void centuriesLongTtl() {
        ResponseCache cache = cache(CacheConfig.builder());
        cache.put("UniProt", "e", params("1"), "v", Duration.ofDays(365L * 300));
        cache.put("UniProt", "e", params("2"), "w", ChronoUnit.FOREVER.getDuration());

        advance(Duration.ofDays(365));

        assertThat(cache.get("UniProt", "e", params("1"), String.class)).contains("v");
        assertThat(cache.get("UniProt", "e", params("2"), String.class)).contains("w");
        assertThat(cache.cleanupExpired()).isZero();
    }

    @Test
    @DisplayName("TTL-ordered eviction copes with unbounded TTLs")
    void ttlEvictionWithUnboundedTtl() {
        ResponseCache cache = cache(CacheConfig.builder().maxEntries(2).strategy(CacheStrategy.TTL));
        for (int i = 0; i < 3; i++) {
            cache.put("UniProt", "e", params(String.valueOf(i)), "v" + i, ChronoUnit.FOREVER.getDuration());
            advance(Duration.ofSeconds(1));
        }

        assertThat(cache.getMetrics().totalEntries()).isLessThanOrEqualTo(2);
        assertThat(cache.get("UniProt", "e", params("2"), String.class)).contains("v2");
    }
}
