package com.proteincollector.common.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Read-through wrapper: serve from {@link ResponseCache}, otherwise run the request, time it and cache the result.
 * Request failures are rethrown unchanged and never cached.
 */
@Slf4j
public class CachedApiClient {

    private final ResponseCache cache;
    private final Ticker ticker;

    public CachedApiClient(ResponseCache cache) {
        this.cache = cache;
        this.ticker = cache.getTicker();
    }

    public <T> T cachedRequest(String apiName, String endpoint, Map<String, ?> params, Class<T> type,
                               Supplier<T> request) {
        return cachedRequest(apiName, endpoint, params, type, request, null);
    }

    /**
     * @param ttl per-entry TTL override; null uses the cache's resolution
     */
    public <T> T cachedRequest(String apiName, String endpoint, Map<String, ?> params, Class<T> type,
                               Supplier<T> request, Duration ttl) {
        Optional<T> cached = cache.get(apiName, endpoint, params, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        long start = ticker.read();
        T result;
        try {
            result = request.get();
        } catch (RuntimeException e) {
            log.debug("Uncached request failed api={} endpoint={}: {}", apiName, endpoint, e.toString());
            throw e;
        } finally {
            cache.recordResponseTime(elapsedMillis(start));
        }
        cache.put(apiName, endpoint, params, result, ttl);
        return result;
    }

    public <T> Mono<T> cachedRequestAsync(String apiName, String endpoint, Map<String, ?> params, Class<T> type,
                                          Supplier<? extends Mono<T>> request) {
        return cachedRequestAsync(apiName, endpoint, params, type, request, null);
    }

    /**
     * Reactive variant. The lookup happens at subscription time; an empty upstream result is passed through uncached.
     */
    public <T> Mono<T> cachedRequestAsync(String apiName, String endpoint, Map<String, ?> params, Class<T> type,
                                          Supplier<? extends Mono<T>> request, Duration ttl) {
        return Mono.defer(() -> {
            Optional<T> cached = cache.get(apiName, endpoint, params, type);
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }
            long start = ticker.read();
            return Mono.<T>defer(request)
                    .doOnNext(result -> cache.put(apiName, endpoint, params, result, ttl))
                    .doOnError(e -> log.debug("Uncached request failed api={} endpoint={}: {}",
                            apiName, endpoint, e.toString()))
                    .doFinally(signal -> cache.recordResponseTime(elapsedMillis(start)));
        });
    }

    public ResponseCache getCache() {
        return cache;
    }

    private double elapsedMillis(long startNanos) {
        return (ticker.read() - startNanos) / 1_000_000.0;
    }
}
