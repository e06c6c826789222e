package com.proteincollector.common;

import com.proteincollector.common.cache.CachedApiClient;
import com.proteincollector.common.ratelimit.RateLimitManager;
import com.proteincollector.common.retry.RetryController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Governed access to a remote API: retry around (cache lookup, on miss rate-limit then call then cache).
 * A cache hit consumes no rate-limit token. Each retry attempt repeats the lookup, so a response cached by a
 * concurrent caller is picked up.
 */
public class AccessGovernor {

    private final RateLimitManager rateLimitManager;
    private final RetryController retryController;
    private final CachedApiClient cachedApiClient;

    public AccessGovernor(RateLimitManager rateLimitManager, RetryController retryController,
                          CachedApiClient cachedApiClient) {
        this.rateLimitManager = rateLimitManager;
        this.retryController = retryController;
        this.cachedApiClient = cachedApiClient;
    }

    public <T> T execute(String apiName, String endpoint, Map<String, ?> params, Class<T> type, Supplier<T> call) {
        return execute(apiName, endpoint, params, type, call, null);
    }

    /**
     * @param ttl cache TTL for the response; null uses the configured TTL for the API
     */
    public <T> T execute(String apiName, String endpoint, Map<String, ?> params, Class<T> type, Supplier<T> call,
                         Duration ttl) {
        return retryController.execute(
                () -> cachedApiClient.cachedRequest(apiName, endpoint, params, type, () -> {
                    rateLimitManager.acquire(apiName, 1);
                    return call.get();
                }, ttl),
                apiName, operationName(endpoint));
    }

    public <T> Mono<T> executeAsync(String apiName, String endpoint, Map<String, ?> params, Class<T> type,
                                    Supplier<? extends Mono<T>> call) {
        return executeAsync(apiName, endpoint, params, type, call, null);
    }

    public <T> Mono<T> executeAsync(String apiName, String endpoint, Map<String, ?> params, Class<T> type,
                                    Supplier<? extends Mono<T>> call, Duration ttl) {
        return retryController.executeAsync(
                () -> cachedApiClient.cachedRequestAsync(apiName, endpoint, params, type,
                        () -> rateLimitManager.acquireAsync(apiName, 1).then(Mono.defer(call)), ttl),
                apiName, operationName(endpoint));
    }

    private static String operationName(String endpoint) {
        return "request:" + endpoint;
    }
}
