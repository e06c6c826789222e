package com.proteincollector.common.ratelimit;

import com.proteincollector.common.Sleeper;
import com.proteincollector.common.error.OperationCancelledException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rate limiter for one API: burst backoff first, then the token bucket, then the soft-limit check.
 *
 * <p>Each stage computes its delay without sleeping; the limiter suspends once per non-zero delay and returns the
 * sum. Waiting callers are not served in FIFO order: each computes and waits out its own delay.
 */
@Slf4j
public class ApiRateLimiter {

    private static final Duration SIGNIFICANT_DELAY = Duration.ofMillis(100);

    private final String apiName;
    private final RateLimitConfig config;
    private final RateLimitMonitor monitor;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Scheduler scheduler;
    private final TokenBucket tokenBucket;
    private final BurstGovernor burstGovernor;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong totalDelayNanos = new AtomicLong();

    /**
     * @param monitor optional; when null nothing is reported
     */
    public ApiRateLimiter(String apiName, RateLimitConfig config, RateLimitMonitor monitor,
                          Clock clock, Sleeper sleeper, Scheduler scheduler) {
        this.apiName = apiName;
        this.config = config;
        this.monitor = monitor;
        this.clock = clock;
        this.sleeper = sleeper;
        this.scheduler = scheduler;
        this.tokenBucket = new TokenBucket(config.getRequestsPerSecond(), clock);
        this.burstGovernor = new BurstGovernor(apiName, config, monitor != null ? monitor::recordViolation : null);
    }

    public Duration acquire() {
        return acquire(1);
    }

    /**
     * Block until the request may proceed.
     *
     * @return total delay applied
     * @throws OperationCancelledException when interrupted while waiting
     */
    public Duration acquire(int tokens) {
        long now = clock.millis();
        Duration burstDelay = burstGovernor.burstDelay(now);
        pause(burstDelay);
        Duration tokenDelay = tokenBucket.acquire(tokens);
        pause(tokenDelay);
        Duration total = burstDelay.plus(tokenDelay);
        complete(now, total, tokens);
        return total;
    }

    public Mono<Duration> acquireAsync() {
        return acquireAsync(1);
    }

    /**
     * Non-blocking twin of {@link #acquire(int)}: delays are {@code Mono.delay} on the limiter's scheduler, so
     * disposing the subscription cancels the wait.
     */
    public Mono<Duration> acquireAsync(int tokens) {
        return Mono.defer(() -> {
            long now = clock.millis();
            Duration burstDelay = burstGovernor.burstDelay(now);
            return suspend(burstDelay)
                    .then(Mono.fromCallable(() -> tokenBucket.acquire(tokens)))
                    .flatMap(tokenDelay -> suspend(tokenDelay).thenReturn(burstDelay.plus(tokenDelay)))
                    .doOnNext(total -> complete(now, total, tokens));
        });
    }

    private void complete(long requestMillis, Duration total, int tokens) {
        burstGovernor.checkSoftLimit(clock.millis());
        burstGovernor.recordRequest(requestMillis);
        totalRequests.incrementAndGet();
        totalDelayNanos.addAndGet(total.toNanos());
        if (monitor != null) {
            monitor.recordRequest(apiName, total);
        }
        if (total.compareTo(SIGNIFICANT_DELAY) > 0) {
            log.debug("Rate limiting delay applied for {} API delayMs={} tokens={} currentRate={}",
                    apiName, total.toMillis(), tokens, burstGovernor.currentRate(clock.millis()));
        }
    }

    private void pause(Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while rate limited for " + apiName, e);
        }
    }

    private Mono<Void> suspend(Duration delay) {
        return delay.isZero() ? Mono.empty() : Mono.delay(delay, scheduler).then();
    }

    public LimiterStats getStats() {
        long requests = totalRequests.get();
        Duration averageDelay = Duration.ofNanos(totalDelayNanos.get() / Math.max(requests, 1));
        return new LimiterStats(apiName, requests, averageDelay, burstGovernor.currentRate(clock.millis()),
                burstGovernor.getConsecutiveViolations(), tokenBucket.getCurrentTokens(),
                config.getRequestsPerSecond(), config.getBurstLimit(), config.getBurstWindow());
    }

    public String getApiName() {
        return apiName;
    }

    public RateLimitConfig getConfig() {
        return config;
    }

    TokenBucket getTokenBucket() {
        return tokenBucket;
    }

    BurstGovernor getBurstGovernor() {
        return burstGovernor;
    }
}
