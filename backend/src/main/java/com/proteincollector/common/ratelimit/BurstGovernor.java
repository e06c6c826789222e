package com.proteincollector.common.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;

/**
 * Sliding-window burst detection for one API.
 *
 * <p>Keeps recent request timestamps in a ring of {@code 2 * burstLimit} slots. When the window already holds
 * {@code burstLimit} requests the caller is delayed by {@code initialDelay * multiplier^(violations - 1)}, capped at
 * the configured maximum. The consecutive-violation count resets once a full window passes without a violation.
 * Separately, a trailing one-minute rate above {@code rate * softLimitThreshold} is reported as a soft violation.
 *
 * <p>All methods are synchronized; delays are returned, never slept.
 */
public class BurstGovernor {

    static final long RATE_WINDOW_MILLIS = 60_000L;

    private final String apiName;
    private final RateLimitConfig config;
    private final Consumer<RateLimitViolation> violationSink;
    private final int ringCapacity;
    private final Deque<Long> requestTimestamps;

    private int consecutiveViolations;
    private long lastViolationMillis;

    public BurstGovernor(String apiName, RateLimitConfig config, Consumer<RateLimitViolation> violationSink) {
        this.apiName = apiName;
        this.config = config;
        this.violationSink = violationSink != null ? violationSink : v -> { };
        this.ringCapacity = config.getBurstLimit() * 2;
        this.requestTimestamps = new ArrayDeque<>(ringCapacity);
    }

    /**
     * Burst check for a request arriving at {@code nowMillis}.
     *
     * @return backoff delay, zero when the window is below the ceiling
     */
    public synchronized Duration burstDelay(long nowMillis) {
        long windowStart = nowMillis - config.getBurstWindow().toMillis();
        int inWindow = countSince(windowStart);
        if (inWindow >= config.getBurstLimit()) {
            consecutiveViolations++;
            Duration delay = violationDelay(consecutiveViolations);
            lastViolationMillis = nowMillis;
            violationSink.accept(new RateLimitViolation(RateLimitViolationType.BURST_LIMIT, apiName,
                    Instant.ofEpochMilli(nowMillis), currentRate(nowMillis), config.getRequestsPerSecond(),
                    delay, inWindow));
            return delay;
        }
        if (nowMillis - lastViolationMillis > config.getBurstWindow().toMillis()) {
            consecutiveViolations = 0;
        }
        return Duration.ZERO;
    }

    /**
     * Records a soft-limit violation when the trailing one-minute rate exceeds the soft threshold.
     *
     * @return true when a soft violation was recorded
     */
    public synchronized boolean checkSoftLimit(long nowMillis) {
        double rate = currentRate(nowMillis);
        double softLimit = config.getRequestsPerSecond() * config.getSoftLimitThreshold();
        if (rate > softLimit) {
            violationSink.accept(new RateLimitViolation(RateLimitViolationType.SOFT_LIMIT, apiName,
                    Instant.ofEpochMilli(nowMillis), rate, config.getRequestsPerSecond(), Duration.ZERO, 0));
            return true;
        }
        return false;
    }

    /**
     * Append a request to the window, dropping slots beyond ring capacity or older than any window in use.
     */
    public synchronized void recordRequest(long requestMillis) {
        long horizon = requestMillis - Math.max(config.getBurstWindow().toMillis(), RATE_WINDOW_MILLIS);
        while (!requestTimestamps.isEmpty() && requestTimestamps.peekFirst() <= horizon) {
            requestTimestamps.pollFirst();
        }
        if (requestTimestamps.size() == ringCapacity) {
            requestTimestamps.pollFirst();
        }
        requestTimestamps.addLast(requestMillis);
    }

    /** Requests per second over the trailing minute. */
    public synchronized double currentRate(long nowMillis) {
        if (requestTimestamps.isEmpty()) {
            return 0.0;
        }
        return countSince(nowMillis - RATE_WINDOW_MILLIS) / (RATE_WINDOW_MILLIS / 1000.0);
    }

    public synchronized int getConsecutiveViolations() {
        return consecutiveViolations;
    }

    public synchronized int getRequestsInWindow(long nowMillis) {
        return countSince(nowMillis - config.getBurstWindow().toMillis());
    }

    Duration violationDelay(int violations) {
        double initialSeconds = config.getViolationInitialDelay().toNanos() / 1_000_000_000.0;
        double seconds = initialSeconds * Math.pow(config.getViolationBackoffMultiplier(), Math.max(0, violations - 1));
        double maxSeconds = config.getViolationMaxDelay().toNanos() / 1_000_000_000.0;
        return Duration.ofNanos(Math.round(Math.min(seconds, maxSeconds) * 1_000_000_000L));
    }

    private int countSince(long exclusiveStart) {
        int count = 0;
        for (long timestamp : requestTimestamps) {
            if (timestamp > exclusiveStart) {
                count++;
            }
        }
        return count;
    }
}
