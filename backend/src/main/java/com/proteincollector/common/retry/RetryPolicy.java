package com.proteincollector.common.retry;

import java.time.Duration;

/**
 * Exponential backoff for API retries: initialDelay * multiplier^attempt, capped at maxDelay.
 * Immutable; one instance is shared by all operations unless a call passes its own.
 */
public final class RetryPolicy {

    private final int maxRetries;
    private final Duration initialDelay;
    private final double backoffMultiplier;
    private final Duration maxDelay;

    public RetryPolicy(int maxRetries, Duration initialDelay, double backoffMultiplier, Duration maxDelay) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least initialDelay");
        }
        this.maxRetries = maxRetries;
        this.initialDelay = initialDelay;
        this.backoffMultiplier = backoffMultiplier;
        this.maxDelay = maxDelay;
    }

    /**
     * Delay before the retry that follows the given zero-based failed attempt.
     */
    public Duration delayFor(int attempt) {
        double seconds = toSeconds(initialDelay) * Math.pow(backoffMultiplier, Math.max(0, attempt));
        double capped = Math.min(seconds, toSeconds(maxDelay));
        return Duration.ofNanos(Math.round(capped * 1_000_000_000L));
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /** Initial call plus retries. */
    public int getMaxAttempts() {
        return maxRetries + 1;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    /**
     * Default: 3 retries, 1s initial delay, doubling, capped at 60s.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60));
    }

    private static double toSeconds(Duration d) {
        return d.toNanos() / 1_000_000_000.0;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries + ", initialDelay=" + initialDelay
                + ", backoffMultiplier=" + backoffMultiplier + ", maxDelay=" + maxDelay + '}';
    }
}
