package com.proteincollector.common.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket refilled continuously at {@code rate} tokens per second up to {@code capacity}. Starts full.
 *
 * <p>{@link #acquire} never sleeps: it debits what it can and returns the wait the caller must observe.
 * Refill and debit happen under one lock, so the balance stays within [0, capacity].
 */
public class TokenBucket {

    private final double rate;
    private final int capacity;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private long lastUpdateMillis;

    public TokenBucket(double rate, Clock clock) {
        this(rate, defaultCapacity(rate), clock);
    }

    public TokenBucket(double rate, int capacity, Clock clock) {
        if (rate <= 0) {
            throw new IllegalArgumentException("rate must be positive");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.rate = rate;
        this.capacity = capacity;
        this.clock = clock;
        this.tokens = capacity;
        this.lastUpdateMillis = clock.millis();
    }

    /** Twice the per-second rate, at least one token. */
    static int defaultCapacity(double rate) {
        return Math.max((int) (rate * 2), 1);
    }

    /**
     * Take {@code requested} tokens.
     *
     * @return zero when enough tokens were available; otherwise the time until the missing tokens refill.
     * The bucket is emptied in that case.
     */
    public Duration acquire(int requested) {
        if (requested <= 0) {
            throw new IllegalArgumentException("requested tokens must be positive");
        }
        lock.lock();
        try {
            long now = clock.millis();
            refill(now);
            if (tokens >= requested) {
                tokens -= requested;
                return Duration.ZERO;
            }
            double missing = requested - tokens;
            tokens = 0.0;
            return Duration.ofNanos(Math.round(missing / rate * 1_000_000_000L));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tokens available right now, including refill since the last acquisition. Does not debit.
     */
    public double getCurrentTokens() {
        lock.lock();
        try {
            double elapsedSeconds = Math.max(0, clock.millis() - lastUpdateMillis) / 1000.0;
            return Math.min(capacity, tokens + elapsedSeconds * rate);
        } finally {
            lock.unlock();
        }
    }

    /** Balance as of the last acquisition, without refill. */
    double getTokens() {
        lock.lock();
        try {
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public double getRate() {
        return rate;
    }

    private void refill(long now) {
        double elapsedSeconds = Math.max(0, now - lastUpdateMillis) / 1000.0;
        tokens = Math.min(capacity, tokens + elapsedSeconds * rate);
        lastUpdateMillis = Math.max(lastUpdateMillis, now);
    }
}
