package com.proteincollector.common;

import java.time.Duration;

/**
 * Blocking suspension used by the rate limiter and the retry controller. Replaced in tests to record delays.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Thread.sleep with nanosecond remainder.
     */
    static Sleeper threadSleep() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                return;
            }
            long nanos = duration.toNanos();
            Thread.sleep(nanos / 1_000_000, (int) (nanos % 1_000_000));
        };
    }
}
