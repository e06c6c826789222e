package com.proteincollector.common.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * A crossed threshold, as recorded in the monitor's violation history.
 *
 * @param currentRate      requests per second over the trailing minute
 * @param limitRate        configured requests per second
 * @param delayApplied     backoff imposed on the caller (zero for soft limits)
 * @param requestsInWindow requests counted in the burst window (zero for soft limits)
 */
public record RateLimitViolation(
        RateLimitViolationType type,
        String apiName,
        Instant timestamp,
        double currentRate,
        double limitRate,
        Duration delayApplied,
        int requestsInWindow
) {
}
