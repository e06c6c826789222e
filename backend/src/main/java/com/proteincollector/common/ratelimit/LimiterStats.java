package com.proteincollector.common.ratelimit;

import java.time.Duration;

/**
 * Counters of a single {@link ApiRateLimiter}.
 *
 * @param currentTokens tokens available right now, after refill
 */
public record LimiterStats(
        String apiName,
        long totalRequests,
        Duration averageDelay,
        double currentRate,
        int consecutiveViolations,
        double currentTokens,
        double requestsPerSecond,
        int burstLimit,
        Duration burstWindow
) {
}
