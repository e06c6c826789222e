package com.proteincollector.common.ratelimit;

import java.time.Duration;
import java.util.Map;

/**
 * Monitor view of one API.
 *
 * @param averageDelay  exponential moving average of the delay applied per request
 * @param lastViolation most recent violation, or null when none
 */
public record RateLimitStats(
        String apiName,
        long totalRequests,
        long totalViolations,
        double currentRate,
        Duration averageDelay,
        RateLimitViolation lastViolation,
        Map<RateLimitViolationType, Long> violationsByType
) {

    public static RateLimitStats empty(String apiName) {
        return new RateLimitStats(apiName, 0, 0, 0.0, Duration.ZERO, null, Map.of());
    }
}
