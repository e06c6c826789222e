package com.proteincollector.common.ratelimit;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregated rate limiting report across all monitored APIs.
 */
public record RateLimitReport(Instant generatedAt, Map<String, RateLimitStats> apis, Summary summary) {

    /**
     * @param recentViolations violations in the last 60 minutes
     */
    public record Summary(int totalApis, long totalRequests, long totalViolations, int recentViolations) {
    }
}
