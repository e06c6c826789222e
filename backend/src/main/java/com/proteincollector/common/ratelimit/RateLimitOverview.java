package com.proteincollector.common.ratelimit;

import java.util.Map;

/**
 * Result of {@link RateLimitManager#getAllStats()}: limiter counters plus monitor statistics (empty when monitoring
 * is disabled).
 */
public record RateLimitOverview(Map<String, LimiterStats> limiters, Map<String, RateLimitStats> monitor) {
}
