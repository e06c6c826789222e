package com.proteincollector.common.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Aggregates request statistics and violation history across all APIs.
 * The violation history is bounded: the oldest records are dropped once {@code historyLimit} is reached.
 */
@Slf4j
public class RateLimitMonitor {

    static final int REQUEST_HISTORY_SIZE = 1000;
    static final double DELAY_SMOOTHING = 0.1;

    private final Clock clock;
    private final int historyLimit;
    private final Map<String, ApiStats> stats = new ConcurrentHashMap<>();
    private final Deque<RateLimitViolation> violations = new ArrayDeque<>();

    public RateLimitMonitor(Clock clock, int historyLimit) {
        if (historyLimit <= 0) {
            throw new IllegalArgumentException("historyLimit must be positive");
        }
        this.clock = clock;
        this.historyLimit = historyLimit;
    }

    public void recordRequest(String apiName, Duration delay) {
        stats.computeIfAbsent(apiName, ApiStats::new).recordRequest(clock.millis(), delay);
    }

    public void recordViolation(RateLimitViolation violation) {
        synchronized (violations) {
            if (violations.size() == historyLimit) {
                violations.pollFirst();
            }
            violations.addLast(violation);
        }
        stats.computeIfAbsent(violation.apiName(), ApiStats::new).recordViolation(violation);
        log.warn("Rate limit violation for {} API type={} currentRate={} limitRate={} delayMs={} requestsInWindow={}",
                violation.apiName(), violation.type(), String.format("%.3f", violation.currentRate()),
                violation.limitRate(), violation.delayApplied().toMillis(), violation.requestsInWindow());
    }

    public RateLimitStats getStats(String apiName) {
        ApiStats s = stats.get(apiName);
        return s != null ? s.snapshot(clock.millis()) : RateLimitStats.empty(apiName);
    }

    public Map<String, RateLimitStats> getStats() {
        long now = clock.millis();
        Map<String, RateLimitStats> result = new TreeMap<>();
        stats.forEach((name, s) -> result.put(name, s.snapshot(now)));
        return result;
    }

    /**
     * Violations recorded within the last {@code minutes}, oldest first.
     */
    public List<RateLimitViolation> getRecentViolations(int minutes) {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(minutes));
        synchronized (violations) {
            List<RateLimitViolation> recent = new ArrayList<>();
            for (RateLimitViolation v : violations) {
                if (v.timestamp().isAfter(cutoff)) {
                    recent.add(v);
                }
            }
            return recent;
        }
    }

    public RateLimitReport generateReport() {
        Map<String, RateLimitStats> apis = getStats();
        long totalRequests = apis.values().stream().mapToLong(RateLimitStats::totalRequests).sum();
        long totalViolations = apis.values().stream().mapToLong(RateLimitStats::totalViolations).sum();
        RateLimitReport.Summary summary = new RateLimitReport.Summary(
                apis.size(), totalRequests, totalViolations, getRecentViolations(60).size());
        return new RateLimitReport(clock.instant(), apis, summary);
    }

    private static final class ApiStats {

        private final String apiName;
        private final Deque<Long> requestHistory = new ArrayDeque<>();
        private final Map<RateLimitViolationType, Long> violationsByType = new EnumMap<>(RateLimitViolationType.class);
        private long totalRequests;
        private long totalViolations;
        private double averageDelaySeconds;
        private RateLimitViolation lastViolation;

        ApiStats(String apiName) {
            this.apiName = apiName;
        }

        synchronized void recordRequest(long nowMillis, Duration delay) {
            totalRequests++;
            double delaySeconds = delay.toNanos() / 1_000_000_000.0;
            averageDelaySeconds = (1 - DELAY_SMOOTHING) * averageDelaySeconds + DELAY_SMOOTHING * delaySeconds;
            if (requestHistory.size() == REQUEST_HISTORY_SIZE) {
                requestHistory.pollFirst();
            }
            requestHistory.addLast(nowMillis);
        }

        synchronized void recordViolation(RateLimitViolation violation) {
            totalViolations++;
            lastViolation = violation;
            violationsByType.merge(violation.type(), 1L, Long::sum);
        }

        synchronized RateLimitStats snapshot(long nowMillis) {
            long cutoff = nowMillis - BurstGovernor.RATE_WINDOW_MILLIS;
            long recent = requestHistory.stream().filter(t -> t > cutoff).count();
            return new RateLimitStats(apiName, totalRequests, totalViolations, recent / 60.0,
                    Duration.ofNanos(Math.round(averageDelaySeconds * 1_000_000_000L)), lastViolation,
                    Map.copyOf(violationsByType));
        }
    }
}
