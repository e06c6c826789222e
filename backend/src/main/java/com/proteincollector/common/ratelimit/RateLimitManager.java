package com.proteincollector.common.ratelimit;

import com.proteincollector.common.Sleeper;
import com.proteincollector.common.error.ConfigurationException;
import com.proteincollector.common.error.ErrorContext;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of per-API rate limiters plus the shared {@link RateLimitMonitor}.
 * One instance per application, constructed at the composition root and injected where needed.
 */
@Slf4j
public class RateLimitManager {

    public static final int DEFAULT_VIOLATION_HISTORY_LIMIT = 1000;

    private final Map<String, ApiRateLimiter> limiters = new ConcurrentHashMap<>();
    private final RateLimitMonitor monitor;
    private final boolean reportingEnabled;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Scheduler scheduler;

    public RateLimitManager() {
        this(true, true, DEFAULT_VIOLATION_HISTORY_LIMIT, Clock.systemUTC(), Sleeper.threadSleep(), Schedulers.parallel());
    }

    public RateLimitManager(boolean monitoringEnabled, boolean reportingEnabled, int violationHistoryLimit,
                            Clock clock, Sleeper sleeper, Scheduler scheduler) {
        this.monitor = monitoringEnabled ? new RateLimitMonitor(clock, violationHistoryLimit) : null;
        this.reportingEnabled = reportingEnabled;
        this.clock = clock;
        this.sleeper = sleeper;
        this.scheduler = scheduler;
    }

    /**
     * Limiter for the API, created on first call. Later calls return the existing limiter and ignore {@code config}.
     */
    public ApiRateLimiter createLimiter(String apiName, RateLimitConfig config) {
        return limiters.computeIfAbsent(apiName, name -> {
            RateLimitMonitor apiMonitor = config.isMonitoringEnabled() ? monitor : null;
            ApiRateLimiter limiter = new ApiRateLimiter(name, config, apiMonitor, clock, sleeper, scheduler);
            log.info("Created rate limiter for {} API requestsPerSecond={} burstLimit={} burstWindow={}",
                    name, config.getRequestsPerSecond(), config.getBurstLimit(), config.getBurstWindow());
            return limiter;
        });
    }

    public Optional<ApiRateLimiter> getLimiter(String apiName) {
        return Optional.ofNullable(limiters.get(apiName));
    }

    /**
     * @throws ConfigurationException when no limiter was created for the API
     */
    public Duration acquire(String apiName, int tokens) {
        return requireLimiter(apiName).acquire(tokens);
    }

    public Mono<Duration> acquireAsync(String apiName, int tokens) {
        return Mono.defer(() -> requireLimiter(apiName).acquireAsync(tokens));
    }

    public RateLimitOverview getAllStats() {
        Map<String, LimiterStats> limiterStats = new TreeMap<>();
        limiters.forEach((name, limiter) -> limiterStats.put(name, limiter.getStats()));
        Map<String, RateLimitStats> monitorStats = monitor != null ? monitor.getStats() : Map.of();
        return new RateLimitOverview(limiterStats, monitorStats);
    }

    /**
     * @return empty when reporting or monitoring is disabled
     */
    public Optional<RateLimitReport> generateReport() {
        if (!reportingEnabled || monitor == null) {
            return Optional.empty();
        }
        return Optional.of(monitor.generateReport());
    }

    public List<RateLimitViolation> getRecentViolations(int minutes) {
        return monitor != null ? monitor.getRecentViolations(minutes) : List.of();
    }

    public Optional<RateLimitMonitor> getMonitor() {
        return Optional.ofNullable(monitor);
    }

    private ApiRateLimiter requireLimiter(String apiName) {
        ApiRateLimiter limiter = limiters.get(apiName);
        if (limiter == null) {
            throw new ConfigurationException("No rate limiter configured for API: " + apiName,
                    ErrorContext.of("rate_limit_acquire", apiName), null);
        }
        return limiter;
    }
}
