package com.proteincollector.ingestion.job;

import com.proteincollector.common.cache.CacheStatistics;
import com.proteincollector.common.cache.ResponseCache;
import com.proteincollector.common.ratelimit.RateLimitManager;
import com.proteincollector.common.ratelimit.RateLimitReport;
import com.proteincollector.common.ratelimit.RateLimitStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Periodic log of rate-limit and cache health. Skips the rate-limit part when reporting is disabled.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GovernanceReportJob {

    private final RateLimitManager rateLimitManager;
    private final ResponseCache responseCache;

    @Scheduled(
            fixedRateString = "${proteincollector.report.interval-ms:600000}",
            initialDelayString = "${proteincollector.report.interval-ms:600000}")
    public void runScheduled() {
        report();
    }

    void report() {
        Optional<RateLimitReport> report = rateLimitManager.generateReport();
        report.ifPresent(r -> {
            RateLimitReport.Summary s = r.summary();
            log.info("Rate limit report apis={} totalRequests={} totalViolations={} recentViolations={}",
                    s.totalApis(), s.totalRequests(), s.totalViolations(), s.recentViolations());
            for (RateLimitStats api : r.apis().values()) {
                log.info("Rate limit stats api={} requests={} violations={} currentRate={} averageDelayMs={}",
                        api.apiName(), api.totalRequests(), api.totalViolations(),
                        String.format("%.3f", api.currentRate()), api.averageDelay().toMillis());
            }
        });
        CacheStatistics cache = responseCache.getMetrics();
        if (cache.enabled()) {
            log.info("Cache stats entries={} sizeMb={} hitRate={} hits={} misses={} evictions={} expired={} avgResponseMs={}",
                    cache.totalEntries(), String.format("%.2f", cache.totalSizeMb()),
                    String.format("%.3f", cache.hitRate()), cache.hits(), cache.misses(), cache.evictions(),
                    cache.expiredRemovals(), String.format("%.1f", cache.averageResponseTimeMs()));
        }
    }
}
