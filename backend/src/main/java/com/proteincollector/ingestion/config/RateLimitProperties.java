package com.proteincollector.ingestion.config;

import com.proteincollector.common.ratelimit.RateLimitConfig;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-API rate limits plus the shared violation backoff. Documented in application.yml.
 * Key of {@code apis} is the API name used by callers (e.g. InterPro, UniProt).
 */
@ConfigurationProperties(prefix = "proteincollector.rate-limit")
@NoArgsConstructor
@Getter
@Setter
public class RateLimitProperties {

    private boolean monitoringEnabled = true;

    /** When false, RateLimitManager.generateReport() returns empty. */
    private boolean reportingEnabled = true;

    /** Max violations retained by the monitor; oldest dropped first. Default 1000. */
    private int violationHistoryLimit = 1000;

    /** First delay after a burst violation; multiplied per consecutive violation. */
    private Duration violationInitialDelay = Duration.ofSeconds(1);

    private double violationBackoffMultiplier = 2.0;

    private Duration violationMaxDelay = Duration.ofSeconds(300);

    /** Fraction of requests-per-second above which a soft-limit violation is recorded. */
    private double softLimitThreshold = 0.8;

    private Map<String, ApiLimit> apis = defaultApis();

    public void setApis(Map<String, ApiLimit> apis) {
        this.apis = apis != null ? apis : new HashMap<>();
    }

    public RateLimitConfig toConfig(ApiLimit api) {
        return RateLimitConfig.builder(api.getRequestsPerSecond())
                .burstLimit(api.getBurstLimit())
                .burstWindow(api.getBurstWindow())
                .violationInitialDelay(violationInitialDelay)
                .violationBackoffMultiplier(violationBackoffMultiplier)
                .violationMaxDelay(violationMaxDelay)
                .softLimitThreshold(softLimitThreshold)
                .monitoringEnabled(monitoringEnabled)
                .reportingEnabled(reportingEnabled)
                .build();
    }

    private static Map<String, ApiLimit> defaultApis() {
        Map<String, ApiLimit> defaults = new HashMap<>();
        defaults.put("InterPro", ApiLimit.of(10.0, 50, Duration.ofSeconds(60)));
        defaults.put("UniProt", ApiLimit.of(5.0, 25, Duration.ofSeconds(60)));
        return defaults;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class ApiLimit {

        private double requestsPerSecond = 10.0;
        private int burstLimit = 50;
        private Duration burstWindow = Duration.ofSeconds(60);

        static ApiLimit of(double requestsPerSecond, int burstLimit, Duration burstWindow) {
            ApiLimit limit = new ApiLimit();
            limit.setRequestsPerSecond(requestsPerSecond);
            limit.setBurstLimit(burstLimit);
            limit.setBurstWindow(burstWindow);
            return limit;
        }
    }
}
