package com.proteincollector.common.ratelimit;

import java.time.Duration;

/**
 * Per-API rate limiting settings. Created once when an API client is wired, never mutated.
 */
public final class RateLimitConfig {

    private final double requestsPerSecond;
    private final int burstLimit;
    private final Duration burstWindow;
    private final Duration violationInitialDelay;
    private final double violationBackoffMultiplier;
    private final Duration violationMaxDelay;
    private final double softLimitThreshold;
    private final boolean monitoringEnabled;
    private final boolean reportingEnabled;

    private RateLimitConfig(Builder builder) {
        if (builder.requestsPerSecond <= 0) {
            throw new IllegalArgumentException("requestsPerSecond must be positive");
        }
        if (builder.burstLimit <= 0) {
            throw new IllegalArgumentException("burstLimit must be positive");
        }
        if (builder.burstWindow == null || builder.burstWindow.isZero() || builder.burstWindow.isNegative()) {
            throw new IllegalArgumentException("burstWindow must be positive");
        }
        if (builder.violationInitialDelay == null || builder.violationInitialDelay.isNegative()) {
            throw new IllegalArgumentException("violationInitialDelay must not be negative");
        }
        if (builder.violationBackoffMultiplier < 1.0) {
            throw new IllegalArgumentException("violationBackoffMultiplier must be at least 1.0");
        }
        if (builder.violationMaxDelay == null || builder.violationMaxDelay.compareTo(builder.violationInitialDelay) < 0) {
            throw new IllegalArgumentException("violationMaxDelay must be at least violationInitialDelay");
        }
        if (builder.softLimitThreshold <= 0 || builder.softLimitThreshold > 1.0) {
            throw new IllegalArgumentException("softLimitThreshold must be in (0, 1]");
        }
        this.requestsPerSecond = builder.requestsPerSecond;
        this.burstLimit = builder.burstLimit;
        this.burstWindow = builder.burstWindow;
        this.violationInitialDelay = builder.violationInitialDelay;
        this.violationBackoffMultiplier = builder.violationBackoffMultiplier;
        this.violationMaxDelay = builder.violationMaxDelay;
        this.softLimitThreshold = builder.softLimitThreshold;
        this.monitoringEnabled = builder.monitoringEnabled;
        this.reportingEnabled = builder.reportingEnabled;
    }

    public double getRequestsPerSecond() {
        return requestsPerSecond;
    }

    /** Maximum requests inside one burst window before violation backoff applies. */
    public int getBurstLimit() {
        return burstLimit;
    }

    public Duration getBurstWindow() {
        return burstWindow;
    }

    public Duration getViolationInitialDelay() {
        return violationInitialDelay;
    }

    public double getViolationBackoffMultiplier() {
        return violationBackoffMultiplier;
    }

    public Duration getViolationMaxDelay() {
        return violationMaxDelay;
    }

    /** Fraction of requestsPerSecond above which a soft-limit warning is recorded. */
    public double getSoftLimitThreshold() {
        return softLimitThreshold;
    }

    public boolean isMonitoringEnabled() {
        return monitoringEnabled;
    }

    public boolean isReportingEnabled() {
        return reportingEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(double requestsPerSecond) {
        return new Builder().requestsPerSecond(requestsPerSecond);
    }

    public static class Builder {
        private double requestsPerSecond = 10.0;
        private int burstLimit = 50;
        private Duration burstWindow = Duration.ofSeconds(60);
        private Duration violationInitialDelay = Duration.ofSeconds(1);
        private double violationBackoffMultiplier = 2.0;
        private Duration violationMaxDelay = Duration.ofMinutes(5);
        private double softLimitThreshold = 0.8;
        private boolean monitoringEnabled = true;
        private boolean reportingEnabled = true;

        public Builder requestsPerSecond(double requestsPerSecond) {
            this.requestsPerSecond = requestsPerSecond;
            return this;
        }

        public Builder burstLimit(int burstLimit) {
            this.burstLimit = burstLimit;
            return this;
        }

        public Builder burstWindow(Duration burstWindow) {
            this.burstWindow = burstWindow;
            return this;
        }

        public Builder violationInitialDelay(Duration violationInitialDelay) {
            this.violationInitialDelay = violationInitialDelay;
            return this;
        }

        public Builder violationBackoffMultiplier(double violationBackoffMultiplier) {
            this.violationBackoffMultiplier = violationBackoffMultiplier;
            return this;
        }

        public Builder violationMaxDelay(Duration violationMaxDelay) {
            this.violationMaxDelay = violationMaxDelay;
            return this;
        }

        public Builder softLimitThreshold(double softLimitThreshold) {
            this.softLimitThreshold = softLimitThreshold;
            return this;
        }

        public Builder monitoringEnabled(boolean monitoringEnabled) {
            this.monitoringEnabled = monitoringEnabled;
            return this;
        }

        public Builder reportingEnabled(boolean reportingEnabled) {
            this.reportingEnabled = reportingEnabled;
            return this;
        }

        public RateLimitConfig build() {
            return new RateLimitConfig(this);
        }
    }

    @Override
    public String toString() {
        return "RateLimitConfig{" +
                "requestsPerSecond=" + requestsPerSecond +
                ", burstLimit=" + burstLimit +
                ", burstWindow=" + burstWindow +
                ", violationInitialDelay=" + violationInitialDelay +
                ", violationBackoffMultiplier=" + violationBackoffMultiplier +
                ", violationMaxDelay=" + violationMaxDelay +
                ", softLimitThreshold=" + softLimitThreshold +
                '}';
    }
}
