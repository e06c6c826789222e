package com.proteincollector.ingestion.config;

import com.proteincollector.common.retry.RetryPolicy;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry policy for API access (exponential backoff, no jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "proteincollector.retry")
@NoArgsConstructor
@Getter
@Setter
public class RetryProperties {

    /** Retries after the initial call. Default 3. */
    private int maxRetries = 3;

    private Duration initialDelay = Duration.ofSeconds(1);

    private double backoffMultiplier = 2.0;

    /** Cap on a single backoff delay. Default 60s. */
    private Duration maxDelay = Duration.ofSeconds(60);

    public RetryPolicy toPolicy() {
        return new RetryPolicy(maxRetries, initialDelay, backoffMultiplier, maxDelay);
    }
}
