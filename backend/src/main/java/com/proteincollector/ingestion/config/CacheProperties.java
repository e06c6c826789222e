package com.proteincollector.ingestion.config;

import com.proteincollector.common.cache.CacheConfig;
import com.proteincollector.common.cache.CacheStrategy;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * API response cache. Documented in application.yml under proteincollector.cache.
 */
@ConfigurationProperties(prefix = "proteincollector.cache")
@NoArgsConstructor
@Getter
@Setter
public class CacheProperties {

    private boolean enabled = true;

    private Duration defaultTtl = Duration.ofHours(1);

    /** TTL per API name; overrides defaultTtl. */
    private Map<String, Duration> apiTtl = defaultApiTtl();

    private int maxEntries = 10_000;

    private int maxMemoryMb = 500;

    private CacheStrategy strategy = CacheStrategy.LRU;

    /** Interval of the background sweep that removes expired entries. */
    private Duration cleanupInterval = Duration.ofMinutes(5);

    private boolean compressionEnabled = true;

    private boolean metricsEnabled = true;

    public void setApiTtl(Map<String, Duration> apiTtl) {
        this.apiTtl = apiTtl != null ? apiTtl : new HashMap<>();
    }

    public CacheConfig toConfig() {
        return CacheConfig.builder()
                .enabled(enabled)
                .defaultTtl(defaultTtl)
                .apiTtl(apiTtl)
                .maxEntries(maxEntries)
                .maxMemoryMb(maxMemoryMb)
                .strategy(strategy)
                .cleanupInterval(cleanupInterval)
                .compressionEnabled(compressionEnabled)
                .metricsEnabled(metricsEnabled)
                .build();
    }

    private static Map<String, Duration> defaultApiTtl() {
        Map<String, Duration> defaults = new HashMap<>();
        defaults.put("InterPro", Duration.ofHours(2));
        defaults.put("UniProt", Duration.ofHours(1));
        return defaults;
    }
}
