package com.proteincollector.common.ratelimit;

public enum RateLimitViolationType {
    /** Sustained rate is approaching the ceiling. Informational, never delays. */
    SOFT_LIMIT,
    /** Burst ceiling reached inside the burst window. Delays the caller with violation backoff. */
    BURST_LIMIT
}
