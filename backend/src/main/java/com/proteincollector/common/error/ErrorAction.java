package com.proteincollector.common.error;

/**
 * Recommended reaction to a classified failure. Only RETRY and FALLBACK consume retry attempts.
 */
public enum ErrorAction {
    RETRY,
    SKIP,
    FAIL,
    LOG_AND_CONTINUE,
    FALLBACK;

    public boolean isRetryable() {
        return this == RETRY || this == FALLBACK;
    }
}
