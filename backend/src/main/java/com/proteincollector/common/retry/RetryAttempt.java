package com.proteincollector.common.retry;

import com.proteincollector.common.error.ErrorInfo;

import java.time.Duration;

/**
 * One failed attempt that is about to be retried. {@code attemptNumber} is 1-based.
 */
public record RetryAttempt(int attemptNumber, Duration delay, ErrorInfo error, String database, String operation) {
}
