package com.proteincollector.common.error;

/**
 * Thread was interrupted while suspended by the rate limiter or between retry attempts.
 * The interrupt flag is restored before this is thrown; it is never retried.
 */
public class OperationCancelledException extends CollectorException {

    public OperationCancelledException(String message, InterruptedException cause) {
        super(message, ErrorCategory.UNKNOWN, ErrorSeverity.LOW, null, cause);
    }
}
