package com.proteincollector.common.error;

import java.util.Optional;

/**
 * Remote API rejected the request. Client errors (4xx other than 408 and 429) are HIGH severity and not retried;
 * server errors, throttling and timeouts are MEDIUM and retried.
 */
public class ApiException extends CollectorException {

    private final Integer statusCode;

    public ApiException(String message) {
        this(message, null, null, null);
    }

    public ApiException(String message, Integer statusCode) {
        this(message, statusCode, null, null);
    }

    public ApiException(String message, Integer statusCode, ErrorContext context, Throwable cause) {
        super(message, ErrorCategory.API, severityFor(statusCode), context, cause);
        this.statusCode = statusCode;
    }

    public Optional<Integer> getStatusCode() {
        return Optional.ofNullable(statusCode);
    }

    static ErrorSeverity severityFor(Integer statusCode) {
        if (statusCode == null) {
            return ErrorSeverity.MEDIUM;
        }
        if (statusCode >= 400 && statusCode < 500 && statusCode != 408 && statusCode != 429) {
            return ErrorSeverity.HIGH;
        }
        return ErrorSeverity.MEDIUM;
    }
}
