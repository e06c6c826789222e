package com.proteincollector.common.error;

import lombok.Getter;

/**
 * Base failure of the collector. Carries its own classification so {@link ErrorHandler} does not have to guess.
 */
@Getter
public class CollectorException extends RuntimeException {

    private final ErrorCategory category;
    private final ErrorSeverity severity;
    private final ErrorContext context;

    public CollectorException(String message, ErrorCategory category, ErrorSeverity severity,
                              ErrorContext context, Throwable cause) {
        super(message, cause);
        this.category = category != null ? category : ErrorCategory.UNKNOWN;
        this.severity = severity != null ? severity : ErrorSeverity.MEDIUM;
        this.context = context != null ? context : ErrorContext.of("unknown");
    }
}
