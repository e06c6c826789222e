package com.proteincollector.common.error;

/**
 * Payload parsed but failed validation rules.
 */
public class ValidationException extends CollectorException {

    public ValidationException(String message) {
        this(message, null, null);
    }

    public ValidationException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ValidationException(String message, ErrorContext context, Throwable cause) {
        super(message, ErrorCategory.VALIDATION, ErrorSeverity.HIGH, context, cause);
    }
}
