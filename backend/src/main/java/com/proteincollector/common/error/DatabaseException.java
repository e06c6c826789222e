package com.proteincollector.common.error;

/**
 * Failure in the local persistence layer.
 */
public class DatabaseException extends CollectorException {

    public DatabaseException(String message) {
        this(message, null, null);
    }

    public DatabaseException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public DatabaseException(String message, ErrorContext context, Throwable cause) {
        super(message, ErrorCategory.DATABASE, ErrorSeverity.HIGH, context, cause);
    }
}
