package com.proteincollector.common.error;

/**
 * Malformed or unparsable response payload.
 */
public class DataException extends CollectorException {

    public DataException(String message) {
        this(message, null, null);
    }

    public DataException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public DataException(String message, ErrorContext context, Throwable cause) {
        super(message, ErrorCategory.DATA, ErrorSeverity.HIGH, context, cause);
    }
}
