package com.proteincollector.common.error;

/**
 * Invalid or missing configuration. Never retried.
 */
public class ConfigurationException extends CollectorException {

    public ConfigurationException(String message) {
        this(message, null, null);
    }

    public ConfigurationException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ConfigurationException(String message, ErrorContext context, Throwable cause) {
        super(message, ErrorCategory.CONFIGURATION, ErrorSeverity.CRITICAL, context, cause);
    }
}
