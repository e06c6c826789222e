package com.proteincollector.common.error;

/**
 * Connectivity failure or timeout talking to a remote API.
 */
public class NetworkException extends CollectorException {

    public NetworkException(String message) {
        this(message, null, null);
    }

    public NetworkException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public NetworkException(String message, ErrorContext context, Throwable cause) {
        super(message, ErrorCategory.NETWORK, ErrorSeverity.MEDIUM, context, cause);
    }
}
