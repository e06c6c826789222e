package com.proteincollector.common.error;

import java.util.List;

/**
 * Classification result: category, severity and the recommended action for one failure.
 */
public record ErrorInfo(
        ErrorCategory category,
        ErrorSeverity severity,
        ErrorAction action,
        String message,
        Throwable originalException,
        ErrorContext context
) {

    public List<String> recoverySuggestions() {
        return category.getRecoverySuggestions();
    }
}
