package com.proteincollector.common.error;

import java.util.List;

/**
 * Failure categories assigned by {@link ErrorHandler}. Each carries operator-facing recovery suggestions.
 */
public enum ErrorCategory {
    NETWORK(List.of(
            "Check network connectivity",
            "Verify API endpoints are accessible",
            "Consider increasing timeout values",
            "Check for firewall or proxy issues")),
    API(List.of(
            "Verify API credentials and permissions",
            "Check API rate limits and quotas",
            "Validate request parameters and format",
            "Check API documentation for changes")),
    DATA(List.of(
            "Validate data format and structure",
            "Check for missing required fields",
            "Verify data encoding and character sets",
            "Review data transformation logic")),
    VALIDATION(List.of(
            "Review validation rules and constraints",
            "Check data quality at source",
            "Verify field formats and ranges",
            "Consider data cleaning procedures")),
    DATABASE(List.of(
            "Check database connectivity and credentials",
            "Verify database schema and constraints",
            "Monitor database performance and resources",
            "Review transaction isolation levels")),
    CONFIGURATION(List.of(
            "Verify configuration file format and syntax",
            "Check file permissions and accessibility",
            "Validate configuration values and ranges",
            "Review environment variable settings")),
    UNKNOWN(List.of("Review error details and system logs"));

    private final List<String> recoverySuggestions;

    ErrorCategory(List<String> recoverySuggestions) {
        this.recoverySuggestions = recoverySuggestions;
    }

    public List<String> getRecoverySuggestions() {
        return recoverySuggestions;
    }
}
