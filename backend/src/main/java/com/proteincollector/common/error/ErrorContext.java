package com.proteincollector.common.error;

import java.time.Instant;
import java.util.Map;

/**
 * Where a failure happened: operation, database (API name), entity and request details.
 * Only {@code operation} is required.
 */
public record ErrorContext(
        String operation,
        String database,
        String entityId,
        String entityType,
        String requestUrl,
        Integer responseStatus,
        Instant timestamp,
        Map<String, Object> additionalData
) {

    public ErrorContext {
        operation = operation != null ? operation : "unknown";
        timestamp = timestamp != null ? timestamp : Instant.now();
        additionalData = additionalData != null ? Map.copyOf(additionalData) : Map.of();
    }

    public static ErrorContext of(String operation) {
        return new ErrorContext(operation, null, null, null, null, null, null, null);
    }

    public static ErrorContext of(String operation, String database) {
        return new ErrorContext(operation, database, null, null, null, null, null, null);
    }

    public ErrorContext withRequest(String requestUrl, Integer responseStatus) {
        return new ErrorContext(operation, database, entityId, entityType, requestUrl, responseStatus, timestamp, additionalData);
    }

    public ErrorContext withEntity(String entityType, String entityId) {
        return new ErrorContext(operation, database, entityId, entityType, requestUrl, responseStatus, timestamp, additionalData);
    }

    public ErrorContext withAdditionalData(Map<String, Object> data) {
        return new ErrorContext(operation, database, entityId, entityType, requestUrl, responseStatus, timestamp, data);
    }
}
