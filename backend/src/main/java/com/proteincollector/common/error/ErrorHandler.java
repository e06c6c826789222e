package com.proteincollector.common.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.io.FileNotFoundException;
import java.lang.reflect.UndeclaredThrowableException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLException;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.TreeMap;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Classifies failures into category, severity and recommended action, and logs them with context.
 * Stateless apart from the per category:operation counters kept by {@link #handle}.
 */
@Slf4j
public class ErrorHandler {

    private final Map<String, AtomicLong> errorCounts = new ConcurrentHashMap<>();

    /**
     * Classify without logging or counting. Used by the retry controller on every failed attempt.
     */
    public ErrorInfo classify(Throwable error, ErrorContext context) {
        Throwable cause = unwrap(error);
        ErrorContext ctx = context != null ? context : ErrorContext.of("unknown");
        if (cause instanceof CollectorException ce) {
            return new ErrorInfo(ce.getCategory(), ce.getSeverity(),
                    determineAction(ce.getCategory(), ce.getSeverity()), messageOf(ce), error, ctx);
        }
        ErrorCategory category;
        ErrorSeverity severity;
        if (isNetwork(cause)) {
            category = ErrorCategory.NETWORK;
            severity = ErrorSeverity.MEDIUM;
        } else if (cause instanceof WebClientResponseException wre) {
            category = ErrorCategory.API;
            severity = ApiException.severityFor(wre.getStatusCode().value());
        } else if (isData(cause)) {
            category = ErrorCategory.DATA;
            severity = ErrorSeverity.HIGH;
        } else if (cause instanceof SQLException) {
            category = ErrorCategory.DATABASE;
            severity = ErrorSeverity.HIGH;
        } else if (isConfiguration(cause)) {
            category = ErrorCategory.CONFIGURATION;
            severity = ErrorSeverity.CRITICAL;
        } else {
            category = ErrorCategory.UNKNOWN;
            severity = ErrorSeverity.MEDIUM;
        }
        return new ErrorInfo(category, severity, determineAction(category, severity), messageOf(cause), error, ctx);
    }

    /**
     * Classify, count under category:operation and log at a level matching severity.
     */
    public ErrorInfo handle(Throwable error, ErrorContext context) {
        ErrorInfo info = classify(error, context);
        String key = info.category().name().toLowerCase() + ":" + info.context().operation();
        errorCounts.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
        logError(info);
        return info;
    }

    public Map<String, Long> getErrorStatistics() {
        Map<String, Long> copy = new TreeMap<>();
        errorCounts.forEach((k, v) -> copy.put(k, v.get()));
        return copy;
    }

    public void resetErrorStatistics() {
        errorCounts.clear();
    }

    static ErrorAction determineAction(ErrorCategory category, ErrorSeverity severity) {
        return switch (category) {
            case NETWORK -> ErrorAction.RETRY;
            case API -> severity == ErrorSeverity.HIGH ? ErrorAction.SKIP : ErrorAction.RETRY;
            case DATA, VALIDATION -> ErrorAction.SKIP;
            case DATABASE -> severity == ErrorSeverity.CRITICAL ? ErrorAction.FAIL : ErrorAction.RETRY;
            case CONFIGURATION -> ErrorAction.FAIL;
            case UNKNOWN -> ErrorAction.LOG_AND_CONTINUE;
        };
    }

    private void logError(ErrorInfo info) {
        ErrorContext ctx = info.context();
        String type = info.originalException() != null ? info.originalException().getClass().getSimpleName() : "n/a";
        switch (info.severity()) {
            case CRITICAL -> log.error("Critical error in {} on {}: {} category={} action={} type={} status={} suggestions={}",
                    ctx.operation(), ctx.database(), info.message(), info.category(), info.action(), type,
                    ctx.responseStatus(), info.recoverySuggestions());
            case HIGH -> log.error("High severity error in {} on {}: {} category={} action={} type={} status={}",
                    ctx.operation(), ctx.database(), info.message(), info.category(), info.action(), type, ctx.responseStatus());
            case MEDIUM -> log.warn("Error in {} on {}: {} category={} action={} type={} status={}",
                    ctx.operation(), ctx.database(), info.message(), info.category(), info.action(), type, ctx.responseStatus());
            case LOW -> log.info("Low severity error in {} on {}: {} category={} action={}",
                    ctx.operation(), ctx.database(), info.message(), info.category(), info.action());
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = Exceptions.unwrap(error);
        while ((current instanceof CompletionException || current instanceof ExecutionException
                || current instanceof UndeclaredThrowableException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean isNetwork(Throwable t) {
        return t instanceof ConnectException
                || t instanceof SocketTimeoutException
                || t instanceof UnknownHostException
                || t instanceof HttpTimeoutException
                || t instanceof TimeoutException
                || t instanceof WebClientRequestException;
    }

    private static boolean isData(Throwable t) {
        return t instanceof JsonProcessingException
                || t instanceof NumberFormatException
                || t instanceof NoSuchElementException
                || t instanceof IndexOutOfBoundsException;
    }

    private static boolean isConfiguration(Throwable t) {
        boolean fileProblem = t instanceof FileNotFoundException
                || t instanceof NoSuchFileException
                || t instanceof AccessDeniedException;
        return fileProblem && t.getMessage() != null && t.getMessage().toLowerCase().contains("config");
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
