package com.proteincollector.common.error;

import com.fasterxml.jackson.core.JsonParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.FileNotFoundException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorHandlerTest {

    private final ErrorHandler handler = new ErrorHandler();
    private final ErrorContext context = ErrorContext.of("get_protein", "UniProt");

    private static WebClientResponseException httpError(int status) {
        return WebClientResponseException.create(status, "status " + status, HttpHeaders.EMPTY,
                new byte[0], StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("connection failures are retryable network errors")
    void network() {
        ErrorInfo info = handler.classify(new ConnectException("refused"), context);

        assertThat(info.category()).isEqualTo(ErrorCategory.NETWORK);
        assertThat(info.severity()).isEqualTo(ErrorSeverity.MEDIUM);
        assertThat(info.action()).isEqualTo(ErrorAction.RETRY);
        assertThat(info.recoverySuggestions()).contains("Check network connectivity");
    }

    @Test
    @DisplayName("HTTP client errors are skipped; server errors, 408 and 429 are retried")
    void httpStatus() {
        assertThat(handler.classify(httpError(404), context).action()).isEqualTo(ErrorAction.SKIP);
        assertThat(handler.classify(httpError(400), context).severity()).isEqualTo(ErrorSeverity.HIGH);
        assertThat(handler.classify(httpError(503), context).action()).isEqualTo(ErrorAction.RETRY);
        assertThat(handler.classify(httpError(429), context).action()).isEqualTo(ErrorAction.RETRY);
        assertThat(handler.classify(httpError(408), context).action()).isEqualTo(ErrorAction.RETRY);
        assertThat(handler.classify(new ApiException("no status"), context).action()).isEqualTo(ErrorAction.RETRY);
    }

    @Test
    @DisplayName("collector exceptions keep their own category")
    void collectorExceptions() {
        assertThat(handler.classify(new ValidationException("bad"), context).action()).isEqualTo(ErrorAction.SKIP);
        assertThat(handler.classify(new DataException("bad json"), context).category()).isEqualTo(ErrorCategory.DATA);
        assertThat(handler.classify(new ConfigurationException("missing"), context).action()).isEqualTo(ErrorAction.FAIL);
        assertThat(handler.classify(new DatabaseException("locked"), context).action()).isEqualTo(ErrorAction.RETRY);
    }

    @Test
    @DisplayName("standard exceptions map to data, database, configuration and unknown")
    void standardExceptions() {
        assertThat(handler.classify(new JsonParseException(null, "unexpected token"), context).category())
                .isEqualTo(ErrorCategory.DATA);
        assertThat(handler.classify(new NumberFormatException("x"), context).action()).isEqualTo(ErrorAction.SKIP);
        assertThat(handler.classify(new SQLException("locked"), context).category()).isEqualTo(ErrorCategory.DATABASE);

        ErrorInfo config = handler.classify(new FileNotFoundException("config.yml not found"), context);
        assertThat(config.category()).isEqualTo(ErrorCategory.CONFIGURATION);
        assertThat(config.severity()).isEqualTo(ErrorSeverity.CRITICAL);
        assertThat(config.action()).isEqualTo(ErrorAction.FAIL);

        ErrorInfo unknown = handler.classify(new IllegalStateException("odd"), context);
        assertThat(unknown.category()).isEqualTo(ErrorCategory.UNKNOWN);
        assertThat(unknown.action()).isEqualTo(ErrorAction.LOG_AND_CONTINUE);
    }

    @Test
    @DisplayName("wrapper exceptions are unwrapped before classification")
    void unwrapsWrappers() {
        CompletionException wrapped = new CompletionException(new ConnectException("refused"));

        ErrorInfo info = handler.classify(wrapped, context);
        assertThat(info.category()).isEqualTo(ErrorCategory.NETWORK);
        assertThat(info.originalException()).isSameAs(wrapped);
    }

    @Test
    @DisplayName("handle counts errors per category and operation")
    void statistics() {
        handler.handle(new ConnectException("a"), context);
        handler.handle(new ConnectException("b"), context);
        handler.handle(new ValidationException("c"), ErrorContext.of("parse_entry"));

        assertThat(handler.getErrorStatistics())
                .containsEntry("network:get_protein", 2L)
                .containsEntry("validation:parse_entry", 1L);

        handler.resetErrorStatistics();
        assertThat(handler.getErrorStatistics()).isEmpty();
    }

    @Test
    @DisplayName("API exception exposes its optional status")
    void apiStatus() {
        assertThat(new ApiException("gone", 410).getStatusCode()).contains(410);
        assertThat(new ApiException("unknown").getStatusCode()).isEmpty();
        assertThat(new ApiException("gone", 410).getSeverity()).isEqualTo(ErrorSeverity.HIGH);
    }
}
