package com.proteincollector.ingestion.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proteincollector.common.AccessGovernor;
import com.proteincollector.common.error.ApiException;
import com.proteincollector.common.error.DataException;
import com.proteincollector.common.error.ErrorContext;
import com.proteincollector.common.error.NetworkException;
import com.proteincollector.common.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

/**
 * Base for REST clients whose calls go through {@link AccessGovernor}. Responses are parsed into Jackson trees.
 * HTTP 404 and empty bodies become an empty result; other failures are mapped to the collector exception hierarchy
 * so the retry controller can classify them.
 */
@Slf4j
abstract class GovernedApiClient {

    private final String apiName;
    private final WebClient webClient;
    private final AccessGovernor governor;
    private final ObjectMapper objectMapper;

    GovernedApiClient(String apiName, WebClient webClient, AccessGovernor governor, ObjectMapper objectMapper) {
        this.apiName = apiName;
        this.webClient = webClient;
        this.governor = governor;
        this.objectMapper = objectMapper;
    }

    /**
     * @param endpoint path relative to the base URL, or an absolute URL (pagination links)
     */
    protected Optional<JsonNode> fetch(String endpoint, Map<String, String> params) {
        Map<String, String> query = params != null ? params : Map.of();
        JsonNode result = governor.execute(apiName, endpoint, query, JsonNode.class, () -> request(endpoint, query));
        return Optional.ofNullable(result);
    }

    protected static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " must not be blank");
        }
        return value.strip();
    }

    private JsonNode request(String endpoint, Map<String, String> params) {
        ErrorContext context = ErrorContext.of("request:" + endpoint, apiName).withRequest(endpoint, null);
        String body;
        try {
            WebClient.RequestHeadersSpec<?> spec = isAbsolute(endpoint)
                    ? webClient.get().uri(URI.create(endpoint))
                    : webClient.get().uri(b -> {
                        b.path(endpoint);
                        params.forEach((name, value) -> b.queryParam(name, value));
                        return b.build();
                    });
            body = spec.retrieve().bodyToMono(String.class).block();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 404) {
                log.debug("{} resource not found endpoint={}", apiName, endpoint);
                return null;
            }
            throw new ApiException(apiName + " API error: " + status, status,
                    context.withRequest(endpoint, status), e);
        } catch (WebClientRequestException e) {
            throw new NetworkException(apiName + " API unreachable: " + e.getMessage(), context, e);
        }
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DataException("Invalid JSON response from " + apiName + " API", context, e);
        }
    }

    private static boolean isAbsolute(String endpoint) {
        return endpoint.startsWith("http://") || endpoint.startsWith("https://");
    }

    String getApiName() {
        return apiName;
    }
}
