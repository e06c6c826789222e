package com.proteincollector.ingestion.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proteincollector.common.AccessGovernor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * UniProt REST client (uniprotkb endpoints). All calls are rate-limited, cached and retried under API name
 * {@value #API_NAME}.
 */
@Slf4j
public class UniProtClient extends GovernedApiClient {

    public static final String API_NAME = "UniProt";

    /** Upper bound UniProt accepts for the {@code size} search parameter. */
    static final int MAX_SEARCH_SIZE = 500;

    public UniProtClient(WebClient webClient, AccessGovernor governor, ObjectMapper objectMapper) {
        super(API_NAME, webClient, governor, objectMapper);
    }

    /**
     * @return the UniProtKB entry, or empty when the accession is unknown
     */
    public Optional<JsonNode> getProtein(String accession) {
        String id = requireNonBlank(accession, "accession");
        return fetch("/uniprotkb/" + id, Map.of("format", "json"));
    }

    /**
     * First page of a UniProtKB search. {@code limit} is capped at {@value #MAX_SEARCH_SIZE}.
     */
    public List<JsonNode> searchProteins(String query, int limit) {
        String q = requireNonBlank(query, "query");
        int size = Math.max(1, Math.min(limit, MAX_SEARCH_SIZE));
        Optional<JsonNode> response = fetch("/uniprotkb/search",
                Map.of("query", q, "format", "json", "size", String.valueOf(size)));
        List<JsonNode> results = new ArrayList<>();
        response.map(r -> r.path("results")).ifPresent(node -> node.forEach(results::add));
        log.debug("UniProt search query={} size={} results={}", q, size, results.size());
        return results;
    }
}
