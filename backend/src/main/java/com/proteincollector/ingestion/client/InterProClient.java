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
 * InterPro REST client. Paged listings follow the {@code next} link until it is null; each page is a separate
 * governed request under API name {@value #API_NAME}.
 */
@Slf4j
public class InterProClient extends GovernedApiClient {

    public static final String API_NAME = "InterPro";

    static final int MAX_PAGE_SIZE = 200;

    public InterProClient(WebClient webClient, AccessGovernor governor, ObjectMapper objectMapper) {
        super(API_NAME, webClient, governor, objectMapper);
    }

    /**
     * @return the InterPro entry metadata, or empty when the accession is unknown
     */
    public Optional<JsonNode> getEntry(String accession) {
        String id = requireNonBlank(accession, "accession");
        return fetch("/entry/interpro/" + id + "/", Map.of())
                .map(r -> r.has("metadata") ? r.get("metadata") : r);
    }

    /**
     * All UniProt proteins annotated with the entry, across all pages.
     */
    public List<JsonNode> getProteinsForEntry(String accession, int pageSize) {
        String id = requireNonBlank(accession, "accession");
        return collectPages("/protein/UniProt/entry/interpro/" + id + "/", pageSize);
    }

    /**
     * Proteins annotated with the entry, restricted to one organism (NCBI taxonomy id, e.g. 9606 for human).
     */
    public List<JsonNode> getProteinsForEntry(String accession, String organismTaxId, int pageSize) {
        String id = requireNonBlank(accession, "accession");
        String taxId = requireNonBlank(organismTaxId, "organismTaxId");
        return collectPages("/protein/UniProt/taxonomy/uniprot/" + taxId + "/entry/interpro/" + id + "/", pageSize);
    }

    private List<JsonNode> collectPages(String endpoint, int pageSize) {
        int size = Math.max(1, Math.min(pageSize, MAX_PAGE_SIZE));
        List<JsonNode> results = new ArrayList<>();
        Optional<JsonNode> page = fetch(endpoint, Map.of("page_size", String.valueOf(size)));
        int pages = 0;
        while (page.isPresent()) {
            pages++;
            page.get().path("results").forEach(results::add);
            JsonNode next = page.get().path("next");
            if (!next.isTextual() || next.asText().isBlank()) {
                break;
            }
            page = fetch(next.asText(), Map.of());
        }
        log.debug("InterPro listing endpoint={} pages={} results={}", endpoint, pages, results.size());
        return results;
    }
}
