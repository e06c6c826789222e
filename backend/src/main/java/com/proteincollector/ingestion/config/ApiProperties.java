package com.proteincollector.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Remote API endpoints and HTTP timeouts. Documented in application.yml under proteincollector.api.
 */
@ConfigurationProperties(prefix = "proteincollector.api")
@NoArgsConstructor
@Getter
@Setter
public class ApiProperties {

    private String interproBaseUrl = "https://www.ebi.ac.uk/interpro/api/";

    private String uniprotBaseUrl = "https://rest.uniprot.org/";

    /** Connect timeout in seconds. */
    private int connectTimeoutSeconds = 10;

    /** Response timeout in seconds. */
    private int readTimeoutSeconds = 30;
}
