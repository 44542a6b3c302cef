package com.phillippitts.aura.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Endpoints of the external collaborators.
 *
 * <p>Example application.properties:
 * <pre>
 * aura.clients.connect-timeout-ms=5000
 * aura.clients.read-timeout-ms=60000
 * aura.clients.generation.base-url=http://localhost:8090
 * aura.clients.literature.base-url=http://localhost:8091
 * aura.clients.literature.path=/search/pubmed
 * aura.clients.cases.base-url=http://localhost:8091
 * aura.clients.cases.path=/search/cases
 * aura.clients.open-alex.base-url=https://api.openalex.org
 * aura.clients.open-alex.mailto=ops@example.org
 * </pre>
 *
 * @param connectTimeoutMs connect timeout applied to every client
 * @param readTimeoutMs    read timeout applied to every client
 * @param generation       generation sidecar (symptoms, critique, report, imaging)
 * @param literature       biomedical literature index
 * @param cases            similar-case index
 * @param openAlex         OpenAlex works API
 */
@Validated
@ConfigurationProperties(prefix = "aura.clients")
public record ClientProperties(
        @Min(value = 0, message = "connect-timeout-ms must be >= 0")
        int connectTimeoutMs,

        @Min(value = 0, message = "read-timeout-ms must be >= 0")
        int readTimeoutMs,

        @Valid Endpoint generation,
        @Valid Endpoint literature,
        @Valid Endpoint cases,
        @Valid OpenAlex openAlex
) {
    public ClientProperties {
        connectTimeoutMs = connectTimeoutMs <= 0 ? 5_000 : connectTimeoutMs;
        readTimeoutMs = readTimeoutMs <= 0 ? 60_000 : readTimeoutMs;
        generation = generation == null ? new Endpoint("http://localhost:8090", null) : generation;
        literature = literature == null ? new Endpoint("http://localhost:8091", null) : literature;
        literature = literature.withDefaultPath("/search/pubmed");
        cases = cases == null ? new Endpoint("http://localhost:8091", null) : cases;
        cases = cases.withDefaultPath("/search/cases");
        openAlex = openAlex == null ? new OpenAlex(null, null) : openAlex;
    }

    /**
     * @param baseUrl scheme, host and port
     * @param path    request path, for search endpoints
     */
    public record Endpoint(String baseUrl, String path) {

        Endpoint withDefaultPath(String defaultPath) {
            return path == null || path.isBlank() ? new Endpoint(baseUrl, defaultPath) : this;
        }
    }

    /**
     * @param baseUrl API root, defaults to https://api.openalex.org
     * @param mailto  contact address sent for the polite pool, optional
     */
    public record OpenAlex(String baseUrl, String mailto) {
        public OpenAlex {
            baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.openalex.org" : baseUrl;
        }
    }
}
