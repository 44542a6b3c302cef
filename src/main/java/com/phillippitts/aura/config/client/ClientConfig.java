package com.phillippitts.aura.config.client;

import com.phillippitts.aura.config.properties.ClientProperties;
import com.phillippitts.aura.service.collaborator.http.GenerationServiceClient;
import com.phillippitts.aura.service.collaborator.http.HttpEvidenceSearchClient;
import com.phillippitts.aura.service.collaborator.http.OpenAlexSearchClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * RestClients for the external collaborators and the HTTP-backed collaborator beans.
 * One client per base URL, all sharing the connect and read timeouts from
 * {@code aura.clients.*}.
 */
@Configuration
public class ClientConfig {

    public static final String LITERATURE_SEARCH = "literatureSearch";
    public static final String BROAD_SEARCH = "broadSearch";
    public static final String CASE_SEARCH = "caseSearch";

    private final ClientProperties properties;

    public ClientConfig(ClientProperties properties) {
        this.properties = properties;
    }

    @Bean
    RestClient generationRestClient() {
        return restClient(properties.generation().baseUrl());
    }

    @Bean
    RestClient literatureRestClient() {
        return restClient(properties.literature().baseUrl());
    }

    @Bean
    RestClient casesRestClient() {
        return restClient(properties.cases().baseUrl());
    }

    @Bean
    RestClient openAlexRestClient() {
        return restClient(properties.openAlex().baseUrl());
    }

    /**
     * Single client implementing symptom extraction, critique, report and image analysis.
     */
    @Bean
    public GenerationServiceClient generationServiceClient(
            @Qualifier("generationRestClient") RestClient restClient) {
        return new GenerationServiceClient(restClient);
    }

    @Bean(name = LITERATURE_SEARCH)
    public HttpEvidenceSearchClient literatureSearch(@Qualifier("literatureRestClient") RestClient restClient) {
        return new HttpEvidenceSearchClient(restClient, "pubmed", properties.literature().path(), "PMID");
    }

    @Bean(name = BROAD_SEARCH)
    public OpenAlexSearchClient broadSearch(@Qualifier("openAlexRestClient") RestClient restClient) {
        return new OpenAlexSearchClient(restClient, properties.openAlex().mailto());
    }

    @Bean(name = CASE_SEARCH)
    public HttpEvidenceSearchClient caseSearch(@Qualifier("casesRestClient") RestClient restClient) {
        return new HttpEvidenceSearchClient(restClient, "cases", properties.cases().path(), "CaseDB");
    }

    private RestClient restClient(String baseUrl) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.connectTimeoutMs());
        factory.setReadTimeout(properties.readTimeoutMs());
        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(factory)
                .build();
    }
}
