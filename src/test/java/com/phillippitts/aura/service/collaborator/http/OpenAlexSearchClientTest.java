package com.phillippitts.aura.service.collaborator.http;

import com.phillippitts.aura.domain.EvidenceItem;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAlexSearchClientTest {

    private static final String LONG_ABSTRACT_INDEX = """
            {"Parvovirus": [0], "B19": [1], "causes": [2], "erythema": [3], "infectiosum": [4],
             "in": [5], "school-aged": [6], "children": [7], "worldwide.": [8]}
            """;

    @Test
    void reconstructsAbstractInPositionOrder() {
        JSONObject index = new JSONObject("{\"world\": [1], \"hello\": [0, 2]}");

        assertThat(OpenAlexSearchClient.reconstructAbstract(index)).isEqualTo("hello world hello");
        assertThat(OpenAlexSearchClient.reconstructAbstract(null)).isEmpty();
    }

    @Test
    void parseNormalizesScoresAndDropsShortAbstracts() {
        JSONObject body = new JSONObject("""
                {"results": [
                  {"id": "https://openalex.org/W1", "doi": "https://doi.org/10.1000/fifth",
                   "title": "Fifth disease", "relevance_score": 40.0,
                   "abstract_inverted_index": %s},
                  {"id": "https://openalex.org/W2", "title": "Too short", "relevance_score": 80.0,
                   "abstract_inverted_index": {"Short": [0]}},
                  {"id": "https://openalex.org/W3", "doi": null, "title": "Exanthems", "relevance_score": 20.0,
                   "abstract_inverted_index": %s}
                ]}
                """.formatted(LONG_ABSTRACT_INDEX, LONG_ABSTRACT_INDEX));

        List<EvidenceItem> items = OpenAlexSearchClient.parseWorks(body, 5);

        assertThat(items).extracting(EvidenceItem::sourceId).containsExactly("DOI:10.1000/fifth", "OpenAlex:W3");
        // The best score on the page belongs to the dropped work
        assertThat(items.get(0).confidence()).isEqualTo(0.5);
        assertThat(items.get(1).confidence()).isEqualTo(0.25);
        assertThat(items.get(0).snippet()).isEqualTo("Title: Fifth disease\nAbstract: "
                + "Parvovirus B19 causes erythema infectiosum in school-aged children worldwide.");
    }

    @Test
    void emptyResultsYieldNoItems() {
        assertThat(OpenAlexSearchClient.parseWorks(new JSONObject("{\"results\": []}"), 5)).isEmpty();
        assertThat(OpenAlexSearchClient.parseWorks(new JSONObject("{}"), 5)).isEmpty();
    }

    @Test
    void searchSendsPoliteParameters() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://openalex.test");
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        OpenAlexSearchClient client = new OpenAlexSearchClient(builder.build(), "ops@example.org");

        server.expect(requestTo(startsWith("http://openalex.test/works")))
                .andExpect(queryParam("search", "measles"))
                .andExpect(queryParam("per-page", "3"))
                .andExpect(queryParam("mailto", "ops@example.org"))
                .andRespond(withSuccess("{\"results\": []}", MediaType.APPLICATION_JSON));

        assertThat(client.search("measles", 3)).isEmpty();
        assertThat(client.name()).isEqualTo("openalex");
        server.verify();
    }
}
