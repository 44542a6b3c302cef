package com.phillippitts.aura.service.collaborator.http;

import com.phillippitts.aura.domain.Critique;
import com.phillippitts.aura.domain.EvidenceItem;
import com.phillippitts.aura.domain.PatientRecord;
import com.phillippitts.aura.domain.RunRecord;
import com.phillippitts.aura.domain.StructuredSymptoms;
import com.phillippitts.aura.domain.Symptom;
import com.phillippitts.aura.exception.CollaboratorException;
import com.phillippitts.aura.exception.SymptomExtractionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GenerationServiceClientTest {

    private static final String BASE = "http://generation.test";

    private MockRestServiceServer server;
    private GenerationServiceClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GenerationServiceClient(builder.build());
    }

    private static RunRecord run() {
        return new RunRecord("run-1", 1, "fever and rash", false,
                new StructuredSymptoms(List.of(Symptom.of("rash", "slapped cheek"))),
                new PatientRecord(1, "Alice Johnson", 8, "Female", "Mild asthma", ""),
                List.of(new EvidenceItem("PMID:1", "Parvovirus B19", 0.9)), List.of(), List.of(),
                null, new Critique(List.of(), List.of("No temperature recorded"), List.of()),
                null, null, null, null);
    }

    @Test
    void extractsSymptoms() {
        server.expect(requestTo(BASE + "/v1/symptoms"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"text\":\"bright red cheeks and fever\"}"))
                .andRespond(withSuccess("""
                        {"symptoms": [
                          {"name": "rash", "qualifiers": ["bright red", "slapped cheek appearance"]},
                          {"name": "fever", "qualifiers": []},
                          {"name": " ", "qualifiers": ["ignored"]}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        StructuredSymptoms symptoms = client.extract("bright red cheeks and fever");

        assertThat(symptoms.names()).containsExactly("rash", "fever");
        assertThat(symptoms.symptoms().get(0).qualifiers()).containsExactly("bright red", "slapped cheek appearance");
        server.verify();
    }

    @Test
    void missingSymptomsArrayIsExtractionFailure() {
        server.expect(requestTo(BASE + "/v1/symptoms"))
                .andRespond(withSuccess("{\"note\": \"could not parse\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.extract("???"))
                .isInstanceOf(SymptomExtractionException.class);
    }

    @Test
    void critiqueSendsRunAndReadsAllSections() {
        server.expect(requestTo(BASE + "/v1/critique"))
                .andExpect(jsonPath("$.runId").value("run-1"))
                .andExpect(jsonPath("$.patient.name").value("Alice Johnson"))
                .andExpect(jsonPath("$.literatureEvidence[0].sourceId").value("PMID:1"))
                .andRespond(withSuccess("""
                        {"inconsistencies": ["Age conflicts with history"],
                         "gaps": [],
                         "red_flags": ["Possible aplastic crisis"]}
                        """, MediaType.APPLICATION_JSON));

        Critique critique = client.critique(run());

        assertThat(critique.inconsistencies()).containsExactly("Age conflicts with history");
        assertThat(critique.gaps()).isEmpty();
        assertThat(critique.redFlags()).containsExactly("Possible aplastic crisis");
    }

    @Test
    void reportReturnsReportField() {
        server.expect(requestTo(BASE + "/v1/report"))
                .andExpect(jsonPath("$.critique.gaps[0]").value("No temperature recorded"))
                .andRespond(withSuccess("{\"report\": \"# Report\\nTRIAGE_LEVEL: Routine\"}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.generate(run())).isEqualTo("# Report\nTRIAGE_LEVEL: Routine");
    }

    @Test
    void imagingSendsBase64AndTreatsBlankFindingsAsNone() {
        server.expect(requestTo(BASE + "/v1/imaging"))
                .andExpect(jsonPath("$.image").value("AQID"))
                .andRespond(withSuccess("{\"findings\": \"Malar erythema\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/v1/imaging"))
                .andRespond(withSuccess("{\"findings\": \"  \"}", MediaType.APPLICATION_JSON));

        assertThat(client.analyze(new byte[]{1, 2, 3})).contains("Malar erythema");
        assertThat(client.analyze(new byte[]{1, 2, 3})).isEmpty();
    }

    @Test
    void serverErrorBecomesCollaboratorExceptionWithStatus() {
        server.expect(requestTo(BASE + "/v1/report"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.generate(run()))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("generation request failed")
                .hasMessageContaining("status=503")
                .hasMessageContaining("endpoint=/v1/report");
    }

    @Test
    void transportErrorBecomesCollaboratorException() {
        server.expect(requestTo(BASE + "/v1/symptoms"))
                .andRespond(withException(new IOException("Connection refused")));

        assertThatThrownBy(() -> client.extract("fever"))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("generation unreachable");
    }

    @Test
    void invalidJsonBecomesCollaboratorException() {
        server.expect(requestTo(BASE + "/v1/critique"))
                .andRespond(withSuccess("<html>oops</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> client.critique(run()))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("invalid JSON");
    }

    @Test
    void emptyBodyBecomesCollaboratorException() {
        server.expect(requestTo(BASE + "/v1/report")).andRespond(withSuccess());

        assertThatThrownBy(() -> client.generate(run()))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("empty body");
    }
}
