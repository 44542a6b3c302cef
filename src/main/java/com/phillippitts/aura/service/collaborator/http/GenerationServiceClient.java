package com.phillippitts.aura.service.collaborator.http;

import com.phillippitts.aura.domain.Critique;
import com.phillippitts.aura.domain.RunRecord;
import com.phillippitts.aura.domain.StructuredSymptoms;
import com.phillippitts.aura.service.collaborator.CritiqueGenerator;
import com.phillippitts.aura.service.collaborator.ImageAnalyzer;
import com.phillippitts.aura.service.collaborator.ReportGenerator;
import com.phillippitts.aura.service.collaborator.SymptomExtractor;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.Base64;
import java.util.Optional;

/**
 * Client for the generation sidecar that hosts the language and vision models.
 *
 * <p>Endpoints (all POST, JSON in and out):
 * <ul>
 *   <li>{@value #SYMPTOMS_PATH}: {@code {"text"}} to the symptoms payload</li>
 *   <li>{@value #CRITIQUE_PATH}: run JSON to the critique payload</li>
 *   <li>{@value #REPORT_PATH}: run JSON to {@code {"report"}}</li>
 *   <li>{@value #IMAGING_PATH}: {@code {"image"}} (base64) to {@code {"findings"}}</li>
 * </ul>
 */
public class GenerationServiceClient extends AbstractHttpCollaborator
        implements SymptomExtractor, CritiqueGenerator, ReportGenerator, ImageAnalyzer {

    static final String SYMPTOMS_PATH = "/v1/symptoms";
    static final String CRITIQUE_PATH = "/v1/critique";
    static final String REPORT_PATH = "/v1/report";
    static final String IMAGING_PATH = "/v1/imaging";

    public GenerationServiceClient(RestClient restClient) {
        super(restClient, "generation");
    }

    @Override
    public StructuredSymptoms extract(String symptomText) {
        JSONObject body = post(SYMPTOMS_PATH, new JSONObject().put("text", symptomText));
        return GenerationPayloads.parseSymptoms(body);
    }

    @Override
    public Critique critique(RunRecord run) {
        return GenerationPayloads.parseCritique(post(CRITIQUE_PATH, GenerationPayloads.runToJson(run)));
    }

    @Override
    public String generate(RunRecord run) {
        return post(REPORT_PATH, GenerationPayloads.runToJson(run)).optString("report", "");
    }

    @Override
    public Optional<String> analyze(byte[] imageBytes) {
        JSONObject request = new JSONObject().put("image", Base64.getEncoder().encodeToString(imageBytes));
        String findings = post(IMAGING_PATH, request).optString("findings", "").trim();
        return findings.isEmpty() ? Optional.empty() : Optional.of(findings);
    }

    private JSONObject post(String path, JSONObject payload) {
        return exchange(path, client -> client.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload.toString())
                .retrieve()
                .body(String.class));
    }
}
