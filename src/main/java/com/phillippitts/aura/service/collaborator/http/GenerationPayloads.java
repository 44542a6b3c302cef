package com.phillippitts.aura.service.collaborator.http;

import com.phillippitts.aura.domain.Critique;
import com.phillippitts.aura.domain.EvidenceItem;
import com.phillippitts.aura.domain.PatientRecord;
import com.phillippitts.aura.domain.RunRecord;
import com.phillippitts.aura.domain.StructuredSymptoms;
import com.phillippitts.aura.domain.Symptom;
import com.phillippitts.aura.exception.SymptomExtractionException;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shapes exchanged with the generation service.
 *
 * <p>Symptoms: {@code {"symptoms":[{"name":"rash","qualifiers":["bright red"]}]}}.
 * Critique: {@code {"inconsistencies":[],"gaps":[],"red_flags":[]}}.
 */
final class GenerationPayloads {

    private GenerationPayloads() {}

    static StructuredSymptoms parseSymptoms(JSONObject body) {
        JSONArray arr = body.optJSONArray("symptoms");
        if (arr == null) {
            throw new SymptomExtractionException("Response has no 'symptoms' array");
        }
        List<Symptom> symptoms = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            JSONObject s = arr.optJSONObject(i);
            if (s == null) {
                continue;
            }
            String name = s.optString("name", "").trim();
            if (name.isEmpty()) {
                continue;
            }
            symptoms.add(new Symptom(name, strings(s.optJSONArray("qualifiers"))));
        }
        return new StructuredSymptoms(symptoms);
    }

    static Critique parseCritique(JSONObject body) {
        return new Critique(
                strings(body.optJSONArray("inconsistencies")),
                strings(body.optJSONArray("gaps")),
                strings(body.optJSONArray("red_flags")));
    }

    /**
     * Serializes the parts of a run the generation prompts need. Image bytes are never sent;
     * only the findings derived from them.
     */
    static JSONObject runToJson(RunRecord run) {
        JSONObject o = new JSONObject();
        o.put("runId", run.runId());
        o.put("symptomsText", run.symptomText());
        o.put("symptoms", symptomsToJson(run.structuredSymptoms()));
        o.put("patient", patientToJson(run.patientRecord()));
        o.put("literatureEvidence", evidenceToJson(run.literatureEvidence()));
        o.put("broadLiteratureEvidence", evidenceToJson(run.broadLiteratureEvidence()));
        o.put("caseEvidence", evidenceToJson(run.caseEvidence()));
        o.put("imagingFindings", run.imagingFindings() == null ? JSONObject.NULL : run.imagingFindings());
        o.put("critique", critiqueToJson(run.critique()));
        return o;
    }

    private static JSONArray symptomsToJson(StructuredSymptoms symptoms) {
        JSONArray arr = new JSONArray();
        if (symptoms != null) {
            for (Symptom s : symptoms.symptoms()) {
                arr.put(new JSONObject()
                        .put("name", s.name())
                        .put("qualifiers", new JSONArray(s.qualifiers())));
            }
        }
        return arr;
    }

    private static Object patientToJson(PatientRecord p) {
        if (p == null) {
            return JSONObject.NULL;
        }
        return new JSONObject()
                .put("id", p.id())
                .put("name", p.name())
                .put("age", p.age())
                .put("gender", p.gender())
                .put("medicalHistory", p.medicalHistory())
                .put("currentSymptoms", p.currentSymptoms());
    }

    private static JSONArray evidenceToJson(List<EvidenceItem> items) {
        JSONArray arr = new JSONArray();
        for (EvidenceItem e : items) {
            arr.put(new JSONObject()
                    .put("sourceId", e.sourceId())
                    .put("snippet", e.snippet())
                    .put("confidence", e.confidence()));
        }
        return arr;
    }

    private static Object critiqueToJson(Critique c) {
        if (c == null) {
            return JSONObject.NULL;
        }
        return new JSONObject()
                .put("inconsistencies", new JSONArray(c.inconsistencies()))
                .put("gaps", new JSONArray(c.gaps()))
                .put("red_flags", new JSONArray(c.redFlags()));
    }

    private static List<String> strings(JSONArray arr) {
        if (arr == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            String v = arr.optString(i, "").trim();
            if (!v.isEmpty()) {
                out.add(v);
            }
        }
        return out;
    }
}
