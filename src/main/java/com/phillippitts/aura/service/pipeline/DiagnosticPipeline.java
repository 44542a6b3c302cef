package com.phillippitts.aura.service.pipeline;

import com.phillippitts.aura.domain.RunRecord;

/**
 * Runs one diagnostic request through Foundation, Evidence and Synthesis.
 *
 * <p><b>Phases:</b>
 * <ol>
 *   <li>Foundation (sequential): symptom extraction, then patient lookup. A failure here
 *       stops the run and the partial record is returned.</li>
 *   <li>Evidence (parallel): literature, broad literature, similar cases and, when an image was
 *       supplied, image analysis. Failures are contained per branch.</li>
 *   <li>Synthesis (sequential): critique, report with triage level, drug-safety check. Failures
 *       are contained.</li>
 * </ol>
 *
 * <p><b>Error Handling:</b> Collaborator failures never propagate. The first failure message
 * is stored in {@link RunRecord#error()}; later steps keep running unless the failed step was
 * foundational.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * RunRecord record = pipeline.run(UUID.randomUUID().toString(), 1,
 *         "5 year old with fever and a bright red rash on both cheeks", null);
 * if (record.triageLevel() == TriageLevel.URGENT) { ... }
 * }</pre>
 */
public interface DiagnosticPipeline {

    String SYMPTOM_STEP = "SymptomAnalyzer";
    String PATIENT_STEP = "EHR_Fetcher";
    String CRITIQUE_STEP = "CritiqueAgent";
    String REPORT_STEP = "ReportSynthesizer";
    String SAFETY_STEP = "DrugChecker";

    /**
     * Executes a run to completion or to its first foundational failure.
     *
     * @param runId       identifier used for log correlation; concurrent runs must use distinct ids
     * @param patientId   patient to look up
     * @param symptomText free-text symptom description
     * @param imageBytes  optional image, null or empty when absent
     * @return final snapshot of the run (never null)
     * @throws NullPointerException if runId or symptomText is null
     */
    RunRecord run(String runId, int patientId, String symptomText, byte[] imageBytes);
}
