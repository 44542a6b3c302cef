package com.phillippitts.aura.service.pipeline;

import com.phillippitts.aura.domain.Critique;
import com.phillippitts.aura.domain.EvidenceItem;
import com.phillippitts.aura.domain.PatientRecord;
import com.phillippitts.aura.domain.RunRecord;
import com.phillippitts.aura.domain.StructuredSymptoms;
import com.phillippitts.aura.domain.TriageLevel;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable accumulator for one diagnostic run, owned by the pipeline for the run's lifetime.
 *
 * <p>Inputs are fixed at construction. Every output field is set at most once; a second write
 * throws {@link IllegalStateException}. The final report may additionally be amended once by the
 * safety check. Only {@link #recordError(String)} may be called from evidence worker threads;
 * all other mutators run on the pipeline thread.
 *
 * <p>Callers never see this object: they receive {@link #snapshot()}.
 */
public final class DiagnosticRun {

    private final String runId;
    private final int patientId;
    private final String symptomText;
    private final byte[] imageBytes;

    private StructuredSymptoms structuredSymptoms;
    private PatientRecord patientRecord;
    private List<EvidenceItem> literatureEvidence;
    private List<EvidenceItem> broadLiteratureEvidence;
    private List<EvidenceItem> caseEvidence;
    private String imagingFindings;
    private Critique critique;
    private String finalReport;
    private boolean reportAmended;
    private TriageLevel triageLevel;
    private List<String> drugWarnings;
    private final AtomicReference<String> error = new AtomicReference<>();

    public DiagnosticRun(String runId, int patientId, String symptomText, byte[] imageBytes) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.patientId = patientId;
        this.symptomText = Objects.requireNonNull(symptomText, "symptomText");
        this.imageBytes = imageBytes == null || imageBytes.length == 0 ? null : imageBytes.clone();
    }

    public String runId() {
        return runId;
    }

    public int patientId() {
        return patientId;
    }

    public String symptomText() {
        return symptomText;
    }

    public boolean hasImage() {
        return imageBytes != null;
    }

    /**
     * @return a copy of the submitted image, or null when none was supplied
     */
    public byte[] imageBytes() {
        return imageBytes == null ? null : imageBytes.clone();
    }

    public StructuredSymptoms structuredSymptoms() {
        return structuredSymptoms;
    }

    public PatientRecord patientRecord() {
        return patientRecord;
    }

    public String finalReport() {
        return finalReport;
    }

    public String error() {
        return error.get();
    }

    void setStructuredSymptoms(StructuredSymptoms value) {
        requireUnset(structuredSymptoms, "structuredSymptoms");
        structuredSymptoms = Objects.requireNonNull(value, "structuredSymptoms");
    }

    void setPatientRecord(PatientRecord value) {
        requireUnset(patientRecord, "patientRecord");
        patientRecord = Objects.requireNonNull(value, "patientRecord");
    }

    void setLiteratureEvidence(List<EvidenceItem> value) {
        requireUnset(literatureEvidence, "literatureEvidence");
        literatureEvidence = value == null ? List.of() : List.copyOf(value);
    }

    void setBroadLiteratureEvidence(List<EvidenceItem> value) {
        requireUnset(broadLiteratureEvidence, "broadLiteratureEvidence");
        broadLiteratureEvidence = value == null ? List.of() : List.copyOf(value);
    }

    void setCaseEvidence(List<EvidenceItem> value) {
        requireUnset(caseEvidence, "caseEvidence");
        caseEvidence = value == null ? List.of() : List.copyOf(value);
    }

    void setImagingFindings(String value) {
        requireUnset(imagingFindings, "imagingFindings");
        imagingFindings = value;
    }

    void setCritique(Critique value) {
        requireUnset(critique, "critique");
        critique = value;
    }

    /**
     * Sets the report together with its triage level so one is never present without the other.
     */
    void setFinalReport(String report, TriageLevel triage) {
        requireUnset(finalReport, "finalReport");
        finalReport = Objects.requireNonNull(report, "report");
        triageLevel = Objects.requireNonNull(triage, "triage");
    }

    void amendFinalReport(String amended) {
        if (finalReport == null) {
            throw new IllegalStateException("finalReport not set");
        }
        if (reportAmended) {
            throw new IllegalStateException("finalReport already amended");
        }
        finalReport = Objects.requireNonNull(amended, "amended");
        reportAmended = true;
    }

    void setDrugWarnings(List<String> value) {
        requireUnset(drugWarnings, "drugWarnings");
        drugWarnings = List.copyOf(value);
    }

    /**
     * Records the first error of the run; later errors are ignored. Safe to call concurrently.
     *
     * @return true if this call set the error
     */
    boolean recordError(String message) {
        return error.compareAndSet(null, Objects.requireNonNull(message, "message"));
    }

    /**
     * Immutable view of the run in its current state.
     */
    public RunRecord snapshot() {
        return new RunRecord(
                runId,
                patientId,
                symptomText,
                imageBytes != null,
                structuredSymptoms,
                patientRecord,
                literatureEvidence,
                broadLiteratureEvidence,
                caseEvidence,
                imagingFindings,
                critique,
                finalReport,
                triageLevel,
                drugWarnings,
                error.get()
        );
    }

    private static void requireUnset(Object current, String field) {
        if (current != null) {
            throw new IllegalStateException(field + " already set");
        }
    }
}
