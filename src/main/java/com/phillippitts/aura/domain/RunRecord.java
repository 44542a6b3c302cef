package com.phillippitts.aura.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a diagnostic run.
 *
 * <p>Handed to generation collaborators (critique, report) as their input and returned to
 * the caller when the run finishes. Fields not yet computed are {@code null}; the three
 * evidence lists are never {@code null}.
 *
 * @param runId                   caller-supplied run identifier used for log correlation
 * @param patientId               patient identifier
 * @param symptomText             original free-text symptom description
 * @param imageSupplied           whether an image accompanied the request; the bytes stay in the run
 *                                and are never part of a snapshot
 * @param structuredSymptoms      extracted symptoms, or null
 * @param patientRecord           patient record, or null when the run stopped before/at lookup
 * @param literatureEvidence      literature search results (possibly empty)
 * @param broadLiteratureEvidence broad/interdisciplinary search results (possibly empty)
 * @param caseEvidence            similar-case search results (possibly empty)
 * @param imagingFindings         image description, or null when no image was analysed
 * @param critique                supervisory critique, or null
 * @param finalReport             synthesized report, or null
 * @param triageLevel             triage parsed from the report; null iff no report
 * @param drugWarnings            drug-interaction warnings, or null when none were found
 * @param error                   first recorded step failure, or null
 */
public record RunRecord(
        String runId,
        int patientId,
        String symptomText,
        boolean imageSupplied,
        StructuredSymptoms structuredSymptoms,
        PatientRecord patientRecord,
        List<EvidenceItem> literatureEvidence,
        List<EvidenceItem> broadLiteratureEvidence,
        List<EvidenceItem> caseEvidence,
        String imagingFindings,
        Critique critique,
        String finalReport,
        TriageLevel triageLevel,
        List<String> drugWarnings,
        String error
) {
    public RunRecord {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(symptomText, "symptomText");
        literatureEvidence = literatureEvidence == null ? List.of() : List.copyOf(literatureEvidence);
        broadLiteratureEvidence = broadLiteratureEvidence == null
                ? List.of() : List.copyOf(broadLiteratureEvidence);
        caseEvidence = caseEvidence == null ? List.of() : List.copyOf(caseEvidence);
        drugWarnings = drugWarnings == null ? null : List.copyOf(drugWarnings);
    }
}
