package com.phillippitts.aura.domain;

import java.util.Objects;

/**
 * One ranked snippet returned by a literature or case search backend.
 *
 * @param sourceId   source identifier used for citations (e.g. "PMID:12345", "CaseDB:CASE_001")
 * @param snippet    snippet or abstract text
 * @param confidence similarity/confidence score between 0.0 and 1.0
 */
public record EvidenceItem(String sourceId, String snippet, double confidence) {

    public EvidenceItem {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(snippet, "snippet");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
    }

    /**
     * Creates an item, clamping the score into [0,1]. Backends that report raw relevance
     * scores go through here.
     */
    public static EvidenceItem clamped(String sourceId, String snippet, double score) {
        double c = Double.isNaN(score) ? 0.0 : Math.max(0.0, Math.min(1.0, score));
        return new EvidenceItem(sourceId, snippet, c);
    }
}
