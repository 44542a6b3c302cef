package com.phillippitts.aura.domain;

import java.util.List;

/**
 * Supervisory review of the gathered evidence.
 *
 * @param inconsistencies contradictions between patient history and evidence
 * @param gaps            missing information that weakens the evidence
 * @param redFlags        high-risk findings that must be highlighted
 */
public record Critique(List<String> inconsistencies, List<String> gaps, List<String> redFlags) {

    public Critique {
        inconsistencies = inconsistencies == null ? List.of() : List.copyOf(inconsistencies);
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
        redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
    }
}
