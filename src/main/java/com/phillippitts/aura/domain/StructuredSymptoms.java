package com.phillippitts.aura.domain;

import java.util.List;

/**
 * Structured output of the symptom extraction step.
 *
 * @param symptoms extracted symptoms in the order the extractor reported them
 */
public record StructuredSymptoms(List<Symptom> symptoms) {

    public StructuredSymptoms {
        symptoms = symptoms == null ? List.of() : List.copyOf(symptoms);
    }

    public static StructuredSymptoms empty() {
        return new StructuredSymptoms(List.of());
    }

    /**
     * Returns the non-blank symptom names in order.
     */
    public List<String> names() {
        return symptoms.stream()
                .map(Symptom::name)
                .filter(n -> !n.isBlank())
                .map(String::trim)
                .toList();
    }

    public boolean isEmpty() {
        return symptoms.isEmpty();
    }
}
