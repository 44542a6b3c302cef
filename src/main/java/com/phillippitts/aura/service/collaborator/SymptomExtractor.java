package com.phillippitts.aura.service.collaborator;

import com.phillippitts.aura.domain.StructuredSymptoms;

/**
 * Turns a free-text symptom description into structured symptoms.
 */
public interface SymptomExtractor {

    /**
     * @throws com.phillippitts.aura.exception.SymptomExtractionException if the output is unusable
     * @throws com.phillippitts.aura.exception.CollaboratorException if the backend call fails
     */
    StructuredSymptoms extract(String symptomText);
}
