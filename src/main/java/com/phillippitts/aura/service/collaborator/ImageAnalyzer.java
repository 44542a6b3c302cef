package com.phillippitts.aura.service.collaborator;

import java.util.Optional;

/**
 * Describes findings visible in a submitted clinical image.
 */
public interface ImageAnalyzer {

    /**
     * @return textual findings, or empty when the analyzer produced nothing usable
     */
    Optional<String> analyze(byte[] imageBytes);
}
