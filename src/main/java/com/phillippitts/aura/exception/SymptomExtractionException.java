package com.phillippitts.aura.exception;

/**
 * Thrown when the symptom extractor returns output that cannot be used to drive
 * evidence gathering (unparseable payload, missing symptom list).
 */
public class SymptomExtractionException extends AuraException {

    public SymptomExtractionException(String message) {
        super(message);
    }

    public SymptomExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
