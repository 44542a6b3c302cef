package com.phillippitts.aura.exception;

/**
 * Thrown when the patient record lookup finds no patient for the requested id.
 * Fatal for a diagnostic run: no evidence gathering is meaningful without the record.
 */
public class PatientNotFoundException extends AuraException {

    private final int patientId;

    public PatientNotFoundException(int patientId) {
        super("Patient with ID " + patientId + " not found.");
        this.patientId = patientId;
    }

    public int getPatientId() {
        return patientId;
    }
}
