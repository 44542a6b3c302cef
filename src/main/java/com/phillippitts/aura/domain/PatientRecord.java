package com.phillippitts.aura.domain;

import java.util.Objects;

/**
 * Patient data returned by the record lookup. Instances are always fully populated;
 * a missing patient is represented by an empty lookup result, never a partial record.
 *
 * @param id              patient identifier
 * @param name            display name
 * @param age             age in years
 * @param gender          recorded gender
 * @param medicalHistory  free-text medical history (may be empty)
 * @param currentSymptoms symptoms noted on the chart (may be empty)
 */
public record PatientRecord(
        int id,
        String name,
        int age,
        String gender,
        String medicalHistory,
        String currentSymptoms
) {
    public PatientRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(gender, "gender");
        if (age < 0) {
            throw new IllegalArgumentException("age must be >= 0, got: " + age);
        }
        medicalHistory = medicalHistory == null ? "" : medicalHistory;
        currentSymptoms = currentSymptoms == null ? "" : currentSymptoms;
    }
}
