package com.phillippitts.aura.service.collaborator.local;

import com.phillippitts.aura.domain.PatientRecord;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonPatientRecordLookupTest {

    @Test
    void parsesSnakeCaseFields() {
        Map<Integer, PatientRecord> records = JsonPatientRecordLookup.parse("""
                [ {"id": 7, "name": "Emma Johnson", "age": 5, "gender": "Female",
                   "medical_history": "No chronic conditions", "current_symptoms": "rash"},
                  {"id": 8, "name": "Sam Lee", "age": 40, "gender": "Male"} ]
                """);

        assertThat(records).containsOnlyKeys(7, 8);
        assertThat(records.get(7).medicalHistory()).isEqualTo("No chronic conditions");
        assertThat(records.get(7).currentSymptoms()).isEqualTo("rash");
        assertThat(records.get(8).medicalHistory()).isEmpty();
    }

    @Test
    void rejectsDuplicateIds() {
        assertThatThrownBy(() -> JsonPatientRecordLookup.parse("""
                [ {"id": 1, "name": "A", "age": 5, "gender": "Female"},
                  {"id": 1, "name": "B", "age": 6, "gender": "Male"} ]
                """)).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("duplicate");
    }

    @Test
    void findByIdReturnsEmptyForUnknownPatient() {
        JsonPatientRecordLookup lookup = new JsonPatientRecordLookup(
                Map.of(1, new PatientRecord(1, "A", 5, "Female", "", "")));

        assertThat(lookup.findById(1)).map(PatientRecord::name).contains("A");
        assertThat(lookup.findById(99)).isEmpty();
    }

    @Test
    void findAllKeepsStoreOrder() {
        Map<Integer, PatientRecord> records = JsonPatientRecordLookup.parse("""
                [ {"id": 3, "name": "C", "age": 5, "gender": "Female"},
                  {"id": 1, "name": "A", "age": 6, "gender": "Male"} ]
                """);

        assertThat(new JsonPatientRecordLookup(records).findAll())
                .extracting(PatientRecord::name).containsExactly("C", "A");
    }

    @Test
    void missingResourceGivesEmptyStore() {
        JsonPatientRecordLookup lookup = JsonPatientRecordLookup.fromResource(new ClassPathResource("nope.json"));

        assertThat(lookup.findAll()).isEmpty();
        assertThat(lookup.findById(1)).isEmpty();
    }

    @Test
    void invalidResourceFailsFast() {
        ByteArrayResource broken = new ByteArrayResource("{\"id\": 1}".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> JsonPatientRecordLookup.fromResource(broken))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid patient store");
    }

    @Test
    void bundledPatientsLoad() {
        JsonPatientRecordLookup lookup = JsonPatientRecordLookup.fromResource(new ClassPathResource("patients.json"));

        assertThat(lookup.findAll()).extracting(PatientRecord::id).startsWith(1, 2, 3, 4);
        assertThat(lookup.findById(4)).map(PatientRecord::medicalHistory).hasValueSatisfying(
                history -> assertThat(history.toLowerCase()).contains("warfarin"));
    }
}
