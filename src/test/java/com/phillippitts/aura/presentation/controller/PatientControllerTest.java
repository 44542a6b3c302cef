package com.phillippitts.aura.presentation.controller;

import com.phillippitts.aura.domain.PatientRecord;
import com.phillippitts.aura.exception.PatientNotFoundException;
import com.phillippitts.aura.service.collaborator.local.JsonPatientRecordLookup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PatientControllerTest {

    private PatientController controller;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        controller = new PatientController(new JsonPatientRecordLookup(
                Map.of(2, new PatientRecord(2, "Bobby Chen", 12, "Male", "Seasonal allergies", "cough"))));
        mvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void listsAllPatientsWithCount() throws Exception {
        mvc.perform(get("/api/patients"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.patients[0].id").value(2))
                .andExpect(jsonPath("$.patients[0].name").value("Bobby Chen"));
    }

    @Test
    void emptyStoreListsNoPatients() throws Exception {
        MockMvc empty = MockMvcBuilders.standaloneSetup(
                new PatientController(new JsonPatientRecordLookup(Map.of()))).build();

        empty.perform(get("/api/patients"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0))
                .andExpect(jsonPath("$.patients").isEmpty());
    }

    @Test
    void returnsPatientRecord() throws Exception {
        mvc.perform(get("/api/patients/2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Bobby Chen"))
                .andExpect(jsonPath("$.age").value(12))
                .andExpect(jsonPath("$.medicalHistory").value("Seasonal allergies"));
    }

    @Test
    void unknownPatientThrowsNotFound() {
        assertThatThrownBy(() -> controller.patient(42))
                .isInstanceOf(PatientNotFoundException.class)
                .hasMessage("Patient with ID 42 not found.");
    }
}
