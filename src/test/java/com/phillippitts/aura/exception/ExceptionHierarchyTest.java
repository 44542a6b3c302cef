package com.phillippitts.aura.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allDomainExceptionsExtendAuraException() {
        assertThat(new PatientNotFoundException(7)).isInstanceOf(AuraException.class);
        assertThat(new SymptomExtractionException("x")).isInstanceOf(AuraException.class);
        assertThat(new CollaboratorException("x")).isInstanceOf(AuraException.class);
        assertThat(new PipelineTimeoutException("r", 10)).isInstanceOf(AuraException.class);
        assertThat(new AuraException("x")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void patientNotFoundCarriesId() {
        PatientNotFoundException ex = new PatientNotFoundException(99);

        assertThat(ex.getPatientId()).isEqualTo(99);
        assertThat(ex.getMessage()).isEqualTo("Patient with ID 99 not found.");
    }

    @Test
    void timeoutMessageNamesRunAndBudget() {
        PipelineTimeoutException ex = new PipelineTimeoutException("run-1", 120_000);

        assertThat(ex.getMessage()).isEqualTo("Run run-1 timed out after 120000 ms");
        assertThat(ex.getTimeoutMs()).isEqualTo(120_000);
    }

    @Test
    void cancellationIsATimeoutWithoutBudget() {
        PipelineTimeoutException ex = PipelineTimeoutException.cancelled("run-2");

        assertThat(ex.getMessage()).isEqualTo("Run run-2 timed out: cancelled by caller");
        assertThat(ex.isCancelled()).isTrue();
        assertThat(ex.getTimeoutMs()).isZero();
        assertThat(new PipelineTimeoutException("run-3", 10).isCancelled()).isFalse();
    }

    @Test
    void collaboratorNameAppendedToMessage() {
        CollaboratorException ex = new CollaboratorException("timeout", "pubmed");

        assertThat(ex.getMessage()).isEqualTo("timeout (collaborator: pubmed)");
        assertThat(ex.getCollaborator()).isEqualTo("pubmed");
        assertThat(new CollaboratorException("x").getCollaborator()).isEqualTo("unknown");
    }
}
