package com.phillippitts.aura.service.pipeline;

import com.phillippitts.aura.domain.DrugCheckResult;
import com.phillippitts.aura.domain.PatientRecord;
import com.phillippitts.aura.domain.RunRecord;
import com.phillippitts.aura.domain.TriageLevel;
import com.phillippitts.aura.service.collaborator.DrugInteractionChecker;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SafetyCheckStepTest {

    private static final String REPORT = String.join("\n",
            "# Diagnostic Report",
            "## Potential Considerations",
            "* **Fifth disease** (parvovirus B19)",
            "- Scarlet fever",
            "Narrative line that is not a bullet",
            "## Recommendations",
            "* Hydration",
            "TRIAGE_LEVEL: Routine");

    private final DrugInteractionChecker checker = mock(DrugInteractionChecker.class);
    private final SafetyCheckStep step = new SafetyCheckStep(checker);

    private static DiagnosticRun runWithReport(String report) {
        DiagnosticRun run = new DiagnosticRun("r", 4, "fever", null);
        run.setPatientRecord(new PatientRecord(4, "Robert Hayes", 67, "Male", "On warfarin", ""));
        run.setFinalReport(report, TriageLevel.ROUTINE);
        return run;
    }

    @Test
    void extractsBulletsUntilNextHeading() {
        assertThat(SafetyCheckStep.extractConditions(REPORT))
                .containsExactly("Fifth disease (parvovirus B19)", "Scarlet fever");
    }

    @Test
    void noSectionMeansNoConditions() {
        assertThat(SafetyCheckStep.extractConditions("# Report\n* something")).isEmpty();
        assertThat(SafetyCheckStep.extractConditions(null)).isEmpty();
    }

    @Test
    void screenPassesConditionsAndHistoryToChecker() {
        DrugCheckResult expected = new DrugCheckResult(List.of("warn"), List.of(), List.of(), DrugCheckResult.Risk.MODERATE);
        when(checker.check(any(), anyString())).thenReturn(expected);

        DrugCheckResult result = step.screen(runWithReport(REPORT).snapshot());

        assertThat(result).isSameAs(expected);
        verify(checker).check(List.of("Fifth disease (parvovirus B19)", "Scarlet fever"), "On warfarin");
    }

    @Test
    void screenSkipsCheckerWhenNoConditions() {
        RunRecord snapshot = runWithReport("# Report\nTRIAGE_LEVEL: Routine").snapshot();

        assertThat(step.screen(snapshot).hasWarnings()).isFalse();
        verify(checker, never()).check(any(), any());
    }

    @Test
    void applyAppendsWarningsSectionAndStoresWarnings() {
        DiagnosticRun run = runWithReport(REPORT);
        DrugCheckResult result = new DrugCheckResult(
                List.of("Blood thinners need monitoring.", "Kidney function affects dosing."),
                List.of(), List.of(), DrugCheckResult.Risk.HIGH);

        step.apply(run, result);

        RunRecord r = run.snapshot();
        assertThat(r.finalReport()).startsWith(REPORT)
                .endsWith("\n\n## Safety Warnings\n\n- Blood thinners need monitoring.\n- Kidney function affects dosing.");
        assertThat(r.drugWarnings()).containsExactly("Blood thinners need monitoring.", "Kidney function affects dosing.");
        assertThat(r.triageLevel()).isEqualTo(TriageLevel.ROUTINE);
    }

    @Test
    void applyWithoutWarningsLeavesReportUntouched() {
        DiagnosticRun run = runWithReport(REPORT);

        step.apply(run, DrugCheckResult.none());

        assertThat(run.snapshot().finalReport()).isEqualTo(REPORT);
        assertThat(run.snapshot().drugWarnings()).isNull();
    }
}
