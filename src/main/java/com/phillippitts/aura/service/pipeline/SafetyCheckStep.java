package com.phillippitts.aura.service.pipeline;

import com.phillippitts.aura.domain.DrugCheckResult;
import com.phillippitts.aura.domain.RunRecord;
import com.phillippitts.aura.service.collaborator.DrugInteractionChecker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Final drug-safety screen of a synthesized report.
 *
 * <p>Candidate conditions are the bullet lines of the report's "Potential Considerations"
 * section. When the checker returns warnings they are stored on the run and appended to the
 * report under a {@value #WARNINGS_HEADING} heading.
 */
public class SafetyCheckStep {
    private static final Logger LOG = LogManager.getLogger(SafetyCheckStep.class);

    static final String SECTION_TITLE = "Potential Considerations";
    static final String WARNINGS_HEADING = "## Safety Warnings";

    private final DrugInteractionChecker checker;

    public SafetyCheckStep(DrugInteractionChecker checker) {
        this.checker = Objects.requireNonNull(checker, "checker");
    }

    /**
     * Screens the report in {@code snapshot}. Runs inside the step runner.
     */
    public DrugCheckResult screen(RunRecord snapshot) {
        List<String> conditions = extractConditions(snapshot.finalReport());
        if (conditions.isEmpty()) {
            LOG.debug("No candidate conditions in report; skipping interaction check");
            return DrugCheckResult.none();
        }
        String history = snapshot.patientRecord() == null ? "" : snapshot.patientRecord().medicalHistory();
        DrugCheckResult result = checker.check(conditions, history);
        return result == null ? DrugCheckResult.none() : result;
    }

    /**
     * Stores warnings and amends the report. No-op when the result has no warnings.
     */
    void apply(DiagnosticRun run, DrugCheckResult result) {
        if (result == null || !result.hasWarnings()) {
            return;
        }
        run.setDrugWarnings(result.warnings());
        StringBuilder sb = new StringBuilder(run.finalReport())
                .append("\n\n").append(WARNINGS_HEADING).append("\n\n");
        for (int i = 0; i < result.warnings().size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append("- ").append(result.warnings().get(i));
        }
        run.amendFinalReport(sb.toString());
        LOG.info("Appended {} safety warning(s), risk={}", result.warnings().size(), result.interactionRisk());
    }

    /**
     * Bullet items ({@code *} or {@code -}) after the "Potential Considerations" title, up to the
     * next markdown heading.
     */
    static List<String> extractConditions(String report) {
        if (report == null) {
            return List.of();
        }
        int idx = report.indexOf(SECTION_TITLE);
        if (idx < 0) {
            return List.of();
        }
        String section = report.substring(idx + SECTION_TITLE.length());
        String[] lines = section.split("\\R");
        List<String> conditions = new ArrayList<>();
        // lines[0] is the remainder of the title line
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.startsWith("#")) {
                break;
            }
            if (line.startsWith("*") || line.startsWith("-")) {
                String item = line.replaceFirst("^[*\\-\\s]+", "").replace("**", "").strip();
                if (!item.isEmpty()) {
                    conditions.add(item);
                }
            }
        }
        return List.copyOf(conditions);
    }
}
