package com.phillippitts.aura.service.pipeline;

import com.phillippitts.aura.config.properties.PipelineProperties;
import com.phillippitts.aura.domain.Critique;
import com.phillippitts.aura.domain.DrugCheckResult;
import com.phillippitts.aura.domain.PatientRecord;
import com.phillippitts.aura.domain.RunRecord;
import com.phillippitts.aura.domain.StructuredSymptoms;
import com.phillippitts.aura.exception.CollaboratorExceptionBuilder;
import com.phillippitts.aura.exception.PatientNotFoundException;
import com.phillippitts.aura.exception.PipelineTimeoutException;
import com.phillippitts.aura.exception.SymptomExtractionException;
import com.phillippitts.aura.service.collaborator.CritiqueGenerator;
import com.phillippitts.aura.service.collaborator.PatientRecordLookup;
import com.phillippitts.aura.service.collaborator.ReportGenerator;
import com.phillippitts.aura.service.collaborator.SymptomExtractor;
import com.phillippitts.aura.service.metrics.PipelineMetrics;
import com.phillippitts.aura.service.pipeline.event.PipelineEventPublisher;
import com.phillippitts.aura.service.pipeline.event.PipelineStepEvent;
import com.phillippitts.aura.util.LogSanitizer;
import com.phillippitts.aura.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;

/**
 * Default implementation of {@link DiagnosticPipeline}.
 *
 * <p>Each call builds its own {@link DiagnosticRun}; nothing mutable is shared between runs, so
 * concurrent calls with distinct run ids are independent. The run id is placed in the Log4j2
 * {@link ThreadContext} for the duration of the call and copied to evidence workers by the
 * executor's task decorator.
 *
 * <p><b>Deadline:</b> the run budget ({@code aura.pipeline.run-timeout-ms}) is checked between
 * steps. When it is exhausted the run stops with a {@link PipelineTimeoutException} message as
 * its error. The evidence join never waits longer than the remaining budget.
 *
 * <p><b>Cancellation:</b> interrupting the calling thread cancels the in-flight evidence branches
 * and stops the run before the next step. The partial record comes back with outcome
 * {@code timed_out}, the interrupt flag still set.
 */
public class DefaultDiagnosticPipeline implements DiagnosticPipeline {

    private static final Logger LOG = LogManager.getLogger(DefaultDiagnosticPipeline.class);

    static final String RUN_ID_KEY = "runId";
    static final String ORCHESTRATOR = "Orchestrator";

    static final String OUTCOME_COMPLETED = "completed";
    static final String OUTCOME_COMPLETED_WITH_ERRORS = "completed_with_errors";
    static final String OUTCOME_ABORTED = "aborted";
    static final String OUTCOME_TIMED_OUT = "timed_out";

    private final SymptomExtractor symptomExtractor;
    private final PatientRecordLookup patientLookup;
    private final EvidencePhase evidencePhase;
    private final CritiqueGenerator critiqueGenerator;
    private final ReportGenerator reportGenerator;
    private final SafetyCheckStep safetyCheck;
    private final StepRunner stepRunner;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetrics metrics;
    private final PipelineProperties properties;

    /**
     * @throws NullPointerException if any collaborator except {@code publisher} is null
     */
    public DefaultDiagnosticPipeline(SymptomExtractor symptomExtractor,
                                     PatientRecordLookup patientLookup,
                                     EvidencePhase evidencePhase,
                                     CritiqueGenerator critiqueGenerator,
                                     ReportGenerator reportGenerator,
                                     SafetyCheckStep safetyCheck,
                                     StepRunner stepRunner,
                                     ApplicationEventPublisher publisher,
                                     PipelineMetrics metrics,
                                     PipelineProperties properties) {
        this.symptomExtractor = Objects.requireNonNull(symptomExtractor, "symptomExtractor must not be null");
        this.patientLookup = Objects.requireNonNull(patientLookup, "patientLookup must not be null");
        this.evidencePhase = Objects.requireNonNull(evidencePhase, "evidencePhase must not be null");
        this.critiqueGenerator = Objects.requireNonNull(critiqueGenerator, "critiqueGenerator must not be null");
        this.reportGenerator = Objects.requireNonNull(reportGenerator, "reportGenerator must not be null");
        this.safetyCheck = Objects.requireNonNull(safetyCheck, "safetyCheck must not be null");
        this.stepRunner = Objects.requireNonNull(stepRunner, "stepRunner must not be null");
        this.publisher = publisher;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    @Override
    public RunRecord run(String runId, int patientId, String symptomText, byte[] imageBytes) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(symptomText, "symptomText must not be null");

        String previousRunId = ThreadContext.get(RUN_ID_KEY);
        ThreadContext.put(RUN_ID_KEY, runId);
        long startNanos = System.nanoTime();
        long deadline = startNanos + properties.runTimeoutMs() * TimeUtils.NANOS_PER_MILLI;
        DiagnosticRun run = new DiagnosticRun(runId, patientId, symptomText, imageBytes);
        String outcome = OUTCOME_ABORTED;
        try {
            LOG.info("Starting run for patient {} (image={}): {}", patientId, run.hasImage(),
                    LogSanitizer.preview(symptomText));
            PipelineEventPublisher.publish(publisher, runId, ORCHESTRATOR,
                    PipelineStepEvent.Action.STARTED, false, 0L, "Workflow started.");

            outcome = execute(run, deadline);
            return run.snapshot();
        } catch (RuntimeException e) {
            // Step failures are contained by StepRunner; this only catches wiring or state bugs
            LOG.error("Unexpected failure in run", e);
            run.recordError("Unexpected pipeline failure: " + e.getMessage());
            outcome = OUTCOME_ABORTED;
            return run.snapshot();
        } finally {
            long elapsed = System.nanoTime() - startNanos;
            metrics.recordRun(outcome, elapsed);
            PipelineEventPublisher.publish(publisher, runId, ORCHESTRATOR,
                    PipelineStepEvent.Action.COMPLETED, false, TimeUtils.nanosToMillis(elapsed),
                    "Workflow finished: " + outcome);
            LOG.info("Run finished in {} ms: {}", TimeUtils.nanosToMillis(elapsed), outcome);
            restoreRunId(previousRunId);
        }
    }

    private String execute(DiagnosticRun run, long deadline) {
        // Foundation
        StepOutcome<StructuredSymptoms> symptoms = stepRunner.run(run, run.snapshot(), SYMPTOM_STEP, true, null,
                s -> {
                    StructuredSymptoms extracted = symptomExtractor.extract(s.symptomText());
                    if (extracted == null) {
                        throw new SymptomExtractionException("Symptom extractor returned no result");
                    }
                    return extracted;
                });
        if (symptoms.isFatal()) {
            return OUTCOME_ABORTED;
        }
        run.setStructuredSymptoms(symptoms.valueOrDefault());
        if (mustStop(run, deadline)) {
            return OUTCOME_TIMED_OUT;
        }

        StepOutcome<PatientRecord> patient = stepRunner.run(run, run.snapshot(), PATIENT_STEP, true, null,
                s -> patientLookup.findById(s.patientId())
                        .orElseThrow(() -> new PatientNotFoundException(s.patientId())));
        if (patient.isFatal()) {
            return OUTCOME_ABORTED;
        }
        run.setPatientRecord(patient.valueOrDefault());
        if (mustStop(run, deadline)) {
            return OUTCOME_TIMED_OUT;
        }

        // Evidence
        boolean cancelled = evidencePhase.execute(run, TimeUtils.remainingMillis(deadline));
        if (cancelled || mustStop(run, deadline)) {
            return OUTCOME_TIMED_OUT;
        }

        // Synthesis
        Critique critique = stepRunner.run(run, run.snapshot(), CRITIQUE_STEP, false, null,
                critiqueGenerator::critique).valueOrDefault();
        run.setCritique(critique);
        if (mustStop(run, deadline)) {
            return OUTCOME_TIMED_OUT;
        }

        String report = stepRunner.run(run, run.snapshot(), REPORT_STEP, false, null, s -> {
            String text = reportGenerator.generate(s);
            if (text == null || text.isBlank()) {
                throw CollaboratorExceptionBuilder.create("Report generator returned an empty report")
                        .collaborator(REPORT_STEP)
                        .build();
            }
            return text;
        }).valueOrDefault();
        if (report != null) {
            run.setFinalReport(report, TriageExtractor.extract(report));
            LOG.info("Report synthesized, triage={}", run.snapshot().triageLevel());
        }
        if (mustStop(run, deadline)) {
            return OUTCOME_TIMED_OUT;
        }

        if (run.finalReport() == null) {
            stepRunner.skip(run, SAFETY_STEP, "No report to screen.");
        } else {
            StepOutcome<DrugCheckResult> screened = stepRunner.run(run, run.snapshot(), SAFETY_STEP, false,
                    DrugCheckResult.none(), safetyCheck::screen);
            safetyCheck.apply(run, screened.valueOrDefault());
        }

        return run.error() == null ? OUTCOME_COMPLETED : OUTCOME_COMPLETED_WITH_ERRORS;
    }

    private boolean mustStop(DiagnosticRun run, long deadline) {
        PipelineTimeoutException timeout;
        if (Thread.currentThread().isInterrupted()) {
            timeout = PipelineTimeoutException.cancelled(run.runId());
        } else if (System.nanoTime() >= deadline) {
            timeout = new PipelineTimeoutException(run.runId(), properties.runTimeoutMs());
        } else {
            return false;
        }
        if (timeout.isCancelled()) {
            LOG.info("{}; skipping remaining steps", timeout.getMessage());
        } else {
            LOG.warn(timeout.getMessage());
        }
        run.recordError(timeout.getMessage());
        return true;
    }

    private static void restoreRunId(String previous) {
        if (previous == null) {
            ThreadContext.remove(RUN_ID_KEY);
        } else {
            ThreadContext.put(RUN_ID_KEY, previous);
        }
    }
}
