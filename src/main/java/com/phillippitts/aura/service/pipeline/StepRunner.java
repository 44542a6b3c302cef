package com.phillippitts.aura.service.pipeline;

import com.phillippitts.aura.domain.RunRecord;
import com.phillippitts.aura.service.metrics.PipelineMetrics;
import com.phillippitts.aura.service.pipeline.event.PipelineEventPublisher;
import com.phillippitts.aura.service.pipeline.event.PipelineStepEvent;
import com.phillippitts.aura.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Failure-containment wrapper around a single pipeline step.
 *
 * <p>Every step is logged and published as {@link PipelineStepEvent}s (STARTED, then COMPLETED
 * or FAILED). A thrown {@link RuntimeException} is recorded as the run's error (first error
 * wins) and converted into a {@link StepOutcome}:
 * <ul>
 *   <li>foundational step: {@link StepOutcome.Fatal}, the caller stops the run</li>
 *   <li>any other step: {@link StepOutcome.Contained} with the caller's safe default</li>
 * </ul>
 *
 * <p>Thread-safe: evidence branches call {@link #run} concurrently for the same run.
 */
@Component
public class StepRunner {
    private static final Logger LOG = LogManager.getLogger(StepRunner.class);

    static final String STEP_KEY = "step";
    private static final String ERROR_PREFIX = "Error in step '";

    private final ApplicationEventPublisher publisher;
    private final PipelineMetrics metrics;

    public StepRunner(ApplicationEventPublisher publisher, PipelineMetrics metrics) {
        this.publisher = publisher;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Runs {@code step} against {@code input}.
     *
     * @param run          run whose error field receives failures
     * @param input        snapshot passed to the step
     * @param stepName     name used in logs, events and metrics
     * @param foundational whether failure must stop the run
     * @param fallback     value returned in a contained failure
     * @param step         the work
     * @return outcome of the step (never null)
     */
    public <T> StepOutcome<T> run(DiagnosticRun run,
                                  RunRecord input,
                                  String stepName,
                                  boolean foundational,
                                  T fallback,
                                  PipelineStep<T> step) {
        Objects.requireNonNull(run, "run");
        Objects.requireNonNull(stepName, "stepName");
        Objects.requireNonNull(step, "step");

        ThreadContext.put(STEP_KEY, stepName);
        long t0 = System.nanoTime();
        try {
            LOG.debug("Step {} started", stepName);
            PipelineEventPublisher.publish(publisher, run.runId(), stepName,
                    PipelineStepEvent.Action.STARTED, foundational, 0L, "Input state received.");

            T value = step.execute(input);

            long elapsed = System.nanoTime() - t0;
            metrics.recordStepLatency(stepName, elapsed);
            metrics.incrementStepSuccess(stepName);
            LOG.info("Step {} completed in {} ms", stepName, TimeUtils.nanosToMillis(elapsed));
            PipelineEventPublisher.publish(publisher, run.runId(), stepName,
                    PipelineStepEvent.Action.COMPLETED, foundational, TimeUtils.nanosToMillis(elapsed),
                    "Step completed successfully.");
            return new StepOutcome.Success<>(value);
        } catch (RuntimeException e) {
            long elapsed = System.nanoTime() - t0;
            String error = errorMessage(stepName, e.getMessage());
            run.recordError(error);
            metrics.recordStepLatency(stepName, elapsed);
            metrics.incrementStepFailure(stepName, foundational ? "fatal" : "contained");
            PipelineEventPublisher.publish(publisher, run.runId(), stepName,
                    PipelineStepEvent.Action.FAILED, foundational, TimeUtils.nanosToMillis(elapsed),
                    e.getClass().getSimpleName() + ": " + e.getMessage());
            if (foundational) {
                LOG.error("Foundational step {} failed; stopping run", stepName, e);
                return new StepOutcome.Fatal<>(error, e);
            }
            LOG.warn("Step {} failed, continuing with default: {}", stepName, e.getMessage());
            return new StepOutcome.Contained<>(fallback, error);
        } finally {
            ThreadContext.remove(STEP_KEY);
        }
    }

    static String errorMessage(String stepName, String message) {
        return ERROR_PREFIX + stepName + "': " + message;
    }

    /**
     * Whether the record's error was produced by {@code stepName}.
     */
    public static boolean failedAt(RunRecord record, String stepName) {
        return record.error() != null && record.error().startsWith(ERROR_PREFIX + stepName + "'");
    }

    /**
     * Records that a step was intentionally not run (no query, no report to screen).
     */
    public void skip(DiagnosticRun run, String stepName, String reason) {
        LOG.info("Step {} skipped: {}", stepName, reason);
        PipelineEventPublisher.publish(publisher, run.runId(), stepName,
                PipelineStepEvent.Action.SKIPPED, false, 0L, reason);
    }
}
