package com.phillippitts.aura.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for diagnostic runs.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Step latency per pipeline step</li>
 *   <li>Success/failure counts per step, failures tagged fatal or contained</li>
 *   <li>Run outcomes (completed, completed with errors, aborted, timed out)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "aura.pipeline";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStepLatency(String step, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".step.latency")
                .description("Time taken by a pipeline step")
                .tag("step", step)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementStepSuccess(String step) {
        Counter.builder(METRIC_PREFIX + ".step.success")
                .description("Number of successful pipeline steps")
                .tag("step", step)
                .register(registry)
                .increment();
    }

    /**
     * @param step   step name
     * @param reason "fatal" or "contained"
     */
    public void incrementStepFailure(String step, String reason) {
        Counter.builder(METRIC_PREFIX + ".step.failure")
                .description("Number of failed pipeline steps")
                .tag("step", step)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordRun(String outcome, long durationNanos) {
        Counter.builder(METRIC_PREFIX + ".run")
                .description("Number of diagnostic runs by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".run.latency")
                .description("End-to-end diagnostic run time")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
