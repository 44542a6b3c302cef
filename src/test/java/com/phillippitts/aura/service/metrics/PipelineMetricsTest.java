package com.phillippitts.aura.service.metrics;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineMetricsTest {

    private SimpleMeterRegistry registry;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
    }

    @Test
    void recordsStepLatencyPerStep() {
        metrics.recordStepLatency("LitSearcher", 5_000_000L);
        metrics.recordStepLatency("LitSearcher", 15_000_000L);

        Timer timer = registry.get("aura.pipeline.step.latency").tag("step", "LitSearcher").timer();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(20.0);
    }

    @Test
    void countsSuccessesAndFailuresSeparately() {
        metrics.incrementStepSuccess("CaseSearcher");
        metrics.incrementStepFailure("CaseSearcher", "contained");
        metrics.incrementStepFailure("EHR_Fetcher", "fatal");

        assertThat(registry.get("aura.pipeline.step.success").tag("step", "CaseSearcher").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("aura.pipeline.step.failure").tag("step", "CaseSearcher")
                .tag("reason", "contained").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("aura.pipeline.step.failure").tag("reason", "fatal").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void recordsRunOutcomeCountAndLatency() {
        metrics.recordRun("completed", 1_000_000L);
        metrics.recordRun("completed", 1_000_000L);
        metrics.recordRun("aborted", 1_000_000L);

        assertThat(registry.get("aura.pipeline.run").tag("outcome", "completed").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("aura.pipeline.run.latency").tag("outcome", "aborted").timer().count()).isEqualTo(1);
    }
}
