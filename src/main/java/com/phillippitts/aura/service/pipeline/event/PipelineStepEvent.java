package com.phillippitts.aura.service.pipeline.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Published on every step transition of a diagnostic run. Correlates by {@code runId} and
 * {@code step}.
 *
 * <p>PII note: {@code detail} carries technical diagnostics only, never symptom or report text.
 */
public record PipelineStepEvent(
        String runId,
        String step,
        Action action,
        boolean foundational,
        long durationMs,
        String detail,
        Instant at
) {
    public enum Action { STARTED, COMPLETED, FAILED, SKIPPED }

    public PipelineStepEvent {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(action, "action");
        if (at == null) {
            at = Instant.now();
        }
        detail = detail == null ? "" : detail;
    }

    public boolean isFailure() {
        return action == Action.FAILED;
    }
}
