package com.phillippitts.aura.service.events;

import com.phillippitts.aura.service.pipeline.event.PipelineStepEvent;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes the audit trail: one line per step transition on the {@value #AUDIT_LOGGER} logger,
 * which log4j2-spring.xml routes to its own rolling file.
 *
 * <p>Line format: {@code [runId] Step.ACTION | STATUS | details (durationMs=n)}.
 * Details carry technical diagnostics only, never patient text.
 */
@Component
class StepAuditListener {
    static final String AUDIT_LOGGER = "aura.audit";

    private static final Logger AUDIT = LogManager.getLogger(AUDIT_LOGGER);

    @EventListener
    void onStep(PipelineStepEvent e) {
        AUDIT.log(levelFor(e), format(e));
    }

    // Package-private for tests
    static String format(PipelineStepEvent e) {
        StringBuilder sb = new StringBuilder()
                .append('[').append(e.runId()).append("] ")
                .append(e.step()).append('.').append(e.action())
                .append(" | ").append(statusFor(e))
                .append(" | ").append(e.detail());
        if (e.action() == PipelineStepEvent.Action.COMPLETED || e.action() == PipelineStepEvent.Action.FAILED) {
            sb.append(" (durationMs=").append(e.durationMs()).append(')');
        }
        return sb.toString();
    }

    static String statusFor(PipelineStepEvent e) {
        return switch (e.action()) {
            case FAILED -> "FAILURE";
            case SKIPPED -> "WARNING";
            default -> "SUCCESS";
        };
    }

    static Level levelFor(PipelineStepEvent e) {
        if (e.action() == PipelineStepEvent.Action.FAILED) {
            return e.foundational() ? Level.ERROR : Level.WARN;
        }
        return Level.INFO;
    }
}
