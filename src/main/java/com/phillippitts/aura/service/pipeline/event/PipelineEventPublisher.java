package com.phillippitts.aura.service.pipeline.event;

import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;

/**
 * Utility for publishing {@link PipelineStepEvent}s.
 *
 * <p>If the publisher is null, publishing is a no-op so pipeline components can run in
 * tests without an application context.
 */
public final class PipelineEventPublisher {

    private PipelineEventPublisher() {
        // Utility class - prevent instantiation
    }

    public static void publish(ApplicationEventPublisher publisher,
                               String runId,
                               String step,
                               PipelineStepEvent.Action action,
                               boolean foundational,
                               long durationMs,
                               String detail) {
        if (publisher != null) {
            publisher.publishEvent(new PipelineStepEvent(
                    runId, step, action, foundational, durationMs, detail, Instant.now()));
        }
    }
}
