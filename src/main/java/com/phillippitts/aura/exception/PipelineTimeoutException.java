package com.phillippitts.aura.exception;

/**
 * Signals that a run exhausted its time budget or was cancelled by its caller. Never thrown
 * out of the pipeline; its message is recorded as the run's error.
 */
public class PipelineTimeoutException extends AuraException {

    private final long timeoutMs;
    private final boolean cancelled;

    public PipelineTimeoutException(String runId, long timeoutMs) {
        this("Run " + runId + " timed out after " + timeoutMs + " ms", timeoutMs, false);
    }

    private PipelineTimeoutException(String message, long timeoutMs, boolean cancelled) {
        super(message);
        this.timeoutMs = timeoutMs;
        this.cancelled = cancelled;
    }

    /**
     * Caller-side cancellation (thread interrupt) of a run that was still in progress.
     * Carries no budget, so {@link #getTimeoutMs()} is 0.
     */
    public static PipelineTimeoutException cancelled(String runId) {
        return new PipelineTimeoutException("Run " + runId + " timed out: cancelled by caller", 0L, true);
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
