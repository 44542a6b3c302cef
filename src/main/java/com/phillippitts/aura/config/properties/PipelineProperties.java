package com.phillippitts.aura.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the diagnostic pipeline.
 *
 * <p>Example application.properties:
 * <pre>
 * aura.pipeline.run-timeout-ms=120000
 * aura.pipeline.evidence-timeout-ms=30000
 * aura.pipeline.literature-max-results=5
 * aura.pipeline.broad-max-results=5
 * aura.pipeline.case-max-results=2
 * </pre>
 *
 * <p>Zero values fall back to the defaults below.
 *
 * @param runTimeoutMs          overall budget for one run
 * @param evidenceTimeoutMs     maximum wait at the Evidence phase join
 * @param literatureMaxResults  max items requested from the literature search
 * @param broadMaxResults       max items requested from the broad search
 * @param caseMaxResults        max items requested from the case search
 */
@Validated
@ConfigurationProperties(prefix = "aura.pipeline")
public record PipelineProperties(
        @Min(value = 0, message = "run-timeout-ms must be >= 0")
        long runTimeoutMs,

        @Min(value = 0, message = "evidence-timeout-ms must be >= 0")
        long evidenceTimeoutMs,

        @Min(value = 0, message = "literature-max-results must be >= 0")
        int literatureMaxResults,

        @Min(value = 0, message = "broad-max-results must be >= 0")
        int broadMaxResults,

        @Min(value = 0, message = "case-max-results must be >= 0")
        int caseMaxResults
) {
    public static final long DEFAULT_RUN_TIMEOUT_MS = 120_000L;
    public static final long DEFAULT_EVIDENCE_TIMEOUT_MS = 30_000L;

    public PipelineProperties {
        runTimeoutMs = runTimeoutMs <= 0 ? DEFAULT_RUN_TIMEOUT_MS : runTimeoutMs;
        evidenceTimeoutMs = evidenceTimeoutMs <= 0 ? DEFAULT_EVIDENCE_TIMEOUT_MS : evidenceTimeoutMs;
        literatureMaxResults = literatureMaxResults <= 0 ? 5 : literatureMaxResults;
        broadMaxResults = broadMaxResults <= 0 ? 5 : broadMaxResults;
        caseMaxResults = caseMaxResults <= 0 ? 2 : caseMaxResults;
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(0, 0, 0, 0, 0);
    }
}
