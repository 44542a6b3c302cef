/**
 * Logging infrastructure and MDC (Log4j2 ThreadContext) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - per HTTP request, set by {@link com.phillippitts.aura.config.logging.MdcFilter}</li>
 *   <li>{@code runId} - per diagnostic run, set by the pipeline and copied to evidence workers</li>
 *   <li>{@code step} - current pipeline step, set by the step runner</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 10:14:07.112 [evidence-1] [requestId] [runId] [step] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.aura.config.logging;
