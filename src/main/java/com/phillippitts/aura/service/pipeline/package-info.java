/**
 * The diagnostic pipeline: run state, step containment, the Evidence fan-out and synthesis.
 *
 * <p>Entry point is {@link com.phillippitts.aura.service.pipeline.DiagnosticPipeline}.
 * {@link com.phillippitts.aura.service.pipeline.DiagnosticRun} holds the mutable state of
 * one run and is never shared; callers only ever see
 * {@link com.phillippitts.aura.domain.RunRecord} snapshots.
 */
package com.phillippitts.aura.service.pipeline;
