/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Controllers are thin adapters over {@link com.phillippitts.aura.service.pipeline.DiagnosticPipeline}
 * and the patient lookup. Presentation depends on service, never the reverse.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST endpoints under {@code /api}</li>
 *   <li>{@code presentation.exception} - global mapping of exceptions to HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.aura.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.aura.presentation;
