/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.aura.exception.AuraException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.aura.exception.PatientNotFoundException} - Patient lookup
 *       found no record; fatal for a run</li>
 *   <li>{@link com.phillippitts.aura.exception.SymptomExtractionException} - Extractor output
 *       is unusable; fatal for a run</li>
 *   <li>{@link com.phillippitts.aura.exception.CollaboratorException} - An external
 *       collaborator failed; contained unless the failing step is foundational</li>
 *   <li>{@link com.phillippitts.aura.exception.PipelineTimeoutException} - The run budget
 *       was exhausted</li>
 * </ul>
 *
 * <p>Pipeline steps throw these; the step runner turns them into recorded errors, so they
 * reach the REST boundary only from non-pipeline endpoints, where
 * {@code GlobalExceptionHandler} maps them to HTTP status codes.
 *
 * @see com.phillippitts.aura.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.aura.exception;
