/**
 * Contracts for the external collaborators the diagnostic pipeline calls.
 *
 * <p>Each interface wraps exactly one external call. The pipeline treats them as black boxes
 * that may throw; failure isolation is the step runner's job, not the collaborator's.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@code http} - REST adapters for the generation sidecar, search indexes and OpenAlex</li>
 *   <li>{@code local} - JSON-backed patient store and rule-based drug interaction checker</li>
 * </ul>
 */
package com.phillippitts.aura.service.collaborator;
