package com.phillippitts.aura.domain;

import java.util.List;

/**
 * Outcome of a drug-interaction screen.
 *
 * @param warnings        interaction or contraindication warnings (empty when nothing found)
 * @param suggestions     treatment suggestions from the drug database
 * @param recommendations generic follow-up recommendations
 * @param interactionRisk overall risk bucket
 */
public record DrugCheckResult(
        List<String> warnings,
        List<String> suggestions,
        List<String> recommendations,
        Risk interactionRisk
) {
    public enum Risk { LOW, MODERATE, HIGH }

    public DrugCheckResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        interactionRisk = interactionRisk == null ? Risk.LOW : interactionRisk;
    }

    public static DrugCheckResult none() {
        return new DrugCheckResult(List.of(), List.of(), List.of(), Risk.LOW);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
