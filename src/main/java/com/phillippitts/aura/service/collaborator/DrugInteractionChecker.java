package com.phillippitts.aura.service.collaborator;

import com.phillippitts.aura.domain.DrugCheckResult;

import java.util.List;

/**
 * Screens candidate conditions against a patient's history for drug interactions.
 */
public interface DrugInteractionChecker {

    DrugCheckResult check(List<String> conditions, String patientHistory);
}
