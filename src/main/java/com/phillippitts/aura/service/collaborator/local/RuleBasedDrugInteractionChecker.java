package com.phillippitts.aura.service.collaborator.local;

import com.phillippitts.aura.domain.DrugCheckResult;
import com.phillippitts.aura.service.collaborator.DrugInteractionChecker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword-based drug-safety screen.
 *
 * <p>Scans the candidate conditions together with the patient history for:
 * <ul>
 *   <li>drug classes known to interact (one warning per class)</li>
 *   <li>organ conditions that change drug metabolism (one warning per organ)</li>
 *   <li>polypharmacy: {@value #POLYPHARMACY_THRESHOLD} or more medication terms</li>
 * </ul>
 * Risk is HIGH with two or more warnings, MODERATE with one, LOW otherwise.
 *
 * <p>Stateless and thread-safe.
 */
public class RuleBasedDrugInteractionChecker implements DrugInteractionChecker {

    static final int POLYPHARMACY_THRESHOLD = 3;

    private static final Map<String, List<String>> INTERACTION_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, String> INTERACTION_WARNINGS = new LinkedHashMap<>();
    private static final Map<String, List<String>> METABOLISM_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, String> METABOLISM_WARNINGS = new LinkedHashMap<>();

    static {
        interaction("blood_thinners",
                List.of("warfarin", "heparin", "aspirin", "clopidogrel", "anticoagulant"),
                "Blood thinning medications require careful monitoring when combined with other treatments.");
        interaction("diabetes_meds",
                List.of("insulin", "metformin", "diabetes", "diabetic", "blood sugar"),
                "Diabetes medications may need adjustment based on new treatments or conditions.");
        interaction("heart_meds",
                List.of("beta blocker", "ace inhibitor", "cardiac", "heart medication", "hypertension"),
                "Heart medications can interact with many other drugs and may affect treatment options.");
        interaction("antibiotics",
                List.of("antibiotic", "penicillin", "amoxicillin", "infection treatment"),
                "Antibiotics can affect the absorption and effectiveness of other medications.");

        metabolism("kidney", List.of("kidney disease", "renal", "dialysis"),
                "Kidney function may affect drug dosing - consider renal function tests.");
        metabolism("liver", List.of("liver disease", "hepatic", "cirrhosis"),
                "Liver function may affect drug metabolism - monitor liver enzymes.");
        metabolism("heart", List.of("heart failure", "cardiac", "arrhythmia"),
                "Heart condition may limit treatment options - cardiology consultation recommended.");
    }

    private static final Pattern MEDICATION_TERMS = Pattern.compile(
            "\\b(medication|medicine|drug|pill|tablet|capsule|prescription|dose|dosage|mg|ml"
                    + "|treatment|therapy|taking|prescribed)\\b",
            Pattern.CASE_INSENSITIVE);

    static final List<String> STANDARD_RECOMMENDATIONS = List.of(
            "Review complete medication list with patient",
            "Consider pharmacist consultation for drug interaction screening",
            "Monitor for signs of adverse drug reactions");

    @Override
    public DrugCheckResult check(List<String> conditions, String medicalHistory) {
        String text = (String.join(" ", conditions) + " " + (medicalHistory == null ? "" : medicalHistory))
                .toLowerCase(Locale.ROOT);

        List<String> warnings = new ArrayList<>();
        INTERACTION_KEYWORDS.forEach((category, keywords) -> {
            if (containsAny(text, keywords)) {
                warnings.add(INTERACTION_WARNINGS.get(category));
            }
        });
        METABOLISM_KEYWORDS.forEach((organ, keywords) -> {
            if (containsAny(text, keywords)) {
                warnings.add(METABOLISM_WARNINGS.get(organ));
            }
        });

        int medications = countMedicationTerms(text);
        if (medications >= POLYPHARMACY_THRESHOLD) {
            warnings.add("Patient appears to be on multiple medications (" + medications
                    + " detected) - increased risk of drug interactions.");
        }

        List<String> recommendations = warnings.isEmpty() ? List.of() : STANDARD_RECOMMENDATIONS;
        return new DrugCheckResult(warnings, List.of(), recommendations, riskFor(warnings.size()));
    }

    static DrugCheckResult.Risk riskFor(int warningCount) {
        if (warningCount >= 2) {
            return DrugCheckResult.Risk.HIGH;
        }
        return warningCount == 1 ? DrugCheckResult.Risk.MODERATE : DrugCheckResult.Risk.LOW;
    }

    static int countMedicationTerms(String text) {
        Matcher m = MEDICATION_TERMS.matcher(text);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String k : keywords) {
            if (text.contains(k)) {
                return true;
            }
        }
        return false;
    }

    private static void interaction(String category, List<String> keywords, String warning) {
        INTERACTION_KEYWORDS.put(category, keywords);
        INTERACTION_WARNINGS.put(category, warning);
    }

    private static void metabolism(String organ, List<String> keywords, String warning) {
        METABOLISM_KEYWORDS.put(organ, keywords);
        METABOLISM_WARNINGS.put(organ, warning);
    }
}
