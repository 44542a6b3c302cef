package com.phillippitts.aura.service.query;

import com.phillippitts.aura.domain.StructuredSymptoms;
import com.phillippitts.aura.domain.Symptom;
import com.phillippitts.aura.service.lexicon.LexiconMatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives evidence search queries from extracted symptoms.
 *
 * <p>Tiered strategy for {@link #buildQuery(StructuredSymptoms, Integer)}:
 * <ol>
 *   <li><b>High-value qualifier:</b> the first qualifier (symptom order, then qualifier order)
 *       that matches the clinical lexicon is mapped to its curated search phrase.</li>
 *   <li><b>Generic differential:</b> {@code "<pediatric|adult> differential diagnosis <a> and <b>"}
 *       over at most the first two symptom names.</li>
 *   <li><b>Nothing usable:</b> empty string, meaning the search should be skipped.</li>
 * </ol>
 */
public class SearchQueryBuilder {
    private static final Logger LOG = LogManager.getLogger(SearchQueryBuilder.class);

    static final int PEDIATRIC_AGE_LIMIT = 18;
    static final int MAX_GENERIC_SYMPTOMS = 2;
    private static final String JOINER = " and ";

    private final LexiconMatcher matcher;

    public SearchQueryBuilder(LexiconMatcher matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    /**
     * @param symptoms   extracted symptoms (null treated as none)
     * @param patientAge patient age in years, or null when unknown (bucketed as adult)
     * @return search query, or "" when no usable symptom exists
     */
    public String buildQuery(StructuredSymptoms symptoms, Integer patientAge) {
        if (symptoms == null || symptoms.isEmpty()) {
            return "";
        }

        Optional<String> highValue = highValueQuery(symptoms);
        if (highValue.isPresent()) {
            LOG.debug("Tier 1 query: {}", highValue.get());
            return highValue.get();
        }

        List<String> names = symptoms.names();
        if (names.isEmpty()) {
            return "";
        }
        List<String> picked = names.subList(0, Math.min(MAX_GENERIC_SYMPTOMS, names.size()));
        String query = ageBucket(patientAge) + " differential diagnosis " + String.join(JOINER, picked);
        LOG.debug("Tier 2 query: {}", query);
        return query;
    }

    /**
     * Natural-language query for similar-case retrieval, e.g.
     * {@code "A case involving a 6 year old with cough and fever"}.
     *
     * @return case query, or "" when there are no symptom names
     */
    public String buildCaseQuery(StructuredSymptoms symptoms, Integer patientAge) {
        if (symptoms == null) {
            return "";
        }
        List<String> names = symptoms.names();
        if (names.isEmpty()) {
            return "";
        }
        String who = patientAge == null ? "patient" : patientAge + " year old";
        return "A case involving a " + who + " with " + String.join(JOINER, names);
    }

    private Optional<String> highValueQuery(StructuredSymptoms symptoms) {
        for (Symptom symptom : symptoms.symptoms()) {
            for (String qualifier : symptom.qualifiers()) {
                Optional<String> term = matcher.match(qualifier);
                if (term.isPresent()) {
                    String matched = term.get();
                    return Optional.of(matcher.lexicon().searchPhraseFor(matched)
                            .orElse(matched + " differential diagnosis"));
                }
            }
        }
        return Optional.empty();
    }

    static String ageBucket(Integer age) {
        return age != null && age < PEDIATRIC_AGE_LIMIT ? "pediatric" : "adult";
    }
}
