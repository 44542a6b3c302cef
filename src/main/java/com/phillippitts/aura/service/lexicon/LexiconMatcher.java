package com.phillippitts.aura.service.lexicon;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fuzzy-matches a free-text symptom qualifier against the clinical lexicon.
 *
 * <p>Returns the first reference phrase, in category then phrase order, whose
 * {@link TextSimilarity#similarity(String, String)} is strictly above the threshold.
 * First-above-threshold wins even if a later phrase would score higher.
 */
public class LexiconMatcher {
    private static final Logger LOG = LogManager.getLogger(LexiconMatcher.class);

    public static final double DEFAULT_THRESHOLD = 0.8;

    private final ClinicalLexicon lexicon;
    private final double threshold;

    public LexiconMatcher(ClinicalLexicon lexicon) {
        this(lexicon, DEFAULT_THRESHOLD);
    }

    /**
     * @param lexicon   reference table
     * @param threshold similarity a phrase must exceed to match (0.0 to 1.0)
     * @throws IllegalArgumentException if threshold is not in [0,1]
     */
    public LexiconMatcher(ClinicalLexicon lexicon, double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold in [0,1]");
        }
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
        this.threshold = threshold;
    }

    /**
     * @param qualifier free-text qualifier, e.g. "slapped cheek appearance"
     * @return the matched reference phrase, or empty when nothing clears the threshold
     */
    public Optional<String> match(String qualifier) {
        String q = TextSimilarity.normalize(qualifier);
        if (q.isEmpty()) {
            return Optional.empty();
        }
        for (Map.Entry<String, List<String>> category : lexicon.categories().entrySet()) {
            for (String phrase : category.getValue()) {
                double score = TextSimilarity.similarity(q, phrase);
                if (score > threshold) {
                    LOG.debug("Qualifier '{}' matched '{}' ({}) score={}", q, phrase, category.getKey(), score);
                    return Optional.of(phrase);
                }
            }
        }
        return Optional.empty();
    }

    public ClinicalLexicon lexicon() {
        return lexicon;
    }
}
