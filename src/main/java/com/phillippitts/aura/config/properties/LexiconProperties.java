package com.phillippitts.aura.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Clinical lexicon source and match threshold.
 *
 * <p>A missing or unreadable {@code location} falls back to the built-in lexicon.
 *
 * @param location       Spring resource location of the lexicon JSON
 * @param matchThreshold similarity a phrase must exceed to count as a match
 */
@Validated
@ConfigurationProperties(prefix = "aura.lexicon")
public record LexiconProperties(
        String location,

        @DecimalMin(value = "0.0", message = "match-threshold must be >= 0")
        @DecimalMax(value = "1.0", message = "match-threshold must be <= 1")
        Double matchThreshold
) {
    public static final String DEFAULT_LOCATION = "classpath:clinical-lexicon.json";
    public static final double DEFAULT_MATCH_THRESHOLD = 0.8;

    public LexiconProperties {
        location = location == null || location.isBlank() ? DEFAULT_LOCATION : location;
        matchThreshold = matchThreshold == null ? DEFAULT_MATCH_THRESHOLD : matchThreshold;
    }
}
