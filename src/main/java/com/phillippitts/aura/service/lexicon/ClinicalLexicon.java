package com.phillippitts.aura.service.lexicon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Curated table of clinically significant reference phrases, grouped by category, plus the
 * high-precision search phrase associated with each term.
 *
 * <p>Iteration order is significant: the matcher returns the first phrase above threshold in
 * category order, then phrase order. Phrases and keys are stored normalized.
 */
public final class ClinicalLexicon {

    private final Map<String, List<String>> categories;
    private final Map<String, String> searchPhrases;

    public ClinicalLexicon(Map<String, List<String>> categories, Map<String, String> searchPhrases) {
        Objects.requireNonNull(categories, "categories");
        Objects.requireNonNull(searchPhrases, "searchPhrases");
        Map<String, List<String>> cats = new LinkedHashMap<>();
        categories.forEach((name, phrases) -> {
            List<String> normalized = new ArrayList<>();
            for (String p : phrases) {
                String n = TextSimilarity.normalize(p);
                if (!n.isEmpty()) {
                    normalized.add(n);
                }
            }
            cats.put(name, List.copyOf(normalized));
        });
        Map<String, String> queries = new LinkedHashMap<>();
        searchPhrases.forEach((term, query) -> queries.put(TextSimilarity.normalize(term), query));
        this.categories = Collections.unmodifiableMap(cats);
        this.searchPhrases = Collections.unmodifiableMap(queries);
    }

    /**
     * Small built-in table used when no external lexicon resource is available.
     */
    public static ClinicalLexicon builtIn() {
        Map<String, List<String>> cats = new LinkedHashMap<>();
        cats.put("dermatological", List.of("slapped cheek", "petechial rash", "target lesions",
                "vesicular rash", "strawberry tongue"));
        cats.put("respiratory", List.of("barking cough", "whooping cough", "inspiratory stridor"));
        cats.put("neurological", List.of("neck stiffness", "stiff neck", "bulging fontanelle"));

        Map<String, String> queries = new LinkedHashMap<>();
        queries.put("slapped cheek", "erythema infectiosum parvovirus B19");
        queries.put("petechial rash", "meningococcal disease petechial rash fever");
        queries.put("target lesions", "erythema multiforme target lesions");
        queries.put("vesicular rash", "varicella zoster vesicular exanthem");
        queries.put("strawberry tongue", "Kawasaki disease versus scarlet fever");
        queries.put("barking cough", "croup laryngotracheobronchitis");
        queries.put("whooping cough", "pertussis Bordetella diagnosis");
        queries.put("inspiratory stridor", "upper airway obstruction stridor differential");
        queries.put("neck stiffness", "bacterial meningitis neck stiffness fever");
        queries.put("stiff neck", "bacterial meningitis neck stiffness fever");
        queries.put("bulging fontanelle", "infant meningitis bulging fontanelle");
        return new ClinicalLexicon(cats, queries);
    }

    public Map<String, List<String>> categories() {
        return categories;
    }

    /**
     * Curated search phrase for a matched term, if one is configured.
     */
    public Optional<String> searchPhraseFor(String term) {
        return Optional.ofNullable(searchPhrases.get(TextSimilarity.normalize(term)));
    }

    public int size() {
        return categories.values().stream().mapToInt(List::size).sum();
    }
}
