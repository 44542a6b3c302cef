package com.phillippitts.aura.service.lexicon;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link ClinicalLexicon} from a JSON resource.
 *
 * <p>Expected shape:
 * <pre>
 * {
 *   "categories": [ { "name": "dermatological", "phrases": ["slapped cheek", ...] }, ... ],
 *   "searchPhrases": { "slapped cheek": "erythema infectiosum parvovirus B19", ... }
 * }
 * </pre>
 * Categories are an array because their order decides match precedence.
 *
 * <p>A missing, unreadable or empty resource yields {@link ClinicalLexicon#builtIn()}.
 */
public final class ClinicalLexiconLoader {
    private static final Logger LOG = LogManager.getLogger(ClinicalLexiconLoader.class);

    private ClinicalLexiconLoader() {}

    public static ClinicalLexicon loadOrFallback(Resource resource) {
        if (resource == null || !resource.exists()) {
            LOG.warn("Clinical lexicon not found at {}; using built-in table",
                    resource == null ? "<none>" : resource.getDescription());
            return ClinicalLexicon.builtIn();
        }
        try (InputStream in = resource.getInputStream()) {
            ClinicalLexicon lexicon = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            if (lexicon.size() == 0) {
                LOG.warn("Clinical lexicon {} has no phrases; using built-in table", resource.getDescription());
                return ClinicalLexicon.builtIn();
            }
            LOG.info("Loaded clinical lexicon: {} categories, {} phrases",
                    lexicon.categories().size(), lexicon.size());
            return lexicon;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to read clinical lexicon {}: {}; using built-in table",
                    resource.getDescription(), e.getMessage());
            return ClinicalLexicon.builtIn();
        }
    }

    static ClinicalLexicon parse(String json) {
        JSONObject root = new JSONObject(json);
        Map<String, List<String>> categories = new LinkedHashMap<>();
        JSONArray cats = root.optJSONArray("categories");
        if (cats != null) {
            for (int i = 0; i < cats.length(); i++) {
                JSONObject cat = cats.optJSONObject(i);
                if (cat == null) {
                    continue;
                }
                String name = cat.optString("name", "category-" + i);
                List<String> phrases = new ArrayList<>();
                JSONArray arr = cat.optJSONArray("phrases");
                if (arr != null) {
                    for (int p = 0; p < arr.length(); p++) {
                        String phrase = arr.optString(p, "");
                        if (!phrase.isBlank()) {
                            phrases.add(phrase);
                        }
                    }
                }
                categories.put(name, phrases);
            }
        }
        Map<String, String> searchPhrases = new LinkedHashMap<>();
        JSONObject queries = root.optJSONObject("searchPhrases");
        if (queries != null) {
            for (String term : queries.keySet()) {
                String q = queries.optString(term, "");
                if (!q.isBlank()) {
                    searchPhrases.put(term, q.trim());
                }
            }
        }
        return new ClinicalLexicon(categories, searchPhrases);
    }
}
