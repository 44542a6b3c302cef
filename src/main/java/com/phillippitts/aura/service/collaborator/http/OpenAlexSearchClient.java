package com.phillippitts.aura.service.collaborator.http;

import com.phillippitts.aura.domain.EvidenceItem;
import com.phillippitts.aura.service.collaborator.EvidenceSearch;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.TreeMap;

/**
 * Broad interdisciplinary literature search against the OpenAlex works API.
 *
 * <p>OpenAlex returns abstracts as an inverted index (word to positions); they are rebuilt
 * into text here. Works whose abstract is shorter than {@value #MIN_ABSTRACT_LENGTH}
 * characters are dropped. Confidence is the work's {@code relevance_score} divided by the
 * best score on the page.
 */
public class OpenAlexSearchClient extends AbstractHttpCollaborator implements EvidenceSearch {

    static final String WORKS_PATH = "/works";
    static final int MIN_ABSTRACT_LENGTH = 50;
    private static final String FILTER = "has_abstract:true,language:en";

    private final String mailto;

    /**
     * @param restClient client bound to the OpenAlex API root
     * @param mailto     contact address for the polite pool, or null
     */
    public OpenAlexSearchClient(RestClient restClient, String mailto) {
        super(restClient, "openalex");
        this.mailto = mailto == null || mailto.isBlank() ? null : mailto;
    }

    @Override
    public List<EvidenceItem> search(String query, int maxResults) {
        JSONObject body = exchange(WORKS_PATH, client -> client.get()
                .uri(b -> {
                    b.path(WORKS_PATH)
                            .queryParam("search", query)
                            .queryParam("per-page", maxResults)
                            .queryParam("filter", FILTER);
                    if (mailto != null) {
                        b.queryParam("mailto", mailto);
                    }
                    return b.build();
                })
                .retrieve()
                .body(String.class));
        return parseWorks(body, maxResults);
    }

    @Override
    public String name() {
        return collaboratorName();
    }

    static List<EvidenceItem> parseWorks(JSONObject body, int maxResults) {
        JSONArray results = body.optJSONArray("results");
        if (results == null || results.isEmpty()) {
            return List.of();
        }
        double best = 0.0;
        for (int i = 0; i < results.length(); i++) {
            JSONObject w = results.optJSONObject(i);
            if (w != null) {
                best = Math.max(best, w.optDouble("relevance_score", 0.0));
            }
        }
        List<EvidenceItem> items = new ArrayList<>();
        for (int i = 0; i < results.length() && items.size() < maxResults; i++) {
            JSONObject w = results.optJSONObject(i);
            if (w == null) {
                continue;
            }
            String abstractText = reconstructAbstract(w.optJSONObject("abstract_inverted_index"));
            if (abstractText.length() < MIN_ABSTRACT_LENGTH) {
                continue;
            }
            String title = w.optString("title", "No title available");
            double score = w.optDouble("relevance_score", 0.0);
            double confidence = best > 0.0 ? score / best : 0.0;
            items.add(EvidenceItem.clamped(sourceId(w), "Title: " + title + "\nAbstract: " + abstractText,
                    confidence));
        }
        return List.copyOf(items);
    }

    /**
     * Rebuilds abstract text from OpenAlex's {@code {"word": [positions...]}} form.
     */
    static String reconstructAbstract(JSONObject invertedIndex) {
        if (invertedIndex == null || invertedIndex.isEmpty()) {
            return "";
        }
        TreeMap<Integer, String> byPosition = new TreeMap<>();
        Iterator<String> words = invertedIndex.keys();
        while (words.hasNext()) {
            String word = words.next();
            JSONArray positions = invertedIndex.optJSONArray(word);
            if (positions == null) {
                continue;
            }
            for (int i = 0; i < positions.length(); i++) {
                int pos = positions.optInt(i, -1);
                if (pos >= 0) {
                    byPosition.put(pos, word);
                }
            }
        }
        return String.join(" ", byPosition.values()).trim();
    }

    private static String sourceId(JSONObject work) {
        String doi = work.optString("doi", "");
        if (!doi.isBlank()) {
            return "DOI:" + doi.replace("https://doi.org/", "");
        }
        return "OpenAlex:" + work.optString("id", "unknown").replace("https://openalex.org/", "");
    }
}
