package com.phillippitts.aura.service.collaborator.http;

import com.phillippitts.aura.domain.EvidenceItem;
import com.phillippitts.aura.service.collaborator.EvidenceSearch;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Client for a search-index service (the literature index and the similar-case index).
 *
 * <p>Request: {@code GET {path}?q={query}&limit={n}}. Response:
 * {@code {"results":[{"id":"12345","snippet":"...","score":0.87}]}}. Ids without a scheme are
 * prefixed with the configured source prefix, e.g. {@code PMID:12345}.
 */
public class HttpEvidenceSearchClient extends AbstractHttpCollaborator implements EvidenceSearch {

    private final String path;
    private final String sourcePrefix;

    /**
     * @param restClient   client bound to the index base URL
     * @param name         search name, e.g. "pubmed" or "cases"
     * @param path         search path on the index
     * @param sourcePrefix prefix for bare ids, e.g. "PMID" or "CaseDB"
     */
    public HttpEvidenceSearchClient(RestClient restClient, String name, String path, String sourcePrefix) {
        super(restClient, name);
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.sourcePrefix = Objects.requireNonNull(sourcePrefix, "sourcePrefix must not be null");
    }

    @Override
    public List<EvidenceItem> search(String query, int maxResults) {
        JSONObject body = exchange(path, client -> client.get()
                .uri(b -> b.path(path)
                        .queryParam("q", query)
                        .queryParam("limit", maxResults)
                        .build())
                .retrieve()
                .body(String.class));
        return parseResults(body, maxResults);
    }

    @Override
    public String name() {
        return collaboratorName();
    }

    List<EvidenceItem> parseResults(JSONObject body, int maxResults) {
        JSONArray results = body.optJSONArray("results");
        if (results == null) {
            return List.of();
        }
        List<EvidenceItem> items = new ArrayList<>();
        for (int i = 0; i < results.length() && items.size() < maxResults; i++) {
            JSONObject r = results.optJSONObject(i);
            if (r == null) {
                continue;
            }
            String id = r.optString("id", "").trim();
            String snippet = r.optString("snippet", "").trim();
            if (id.isEmpty() || snippet.isEmpty()) {
                continue;
            }
            items.add(EvidenceItem.clamped(sourceId(id), snippet, r.optDouble("score", 0.0)));
        }
        return List.copyOf(items);
    }

    private String sourceId(String id) {
        return id.contains(":") ? id : sourcePrefix + ":" + id;
    }
}
