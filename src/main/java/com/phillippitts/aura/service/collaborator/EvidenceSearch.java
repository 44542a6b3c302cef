package com.phillippitts.aura.service.collaborator;

import com.phillippitts.aura.domain.EvidenceItem;

import java.util.List;

/**
 * Keyword search over a literature or case corpus, returning ranked snippets.
 * Implementations must be safe for concurrent use by independent runs.
 */
public interface EvidenceSearch {

    /**
     * @param query      non-blank search query
     * @param maxResults maximum number of items to return
     * @return ranked items, best first (empty when nothing relevant was found)
     */
    List<EvidenceItem> search(String query, int maxResults);

    /**
     * Short name used in logs, metrics and source identifiers.
     */
    String name();
}
