package com.eainde.intent.retrieval;

import java.util.List;

/**
 * Semantic search over the indexed service catalog.
 */
public interface CatalogRetriever {

    /**
     * @return at most {@code maxResults} matches, ordered by descending score
     */
    List<CatalogMatch> search(String query, int maxResults);
}
