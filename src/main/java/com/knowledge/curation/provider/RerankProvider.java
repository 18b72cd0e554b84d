package com.knowledge.curation.provider;

import java.util.List;

/**
 * Optional second-stage scorer applied to neighbor candidates.
 */
public interface RerankProvider {

    /**
     * Scores each candidate against the query item. Candidates missing from the
     * result are treated as not reranked.
     *
     * @throws ProviderUnavailableException if the reranker cannot be reached
     */
    List<RerankScore> rerank(String itemId, List<String> candidateIds);

    default String getProviderName() {
        return getClass().getSimpleName();
    }
}
