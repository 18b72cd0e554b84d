package com.knowledge.curation.provider;

import java.util.List;

/**
 * Nearest-neighbor lookup over item embeddings.
 * Implementations wrap a vector index (FAISS, pgvector, ...) and must be restricted to
 * the item's own category; results from other categories are discarded by the caller.
 */
public interface VectorProvider {

    /**
     * Returns up to {@code k} neighbors of the item, best first.
     *
     * @throws ProviderUnavailableException if the index cannot be queried
     */
    List<Neighbor> neighbors(String itemId, int k);

    default String getProviderName() {
        return getClass().getSimpleName();
    }
}
