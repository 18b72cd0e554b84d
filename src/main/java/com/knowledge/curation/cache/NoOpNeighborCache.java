package com.knowledge.curation.cache;

import com.knowledge.curation.provider.Neighbor;

import java.util.List;
import java.util.Optional;

/**
 * Neighbor cache that never stores anything. Used when caching is disabled.
 */
public class NoOpNeighborCache implements NeighborCache, EmbeddingChangeListener {

    @Override
    public Optional<List<Neighbor>> get(String itemId, int k) {
        return Optional.empty();
    }

    @Override
    public void put(String itemId, int k, List<Neighbor> neighbors) {
    }

    @Override
    public void invalidate(String itemId) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }

    @Override
    public void onEmbeddingChanged(String itemId) {
    }
}
