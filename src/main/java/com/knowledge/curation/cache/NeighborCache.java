package com.knowledge.curation.cache;

import com.knowledge.curation.provider.Neighbor;

import java.util.List;
import java.util.Optional;

/**
 * Cache of raw vector-provider neighbor lists, keyed by item id and k.
 * Owned by the graph builder; invalidated explicitly, never implicitly shared.
 */
public interface NeighborCache {

    Optional<List<Neighbor>> get(String itemId, int k);

    void put(String itemId, int k, List<Neighbor> neighbors);

    /**
     * Drops the item's own neighbor lists and every list it appears in.
     */
    void invalidate(String itemId);

    void invalidateAll();

    CacheStats getStats();
}
