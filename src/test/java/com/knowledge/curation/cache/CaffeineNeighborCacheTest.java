package com.knowledge.curation.cache;

import com.knowledge.curation.provider.Neighbor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CaffeineNeighborCache Tests")
class CaffeineNeighborCacheTest {

    private CaffeineNeighborCache cache;

    @BeforeEach
    void setUp() {
        cache = new CaffeineNeighborCache(new CacheConfig(100, 60, true));
    }

    @Test
    @DisplayName("Stored lists are keyed by item and k")
    void keyedByItemAndK() {
        cache.put("a", 5, List.of(new Neighbor("b", 0.9, "skill")));

        assertTrue(cache.get("a", 5).isPresent());
        assertTrue(cache.get("a", 10).isEmpty());
        assertEquals("b", cache.get("a", 5).get().get(0).itemId());
    }

    @Test
    @DisplayName("Invalidating an item drops its own lists and lists that contain it")
    void invalidateThroughIndex() {
        cache.put("a", 5, List.of(new Neighbor("b", 0.9, "skill")));
        cache.put("c", 5, List.of(new Neighbor("b", 0.8, "skill")));
        cache.put("d", 5, List.of(new Neighbor("e", 0.8, "skill")));

        cache.invalidate("b");

        assertTrue(cache.get("a", 5).isEmpty());
        assertTrue(cache.get("c", 5).isEmpty());
        assertTrue(cache.get("d", 5).isPresent());
    }

    @Test
    @DisplayName("A list stored again under the same key can still be invalidated through a neighbor")
    void replacedListStaysIndexed() {
        cache.put("a", 5, List.of(new Neighbor("b", 0.9, "skill")));
        cache.put("a", 5, List.of(new Neighbor("b", 0.91, "skill")));

        cache.invalidate("b");

        assertTrue(cache.get("a", 5).isEmpty());
    }

    @Test
    @DisplayName("A list re-stored after invalidation is indexed again")
    void reputAfterInvalidate() {
        cache.put("a", 5, List.of(new Neighbor("b", 0.9, "skill")));
        cache.invalidate("a");
        cache.put("a", 5, List.of(new Neighbor("b", 0.9, "skill")));

        cache.onEmbeddingChanged("b");

        assertTrue(cache.get("a", 5).isEmpty());
    }

    @Test
    @DisplayName("Embedding change notifications invalidate the item")
    void embeddingChangeInvalidates() {
        cache.put("a", 5, List.of(new Neighbor("b", 0.9, "skill")));

        cache.onEmbeddingChanged("a");

        assertTrue(cache.get("a", 5).isEmpty());
    }

    @Test
    @DisplayName("Stats count hits and misses")
    void stats() {
        cache.put("a", 5, List.of());
        cache.get("a", 5);
        cache.get("x", 5);

        CacheStats stats = cache.getStats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.5, stats.hitRate());
    }

    @Test
    @DisplayName("invalidateAll empties the cache")
    void invalidateAll() {
        cache.put("a", 5, List.of(new Neighbor("b", 0.9, "skill")));

        cache.invalidateAll();

        assertTrue(cache.get("a", 5).isEmpty());
    }

    @Test
    @DisplayName("CacheConfig rejects non-positive sizes")
    void configValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
    }
}
