package com.knowledge.curation.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.knowledge.curation.provider.Neighbor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed neighbor cache with an item index for targeted invalidation.
 * Implements {@link EmbeddingChangeListener} so that updates evict affected lists.
 */
public class CaffeineNeighborCache implements NeighborCache, EmbeddingChangeListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineNeighborCache.class);

    private final Cache<CacheKey, List<Neighbor>> cache;
    // itemId -> keys whose list is about or contains that item
    private final ConcurrentMap<String, Set<CacheKey>> itemIndex = new ConcurrentHashMap<>();

    public CaffeineNeighborCache() {
        this(CacheConfig.defaults());
    }

    public CaffeineNeighborCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                // listener runs on the writing thread, before put() re-indexes the key
                .executor(Runnable::run)
                .removalListener((CacheKey key, List<Neighbor> value, RemovalCause cause) -> onRemoval(key, cause))
                .build();
        log.info("CaffeineNeighborCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<List<Neighbor>> get(String itemId, int k) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(itemId, k)));
    }

    @Override
    public void put(String itemId, int k, List<Neighbor> neighbors) {
        CacheKey key = new CacheKey(itemId, k);
        cache.put(key, List.copyOf(neighbors));
        index(itemId, key);
        for (Neighbor neighbor : neighbors) {
            index(neighbor.itemId(), key);
        }
    }

    @Override
    public void invalidate(String itemId) {
        Set<CacheKey> keys = itemIndex.remove(itemId);
        if (keys != null) {
            for (CacheKey key : keys) {
                cache.invalidate(key);
                removeFromIndex(key);
            }
            log.debug("Invalidated {} neighbor lists for item {}", keys.size(), itemId);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        itemIndex.clear();
        log.debug("Invalidated all neighbor lists");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    @Override
    public void onEmbeddingChanged(String itemId) {
        invalidate(itemId);
    }

    private void index(String itemId, CacheKey key) {
        itemIndex.computeIfAbsent(itemId, id -> ConcurrentHashMap.newKeySet()).add(key);
    }

    /**
     * Explicit removals are de-indexed by {@link #invalidate}; replaced keys stay indexed.
     */
    private void onRemoval(CacheKey key, RemovalCause cause) {
        if (key != null && cause.wasEvicted() && !cache.asMap().containsKey(key)) {
            removeFromIndex(key);
        }
    }

    private void removeFromIndex(CacheKey key) {
        itemIndex.values().forEach(keys -> keys.remove(key));
    }

    record CacheKey(String itemId, int k) {}
}
