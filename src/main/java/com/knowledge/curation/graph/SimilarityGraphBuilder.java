package com.knowledge.curation.graph;

import com.knowledge.curation.cache.EmbeddingChangeListener;
import com.knowledge.curation.cache.NeighborCache;
import com.knowledge.curation.cache.NoOpNeighborCache;
import com.knowledge.curation.config.BlendWeights;
import com.knowledge.curation.config.CurationOptions;
import com.knowledge.curation.core.model.CrossCategoryViolationException;
import com.knowledge.curation.core.model.Edge;
import com.knowledge.curation.core.model.Item;
import com.knowledge.curation.core.model.PairKey;
import com.knowledge.curation.metrics.MetricsService;
import com.knowledge.curation.metrics.NoOpMetricsService;
import com.knowledge.curation.provider.Neighbor;
import com.knowledge.curation.provider.ProviderUnavailableException;
import com.knowledge.curation.provider.RerankProvider;
import com.knowledge.curation.provider.RerankScore;
import com.knowledge.curation.provider.VectorProvider;
import com.knowledge.curation.store.ItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds per-category sparse similarity graphs from the vector provider.
 *
 * <p>For every active item the top-K neighbors are fetched (through the neighbor cache),
 * optionally reranked, blended and filtered against the edge-keep threshold. Symmetric
 * pairs are deduplicated keeping the higher score. Neighbors that are the item itself,
 * unknown, rejected or from another category never become edges.</p>
 *
 * <p>Provider failures propagate as {@link ProviderUnavailableException}; a partial graph
 * is never returned.</p>
 */
public class SimilarityGraphBuilder implements EmbeddingChangeListener {
    private static final Logger log = LoggerFactory.getLogger(SimilarityGraphBuilder.class);

    private final VectorProvider vectorProvider;
    private final RerankProvider rerankProvider;
    private final NeighborCache neighborCache;
    private final CurationOptions options;
    private final MetricsService metricsService;

    public SimilarityGraphBuilder(VectorProvider vectorProvider, CurationOptions options) {
        this(vectorProvider, null, new NoOpNeighborCache(), options, new NoOpMetricsService());
    }

    public SimilarityGraphBuilder(VectorProvider vectorProvider,
                                  RerankProvider rerankProvider,
                                  NeighborCache neighborCache,
                                  CurationOptions options,
                                  MetricsService metricsService) {
        this.vectorProvider = Objects.requireNonNull(vectorProvider, "vectorProvider is required");
        this.rerankProvider = rerankProvider;
        this.neighborCache = neighborCache != null ? neighborCache : new NoOpNeighborCache();
        this.options = Objects.requireNonNull(options, "options is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Builds graphs for every category that has items.
     */
    public GraphSnapshot build(ItemRepository items) {
        Map<String, SimilarityGraph> graphs = new TreeMap<>();
        for (String category : items.categories()) {
            graphs.put(category, buildCategory(items, category));
        }
        GraphSnapshot snapshot = new GraphSnapshot(graphs);
        log.info("graph.snapshot.built categories={} nodes={} edges={}",
                graphs.size(), snapshot.totalNodes(), snapshot.totalEdges());
        return snapshot;
    }

    /**
     * Builds the graph of a single category.
     *
     * @throws ProviderUnavailableException if the vector or rerank provider fails
     */
    public SimilarityGraph buildCategory(ItemRepository items, String category) {
        List<Item> active = items.findActiveByCategory(category);
        Map<String, Item> activeById = new LinkedHashMap<>();
        active.forEach(i -> activeById.put(i.getId(), i));

        Map<PairKey, Edge> kept = new HashMap<>();
        int discarded = 0;
        for (Item item : active) {
            List<Neighbor> candidates = filterNeighbors(item, fetchNeighbors(item.getId()), items, activeById);
            Map<String, Double> rerankScores = rerank(item.getId(), candidates);
            for (Neighbor neighbor : candidates) {
                Double rerankScore = rerankScores.get(neighbor.itemId());
                BlendWeights weights = options.getBlendWeights();
                double blended = weights.blend(neighbor.embedScore(), rerankScore);
                if (blended < options.getEdgeKeepThreshold()) {
                    discarded++;
                    continue;
                }
                Item other = activeById.get(neighbor.itemId());
                Edge edge = Edge.between(item.getId(), item.getCategory(), other.getId(), other.getCategory(),
                        neighbor.embedScore(), rerankScore, blended);
                kept.merge(edge.key(), edge, (a, b) -> a.blendedScore() >= b.blendedScore() ? a : b);
            }
        }

        SimilarityGraph graph = new SimilarityGraph(category, activeById.keySet(), kept.values());
        metricsService.recordGraphBuilt(category, graph.nodeCount(), graph.edgeCount());
        log.debug("graph.built category={} nodes={} edges={} belowThreshold={}",
                category, graph.nodeCount(), graph.edgeCount(), discarded);
        return graph;
    }

    private List<Neighbor> fetchNeighbors(String itemId) {
        int k = options.getTopKNeighbors();
        Optional<List<Neighbor>> cached = neighborCache.get(itemId, k);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached.get();
        }
        metricsService.recordCacheMiss();
        List<Neighbor> neighbors;
        try {
            neighbors = vectorProvider.neighbors(itemId, k);
        } catch (ProviderUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderUnavailableException(vectorProvider.getProviderName(),
                    "neighbor query failed for item " + itemId, e);
        }
        if (neighbors == null) {
            throw new ProviderUnavailableException(vectorProvider.getProviderName(),
                    "no neighbor result for item " + itemId);
        }
        neighborCache.put(itemId, k, neighbors);
        return neighbors;
    }

    private List<Neighbor> filterNeighbors(Item item, List<Neighbor> neighbors,
                                           ItemRepository items, Map<String, Item> activeById) {
        List<Neighbor> result = new ArrayList<>();
        for (Neighbor neighbor : neighbors) {
            String otherId = neighbor.itemId();
            if (otherId.equals(item.getId())) {
                continue;
            }
            Optional<Item> other = activeById.containsKey(otherId)
                    ? Optional.of(activeById.get(otherId))
                    : items.findById(otherId);
            if (other.isEmpty()) {
                log.debug("graph.neighbor-unknown itemId={} neighborId={}", item.getId(), otherId);
                continue;
            }
            String otherCategory = other.get().getCategory();
            if (!item.getCategory().equals(otherCategory)
                    || (neighbor.category() != null && !item.getCategory().equals(neighbor.category()))) {
                String reported = otherCategory.equals(item.getCategory()) ? neighbor.category() : otherCategory;
                try {
                    Edge.between(item.getId(), item.getCategory(), otherId, reported,
                            neighbor.embedScore(), null, neighbor.embedScore());
                } catch (CrossCategoryViolationException e) {
                    metricsService.incrementCrossCategoryViolation();
                    log.error("graph.cross-category-violation itemId={} category={} neighborId={} neighborCategory={}",
                            item.getId(), item.getCategory(), otherId, reported);
                }
                continue;
            }
            if (!other.get().isActive()) {
                continue;
            }
            result.add(neighbor);
        }
        return result;
    }

    private Map<String, Double> rerank(String itemId, List<Neighbor> candidates) {
        Map<String, Double> scores = new HashMap<>();
        if (rerankProvider == null || candidates.isEmpty()) {
            return scores;
        }
        List<String> ids = candidates.stream().map(Neighbor::itemId).toList();
        List<RerankScore> reranked;
        try {
            reranked = rerankProvider.rerank(itemId, ids);
        } catch (ProviderUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderUnavailableException(rerankProvider.getProviderName(),
                    "rerank failed for item " + itemId, e);
        }
        for (RerankScore score : reranked) {
            scores.put(score.itemId(), score.score());
        }
        return scores;
    }

    /**
     * Drops cached neighbor lists involving an item whose content changed.
     */
    @Override
    public void onEmbeddingChanged(String itemId) {
        neighborCache.invalidate(itemId);
    }

    public void invalidateAll() {
        neighborCache.invalidateAll();
    }
}
