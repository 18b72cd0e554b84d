package com.knowledge.curation.graph;

import com.knowledge.curation.cache.CacheConfig;
import com.knowledge.curation.cache.CaffeineNeighborCache;
import com.knowledge.curation.config.CurationOptions;
import com.knowledge.curation.core.model.Edge;
import com.knowledge.curation.core.model.Item;
import com.knowledge.curation.core.model.ItemStatus;
import com.knowledge.curation.metrics.MetricsService;
import com.knowledge.curation.provider.Neighbor;
import com.knowledge.curation.provider.ProviderUnavailableException;
import com.knowledge.curation.provider.RerankProvider;
import com.knowledge.curation.provider.RerankScore;
import com.knowledge.curation.provider.VectorProvider;
import com.knowledge.curation.store.InMemoryItemRepository;
import com.knowledge.curation.support.ScoreTableVectorProvider;
import com.knowledge.curation.support.TestItems;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("SimilarityGraphBuilder Tests")
class SimilarityGraphBuilderTest {

    private InMemoryItemRepository items;
    private ScoreTableVectorProvider provider;
    private CurationOptions options;

    @BeforeEach
    void setUp() {
        items = new InMemoryItemRepository(List.of(
                TestItems.pending("a", "skill"),
                TestItems.pending("b", "skill"),
                TestItems.pending("c", "skill"),
                TestItems.pending("x", "experience"),
                TestItems.pending("y", "experience")));
        provider = new ScoreTableVectorProvider(items)
                .score("a", "b", 0.95)
                .score("b", "c", 0.80)
                .score("a", "c", 0.50)
                .score("x", "y", 0.90);
        options = CurationOptions.defaults();
    }

    @Nested
    @DisplayName("Graph construction")
    class Construction {

        @Test
        @DisplayName("Builds one graph per category with every active item as a node")
        void perCategoryGraphs() {
            GraphSnapshot snapshot = new SimilarityGraphBuilder(provider, options).build(items);

            assertEquals(List.of("experience", "skill"), List.copyOf(snapshot.graphs().keySet()));
            assertEquals(List.of("a", "b", "c"), snapshot.graph("skill").nodes());
            assertEquals(2, snapshot.graph("skill").edgeCount());
            assertEquals(1, snapshot.graph("experience").edgeCount());
            assertEquals(5, snapshot.totalNodes());
        }

        @Test
        @DisplayName("Edges below the keep threshold are discarded and score 0.0")
        void edgeKeepThreshold() {
            SimilarityGraph graph = new SimilarityGraphBuilder(provider, options).buildCategory(items, "skill");

            assertTrue(graph.edge("a", "c").isEmpty());
            assertEquals(0.0, graph.score("a", "c"));
            assertEquals(0.95, graph.score("b", "a"));
        }

        @Test
        @DisplayName("Rejected items are neither nodes nor edge endpoints")
        void rejectedItemsExcluded() {
            items.save(Item.builder(items.findById("b").orElseThrow())
                    .status(ItemStatus.REJECTED).build());

            SimilarityGraph graph = new SimilarityGraphBuilder(provider, options).buildCategory(items, "skill");

            assertEquals(List.of("a", "c"), graph.nodes());
            assertEquals(0, graph.edgeCount());
        }

        @Test
        @DisplayName("Rerank scores are blended with the configured weights")
        void blendsRerank() {
            RerankProvider reranker = mock(RerankProvider.class);
            when(reranker.rerank(anyString(), anyList())).thenAnswer(inv -> {
                List<String> ids = inv.getArgument(1);
                return ids.stream().map(id -> new RerankScore(id, 0.5)).toList();
            });
            SimilarityGraphBuilder builder = new SimilarityGraphBuilder(provider, reranker, null, options, null);

            SimilarityGraph graph = builder.buildCategory(items, "skill");

            Edge ab = graph.edge("a", "b").orElseThrow();
            assertEquals(0.5, ab.rerankScore());
            assertEquals(0.7 * 0.95 + 0.3 * 0.5, ab.blendedScore(), 1e-9);
            assertTrue(graph.edge("b", "c").isEmpty(), "0.7*0.80 + 0.3*0.5 falls below 0.72");
        }
    }

    @Nested
    @DisplayName("Category isolation")
    class Isolation {

        @Test
        @DisplayName("Cross-category neighbors never become edges and are counted")
        void crossCategoryNeighbor() {
            provider.score("a", "x", 0.99);
            MetricsService metrics = mock(MetricsService.class);
            SimilarityGraphBuilder builder = new SimilarityGraphBuilder(provider, null, null, options, metrics);

            GraphSnapshot snapshot = builder.build(items);

            assertFalse(snapshot.graph("skill").containsNode("x"));
            assertTrue(snapshot.graph("skill").neighbors("a").keySet().stream().noneMatch("x"::equals));
            assertTrue(snapshot.graph("experience").neighbors("x").keySet().stream().noneMatch("a"::equals));
            verify(metrics, atLeastOnce()).incrementCrossCategoryViolation();
        }

        @Test
        @DisplayName("A wrong category reported by the provider is a violation too")
        void providerReportedCategory() {
            VectorProvider lying = mock(VectorProvider.class);
            when(lying.neighbors(eq("a"), anyInt())).thenReturn(List.of(new Neighbor("b", 0.99, "experience")));
            when(lying.neighbors(eq("b"), anyInt())).thenReturn(List.of());
            when(lying.neighbors(eq("c"), anyInt())).thenReturn(List.of());
            MetricsService metrics = mock(MetricsService.class);
            SimilarityGraphBuilder builder = new SimilarityGraphBuilder(lying, null, null, options, metrics);

            SimilarityGraph graph = builder.buildCategory(items, "skill");

            assertEquals(0, graph.edgeCount());
            verify(metrics).incrementCrossCategoryViolation();
        }

        @Test
        @DisplayName("SimilarityGraph refuses edges from another category")
        void graphRejectsForeignEdge() {
            Edge foreign = new Edge("x", "y", "experience", 0.9, null, 0.9);

            assertThrows(IllegalArgumentException.class,
                    () -> new SimilarityGraph("skill", List.of("x", "y"), List.of(foreign)));
        }
    }

    @Nested
    @DisplayName("Neighbor cache and failures")
    class CacheAndFailures {

        @Test
        @DisplayName("Second build is answered from the cache")
        void cacheHits() {
            CaffeineNeighborCache cache = new CaffeineNeighborCache(new CacheConfig(100, 60, true));
            SimilarityGraphBuilder builder = new SimilarityGraphBuilder(provider, null, cache, options, null);

            builder.build(items);
            int callsAfterFirst = provider.getCalls();
            builder.build(items);

            assertEquals(5, callsAfterFirst);
            assertEquals(callsAfterFirst, provider.getCalls());
            assertEquals(5, cache.getStats().hitCount());
        }

        @Test
        @DisplayName("Embedding changes evict affected neighbor lists")
        void embeddingChangeEvicts() {
            CaffeineNeighborCache cache = new CaffeineNeighborCache(new CacheConfig(100, 60, true));
            SimilarityGraphBuilder builder = new SimilarityGraphBuilder(provider, null, cache, options, null);
            builder.buildCategory(items, "skill");

            builder.onEmbeddingChanged("b");

            // a, b and c all have b in their lists
            assertTrue(cache.get("a", options.getTopKNeighbors()).isEmpty());
            assertTrue(cache.get("b", options.getTopKNeighbors()).isEmpty());
            assertTrue(cache.get("c", options.getTopKNeighbors()).isEmpty());
        }

        @Test
        @DisplayName("Provider failure aborts the build")
        void providerFailure() {
            provider.failAfter(1);

            ProviderUnavailableException e = assertThrows(ProviderUnavailableException.class,
                    () -> new SimilarityGraphBuilder(provider, options).build(items));
            assertEquals("score-table", e.getProviderName());
        }

        @Test
        @DisplayName("Unexpected provider exceptions are wrapped")
        void wrapsRuntimeExceptions() {
            VectorProvider broken = mock(VectorProvider.class);
            when(broken.neighbors(anyString(), anyInt())).thenThrow(new IllegalStateException("socket closed"));
            when(broken.getProviderName()).thenReturn("broken");

            ProviderUnavailableException e = assertThrows(ProviderUnavailableException.class,
                    () -> new SimilarityGraphBuilder(broken, options).buildCategory(items, "skill"));
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }
    }
}
