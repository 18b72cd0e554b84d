package com.knowledge.curation.graph;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable set of per-category graphs that one round works on.
 */
public final class GraphSnapshot {

    private final SortedMap<String, SimilarityGraph> graphs;
    private final Instant builtAt;

    public GraphSnapshot(Map<String, SimilarityGraph> graphs) {
        this.graphs = Collections.unmodifiableSortedMap(new TreeMap<>(graphs));
        this.builtAt = Instant.now();
    }

    public SortedMap<String, SimilarityGraph> graphs() {
        return graphs;
    }

    public SimilarityGraph graph(String category) {
        SimilarityGraph graph = graphs.get(category);
        return graph != null ? graph : SimilarityGraph.empty(category);
    }

    public int totalEdges() {
        return graphs.values().stream().mapToInt(SimilarityGraph::edgeCount).sum();
    }

    public int totalNodes() {
        return graphs.values().stream().mapToInt(SimilarityGraph::nodeCount).sum();
    }

    public Instant builtAt() {
        return builtAt;
    }
}
