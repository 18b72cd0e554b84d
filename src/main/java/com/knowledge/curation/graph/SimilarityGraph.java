package com.knowledge.curation.graph;

import com.knowledge.curation.core.model.Edge;
import com.knowledge.curation.core.model.PairKey;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable sparse similarity graph for one category.
 * Nodes are the active items of the category, including isolated ones.
 */
public final class SimilarityGraph {

    private final String category;
    private final List<String> nodes;
    private final List<Edge> edges;
    private final Map<PairKey, Edge> edgeIndex;
    private final Map<String, SortedMap<String, Edge>> adjacency;

    public SimilarityGraph(String category, Collection<String> nodes, Collection<Edge> edges) {
        this.category = Objects.requireNonNull(category, "category is required");
        SortedSet<String> sortedNodes = new TreeSet<>(nodes);
        Map<PairKey, Edge> index = new HashMap<>();
        Map<String, SortedMap<String, Edge>> adj = new HashMap<>();
        for (String node : sortedNodes) {
            adj.put(node, new TreeMap<>());
        }
        for (Edge edge : edges) {
            if (!category.equals(edge.category())) {
                throw new IllegalArgumentException("Edge " + edge.key() + " belongs to category "
                        + edge.category() + ", not " + category);
            }
            if (!sortedNodes.contains(edge.aId()) || !sortedNodes.contains(edge.bId())) {
                throw new IllegalArgumentException("Edge " + edge.key() + " references an unknown node");
            }
            index.put(edge.key(), edge);
            adj.get(edge.aId()).put(edge.bId(), edge);
            adj.get(edge.bId()).put(edge.aId(), edge);
        }
        this.nodes = List.copyOf(sortedNodes);
        this.edges = index.values().stream()
                .sorted(Comparator.comparing(Edge::aId).thenComparing(Edge::bId))
                .toList();
        this.edgeIndex = Collections.unmodifiableMap(index);
        Map<String, SortedMap<String, Edge>> frozen = new HashMap<>();
        adj.forEach((node, neighbors) -> frozen.put(node, Collections.unmodifiableSortedMap(neighbors)));
        this.adjacency = Collections.unmodifiableMap(frozen);
    }

    public static SimilarityGraph empty(String category) {
        return new SimilarityGraph(category, List.of(), List.of());
    }

    public String category() {
        return category;
    }

    /**
     * Node ids in ascending order.
     */
    public List<String> nodes() {
        return nodes;
    }

    /**
     * Edges ordered by (aId, bId).
     */
    public List<Edge> edges() {
        return edges;
    }

    public boolean containsNode(String itemId) {
        return adjacency.containsKey(itemId);
    }

    public Optional<Edge> edge(String a, String b) {
        if (a.equals(b)) {
            return Optional.empty();
        }
        return Optional.ofNullable(edgeIndex.get(PairKey.of(a, b)));
    }

    /**
     * Blended score between two nodes, or 0.0 when no edge was kept.
     */
    public double score(String a, String b) {
        return edge(a, b).map(Edge::blendedScore).orElse(0.0);
    }

    /**
     * Neighbors of a node with their edges, ordered by neighbor id.
     */
    public SortedMap<String, Edge> neighbors(String itemId) {
        SortedMap<String, Edge> neighbors = adjacency.get(itemId);
        return neighbors != null ? neighbors : Collections.emptySortedMap();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public List<Edge> edgesAtOrAbove(double threshold) {
        return edges.stream()
                .filter(e -> e.blendedScore() >= threshold)
                .collect(Collectors.toList());
    }

    /**
     * Edges whose both endpoints are in the given set.
     */
    public List<Edge> edgesWithin(Collection<String> members) {
        Set<String> set = new HashSet<>(members);
        return edges.stream()
                .filter(e -> set.contains(e.aId()) && set.contains(e.bId()))
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "SimilarityGraph{category='" + category + "', nodes=" + nodes.size()
                + ", edges=" + edges.size() + '}';
    }
}
