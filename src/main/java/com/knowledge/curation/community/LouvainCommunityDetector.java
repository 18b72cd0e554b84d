package com.knowledge.curation.community;

import com.knowledge.curation.core.model.Community;
import com.knowledge.curation.core.model.Edge;
import com.knowledge.curation.graph.SimilarityGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Louvain modularity clustering with a seeded node visiting order.
 *
 * <p>Each level moves single nodes to the neighboring community with the best modularity
 * gain until no move helps, then collapses communities into super-nodes and repeats.
 * Nodes are visited in a shuffle of the sorted node list driven by {@code seed}, and
 * neighbor communities are evaluated in index order, so the same graph always yields
 * the same partition.</p>
 */
public class LouvainCommunityDetector implements CommunityDetector {
    private static final Logger log = LoggerFactory.getLogger(LouvainCommunityDetector.class);

    private static final double MIN_GAIN = 1e-12;
    private static final int MAX_LEVELS = 32;

    private final long seed;
    private final double resolution;
    private final int maxCommunitySize;

    public LouvainCommunityDetector(long seed, double resolution, int maxCommunitySize) {
        if (resolution <= 0) {
            throw new IllegalArgumentException("resolution must be positive");
        }
        this.seed = seed;
        this.resolution = resolution;
        this.maxCommunitySize = maxCommunitySize;
    }

    @Override
    public List<Community> detect(SimilarityGraph graph) {
        List<String> nodes = graph.nodes();
        if (graph.edgeCount() == 0) {
            return List.of();
        }
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            index.put(nodes.get(i), i);
        }

        Level level = Level.fromGraph(graph, index);
        int[] membership = new int[nodes.size()];
        for (int i = 0; i < membership.length; i++) {
            membership[i] = i;
        }

        Random random = new Random(seed);
        for (int depth = 0; depth < MAX_LEVELS; depth++) {
            int[] assignment = moveNodes(level, random);
            int communities = renumber(assignment);
            if (communities == level.size()) {
                break;
            }
            for (int i = 0; i < membership.length; i++) {
                membership[i] = assignment[membership[i]];
            }
            level = level.aggregate(assignment, communities);
        }

        Map<Integer, List<String>> groups = new TreeMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            groups.computeIfAbsent(membership[i], c -> new ArrayList<>()).add(nodes.get(i));
        }

        List<Community> result = new ArrayList<>();
        for (List<String> members : groups.values()) {
            if (members.size() < 2) {
                continue;
            }
            List<Edge> internal = graph.edgesWithin(members);
            result.add(CommunityScoring.score(graph.category(), members, internal, maxCommunitySize));
        }
        result.sort(Community.PRIORITY_ORDER);
        log.debug("communities.detected category={} nodes={} communities={}",
                graph.category(), nodes.size(), result.size());
        return result;
    }

    private int[] moveNodes(Level level, Random random) {
        int n = level.size();
        int[] community = new int[n];
        double[] total = new double[n];
        for (int i = 0; i < n; i++) {
            community[i] = i;
            total[i] = level.degree[i];
        }
        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            order.add(i);
        }
        Collections.shuffle(order, random);

        double m2 = level.totalWeight;
        boolean moved = true;
        while (moved) {
            moved = false;
            for (int node : order) {
                int current = community[node];
                double k = level.degree[node];
                Map<Integer, Double> linkWeights = new TreeMap<>();
                for (Map.Entry<Integer, Double> e : level.adjacency.get(node).entrySet()) {
                    if (e.getKey() != node) {
                        linkWeights.merge(community[e.getKey()], e.getValue(), Double::sum);
                    }
                }
                total[current] -= k;
                int best = current;
                double bestGain = linkWeights.getOrDefault(current, 0.0) - resolution * total[current] * k / m2;
                for (Map.Entry<Integer, Double> e : linkWeights.entrySet()) {
                    double gain = e.getValue() - resolution * total[e.getKey()] * k / m2;
                    if (gain > bestGain + MIN_GAIN) {
                        best = e.getKey();
                        bestGain = gain;
                    }
                }
                total[best] += k;
                community[node] = best;
                if (best != current) {
                    moved = true;
                }
            }
        }
        return community;
    }

    /**
     * Renumbers community labels to 0..c-1 in order of first appearance; returns c.
     */
    private static int renumber(int[] assignment) {
        Map<Integer, Integer> labels = new HashMap<>();
        for (int i = 0; i < assignment.length; i++) {
            Integer label = labels.get(assignment[i]);
            if (label == null) {
                label = labels.size();
                labels.put(assignment[i], label);
            }
            assignment[i] = label;
        }
        return labels.size();
    }

    /**
     * Weighted graph at one aggregation level. Self-loops hold intra-community weight.
     */
    private static final class Level {
        private final List<TreeMap<Integer, Double>> adjacency;
        private final double[] degree;
        private final double totalWeight;

        private Level(List<TreeMap<Integer, Double>> adjacency) {
            this.adjacency = adjacency;
            this.degree = new double[adjacency.size()];
            double sum = 0.0;
            for (int i = 0; i < adjacency.size(); i++) {
                double d = 0.0;
                for (Map.Entry<Integer, Double> e : adjacency.get(i).entrySet()) {
                    d += e.getKey() == i ? 2 * e.getValue() : e.getValue();
                }
                degree[i] = d;
                sum += d;
            }
            this.totalWeight = sum;
        }

        static Level fromGraph(SimilarityGraph graph, Map<String, Integer> index) {
            List<TreeMap<Integer, Double>> adjacency = new ArrayList<>();
            for (int i = 0; i < index.size(); i++) {
                adjacency.add(new TreeMap<>());
            }
            for (Edge edge : graph.edges()) {
                int a = index.get(edge.aId());
                int b = index.get(edge.bId());
                adjacency.get(a).put(b, edge.blendedScore());
                adjacency.get(b).put(a, edge.blendedScore());
            }
            return new Level(adjacency);
        }

        int size() {
            return adjacency.size();
        }

        Level aggregate(int[] assignment, int communities) {
            List<TreeMap<Integer, Double>> next = new ArrayList<>();
            for (int c = 0; c < communities; c++) {
                next.add(new TreeMap<>());
            }
            for (int i = 0; i < adjacency.size(); i++) {
                int ci = assignment[i];
                for (Map.Entry<Integer, Double> e : adjacency.get(i).entrySet()) {
                    int j = e.getKey();
                    int cj = assignment[j];
                    if (j == i) {
                        next.get(ci).merge(ci, e.getValue(), Double::sum);
                    } else if (ci == cj) {
                        // each internal edge is seen from both ends
                        if (i < j) {
                            next.get(ci).merge(ci, e.getValue(), Double::sum);
                        }
                    } else {
                        next.get(ci).merge(cj, e.getValue(), Double::sum);
                    }
                }
            }
            return new Level(next);
        }
    }
}
