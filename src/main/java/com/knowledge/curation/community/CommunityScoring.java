package com.knowledge.curation.community;

import com.knowledge.curation.core.model.Community;
import com.knowledge.curation.core.model.Edge;

import java.util.List;

/**
 * Scores candidate communities for processing order.
 * priority = 0.6 * average similarity + 0.3 * density + 0.1 * size score.
 */
public final class CommunityScoring {

    private static final double SIMILARITY_WEIGHT = 0.6;
    private static final double DENSITY_WEIGHT = 0.3;
    private static final double SIZE_WEIGHT = 0.1;

    private CommunityScoring() {
    }

    /**
     * Small communities are penalized, 3 to 10 members is optimal, larger ones decay.
     */
    public static double sizeScore(int size) {
        if (size < 3) {
            return size / 3.0;
        }
        if (size <= 10) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, 10.0 / size));
    }

    public static double priority(double avgSimilarity, double density, int size) {
        return SIMILARITY_WEIGHT * avgSimilarity + DENSITY_WEIGHT * density + SIZE_WEIGHT * sizeScore(size);
    }

    public static double density(int size, int edgeCount) {
        if (size < 2) {
            return 0.0;
        }
        double possible = size * (size - 1) / 2.0;
        return Math.min(1.0, edgeCount / possible);
    }

    /**
     * Builds a scored community from its members and internal edges.
     */
    public static Community score(String category, List<String> members, List<Edge> internalEdges,
                                  int maxCommunitySize) {
        List<String> sorted = members.stream().sorted().toList();
        double avg = internalEdges.stream().mapToDouble(Edge::blendedScore).average().orElse(0.0);
        double min = internalEdges.stream().mapToDouble(Edge::blendedScore).min().orElse(0.0);
        // missing pairs count as 0.0
        if (internalEdges.size() < sorted.size() * (sorted.size() - 1) / 2) {
            min = 0.0;
        }
        double density = density(sorted.size(), internalEdges.size());
        double priority = priority(avg, density, sorted.size());
        String id = category + "/" + sorted.get(0);
        return new Community(id, category, sorted, avg, min, density, priority,
                sorted.size() > maxCommunitySize, internalEdges);
    }
}
