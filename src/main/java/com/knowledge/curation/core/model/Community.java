package com.knowledge.curation.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Cluster of mutually similar items produced by graph partitioning.
 * Communities are a per-round view and never authoritative state.
 *
 * @param id            identifier, stable for a fixed graph
 * @param category      category of all members
 * @param members       member ids in ascending order (size &gt;= 2)
 * @param avgSimilarity mean blended score of internal edges
 * @param minSimilarity smallest internal edge score
 * @param density       internal edge count over possible pairs
 * @param priorityScore processing priority, higher first
 * @param oversized     whether the community exceeds the configured maximum size
 * @param edges         internal edges
 */
public record Community(
        String id,
        String category,
        List<String> members,
        double avgSimilarity,
        double minSimilarity,
        double density,
        double priorityScore,
        boolean oversized,
        List<Edge> edges
) {
    /**
     * Processing order: priority desc, then size desc, then first member id.
     */
    public static final Comparator<Community> PRIORITY_ORDER = Comparator
            .comparingDouble(Community::priorityScore).reversed()
            .thenComparing(Comparator.comparingInt(Community::size).reversed())
            .thenComparing(c -> c.members().get(0));

    public Community {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(members, "members is required");
        if (members.size() < 2) {
            throw new IllegalArgumentException("A community needs at least two members, got " + members);
        }
        members = members.stream().sorted().toList();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    public int size() {
        return members.size();
    }

    public boolean contains(String itemId) {
        return members.contains(itemId);
    }
}
