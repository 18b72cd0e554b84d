package com.knowledge.curation.core.model;

import java.util.Objects;

/**
 * Scored, undirected relationship between two items of the same category.
 * The pair is stored canonically with {@code aId < bId}.
 *
 * @param aId          lexicographically smaller item id
 * @param bId          lexicographically larger item id
 * @param category     category shared by both items
 * @param embedScore   embedding similarity
 * @param rerankScore  rerank similarity, or null when no reranker took part
 * @param blendedScore score used for routing and graph weights
 */
public record Edge(
        String aId,
        String bId,
        String category,
        double embedScore,
        Double rerankScore,
        double blendedScore
) {
    public Edge {
        Objects.requireNonNull(aId, "aId is required");
        Objects.requireNonNull(bId, "bId is required");
        Objects.requireNonNull(category, "category is required");
        if (aId.equals(bId)) {
            throw new IllegalArgumentException("Self-edges are not allowed: " + aId);
        }
        if (aId.compareTo(bId) > 0) {
            String tmp = aId;
            aId = bId;
            bId = tmp;
        }
    }

    /**
     * Creates an edge between two items, enforcing category isolation.
     *
     * @throws CrossCategoryViolationException if the categories differ
     */
    public static Edge between(String aId, String aCategory, String bId, String bCategory,
                               double embedScore, Double rerankScore, double blendedScore) {
        if (!Objects.equals(aCategory, bCategory)) {
            throw new CrossCategoryViolationException(aId, aCategory, bId, bCategory);
        }
        return new Edge(aId, bId, aCategory, embedScore, rerankScore, blendedScore);
    }

    public PairKey key() {
        return new PairKey(aId, bId);
    }

    public boolean touches(String itemId) {
        return aId.equals(itemId) || bId.equals(itemId);
    }

    public String other(String itemId) {
        if (aId.equals(itemId)) return bId;
        if (bId.equals(itemId)) return aId;
        throw new IllegalArgumentException(itemId + " is not an endpoint of " + this);
    }

    public boolean hasRerank() {
        return rerankScore != null;
    }
}
