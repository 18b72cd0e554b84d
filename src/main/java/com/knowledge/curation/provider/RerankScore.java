package com.knowledge.curation.provider;

/**
 * Cross-encoder score of a candidate against a query item.
 */
public record RerankScore(String itemId, double score) {
}
