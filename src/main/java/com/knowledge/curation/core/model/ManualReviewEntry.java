package com.knowledge.curation.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Community deferred to a human by the automated loop.
 *
 * @param round         round in which it was deferred
 * @param communityId   community id within that round
 * @param category      category of all members
 * @param members       member ids
 * @param avgSimilarity community average similarity
 * @param reason        why it was deferred (low confidence, oversized, LLM unavailable, ...)
 */
public record ManualReviewEntry(
        int round,
        String communityId,
        String category,
        List<String> members,
        double avgSimilarity,
        String reason
) {
    public ManualReviewEntry {
        Objects.requireNonNull(members, "members is required");
        members = List.copyOf(members);
    }
}
