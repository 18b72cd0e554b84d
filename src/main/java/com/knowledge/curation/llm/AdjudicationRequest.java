package com.knowledge.curation.llm;

import com.knowledge.curation.core.model.Community;
import com.knowledge.curation.core.model.Item;
import com.knowledge.curation.drift.DriftTriad;

import java.util.List;
import java.util.Objects;

/**
 * Request to adjudicate one community.
 *
 * @param community the community under consideration
 * @param members   current member items, in community member order
 * @param triads    drift triads touching the community
 * @param round     convergence round, 0 outside the loop
 */
public record AdjudicationRequest(
        Community community,
        List<Item> members,
        List<DriftTriad> triads,
        int round
) {
    public AdjudicationRequest {
        Objects.requireNonNull(community, "community is required");
        Objects.requireNonNull(members, "members is required");
        members = List.copyOf(members);
        triads = triads != null ? List.copyOf(triads) : List.of();
    }

    /**
     * Ids the adjudicator may reference in its reply.
     */
    public List<String> allowedIds() {
        return community.members();
    }
}
