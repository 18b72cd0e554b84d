package com.knowledge.curation.decision;

import com.knowledge.curation.core.model.Community;
import com.knowledge.curation.drift.DriftTriad;

import java.util.List;
import java.util.Objects;

/**
 * Result of routing one community.
 *
 * @param community the routed community
 * @param bucket    effective bucket after demotion
 * @param route     destination
 * @param reason    short explanation, logged and recorded in the manual queue
 * @param triads    drift triads inside the community
 */
public record RoutingDecision(
        Community community,
        Bucket bucket,
        Route route,
        String reason,
        List<DriftTriad> triads
) {
    public RoutingDecision {
        Objects.requireNonNull(community, "community is required");
        Objects.requireNonNull(bucket, "bucket is required");
        Objects.requireNonNull(route, "route is required");
        triads = triads != null ? List.copyOf(triads) : List.of();
    }
}
