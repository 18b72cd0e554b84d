package com.knowledge.curation.review;

import com.knowledge.curation.community.CommunityDetector;
import com.knowledge.curation.core.model.Community;
import com.knowledge.curation.core.model.Edge;
import com.knowledge.curation.core.model.ReviewEntryKind;
import com.knowledge.curation.core.model.ReviewQueueEntry;
import com.knowledge.curation.decision.Bucket;
import com.knowledge.curation.decision.DecisionPolicyEngine;
import com.knowledge.curation.decision.RoutingDecision;
import com.knowledge.curation.drift.DriftTriad;
import com.knowledge.curation.drift.DriftTriadDetector;
import com.knowledge.curation.graph.SimilarityGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the review queue of one category and bucket.
 * Drift triads come first (ordered by center, then outer items), followed by the
 * communities of the bucket in priority order. Two-member communities become pairs.
 */
public class ReviewQueueBuilder {
    private static final Logger log = LoggerFactory.getLogger(ReviewQueueBuilder.class);

    private final DecisionPolicyEngine policyEngine;
    private final CommunityDetector communityDetector;
    private final DriftTriadDetector triadDetector;

    public ReviewQueueBuilder(DecisionPolicyEngine policyEngine,
                              CommunityDetector communityDetector,
                              DriftTriadDetector triadDetector) {
        this.policyEngine = policyEngine;
        this.communityDetector = communityDetector;
        this.triadDetector = triadDetector;
    }

    public List<ReviewQueueEntry> build(SimilarityGraph graph, Bucket bucket) {
        List<ReviewQueueEntry> queue = new ArrayList<>();
        List<DriftTriad> triads = triadDetector.detect(graph);

        triads.stream()
                .filter(t -> policyEngine.classify(Math.min(t.scoreAB(), t.scoreBC())) == bucket)
                .sorted(Comparator.comparing(DriftTriad::b).thenComparing(DriftTriad::a).thenComparing(DriftTriad::c))
                .map(this::triadEntry)
                .forEach(queue::add);

        for (Community community : communityDetector.detect(graph)) {
            RoutingDecision routing = policyEngine.route(community, triads);
            if (routing.bucket() != bucket) {
                continue;
            }
            queue.add(communityEntry(community, routing));
        }
        log.info("review.queue.built category={} bucket={} entries={}", graph.category(), bucket, queue.size());
        return queue;
    }

    private ReviewQueueEntry triadEntry(DriftTriad triad) {
        Map<String, Double> scores = new HashMap<>();
        scores.put(ReviewQueueEntry.scoreKey(triad.a(), triad.b()), triad.scoreAB());
        scores.put(ReviewQueueEntry.scoreKey(triad.b(), triad.c()), triad.scoreBC());
        scores.put(ReviewQueueEntry.scoreKey(triad.a(), triad.c()), triad.scoreAC());
        return new ReviewQueueEntry(
                "triad:" + triad.a() + "," + triad.b() + "," + triad.c(),
                ReviewEntryKind.TRIAD,
                triad.category(),
                triad.members(),
                Math.min(triad.scoreAB(), triad.scoreBC()),
                scores,
                triad.recommendation());
    }

    private ReviewQueueEntry communityEntry(Community community, RoutingDecision routing) {
        Map<String, Double> scores = new HashMap<>();
        for (Edge edge : community.edges()) {
            scores.put(ReviewQueueEntry.scoreKey(edge.aId(), edge.bId()), edge.blendedScore());
        }
        ReviewEntryKind kind = community.size() == 2 ? ReviewEntryKind.PAIR : ReviewEntryKind.COMMUNITY;
        String note = routing.triads().isEmpty() ? null : routing.triads().size() + " drift triad(s) inside";
        return new ReviewQueueEntry(community.id(), kind, community.category(), community.members(),
                community.avgSimilarity(), scores, note);
    }
}
