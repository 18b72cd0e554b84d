package com.knowledge.curation.decision;

import com.knowledge.curation.config.CurationOptions;
import com.knowledge.curation.core.model.Community;
import com.knowledge.curation.drift.DriftTriad;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Routes communities by similarity bucket.
 *
 * <ul>
 *   <li>AUTO: merged by threshold, only if every internal pair is at or above the auto
 *       threshold and no drift triad touches the community; otherwise demoted to HIGH</li>
 *   <li>HIGH / MEDIUM: human review (interactive) or LLM adjudication (automated)</li>
 *   <li>LOW: preview only unless borderline processing is enabled</li>
 *   <li>below LOW: ignored</li>
 * </ul>
 * Oversized communities go to manual review unless oversized processing is enabled.
 */
public class DecisionPolicyEngine {
    private static final Logger log = LoggerFactory.getLogger(DecisionPolicyEngine.class);

    private final CurationOptions options;
    private final PolicyMode mode;

    public DecisionPolicyEngine(CurationOptions options, PolicyMode mode) {
        this.options = Objects.requireNonNull(options, "options is required");
        this.mode = Objects.requireNonNull(mode, "mode is required");
    }

    public Bucket classify(double score) {
        return Bucket.classify(score, options);
    }

    public RoutingDecision route(Community community, List<DriftTriad> allTriads) {
        List<DriftTriad> triads = triadsWithin(community, allTriads);
        Bucket bucket = classify(community.avgSimilarity());

        if (bucket == Bucket.AUTO) {
            if (!triads.isEmpty()) {
                return decide(community, Bucket.HIGH, "contains drift triad", triads);
            }
            if (community.minSimilarity() < options.getAutoDedupThreshold()) {
                return decide(community, Bucket.HIGH, "weakest pair below auto threshold", triads);
            }
        }
        return decide(community, bucket, null, triads);
    }

    private RoutingDecision decide(Community community, Bucket bucket, String demotion, List<DriftTriad> triads) {
        Route route;
        String reason;
        if (bucket == Bucket.IGNORED) {
            route = Route.IGNORE;
            reason = "below low threshold";
        } else if (bucket == Bucket.LOW && !options.isIncludeBorderline()) {
            route = Route.PREVIEW_ONLY;
            reason = "borderline";
        } else if (community.oversized() && !options.isProcessOversized()) {
            route = mode == PolicyMode.AUTOMATED ? Route.MANUAL_QUEUE : Route.HUMAN_REVIEW;
            reason = "oversized community (" + community.size() + " members)";
        } else if (bucket == Bucket.AUTO) {
            route = Route.AUTO_MERGE;
            reason = "all pairs at or above auto threshold";
        } else {
            route = mode == PolicyMode.AUTOMATED ? Route.ADJUDICATE : Route.HUMAN_REVIEW;
            reason = bucket.name().toLowerCase(Locale.ROOT) + " bucket";
        }
        if (demotion != null) {
            reason = reason + ", demoted from AUTO: " + demotion;
        }
        log.debug("policy.routed communityId={} bucket={} route={} reason={}",
                community.id(), bucket, route, reason);
        return new RoutingDecision(community, bucket, route, reason, triads);
    }

    /**
     * Triads that involve any member of the community.
     */
    public static List<DriftTriad> triadsWithin(Community community, List<DriftTriad> triads) {
        return triads.stream()
                .filter(t -> t.category().equals(community.category()))
                .filter(t -> community.contains(t.a()) || community.contains(t.b()) || community.contains(t.c()))
                .collect(Collectors.toList());
    }

    public PolicyMode getMode() {
        return mode;
    }

    public CurationOptions getOptions() {
        return options;
    }
}
