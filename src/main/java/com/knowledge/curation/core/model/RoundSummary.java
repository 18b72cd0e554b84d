package com.knowledge.curation.core.model;

/**
 * Counters for one convergence round.
 *
 * @param round               1-based round number
 * @param activeBefore        active items at round start
 * @param activeAfter         active items at round end
 * @param autoDedupMerges     items merged away by the auto-dedup pass
 * @param communities         communities detected
 * @param communitiesProcessed communities routed in this round
 * @param merges              items merged away by community decisions
 * @param keptSeparate        KEEP_SEPARATE decisions
 * @param splits              SPLIT decisions
 * @param manualReviews       communities deferred to manual review
 * @param manualReviewItems   members of those communities
 * @param deferredConflicts   decisions deferred because their items were already mutated
 * @param triads              drift triads detected
 * @param improvementRate     reduction ratio used for halting
 */
public record RoundSummary(
        int round,
        int activeBefore,
        int activeAfter,
        int autoDedupMerges,
        int communities,
        int communitiesProcessed,
        int merges,
        int keptSeparate,
        int splits,
        int manualReviews,
        int manualReviewItems,
        int deferredConflicts,
        int triads,
        double improvementRate
) {
    public int reduction() {
        return activeBefore - activeAfter;
    }
}
