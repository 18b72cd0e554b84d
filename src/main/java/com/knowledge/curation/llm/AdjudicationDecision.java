package com.knowledge.curation.llm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Closed set of adjudication outcomes.
 *
 * @param kind        decision kind
 * @param groups      MERGE: one group with all members; MERGE_SUBSET: the groups to merge;
 *                    SPLIT: the proposed sub-groups; otherwise empty
 * @param canonicalIds surviving item per group, aligned with {@code groups}; an entry (or the whole
 *                    list) may be null or empty, meaning the default canonical rule applies
 * @param rationale   explanation, never blank
 * @param confidence  confidence in [0, 1]
 * @param rawReply    unparsed adjudicator reply, kept for the audit record
 */
public record AdjudicationDecision(
        Kind kind,
        List<List<String>> groups,
        List<String> canonicalIds,
        String rationale,
        double confidence,
        String rawReply
) {
    public enum Kind {
        MERGE,
        MERGE_SUBSET,
        KEEP_SEPARATE,
        SPLIT,
        MANUAL_REVIEW
    }

    public AdjudicationDecision {
        Objects.requireNonNull(kind, "kind is required");
        groups = groups != null ? groups.stream().map(List::copyOf).toList() : List.of();
        // entries may be null, so List.copyOf does not fit
        canonicalIds = canonicalIds != null
                ? Collections.unmodifiableList(new ArrayList<>(canonicalIds))
                : List.of();
        if (!canonicalIds.isEmpty() && canonicalIds.size() != groups.size()) {
            throw new IllegalArgumentException("one canonical entry per group is required");
        }
        if (rationale == null || rationale.isBlank()) {
            rationale = kind.name().toLowerCase(Locale.ROOT);
        }
        if ((kind == Kind.MERGE || kind == Kind.MERGE_SUBSET || kind == Kind.SPLIT) && groups.isEmpty()) {
            throw new IllegalArgumentException(kind + " needs at least one group");
        }
        if (groups.stream().anyMatch(g -> g.size() < 2) && kind != Kind.SPLIT) {
            throw new IllegalArgumentException("merge groups need at least two members");
        }
    }

    public static AdjudicationDecision merge(List<String> members, String canonicalId,
                                             String rationale, double confidence) {
        return new AdjudicationDecision(Kind.MERGE, List.of(members), Collections.singletonList(canonicalId),
                rationale, confidence, null);
    }

    public static AdjudicationDecision mergeSubset(List<List<String>> groups, String rationale, double confidence) {
        return new AdjudicationDecision(Kind.MERGE_SUBSET, groups, null, rationale, confidence, null);
    }

    /**
     * Subset merge where each group names its surviving item ({@code null} entries use the default rule).
     */
    public static AdjudicationDecision mergeSubset(List<List<String>> groups, List<String> canonicalIds,
                                                   String rationale, double confidence) {
        return new AdjudicationDecision(Kind.MERGE_SUBSET, groups, canonicalIds, rationale, confidence, null);
    }

    public static AdjudicationDecision keepSeparate(String rationale, double confidence) {
        return new AdjudicationDecision(Kind.KEEP_SEPARATE, List.of(), null, rationale, confidence, null);
    }

    public static AdjudicationDecision split(List<List<String>> groups, String rationale, double confidence) {
        return new AdjudicationDecision(Kind.SPLIT, groups, null, rationale, confidence, null);
    }

    public static AdjudicationDecision manualReview(String reason) {
        return new AdjudicationDecision(Kind.MANUAL_REVIEW, List.of(), null, reason, 0.0, null);
    }

    public AdjudicationDecision withRawReply(String reply) {
        return new AdjudicationDecision(kind, groups, canonicalIds, rationale, confidence, reply);
    }

    /**
     * Surviving item of the first group, or null for the default rule.
     */
    public String canonicalId() {
        return canonicalFor(0);
    }

    public String canonicalFor(int groupIndex) {
        return groupIndex < canonicalIds.size() ? canonicalIds.get(groupIndex) : null;
    }

    public boolean isMerge() {
        return kind == Kind.MERGE || kind == Kind.MERGE_SUBSET;
    }
}
