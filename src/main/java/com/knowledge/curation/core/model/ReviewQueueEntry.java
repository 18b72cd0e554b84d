package com.knowledge.curation.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One unit of work presented to a reviewer.
 *
 * @param id       stable identifier within a session
 * @param kind     pair, triad or community
 * @param category category of all members
 * @param members  member ids in presentation order
 * @param score    score used for bucketing (edge score, or community average)
 * @param scores   pairwise scores keyed by {@code "a|b"} with {@code a < b}
 * @param note     optional hint shown with the entry, e.g. a triad recommendation
 */
public record ReviewQueueEntry(
        String id,
        ReviewEntryKind kind,
        String category,
        List<String> members,
        double score,
        Map<String, Double> scores,
        String note
) {
    public ReviewQueueEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(members, "members is required");
        if (members.size() < 2) {
            throw new IllegalArgumentException("A review entry needs at least two members");
        }
        if (kind == ReviewEntryKind.TRIAD && members.size() != 3) {
            throw new IllegalArgumentException("A triad entry needs exactly three members");
        }
        members = List.copyOf(members);
        scores = scores != null ? Map.copyOf(scores) : Map.of();
    }

    public static String scoreKey(String a, String b) {
        PairKey key = PairKey.of(a, b);
        return key.first() + "|" + key.second();
    }

    public double scoreBetween(String a, String b) {
        return scores.getOrDefault(scoreKey(a, b), 0.0);
    }
}
