package com.knowledge.curation.drift;

import java.util.List;
import java.util.Objects;

/**
 * Transitive-similarity violation: A~B and B~C are high but A~C is not.
 *
 * @param category category of the three items
 * @param a        first outer item ({@code a < c})
 * @param b        center item
 * @param c        second outer item
 * @param scoreAB  blended score A-B
 * @param scoreBC  blended score B-C
 * @param scoreAC  blended score A-C, 0.0 when no edge was kept
 */
public record DriftTriad(
        String category,
        String a,
        String b,
        String c,
        double scoreAB,
        double scoreBC,
        double scoreAC
) {
    public DriftTriad {
        Objects.requireNonNull(a, "a is required");
        Objects.requireNonNull(b, "b is required");
        Objects.requireNonNull(c, "c is required");
        if (a.compareTo(c) > 0) {
            String tmp = a;
            a = c;
            c = tmp;
            double s = scoreAB;
            scoreAB = scoreBC;
            scoreBC = s;
        }
    }

    public List<String> members() {
        return List.of(a, b, c);
    }

    public boolean involves(String itemId) {
        return a.equals(itemId) || b.equals(itemId) || c.equals(itemId);
    }

    /**
     * The pair to merge: the closer of the two high edges (A-B on ties).
     */
    public List<String> recommendedPair() {
        return scoreAB >= scoreBC ? List.of(a, b) : List.of(b, c);
    }

    /**
     * The item to keep separate.
     */
    public String distantItem() {
        return scoreAB >= scoreBC ? c : a;
    }

    public String recommendation() {
        List<String> pair = recommendedPair();
        return String.format("merge %s+%s, keep %s separate", pair.get(0), pair.get(1), distantItem());
    }
}
