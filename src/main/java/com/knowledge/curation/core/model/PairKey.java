package com.knowledge.curation.core.model;

import java.util.Objects;

/**
 * Unordered item pair, normalized so that {@code first < second}.
 */
public record PairKey(String first, String second) {

    public PairKey {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
        if (first.compareTo(second) > 0) {
            String tmp = first;
            first = second;
            second = tmp;
        }
    }

    public static PairKey of(String a, String b) {
        return new PairKey(a, b);
    }
}
