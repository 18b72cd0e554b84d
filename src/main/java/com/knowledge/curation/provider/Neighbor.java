package com.knowledge.curation.provider;

import java.util.Objects;

/**
 * One nearest-neighbor hit returned by a {@link VectorProvider}.
 *
 * @param itemId     neighbor item id
 * @param embedScore embedding similarity in [0, 1]
 * @param category   category the provider reports for the neighbor
 */
public record Neighbor(String itemId, double embedScore, String category) {
    public Neighbor {
        Objects.requireNonNull(itemId, "itemId is required");
    }
}
