package com.knowledge.curation.merge;

import com.knowledge.curation.core.model.Item;
import com.knowledge.curation.core.model.ItemStatus;

import java.util.Collection;
import java.util.Comparator;

/**
 * Default surviving item for automated merges: an already published (SYNCED) item first,
 * then the lowest id.
 */
public final class CanonicalSelector {

    private static final Comparator<Item> ORDER = Comparator
            .comparing((Item i) -> i.getStatus() == ItemStatus.SYNCED ? 0 : 1)
            .thenComparing(Item::getId);

    private CanonicalSelector() {
    }

    public static Item select(Collection<Item> candidates) {
        return candidates.stream()
                .filter(Item::isActive)
                .min(ORDER)
                .orElseThrow(() -> new IllegalArgumentException("No active candidate to keep"));
    }
}
