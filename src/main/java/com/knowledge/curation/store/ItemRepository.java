package com.knowledge.curation.store;

import com.knowledge.curation.core.model.Item;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Repository interface for knowledge items.
 * Items are never deleted; merges and rejections are status changes saved through {@link #save(Item)}.
 */
public interface ItemRepository {

    Optional<Item> findById(String id);

    /**
     * Gets all items ordered by id.
     */
    List<Item> findAll();

    /**
     * Gets all items of a category ordered by id.
     */
    List<Item> findByCategory(String category);

    /**
     * Gets PENDING and SYNCED items of a category ordered by id.
     */
    List<Item> findActiveByCategory(String category);

    /**
     * Gets the distinct categories in natural order.
     */
    SortedSet<String> categories();

    /**
     * Gets merged items whose canonical pointer is the given item.
     */
    List<Item> findMergedInto(String canonicalId);

    /**
     * Inserts or replaces an item.
     */
    void save(Item item);

    int countActive();
}
