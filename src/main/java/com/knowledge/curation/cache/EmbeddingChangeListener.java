package com.knowledge.curation.cache;

/**
 * Listener for item content changes that make an embedding stale.
 */
public interface EmbeddingChangeListener {

    /**
     * Called after an item's title or body was updated.
     *
     * @param itemId the updated item
     */
    void onEmbeddingChanged(String itemId);
}
