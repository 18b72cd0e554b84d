package com.knowledge.curation.core.model;

/**
 * Lifecycle status of a knowledge item.
 * Items are never physically deleted; REJECTED is a soft state kept for audit.
 */
public enum ItemStatus {
    /**
     * Imported but not yet published to the canonical set.
     */
    PENDING,

    /**
     * Already published to the canonical set.
     */
    SYNCED,

    /**
     * Merged into another item or explicitly rejected.
     * A merged item carries a {@code canonicalOf} pointer to the surviving item.
     */
    REJECTED
}
