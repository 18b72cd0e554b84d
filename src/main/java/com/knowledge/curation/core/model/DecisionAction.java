package com.knowledge.curation.core.model;

/**
 * Action recorded by a curation decision.
 */
public enum DecisionAction {
    /** All subject items collapse into the canonical item. */
    MERGE,

    /** A subset collapses; the remainder returns to the pool still active. */
    MERGE_SUBSET,

    /** Items are distinct; no mutation. */
    KEEP_SEPARATE,

    /** Item is invalid and rejected without a merge target. */
    REJECT,

    /** A community is broken into sub-groups that are reconsidered separately. */
    SPLIT,

    /** Canonical content was edited. */
    UPDATE;

    public boolean isMutating() {
        return this == MERGE || this == MERGE_SUBSET || this == REJECT || this == UPDATE;
    }
}
