package com.knowledge.curation.store;

/**
 * Kind of a persisted session.
 */
public enum SessionMode {
    REVIEW,
    CONVERGENCE
}
