package com.knowledge.curation.core.model;

/**
 * Shape of a review queue entry.
 */
public enum ReviewEntryKind {
    /** Two items joined by a single edge. */
    PAIR,

    /** A drift triad A-B-C; members are stored as [A, B, C] with B the center. */
    TRIAD,

    /** A community of two or more items. */
    COMMUNITY
}
