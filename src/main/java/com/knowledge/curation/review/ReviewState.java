package com.knowledge.curation.review;

/**
 * States of an interactive review session.
 */
public enum ReviewState {
    /** Waiting for the reviewer's next command on the current entry. */
    AWAITING_INPUT,

    /** A command is being validated and applied. */
    APPLYING,

    /** The decision was recorded and the session state persisted. */
    RECORDED,

    /** The reviewer quit; the session can be resumed. */
    SUSPENDED,

    /** The queue is exhausted. */
    DONE
}
