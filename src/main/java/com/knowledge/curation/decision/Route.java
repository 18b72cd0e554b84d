package com.knowledge.curation.decision;

/**
 * Where a candidate is sent by the policy engine.
 */
public enum Route {
    /** Merged automatically by threshold. */
    AUTO_MERGE,

    /** Sent to the LLM adjudicator (automated mode). */
    ADJUDICATE,

    /** Presented to a human reviewer (interactive mode). */
    HUMAN_REVIEW,

    /** Deferred to the manual-review queue without adjudication. */
    MANUAL_QUEUE,

    /** Borderline candidate shown in previews only. */
    PREVIEW_ONLY,

    /** Below the low threshold. */
    IGNORE
}
