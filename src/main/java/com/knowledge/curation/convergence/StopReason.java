package com.knowledge.curation.convergence;

/**
 * Why a convergence run stopped.
 */
public enum StopReason {
    /** A round improved less than the minimum improvement rate. */
    CONVERGED,

    /** The iteration cap was reached. */
    MAX_ITERATIONS,

    /** A provider failed during a round; the checkpoint was not advanced. */
    PROVIDER_FAILURE,

    /** Dry run: a single preview round was computed. */
    DRY_RUN_PREVIEW,

    /** The graph had no candidates left to process. */
    NO_CANDIDATES
}
