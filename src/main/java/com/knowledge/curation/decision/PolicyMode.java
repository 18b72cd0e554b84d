package com.knowledge.curation.decision;

/**
 * Whether decisions below the auto threshold go to a human or to the LLM.
 */
public enum PolicyMode {
    INTERACTIVE,
    AUTOMATED
}
