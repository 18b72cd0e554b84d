package com.knowledge.curation.core.model;

/**
 * Who made a curation decision.
 */
public enum DecisionActor {
    HUMAN,
    LLM,
    AUTO_THRESHOLD;

    /**
     * HUMAN and LLM decisions must carry a rationale.
     */
    public boolean requiresRationale() {
        return this != AUTO_THRESHOLD;
    }
}
