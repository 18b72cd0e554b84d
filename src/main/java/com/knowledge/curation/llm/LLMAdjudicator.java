package com.knowledge.curation.llm;

/**
 * Interface for LLM adjudication of candidate duplicate groups.
 *
 * <p>The adjudicator only proposes a decision; the merge engine applies it after the
 * decision record is written.</p>
 */
public interface LLMAdjudicator {

    /**
     * Proposes a decision for the community in the request.
     *
     * @throws com.knowledge.curation.provider.ProviderUnavailableException if the model cannot be reached
     * @throws AmbiguousDecisionException if the reply does not map to a defined decision
     */
    AdjudicationDecision decide(AdjudicationRequest request);

    /**
     * Returns the name/identifier of this adjudicator.
     */
    String getProviderName();

    /**
     * Checks if the adjudicator is available and configured.
     */
    default boolean isAvailable() {
        return true;
    }
}
