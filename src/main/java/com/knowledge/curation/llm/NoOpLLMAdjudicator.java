package com.knowledge.curation.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adjudicator used when no model is configured.
 * Every community is deferred to manual review.
 */
public class NoOpLLMAdjudicator implements LLMAdjudicator {
    private static final Logger log = LoggerFactory.getLogger(NoOpLLMAdjudicator.class);

    @Override
    public AdjudicationDecision decide(AdjudicationRequest request) {
        log.debug("NoOp adjudicator called for community {}", request.community().id());
        return AdjudicationDecision.manualReview("LLM adjudication not available - manual review required");
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
