package com.knowledge.curation.metrics;

import com.knowledge.curation.core.model.DecisionAction;
import com.knowledge.curation.core.model.DecisionActor;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordGraphBuilt(String category, int nodes, int edges) {
    }

    @Override
    public void incrementDecision(DecisionAction action, DecisionActor actor) {
    }

    @Override
    public void incrementCrossCategoryViolation() {
    }

    @Override
    public void incrementManualReview() {
    }

    @Override
    public void incrementDeferredConflict() {
    }

    @Override
    public void recordRoundImprovement(double improvementRate) {
    }

    @Override
    public void recordAdjudicationDuration(Duration duration) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
