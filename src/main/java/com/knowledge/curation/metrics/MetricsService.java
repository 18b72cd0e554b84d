package com.knowledge.curation.metrics;

import com.knowledge.curation.core.model.DecisionAction;
import com.knowledge.curation.core.model.DecisionActor;

import java.time.Duration;

/**
 * Interface for recording curation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a meter registry.
 */
public interface MetricsService {

    void recordGraphBuilt(String category, int nodes, int edges);

    void incrementDecision(DecisionAction action, DecisionActor actor);

    void incrementCrossCategoryViolation();

    void incrementManualReview();

    void incrementDeferredConflict();

    void recordRoundImprovement(double improvementRate);

    void recordAdjudicationDuration(Duration duration);

    void recordCacheHit();

    void recordCacheMiss();
}
