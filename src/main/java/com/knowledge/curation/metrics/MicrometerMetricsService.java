package com.knowledge.curation.metrics;

import com.knowledge.curation.core.model.DecisionAction;
import com.knowledge.curation.core.model.DecisionActor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code curation.graph.edges}: DistributionSummary (tag: category)</li>
 *   <li>{@code curation.decisions}: Counter (tags: action, actor)</li>
 *   <li>{@code curation.cross_category.violations}: Counter</li>
 *   <li>{@code curation.manual_review}: Counter</li>
 *   <li>{@code curation.conflicts.deferred}: Counter</li>
 *   <li>{@code curation.round.improvement}: DistributionSummary</li>
 *   <li>{@code curation.adjudication.duration}: Timer</li>
 *   <li>{@code curation.neighbor.cache.hit} / {@code .miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final Counter crossCategoryCounter;
    private final Counter manualReviewCounter;
    private final Counter deferredCounter;
    private final DistributionSummary improvementSummary;
    private final Timer adjudicationTimer;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.crossCategoryCounter = Counter.builder("curation.cross_category.violations")
                .description("Neighbor results discarded because they crossed categories")
                .register(registry);
        this.manualReviewCounter = Counter.builder("curation.manual_review")
                .description("Candidates deferred to the manual review queue")
                .register(registry);
        this.deferredCounter = Counter.builder("curation.conflicts.deferred")
                .description("Decisions deferred because their items were already mutated this round")
                .register(registry);
        this.improvementSummary = DistributionSummary.builder("curation.round.improvement")
                .description("Per-round reduction ratio")
                .register(registry);
        this.adjudicationTimer = Timer.builder("curation.adjudication.duration")
                .description("Duration of LLM adjudication calls")
                .register(registry);
        this.cacheHitCounter = Counter.builder("curation.neighbor.cache.hit")
                .description("Neighbor cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("curation.neighbor.cache.miss")
                .description("Neighbor cache misses")
                .register(registry);
    }

    @Override
    public void recordGraphBuilt(String category, int nodes, int edges) {
        DistributionSummary summary = summaryCache.computeIfAbsent(category, k ->
                DistributionSummary.builder("curation.graph.edges")
                        .description("Edges kept per category graph build")
                        .tag("category", category)
                        .register(registry));
        summary.record(edges);
    }

    @Override
    public void incrementDecision(DecisionAction action, DecisionActor actor) {
        String key = action.name() + ":" + actor.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("curation.decisions")
                        .description("Number of recorded curation decisions")
                        .tag("action", action.name())
                        .tag("actor", actor.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementCrossCategoryViolation() {
        crossCategoryCounter.increment();
    }

    @Override
    public void incrementManualReview() {
        manualReviewCounter.increment();
    }

    @Override
    public void incrementDeferredConflict() {
        deferredCounter.increment();
    }

    @Override
    public void recordRoundImprovement(double improvementRate) {
        improvementSummary.record(improvementRate);
    }

    @Override
    public void recordAdjudicationDuration(Duration duration) {
        adjudicationTimer.record(duration);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
