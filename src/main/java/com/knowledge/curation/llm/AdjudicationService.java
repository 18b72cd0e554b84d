package com.knowledge.curation.llm;

import com.knowledge.curation.config.CurationOptions;
import com.knowledge.curation.metrics.MetricsService;
import com.knowledge.curation.metrics.NoOpMetricsService;
import com.knowledge.curation.provider.ProviderUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Calls the adjudicator with retries and turns every failure into a manual-review decision.
 *
 * <p>Unreachable models, malformed replies and low-confidence answers all become
 * {@link AdjudicationDecision.Kind#MANUAL_REVIEW}; nothing is silently kept or merged.
 * Retry delays start at the configured backoff and double on each attempt.</p>
 */
public class AdjudicationService {
    private static final Logger log = LoggerFactory.getLogger(AdjudicationService.class);

    private final LLMAdjudicator adjudicator;
    private final CurationOptions options;
    private final MetricsService metricsService;

    public AdjudicationService(LLMAdjudicator adjudicator, CurationOptions options) {
        this(adjudicator, options, new NoOpMetricsService());
    }

    public AdjudicationService(LLMAdjudicator adjudicator, CurationOptions options, MetricsService metricsService) {
        this.adjudicator = Objects.requireNonNull(adjudicator, "adjudicator is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public AdjudicationDecision adjudicate(AdjudicationRequest request) {
        String communityId = request.community().id();
        int attempts = options.getLlmMaxRetries() + 1;
        String lastError = null;
        String lastRaw = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            long start = System.nanoTime();
            try {
                AdjudicationDecision decision = adjudicator.decide(request);
                metricsService.recordAdjudicationDuration(Duration.ofNanos(System.nanoTime() - start));
                if (decision == null) {
                    throw new AmbiguousDecisionException("Adjudicator returned no decision", null);
                }
                return applyConfidenceThreshold(communityId, decision);
            } catch (ProviderUnavailableException e) {
                lastError = "LLM unavailable: " + e.getMessage();
            } catch (AmbiguousDecisionException e) {
                lastError = "ambiguous LLM reply: " + e.getMessage();
                lastRaw = e.getRawReply();
            } catch (RuntimeException e) {
                lastError = "LLM call failed: " + e.getMessage();
            }
            log.warn("llm.attempt-failed communityId={} attempt={} of={} error={}",
                    communityId, attempt, attempts, lastError);
            if (attempt < attempts && !sleep(delayFor(attempt))) {
                break;
            }
        }
        log.warn("llm.deferred communityId={} reason={}", communityId, lastError);
        return AdjudicationDecision.manualReview(lastError).withRawReply(lastRaw);
    }

    private AdjudicationDecision applyConfidenceThreshold(String communityId, AdjudicationDecision decision) {
        if (decision.kind() == AdjudicationDecision.Kind.MANUAL_REVIEW) {
            return decision;
        }
        if (decision.confidence() < options.getLlmConfidenceThreshold()) {
            log.info("llm.low-confidence communityId={} decision={} confidence={} threshold={}",
                    communityId, decision.kind(), decision.confidence(), options.getLlmConfidenceThreshold());
            return AdjudicationDecision.manualReview(String.format(Locale.ROOT,
                    "low confidence %.2f for %s: %s",
                    decision.confidence(), decision.kind(), decision.rationale()))
                    .withRawReply(decision.rawReply());
        }
        return decision;
    }

    Duration delayFor(int attempt) {
        Duration base = options.getLlmRetryBackoff();
        return base.multipliedBy(1L << Math.min(attempt - 1, 16));
    }

    private boolean sleep(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public LLMAdjudicator getAdjudicator() {
        return adjudicator;
    }
}
