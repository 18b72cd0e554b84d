package com.knowledge.curation.convergence;

import com.knowledge.curation.core.model.ManualReviewEntry;
import com.knowledge.curation.core.model.RoundSummary;

import java.time.Instant;
import java.util.List;

/**
 * Result of a convergence run, the input of the morning report.
 *
 * @param sessionId         run identifier
 * @param initialActive     active items when the run first started
 * @param finalActive       active items at the end
 * @param rounds            summaries of all completed rounds, including earlier runs of a resumed session
 * @param stopReason        why the loop stopped
 * @param manualReviewQueue communities deferred to humans
 * @param warnings          conditions worth a look in the morning
 * @param dryRun            whether nothing was persisted
 * @param finishedAt        end time
 */
public record ConvergenceReport(
        String sessionId,
        int initialActive,
        int finalActive,
        List<RoundSummary> rounds,
        StopReason stopReason,
        List<ManualReviewEntry> manualReviewQueue,
        List<String> warnings,
        boolean dryRun,
        Instant finishedAt
) {
    public ConvergenceReport {
        rounds = rounds != null ? List.copyOf(rounds) : List.of();
        manualReviewQueue = manualReviewQueue != null ? List.copyOf(manualReviewQueue) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        finishedAt = finishedAt != null ? finishedAt : Instant.now();
    }

    public int roundsRun() {
        return rounds.size();
    }

    public int reduction() {
        return initialActive - finalActive;
    }

    /**
     * Fraction of the initial items removed, 0.0 for an empty store.
     */
    public double reductionRate() {
        return initialActive == 0 ? 0.0 : (double) reduction() / initialActive;
    }

    public int totalMerges() {
        return rounds.stream().mapToInt(r -> r.autoDedupMerges() + r.merges()).sum();
    }
}
