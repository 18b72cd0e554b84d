package com.knowledge.curation.convergence;

import com.knowledge.curation.audit.DecisionRecord;

import java.util.List;

/**
 * Outcome of one auto-dedup pass.
 *
 * @param groups        groups found above the auto threshold
 * @param records       one MERGE record per applied (or previewed) group
 * @param mergedItems   items merged away
 * @param deferred      groups skipped because an item was already mutated
 * @param excludedEdges edges at or above the threshold left out because they touch a drift triad
 */
public record AutoDedupResult(
        List<List<String>> groups,
        List<DecisionRecord> records,
        int mergedItems,
        int deferred,
        int excludedEdges
) {
    public AutoDedupResult {
        groups = groups != null ? List.copyOf(groups) : List.of();
        records = records != null ? List.copyOf(records) : List.of();
    }

    public static AutoDedupResult empty() {
        return new AutoDedupResult(List.of(), List.of(), 0, 0, 0);
    }
}
