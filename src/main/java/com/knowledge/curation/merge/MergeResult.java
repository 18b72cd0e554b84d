package com.knowledge.curation.merge;

import com.knowledge.curation.audit.DecisionRecord;
import com.knowledge.curation.core.model.DecisionAction;

import java.util.List;

/**
 * Result of applying a decision.
 *
 * @param success      whether the decision was recorded and applied
 * @param action       recorded action
 * @param canonicalId  surviving item for merges
 * @param affectedIds  items whose state changed (merged, rejected or updated)
 * @param record       the decision record written ahead of the mutation
 * @param dryRun       whether the mutation was only previewed
 * @param errorMessage failure reason
 */
public record MergeResult(
        boolean success,
        DecisionAction action,
        String canonicalId,
        List<String> affectedIds,
        DecisionRecord record,
        boolean dryRun,
        String errorMessage
) {
    public MergeResult {
        affectedIds = affectedIds != null ? List.copyOf(affectedIds) : List.of();
    }

    public static MergeResult success(DecisionRecord record, List<String> affectedIds) {
        return new MergeResult(true, record.action(), record.canonicalId(), affectedIds, record, false, null);
    }

    public static MergeResult preview(DecisionRecord record, List<String> affectedIds) {
        return new MergeResult(true, record.action(), record.canonicalId(), affectedIds, record, true, null);
    }

    public static MergeResult failure(DecisionRecord record, String errorMessage) {
        return new MergeResult(false, record.action(), record.canonicalId(), List.of(), record, false, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }
}
