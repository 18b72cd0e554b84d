package com.knowledge.curation.merge;

import com.knowledge.curation.core.CurationException;

import java.util.List;

/**
 * Thrown when a decision targets an item that was already mutated in the current round,
 * or whose state no longer matches the view the decision was made against.
 * The decision is deferred to the next round instead of being applied.
 */
public class ConcurrentMutationConflictException extends CurationException {

    private final List<String> conflictingIds;

    public ConcurrentMutationConflictException(String message, List<String> conflictingIds) {
        super(message + " " + conflictingIds);
        this.conflictingIds = List.copyOf(conflictingIds);
    }

    public List<String> getConflictingIds() {
        return conflictingIds;
    }
}
