package com.knowledge.curation.core.model;

import com.knowledge.curation.core.CurationException;

/**
 * Raised when an edge would span two categories.
 * This is an internal invariant breach: callers log and discard, never surface it as a duplicate.
 */
public class CrossCategoryViolationException extends CurationException {

    private final String aId;
    private final String bId;

    public CrossCategoryViolationException(String aId, String aCategory, String bId, String bCategory) {
        super("Cross-category edge rejected: " + aId + " [" + aCategory + "] <-> "
                + bId + " [" + bCategory + "]");
        this.aId = aId;
        this.bId = bId;
    }

    public String getAId() {
        return aId;
    }

    public String getBId() {
        return bId;
    }
}
