package com.knowledge.curation.llm;

import com.knowledge.curation.core.CurationException;

/**
 * Raised when an adjudicator reply cannot be parsed into one of the defined decisions.
 * Such replies are routed to manual review, never defaulted to merge or keep.
 */
public class AmbiguousDecisionException extends CurationException {

    private final String rawReply;

    public AmbiguousDecisionException(String message, String rawReply) {
        super(message);
        this.rawReply = rawReply;
    }

    public AmbiguousDecisionException(String message, String rawReply, Throwable cause) {
        super(message, cause);
        this.rawReply = rawReply;
    }

    public String getRawReply() {
        return rawReply;
    }
}
