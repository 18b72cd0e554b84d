package com.knowledge.curation.review;

import com.knowledge.curation.audit.DecisionRecord;

/**
 * What happened when a command was handled.
 *
 * @param success whether the command was accepted
 * @param state   session state after the command
 * @param message text for the reviewer
 * @param record  decision record written, or null
 */
public record ReviewOutcome(boolean success, ReviewState state, String message, DecisionRecord record) {

    public static ReviewOutcome recorded(ReviewState state, String message, DecisionRecord record) {
        return new ReviewOutcome(true, state, message, record);
    }

    public static ReviewOutcome info(ReviewState state, String message) {
        return new ReviewOutcome(true, state, message, null);
    }

    public static ReviewOutcome error(ReviewState state, String message) {
        return new ReviewOutcome(false, state, message, null);
    }
}
