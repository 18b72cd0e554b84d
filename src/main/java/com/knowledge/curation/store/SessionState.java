package com.knowledge.curation.store;

import com.knowledge.curation.core.model.ManualReviewEntry;
import com.knowledge.curation.core.model.ReviewQueueEntry;
import com.knowledge.curation.core.model.RoundSummary;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Persisted progress of a review session or a convergence run.
 * Immutable; every change produces a new snapshot that is saved as a whole.
 *
 * @param sessionId          session identifier
 * @param mode               review or convergence
 * @param category           category under review (review sessions)
 * @param bucket             bucket under review (review sessions)
 * @param queue              review entries in presentation order
 * @param cursor             index of the next entry to present
 * @param roundCounter       last completed convergence round
 * @param improvementHistory improvement rate of each completed round
 * @param manualReviewQueue  communities deferred to humans
 * @param rounds             per-round summaries
 * @param initialItemCount   active items when the session started
 * @param completed          whether the session reached its end
 * @param updatedAt          last save time
 */
public record SessionState(
        String sessionId,
        SessionMode mode,
        String category,
        String bucket,
        List<ReviewQueueEntry> queue,
        int cursor,
        int roundCounter,
        List<Double> improvementHistory,
        List<ManualReviewEntry> manualReviewQueue,
        List<RoundSummary> rounds,
        int initialItemCount,
        boolean completed,
        Instant updatedAt
) {
    public SessionState {
        Objects.requireNonNull(sessionId, "sessionId is required");
        Objects.requireNonNull(mode, "mode is required");
        queue = queue != null ? List.copyOf(queue) : List.of();
        improvementHistory = improvementHistory != null ? List.copyOf(improvementHistory) : List.of();
        manualReviewQueue = manualReviewQueue != null ? List.copyOf(manualReviewQueue) : List.of();
        rounds = rounds != null ? List.copyOf(rounds) : List.of();
        if (cursor < 0 || cursor > queue.size()) {
            throw new IllegalArgumentException("cursor " + cursor + " outside queue of size " + queue.size());
        }
        updatedAt = updatedAt != null ? updatedAt : Instant.now();
    }

    public static SessionState newReview(String sessionId, String category, String bucket,
                                         List<ReviewQueueEntry> queue, int initialItemCount) {
        return new SessionState(sessionId, SessionMode.REVIEW, category, bucket, queue, 0, 0,
                List.of(), List.of(), List.of(), initialItemCount, queue.isEmpty(), Instant.now());
    }

    public static SessionState newConvergence(String sessionId, int initialItemCount) {
        return new SessionState(sessionId, SessionMode.CONVERGENCE, null, null, List.of(), 0, 0,
                List.of(), List.of(), List.of(), initialItemCount, false, Instant.now());
    }

    public boolean hasNext() {
        return cursor < queue.size();
    }

    public SessionState withCursor(int newCursor) {
        return new SessionState(sessionId, mode, category, bucket, queue, newCursor, roundCounter,
                improvementHistory, manualReviewQueue, rounds, initialItemCount,
                completed, Instant.now());
    }

    /**
     * Inserts entries right after the current entry (the one at {@code cursor}).
     */
    public SessionState withInsertedAfterCursor(List<ReviewQueueEntry> entries) {
        List<ReviewQueueEntry> newQueue = new ArrayList<>(queue);
        int at = Math.min(cursor + 1, newQueue.size());
        newQueue.addAll(at, entries);
        return new SessionState(sessionId, mode, category, bucket, newQueue, cursor, roundCounter,
                improvementHistory, manualReviewQueue, rounds, initialItemCount,
                completed, Instant.now());
    }

    public SessionState withCompleted(boolean done) {
        return new SessionState(sessionId, mode, category, bucket, queue, cursor, roundCounter,
                improvementHistory, manualReviewQueue, rounds, initialItemCount,
                done, Instant.now());
    }

    /**
     * Records a completed convergence round.
     */
    public SessionState withRound(RoundSummary summary, List<ManualReviewEntry> deferred) {
        List<Double> history = new ArrayList<>(improvementHistory);
        history.add(summary.improvementRate());
        List<RoundSummary> newRounds = new ArrayList<>(rounds);
        newRounds.add(summary);
        List<ManualReviewEntry> manual = new ArrayList<>(manualReviewQueue);
        manual.addAll(deferred);
        return new SessionState(sessionId, mode, category, bucket, queue, cursor, summary.round(),
                history, manual, newRounds, initialItemCount, completed, Instant.now());
    }
}
