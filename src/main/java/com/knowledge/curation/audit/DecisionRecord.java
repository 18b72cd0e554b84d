package com.knowledge.curation.audit;

import com.knowledge.curation.core.model.DecisionAction;
import com.knowledge.curation.core.model.DecisionActor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable, append-only record of a curation decision.
 *
 * @param id          record identifier
 * @param sessionId   review session or convergence run that produced the decision
 * @param round       convergence round, or null for interactive decisions
 * @param subject     item ids the decision is about (pair, triad subset or community)
 * @param action      recorded action
 * @param actor       who decided
 * @param canonicalId surviving item for merges, otherwise null
 * @param rationale   free text, required for HUMAN and LLM actors
 * @param details     additional string attributes (scores, bucket, notes)
 * @param timestamp   when the decision was recorded
 */
public record DecisionRecord(
        String id,
        String sessionId,
        Integer round,
        List<String> subject,
        DecisionAction action,
        DecisionActor actor,
        String canonicalId,
        String rationale,
        Map<String, String> details,
        Instant timestamp
) {
    public DecisionRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(sessionId, "sessionId is required");
        Objects.requireNonNull(subject, "subject is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(actor, "actor is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (subject.isEmpty()) {
            throw new IllegalArgumentException("subject must not be empty");
        }
        if (actor.requiresRationale() && (rationale == null || rationale.isBlank())) {
            throw new IllegalArgumentException("rationale is required for actor " + actor);
        }
        if ((action == DecisionAction.MERGE || action == DecisionAction.MERGE_SUBSET)
                && (canonicalId == null || !subject.contains(canonicalId))) {
            throw new IllegalArgumentException("merge decisions need a canonicalId from the subject");
        }
        subject = List.copyOf(subject);
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public boolean isMerge() {
        return action == DecisionAction.MERGE || action == DecisionAction.MERGE_SUBSET;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String sessionId;
        private Integer round;
        private List<String> subject;
        private DecisionAction action;
        private DecisionActor actor;
        private String canonicalId;
        private String rationale;
        private Map<String, String> details;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder round(Integer round) {
            this.round = round;
            return this;
        }

        public Builder subject(List<String> subject) {
            this.subject = subject;
            return this;
        }

        public Builder action(DecisionAction action) {
            this.action = action;
            return this;
        }

        public Builder actor(DecisionActor actor) {
            this.actor = actor;
            return this;
        }

        public Builder canonicalId(String canonicalId) {
            this.canonicalId = canonicalId;
            return this;
        }

        public Builder rationale(String rationale) {
            this.rationale = rationale;
            return this;
        }

        public Builder details(Map<String, String> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public DecisionRecord build() {
            return new DecisionRecord(id, sessionId, round, subject, action, actor,
                    canonicalId, rationale, details, timestamp);
        }
    }
}
