package com.knowledge.curation.merge;

import com.knowledge.curation.core.model.DecisionActor;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Who is deciding, where, and why; carried into the decision record.
 *
 * @param sessionId review session or convergence run id
 * @param round     convergence round, null for interactive decisions
 * @param actor     decision maker
 * @param rationale explanation, required for HUMAN and LLM
 * @param details   extra attributes for the record
 * @param scope     round mutation scope, or null outside a round
 */
public record DecisionContext(
        String sessionId,
        Integer round,
        DecisionActor actor,
        String rationale,
        Map<String, String> details,
        MutationScope scope
) {
    public DecisionContext {
        Objects.requireNonNull(sessionId, "sessionId is required");
        Objects.requireNonNull(actor, "actor is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static DecisionContext human(String sessionId, String rationale) {
        return new DecisionContext(sessionId, null, DecisionActor.HUMAN, rationale, Map.of(), null);
    }

    public DecisionContext withDetails(Map<String, String> extra) {
        Map<String, String> merged = new HashMap<>(details);
        merged.putAll(extra);
        return new DecisionContext(sessionId, round, actor, rationale, merged, scope);
    }
}
