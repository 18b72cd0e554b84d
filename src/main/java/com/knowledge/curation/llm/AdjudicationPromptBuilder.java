package com.knowledge.curation.llm;

import com.knowledge.curation.core.model.Community;
import com.knowledge.curation.core.model.Edge;
import com.knowledge.curation.core.model.Item;
import com.knowledge.curation.drift.DriftTriad;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Renders the adjudication prompt for a community: members, strongest internal edges
 * and drift-triad hints, followed by the JSON reply contract.
 */
public class AdjudicationPromptBuilder {

    private static final int DEFAULT_TOP_EDGES = 20;

    private final int topEdges;

    public AdjudicationPromptBuilder() {
        this(DEFAULT_TOP_EDGES);
    }

    public AdjudicationPromptBuilder(int topEdges) {
        this.topEdges = topEdges;
    }

    public String build(AdjudicationRequest request) {
        Community community = request.community();
        StringBuilder prompt = new StringBuilder();

        prompt.append("You are curating a shared knowledge base of ").append(community.category())
                .append(" entries. Decide whether the entries below are duplicates of each other.\n\n");

        prompt.append("Community: ").append(community.id())
                .append(" (size ").append(community.size())
                .append(", round ").append(request.round())
                .append(String.format(Locale.ROOT, ", priority %.3f", community.priorityScore()));
        if (community.oversized()) {
            prompt.append(", oversized");
        }
        prompt.append(")\n\n");

        prompt.append("Members:\n");
        for (Item item : request.members()) {
            prompt.append("- ").append(item.getId()).append(": ").append(item.getTitle()).append('\n');
            if (!item.getBody().isBlank()) {
                prompt.append("  ").append(item.getBody().replace("\n", "\n  ")).append('\n');
            }
        }
        prompt.append('\n');

        List<Edge> strongest = community.edges().stream()
                .sorted(Comparator.comparingDouble(Edge::blendedScore).reversed()
                        .thenComparing(Edge::aId).thenComparing(Edge::bId))
                .limit(topEdges)
                .toList();
        if (!strongest.isEmpty()) {
            prompt.append("Similarity edges:\n");
            for (Edge edge : strongest) {
                prompt.append(String.format(Locale.ROOT, "- %s <-> %s: weight=%.3f%n",
                        edge.aId(), edge.bId(), edge.blendedScore()));
            }
            prompt.append('\n');
        }

        if (!request.triads().isEmpty()) {
            prompt.append("Drift warnings (A~B and B~C are close but A~C is not):\n");
            for (DriftTriad triad : request.triads()) {
                prompt.append(String.format(Locale.ROOT, "- %s ~ %s (%.3f), %s ~ %s (%.3f), %s ~ %s (%.3f): suggest %s%n",
                        triad.a(), triad.b(), triad.scoreAB(),
                        triad.b(), triad.c(), triad.scoreBC(),
                        triad.a(), triad.c(), triad.scoreAC(),
                        triad.recommendation()));
            }
            prompt.append('\n');
        }

        prompt.append("Instructions:\n");
        prompt.append("1. Merge only entries that describe the same lesson or procedure.\n");
        prompt.append("2. Use merge_subset when only some entries are duplicates.\n");
        prompt.append("3. Use split when the entries form separate topics; list the groups.\n");
        prompt.append("4. Use manual_review when unsure.\n\n");

        prompt.append("Respond with JSON only, in this exact shape:\n");
        prompt.append("{\"decision\": \"merge_all|merge_subset|keep_separate|split|manual_review\", ");
        prompt.append("\"merges\": [[\"merged_id\", \"surviving_id\"]], ");
        prompt.append("\"groups\": [[\"id\", \"id\"]], ");
        prompt.append("\"confidence\": 0.0, ");
        prompt.append("\"notes\": \"short reason\"}\n");
        prompt.append("Only use ids from the member list.\n");

        return prompt.toString();
    }
}
