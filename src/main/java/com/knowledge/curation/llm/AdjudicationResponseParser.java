package com.knowledge.curation.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.curation.community.UnionFind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Strict parser for adjudicator replies.
 *
 * <p>Expected shape:</p>
 * <pre>
 * {
 *   "decision": "merge_all" | "merge_subset" | "keep_separate" | "split" | "manual_review",
 *   "merges": [["sourceId", "targetId"], ...],
 *   "groups": [["a", "b"], ["c", "d"]],
 *   "canonical_id": "targetId",
 *   "confidence": 0.93,
 *   "notes": "why"
 * }
 * </pre>
 * Merge pairs point from the merged item to the surviving one. Any reply that is not JSON,
 * names an unknown decision or references ids outside the community is rejected with
 * {@link AmbiguousDecisionException}.
 */
public class AdjudicationResponseParser {
    private static final Logger log = LoggerFactory.getLogger(AdjudicationResponseParser.class);

    private final ObjectMapper objectMapper;

    public AdjudicationResponseParser() {
        this.objectMapper = new ObjectMapper();
    }

    public AdjudicationDecision parse(String raw, List<String> allowedIds) {
        if (raw == null || raw.isBlank()) {
            throw new AmbiguousDecisionException("Empty reply", raw);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(raw));
        } catch (JsonProcessingException e) {
            throw new AmbiguousDecisionException("Reply is not valid JSON: " + e.getOriginalMessage(), raw, e);
        }
        if (root == null || !root.isObject()) {
            throw new AmbiguousDecisionException("Reply is not a JSON object", raw);
        }

        String decision = root.path("decision").asText("");
        double confidence = parseConfidence(root, raw);
        String rationale = firstText(root, "notes", "rationale", "reasoning");
        Set<String> allowed = new HashSet<>(allowedIds);

        AdjudicationDecision result = switch (decision) {
            case "merge_all" -> parseMergeAll(root, allowedIds, allowed, rationale, confidence, raw);
            case "merge_subset" -> parseMergeSubset(root, allowed, rationale, confidence, raw);
            case "keep_separate" -> AdjudicationDecision.keepSeparate(rationale, confidence);
            case "split" -> AdjudicationDecision.split(parseGroups(root, allowed, raw), rationale, confidence);
            case "manual_review" -> AdjudicationDecision.manualReview(
                    rationale != null ? rationale : "adjudicator requested manual review");
            default -> throw new AmbiguousDecisionException("Invalid decision '" + decision + "'", raw);
        };
        log.debug("llm.reply.parsed decision={} groups={} confidence={}",
                result.kind(), result.groups(), result.confidence());
        return result.withRawReply(raw);
    }

    private AdjudicationDecision parseMergeAll(JsonNode root, List<String> allowedIds, Set<String> allowed,
                                               String rationale, double confidence, String raw) {
        String canonical = root.hasNonNull("canonical_id") ? root.get("canonical_id").asText() : null;
        if (root.has("merges")) {
            List<String[]> pairs = parsePairs(root, allowed, raw);
            List<List<String>> groups = group(pairs);
            if (groups.size() != 1 || groups.get(0).size() != allowedIds.size()) {
                throw new AmbiguousDecisionException("merge_all pairs do not cover the whole community", raw);
            }
            if (canonical == null) {
                canonical = targetOf(pairs, groups.get(0));
            }
        }
        if (canonical != null && !allowed.contains(canonical)) {
            throw new AmbiguousDecisionException("Unknown canonical id " + canonical, raw);
        }
        return AdjudicationDecision.merge(allowedIds, canonical, rationale, confidence);
    }

    private AdjudicationDecision parseMergeSubset(JsonNode root, Set<String> allowed,
                                                  String rationale, double confidence, String raw) {
        if (!root.has("merges")) {
            throw new AmbiguousDecisionException("Missing 'merges' for merge decision", raw);
        }
        List<String[]> pairs = parsePairs(root, allowed, raw);
        List<List<String>> groups = group(pairs);
        List<String> targets = new ArrayList<>();
        for (List<String> group : groups) {
            targets.add(targetOf(pairs, group));
        }
        return AdjudicationDecision.mergeSubset(groups, targets, rationale, confidence);
    }

    private List<String[]> parsePairs(JsonNode root, Set<String> allowed, String raw) {
        JsonNode merges = root.get("merges");
        if (!merges.isArray() || merges.isEmpty()) {
            throw new AmbiguousDecisionException("Empty 'merges' for merge decision", raw);
        }
        List<String[]> pairs = new ArrayList<>();
        for (JsonNode pair : merges) {
            if (!pair.isArray() || pair.size() != 2) {
                throw new AmbiguousDecisionException("Invalid merge pair shape: " + pair, raw);
            }
            String source = pair.get(0).asText();
            String target = pair.get(1).asText();
            if (!allowed.contains(source) || !allowed.contains(target)) {
                throw new AmbiguousDecisionException("Merge pair contains unknown id: " + pair, raw);
            }
            if (source.equals(target)) {
                throw new AmbiguousDecisionException("Merge pair merges an item into itself: " + pair, raw);
            }
            pairs.add(new String[]{source, target});
        }
        return pairs;
    }

    private List<List<String>> parseGroups(JsonNode root, Set<String> allowed, String raw) {
        JsonNode groups = root.path("groups");
        if (!groups.isArray() || groups.isEmpty()) {
            throw new AmbiguousDecisionException("Missing 'groups' for split decision", raw);
        }
        Set<String> seen = new HashSet<>();
        List<List<String>> result = new ArrayList<>();
        for (JsonNode group : groups) {
            if (!group.isArray() || group.isEmpty()) {
                throw new AmbiguousDecisionException("Invalid split group: " + group, raw);
            }
            List<String> members = new ArrayList<>();
            for (JsonNode id : group) {
                String value = id.asText();
                if (!allowed.contains(value)) {
                    throw new AmbiguousDecisionException("Split group contains unknown id: " + value, raw);
                }
                if (!seen.add(value)) {
                    throw new AmbiguousDecisionException("Item " + value + " appears in two split groups", raw);
                }
                members.add(value);
            }
            result.add(members);
        }
        return result;
    }

    private double parseConfidence(JsonNode root, String raw) {
        JsonNode node = root.get("confidence");
        if (node == null || node.isNull()) {
            return 1.0;
        }
        if (!node.isNumber()) {
            throw new AmbiguousDecisionException("Confidence is not a number: " + node, raw);
        }
        double confidence = node.asDouble();
        if (confidence < 0.0 || confidence > 1.0) {
            throw new AmbiguousDecisionException("Confidence out of range: " + confidence, raw);
        }
        return confidence;
    }

    private static List<List<String>> group(List<String[]> pairs) {
        UnionFind unionFind = new UnionFind();
        for (String[] pair : pairs) {
            unionFind.union(pair[0], pair[1]);
        }
        return unionFind.groups();
    }

    /**
     * The single item of the group that is a merge target but never a merge source, if any.
     */
    private static String targetOf(List<String[]> pairs, List<String> group) {
        Set<String> sources = new HashSet<>();
        Set<String> targets = new LinkedHashSet<>();
        for (String[] pair : pairs) {
            if (group.contains(pair[0])) {
                sources.add(pair[0]);
                targets.add(pair[1]);
            }
        }
        targets.removeAll(sources);
        return targets.size() == 1 ? targets.iterator().next() : null;
    }

    private static String firstText(JsonNode root, String... fields) {
        for (String field : fields) {
            JsonNode node = root.get(field);
            if (node != null && node.isTextual() && !node.asText().isBlank()) {
                return node.asText();
            }
        }
        return null;
    }

    static String stripCodeFence(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }
}
