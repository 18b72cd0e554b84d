package com.knowledge.curation.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Loads {@link CurationOptions} from a YAML document.
 *
 * <p>Only the {@code curation} section is read; keys that are absent keep their defaults.</p>
 * <pre>
 * curation:
 *   thresholds:
 *     edge_keep: 0.72
 *     auto_dedup: 0.98
 *     high: 0.92
 *     medium: 0.75
 *     low: 0.55
 *   top_k: 50
 *   blend_weights:
 *     embed: 0.7
 *     rerank: 0.3
 *   max_iterations: 10
 *   min_improvement_rate: 0.05
 *   max_community_size: 50
 * </pre>
 */
public class CurationConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(CurationConfigLoader.class);

    private final ObjectMapper yamlMapper;

    public CurationConfigLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    public CurationOptions load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new CurationConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            CurationOptions options = load(in);
            log.info("config.loaded path={}", path);
            return options;
        } catch (IOException e) {
            throw new CurationConfigurationException("Failed to read configuration " + path, e);
        }
    }

    public CurationOptions load(InputStream in) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(in);
        } catch (IOException e) {
            throw new CurationConfigurationException("Malformed YAML configuration: " + e.getMessage(), e);
        }
        return fromTree(root);
    }

    /**
     * Overlays the {@code curation} section of an already parsed document onto the defaults.
     */
    public CurationOptions fromTree(JsonNode root) {
        CurationOptions.Builder builder = CurationOptions.builder();
        if (root == null || root.isMissingNode() || root.isNull()) {
            return builder.build();
        }
        JsonNode cur = root.path("curation");
        if (cur.isMissingNode()) {
            log.warn("config.section-missing section=curation usingDefaults=true");
            return builder.build();
        }

        JsonNode thresholds = cur.path("thresholds");
        JsonNode legacyEdgeKeep = cur.path("min_similarity_threshold");
        if (thresholds.has("edge_keep")) {
            builder.edgeKeepThreshold(number(thresholds, "edge_keep"));
        } else if (!legacyEdgeKeep.isMissingNode()) {
            builder.edgeKeepThreshold(number(cur, "min_similarity_threshold"));
        }
        if (thresholds.has("auto_dedup")) {
            builder.autoDedupThreshold(number(thresholds, "auto_dedup"));
        }
        if (thresholds.has("high")) {
            builder.highBucketThreshold(number(thresholds, "high"));
        }
        if (thresholds.has("medium")) {
            builder.mediumBucketThreshold(number(thresholds, "medium"));
        }
        if (thresholds.has("low")) {
            builder.lowBucketThreshold(number(thresholds, "low"));
        }
        if (thresholds.has("llm_confidence")) {
            builder.llmConfidenceThreshold(number(thresholds, "llm_confidence"));
        }

        if (cur.has("top_k")) {
            builder.topKNeighbors(integer(cur, "top_k"));
        }
        JsonNode weights = cur.path("blend_weights");
        if (!weights.isMissingNode()) {
            builder.blendWeights(new BlendWeights(number(weights, "embed"), number(weights, "rerank")));
        }
        if (cur.has("max_iterations")) {
            builder.maxIterations(integer(cur, "max_iterations"));
        }
        if (cur.has("min_improvement_rate")) {
            builder.minImprovementRate(number(cur, "min_improvement_rate"));
        }
        if (cur.has("max_community_size")) {
            builder.maxCommunitySize(integer(cur, "max_community_size"));
        }
        if (cur.has("process_oversized")) {
            builder.processOversized(cur.get("process_oversized").asBoolean());
        }
        if (cur.has("max_communities_per_round")) {
            builder.maxCommunitiesPerRound(integer(cur, "max_communities_per_round"));
        }
        if (cur.has("community_seed")) {
            builder.communitySeed(cur.get("community_seed").asLong());
        }
        if (cur.has("llm_max_retries")) {
            builder.llmMaxRetries(integer(cur, "llm_max_retries"));
        }
        if (cur.has("llm_retry_backoff_ms")) {
            builder.llmRetryBackoff(Duration.ofMillis(cur.get("llm_retry_backoff_ms").asLong()));
        }
        if (cur.has("dry_run")) {
            builder.dryRun(cur.get("dry_run").asBoolean());
        }
        return builder.build();
    }

    private double number(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isNumber()) {
            throw new CurationConfigurationException("Expected a number for '" + field + "', got " + value);
        }
        return value.asDouble();
    }

    private int integer(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new CurationConfigurationException("Expected an integer for '" + field + "', got " + value);
        }
        return value.asInt();
    }
}
