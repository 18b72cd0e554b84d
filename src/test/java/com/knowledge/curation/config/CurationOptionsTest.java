package com.knowledge.curation.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CurationOptions Tests")
class CurationOptionsTest {

    @Nested
    @DisplayName("Presets")
    class Presets {

        @Test
        @DisplayName("Defaults match the documented thresholds")
        void defaults() {
            CurationOptions options = CurationOptions.defaults();

            assertEquals(0.72, options.getEdgeKeepThreshold());
            assertEquals(0.98, options.getAutoDedupThreshold());
            assertEquals(0.92, options.getHighBucketThreshold());
            assertEquals(0.75, options.getMediumBucketThreshold());
            assertEquals(0.55, options.getLowBucketThreshold());
            assertEquals(50, options.getTopKNeighbors());
            assertEquals(10, options.getMaxIterations());
            assertEquals(0.05, options.getMinImprovementRate());
            assertEquals(42L, options.getCommunitySeed());
            assertEquals(50, options.getMaxCommunitySize());
            assertEquals(0.85, options.getLlmConfidenceThreshold());
            assertEquals(BlendWeights.defaultWeights(), options.getBlendWeights());
            assertFalse(options.isDryRun());
        }

        @Test
        @DisplayName("Conservative preset raises every bucket")
        void conservative() {
            CurationOptions options = CurationOptions.conservative();

            assertEquals(0.99, options.getAutoDedupThreshold());
            assertEquals(0.95, options.getHighBucketThreshold());
            assertEquals(0.85, options.getMediumBucketThreshold());
            assertEquals(0.70, options.getLowBucketThreshold());
            assertEquals(0.92, options.getLlmConfidenceThreshold());
        }

        @Test
        @DisplayName("builder(existing) copies all values")
        void copyBuilder() {
            CurationOptions original = CurationOptions.builder()
                    .maxIterations(4)
                    .llmRetryBackoff(Duration.ofMillis(10))
                    .dryRun(true)
                    .build();

            CurationOptions copy = CurationOptions.builder(original).topKNeighbors(5).build();

            assertEquals(4, copy.getMaxIterations());
            assertEquals(Duration.ofMillis(10), copy.getLlmRetryBackoff());
            assertTrue(copy.isDryRun());
            assertEquals(5, copy.getTopKNeighbors());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Unordered bucket thresholds are rejected, never clamped")
        void rejectsUnorderedThresholds() {
            assertThrows(CurationConfigurationException.class, () ->
                    CurationOptions.builder().autoDedupThreshold(0.90).highBucketThreshold(0.92).build());
            assertThrows(CurationConfigurationException.class, () ->
                    CurationOptions.builder().highBucketThreshold(0.70).mediumBucketThreshold(0.75).build());
            assertThrows(CurationConfigurationException.class, () ->
                    CurationOptions.builder().mediumBucketThreshold(0.50).lowBucketThreshold(0.55).build());
        }

        @Test
        @DisplayName("Equal thresholds are allowed")
        void allowsEqualThresholds() {
            CurationOptions options = CurationOptions.builder()
                    .autoDedupThreshold(0.9).highBucketThreshold(0.9)
                    .mediumBucketThreshold(0.9).lowBucketThreshold(0.9)
                    .build();

            assertEquals(0.9, options.getLowBucketThreshold());
        }

        @Test
        @DisplayName("Thresholds outside [0, 1] are rejected")
        void rejectsOutOfRange() {
            assertThrows(CurationConfigurationException.class, () ->
                    CurationOptions.builder().autoDedupThreshold(1.2).build());
            assertThrows(CurationConfigurationException.class, () ->
                    CurationOptions.builder().lowBucketThreshold(-0.1).build());
            assertThrows(CurationConfigurationException.class, () ->
                    CurationOptions.builder().edgeKeepThreshold(Double.NaN).build());
        }

        @Test
        @DisplayName("Non-positive counts are rejected")
        void rejectsBadCounts() {
            assertThrows(CurationConfigurationException.class, () ->
                    CurationOptions.builder().topKNeighbors(0).build());
            assertThrows(CurationConfigurationException.class, () ->
                    CurationOptions.builder().maxIterations(0).build());
            assertThrows(CurationConfigurationException.class, () ->
                    CurationOptions.builder().maxCommunitySize(1).build());
            assertThrows(CurationConfigurationException.class, () ->
                    CurationOptions.builder().llmMaxRetries(-1).build());
            assertThrows(CurationConfigurationException.class, () ->
                    CurationOptions.builder().llmRetryBackoff(Duration.ofMillis(-5)).build());
        }
    }

    @Nested
    @DisplayName("BlendWeights")
    class Weights {

        @Test
        @DisplayName("Weights must sum to one")
        void mustSumToOne() {
            assertThrows(CurationConfigurationException.class, () -> new BlendWeights(0.5, 0.3));
            assertThrows(CurationConfigurationException.class, () -> new BlendWeights(1.2, -0.2));
        }

        @Test
        @DisplayName("Blend falls back to the embedding score without rerank")
        void blend() {
            BlendWeights weights = new BlendWeights(0.7, 0.3);

            assertEquals(0.8, weights.blend(0.8, null), 1e-9);
            assertEquals(0.7 * 0.8 + 0.3 * 0.6, weights.blend(0.8, 0.6), 1e-9);
        }
    }
}
