package com.knowledge.curation.config;

import java.time.Duration;

/**
 * Options for curation runs.
 * Configures thresholds, neighbor search, community detection, LLM adjudication and halting.
 */
public class CurationOptions {

    private static final double DEFAULT_EDGE_KEEP_THRESHOLD = 0.72;
    private static final double DEFAULT_AUTO_DEDUP_THRESHOLD = 0.98;
    private static final double DEFAULT_HIGH_BUCKET_THRESHOLD = 0.92;
    private static final double DEFAULT_MEDIUM_BUCKET_THRESHOLD = 0.75;
    private static final double DEFAULT_LOW_BUCKET_THRESHOLD = 0.55;
    private static final int DEFAULT_TOP_K_NEIGHBORS = 50;
    private static final int DEFAULT_MAX_ITERATIONS = 10;
    private static final double DEFAULT_MIN_IMPROVEMENT_RATE = 0.05;
    private static final long DEFAULT_COMMUNITY_SEED = 42L;
    private static final double DEFAULT_COMMUNITY_RESOLUTION = 1.0;
    private static final int DEFAULT_MAX_COMMUNITY_SIZE = 50;
    private static final double DEFAULT_LLM_CONFIDENCE_THRESHOLD = 0.85;
    private static final Duration DEFAULT_LLM_RETRY_BACKOFF = Duration.ofSeconds(1);

    private final double edgeKeepThreshold;
    private final double autoDedupThreshold;
    private final double highBucketThreshold;
    private final double mediumBucketThreshold;
    private final double lowBucketThreshold;
    private final int topKNeighbors;
    private final int maxIterations;
    private final double minImprovementRate;
    private final BlendWeights blendWeights;
    private final long communitySeed;
    private final double communityResolution;
    private final int maxCommunitySize;
    private final boolean processOversized;
    private final int maxCommunitiesPerRound;
    private final double llmConfidenceThreshold;
    private final int llmMaxRetries;
    private final Duration llmRetryBackoff;
    private final boolean includeBorderline;
    private final boolean dryRun;

    private CurationOptions(Builder builder) {
        this.edgeKeepThreshold = builder.edgeKeepThreshold;
        this.autoDedupThreshold = builder.autoDedupThreshold;
        this.highBucketThreshold = builder.highBucketThreshold;
        this.mediumBucketThreshold = builder.mediumBucketThreshold;
        this.lowBucketThreshold = builder.lowBucketThreshold;
        this.topKNeighbors = builder.topKNeighbors;
        this.maxIterations = builder.maxIterations;
        this.minImprovementRate = builder.minImprovementRate;
        this.blendWeights = builder.blendWeights;
        this.communitySeed = builder.communitySeed;
        this.communityResolution = builder.communityResolution;
        this.maxCommunitySize = builder.maxCommunitySize;
        this.processOversized = builder.processOversized;
        this.maxCommunitiesPerRound = builder.maxCommunitiesPerRound;
        this.llmConfidenceThreshold = builder.llmConfidenceThreshold;
        this.llmMaxRetries = builder.llmMaxRetries;
        this.llmRetryBackoff = builder.llmRetryBackoff;
        this.includeBorderline = builder.includeBorderline;
        this.dryRun = builder.dryRun;
    }

    public double getEdgeKeepThreshold() {
        return edgeKeepThreshold;
    }

    public double getAutoDedupThreshold() {
        return autoDedupThreshold;
    }

    public double getHighBucketThreshold() {
        return highBucketThreshold;
    }

    public double getMediumBucketThreshold() {
        return mediumBucketThreshold;
    }

    public double getLowBucketThreshold() {
        return lowBucketThreshold;
    }

    public int getTopKNeighbors() {
        return topKNeighbors;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getMinImprovementRate() {
        return minImprovementRate;
    }

    public BlendWeights getBlendWeights() {
        return blendWeights;
    }

    public long getCommunitySeed() {
        return communitySeed;
    }

    public double getCommunityResolution() {
        return communityResolution;
    }

    public int getMaxCommunitySize() {
        return maxCommunitySize;
    }

    public boolean isProcessOversized() {
        return processOversized;
    }

    /**
     * Maximum number of communities adjudicated per round; 0 means unlimited.
     */
    public int getMaxCommunitiesPerRound() {
        return maxCommunitiesPerRound;
    }

    public double getLlmConfidenceThreshold() {
        return llmConfidenceThreshold;
    }

    public int getLlmMaxRetries() {
        return llmMaxRetries;
    }

    public Duration getLlmRetryBackoff() {
        return llmRetryBackoff;
    }

    public boolean isIncludeBorderline() {
        return includeBorderline;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /**
     * Creates default options.
     */
    public static CurationOptions defaults() {
        return builder().build();
    }

    /**
     * Creates conservative options (higher thresholds, stricter LLM confidence).
     */
    public static CurationOptions conservative() {
        return builder()
                .autoDedupThreshold(0.99)
                .highBucketThreshold(0.95)
                .mediumBucketThreshold(0.85)
                .lowBucketThreshold(0.70)
                .llmConfidenceThreshold(0.92)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(CurationOptions options) {
        return new Builder()
                .edgeKeepThreshold(options.edgeKeepThreshold)
                .autoDedupThreshold(options.autoDedupThreshold)
                .highBucketThreshold(options.highBucketThreshold)
                .mediumBucketThreshold(options.mediumBucketThreshold)
                .lowBucketThreshold(options.lowBucketThreshold)
                .topKNeighbors(options.topKNeighbors)
                .maxIterations(options.maxIterations)
                .minImprovementRate(options.minImprovementRate)
                .blendWeights(options.blendWeights)
                .communitySeed(options.communitySeed)
                .communityResolution(options.communityResolution)
                .maxCommunitySize(options.maxCommunitySize)
                .processOversized(options.processOversized)
                .maxCommunitiesPerRound(options.maxCommunitiesPerRound)
                .llmConfidenceThreshold(options.llmConfidenceThreshold)
                .llmMaxRetries(options.llmMaxRetries)
                .llmRetryBackoff(options.llmRetryBackoff)
                .includeBorderline(options.includeBorderline)
                .dryRun(options.dryRun);
    }

    public static class Builder {
        private double edgeKeepThreshold = DEFAULT_EDGE_KEEP_THRESHOLD;
        private double autoDedupThreshold = DEFAULT_AUTO_DEDUP_THRESHOLD;
        private double highBucketThreshold = DEFAULT_HIGH_BUCKET_THRESHOLD;
        private double mediumBucketThreshold = DEFAULT_MEDIUM_BUCKET_THRESHOLD;
        private double lowBucketThreshold = DEFAULT_LOW_BUCKET_THRESHOLD;
        private int topKNeighbors = DEFAULT_TOP_K_NEIGHBORS;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private double minImprovementRate = DEFAULT_MIN_IMPROVEMENT_RATE;
        private BlendWeights blendWeights = BlendWeights.defaultWeights();
        private long communitySeed = DEFAULT_COMMUNITY_SEED;
        private double communityResolution = DEFAULT_COMMUNITY_RESOLUTION;
        private int maxCommunitySize = DEFAULT_MAX_COMMUNITY_SIZE;
        private boolean processOversized = false;
        private int maxCommunitiesPerRound = 0;
        private double llmConfidenceThreshold = DEFAULT_LLM_CONFIDENCE_THRESHOLD;
        private int llmMaxRetries = 0;
        private Duration llmRetryBackoff = DEFAULT_LLM_RETRY_BACKOFF;
        private boolean includeBorderline = false;
        private boolean dryRun = false;

        public Builder edgeKeepThreshold(double edgeKeepThreshold) {
            this.edgeKeepThreshold = edgeKeepThreshold;
            return this;
        }

        public Builder autoDedupThreshold(double autoDedupThreshold) {
            this.autoDedupThreshold = autoDedupThreshold;
            return this;
        }

        public Builder highBucketThreshold(double highBucketThreshold) {
            this.highBucketThreshold = highBucketThreshold;
            return this;
        }

        public Builder mediumBucketThreshold(double mediumBucketThreshold) {
            this.mediumBucketThreshold = mediumBucketThreshold;
            return this;
        }

        public Builder lowBucketThreshold(double lowBucketThreshold) {
            this.lowBucketThreshold = lowBucketThreshold;
            return this;
        }

        public Builder topKNeighbors(int topKNeighbors) {
            this.topKNeighbors = topKNeighbors;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder minImprovementRate(double minImprovementRate) {
            this.minImprovementRate = minImprovementRate;
            return this;
        }

        public Builder blendWeights(BlendWeights blendWeights) {
            this.blendWeights = blendWeights;
            return this;
        }

        public Builder communitySeed(long communitySeed) {
            this.communitySeed = communitySeed;
            return this;
        }

        public Builder communityResolution(double communityResolution) {
            this.communityResolution = communityResolution;
            return this;
        }

        public Builder maxCommunitySize(int maxCommunitySize) {
            this.maxCommunitySize = maxCommunitySize;
            return this;
        }

        public Builder processOversized(boolean processOversized) {
            this.processOversized = processOversized;
            return this;
        }

        public Builder maxCommunitiesPerRound(int maxCommunitiesPerRound) {
            this.maxCommunitiesPerRound = maxCommunitiesPerRound;
            return this;
        }

        public Builder llmConfidenceThreshold(double llmConfidenceThreshold) {
            this.llmConfidenceThreshold = llmConfidenceThreshold;
            return this;
        }

        public Builder llmMaxRetries(int llmMaxRetries) {
            this.llmMaxRetries = llmMaxRetries;
            return this;
        }

        public Builder llmRetryBackoff(Duration llmRetryBackoff) {
            this.llmRetryBackoff = llmRetryBackoff;
            return this;
        }

        public Builder includeBorderline(boolean includeBorderline) {
            this.includeBorderline = includeBorderline;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        /**
         * Builds the options.
         *
         * @throws CurationConfigurationException if a value is out of range or the
         *                                        bucket thresholds are not ordered
         */
        public CurationOptions build() {
            validateThreshold(edgeKeepThreshold, "edgeKeepThreshold");
            validateThreshold(autoDedupThreshold, "autoDedupThreshold");
            validateThreshold(highBucketThreshold, "highBucketThreshold");
            validateThreshold(mediumBucketThreshold, "mediumBucketThreshold");
            validateThreshold(lowBucketThreshold, "lowBucketThreshold");
            validateThreshold(llmConfidenceThreshold, "llmConfidenceThreshold");
            validateThreshold(minImprovementRate, "minImprovementRate");

            if (autoDedupThreshold < highBucketThreshold) {
                throw new CurationConfigurationException(
                        "autoDedupThreshold must be >= highBucketThreshold");
            }
            if (highBucketThreshold < mediumBucketThreshold) {
                throw new CurationConfigurationException(
                        "highBucketThreshold must be >= mediumBucketThreshold");
            }
            if (mediumBucketThreshold < lowBucketThreshold) {
                throw new CurationConfigurationException(
                        "mediumBucketThreshold must be >= lowBucketThreshold");
            }
            if (topKNeighbors <= 0) {
                throw new CurationConfigurationException("topKNeighbors must be positive");
            }
            if (maxIterations <= 0) {
                throw new CurationConfigurationException("maxIterations must be positive");
            }
            if (maxCommunitySize < 2) {
                throw new CurationConfigurationException("maxCommunitySize must be at least 2");
            }
            if (maxCommunitiesPerRound < 0) {
                throw new CurationConfigurationException("maxCommunitiesPerRound must be >= 0");
            }
            if (communityResolution <= 0) {
                throw new CurationConfigurationException("communityResolution must be positive");
            }
            if (llmMaxRetries < 0) {
                throw new CurationConfigurationException("llmMaxRetries must be >= 0");
            }
            if (blendWeights == null) {
                throw new CurationConfigurationException("blendWeights is required");
            }
            if (llmRetryBackoff == null || llmRetryBackoff.isNegative()) {
                throw new CurationConfigurationException("llmRetryBackoff must be a non-negative duration");
            }
            return new CurationOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new CurationConfigurationException(name + " must be between 0.0 and 1.0, got " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "CurationOptions{" +
                "edgeKeepThreshold=" + edgeKeepThreshold +
                ", autoDedupThreshold=" + autoDedupThreshold +
                ", highBucketThreshold=" + highBucketThreshold +
                ", mediumBucketThreshold=" + mediumBucketThreshold +
                ", lowBucketThreshold=" + lowBucketThreshold +
                ", topKNeighbors=" + topKNeighbors +
                ", maxIterations=" + maxIterations +
                ", minImprovementRate=" + minImprovementRate +
                ", blendWeights=" + blendWeights +
                ", communitySeed=" + communitySeed +
                ", maxCommunitySize=" + maxCommunitySize +
                ", processOversized=" + processOversized +
                ", maxCommunitiesPerRound=" + maxCommunitiesPerRound +
                ", llmConfidenceThreshold=" + llmConfidenceThreshold +
                ", llmMaxRetries=" + llmMaxRetries +
                ", dryRun=" + dryRun +
                '}';
    }
}
