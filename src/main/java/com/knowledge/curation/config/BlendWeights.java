package com.knowledge.curation.config;

/**
 * Weights used to blend embedding and rerank similarity into a single edge score.
 */
public record BlendWeights(double embed, double rerank) {

    public BlendWeights {
        if (embed < 0 || rerank < 0) {
            throw new CurationConfigurationException("Blend weights must be non-negative");
        }
        double sum = embed + rerank;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new CurationConfigurationException("Blend weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default weights: 0.7 embedding, 0.3 rerank.
     */
    public static BlendWeights defaultWeights() {
        return new BlendWeights(0.7, 0.3);
    }

    /**
     * Blends the two scores; without a rerank score the embedding score is used as is.
     */
    public double blend(double embedScore, Double rerankScore) {
        if (rerankScore == null) {
            return embedScore;
        }
        return embed * embedScore + rerank * rerankScore;
    }
}
