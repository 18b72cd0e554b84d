package com.knowledge.curation.decision;

import com.knowledge.curation.config.CurationOptions;

import java.util.Locale;

/**
 * Similarity buckets, from auto-merge down to ignored.
 */
public enum Bucket {
    AUTO,
    HIGH,
    MEDIUM,
    LOW,
    IGNORED;

    /**
     * Classifies a score against the configured thresholds (lower bounds are inclusive).
     */
    public static Bucket classify(double score, CurationOptions options) {
        if (score >= options.getAutoDedupThreshold()) {
            return AUTO;
        }
        if (score >= options.getHighBucketThreshold()) {
            return HIGH;
        }
        if (score >= options.getMediumBucketThreshold()) {
            return MEDIUM;
        }
        if (score >= options.getLowBucketThreshold()) {
            return LOW;
        }
        return IGNORED;
    }

    /**
     * Parses a bucket name case-insensitively.
     */
    public static Bucket fromName(String name) {
        return Bucket.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
