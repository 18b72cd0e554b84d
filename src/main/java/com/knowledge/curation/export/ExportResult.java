package com.knowledge.curation.export;

/**
 * Result of a curated export.
 *
 * @param canonicalItems active items written
 * @param rejectedItems  rejected items written (only with {@code includeRejected})
 * @param decisions      decision records written
 */
public record ExportResult(
        long canonicalItems,
        long rejectedItems,
        long decisions
) {
    @Override
    public String toString() {
        return "ExportResult{items=" + canonicalItems +
                ", rejected=" + rejectedItems +
                ", decisions=" + decisions + '}';
    }
}
