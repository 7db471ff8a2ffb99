package com.example.cdscoverage.model;

/**
 * One row of the ranked gap list derived from a {@link CoverageReport}.
 *
 * @param categoryId   Category
 * @param priorityTier Tier of the category
 * @param currentScore Score in the source report
 * @param gapSize      max(0, threshold - currentScore)
 * @param priorityRank 1-based position: tier first, then gap size descending
 */
public record GapEntry(
        String categoryId,
        PriorityTier priorityTier,
        double currentScore,
        double gapSize,
        int priorityRank
) {
    public boolean belowThreshold() {
        return gapSize > 0.0;
    }
}
