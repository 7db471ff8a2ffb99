package com.example.cdscoverage.model;

import java.util.List;

/**
 * Score of one document against one category. A new evaluation produces a new instance.
 *
 * @param categoryId      Category the score refers to
 * @param score           Normalized score in [0, 1]
 * @param matchedFeatures Phrases that fired, in feature order
 * @param rationale       Short explanation of the score
 */
public record RobustnessScore(
        String categoryId,
        double score,
        List<String> matchedFeatures,
        String rationale
) {
    public RobustnessScore {
        if (Double.isNaN(score) || score < 0.0) score = 0.0;
        if (score > 1.0) score = 1.0;
        matchedFeatures = matchedFeatures != null ? List.copyOf(matchedFeatures) : List.of();
    }

    public static RobustnessScore zero(String categoryId, String rationale) {
        return new RobustnessScore(categoryId, 0.0, List.of(), rationale);
    }
}
