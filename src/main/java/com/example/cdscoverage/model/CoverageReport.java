package com.example.cdscoverage.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores of one document against every taxonomy category.
 * The key set of {@code scores} is exactly the registry's category set, in registry order.
 *
 * @param documentName    Evaluated document
 * @param scores          categoryId → score, unmatched categories carry 0.0
 * @param overallCoverage Mean of all scores
 * @param timestamp       Evaluation time
 */
public record CoverageReport(
        String documentName,
        Map<String, RobustnessScore> scores,
        double overallCoverage,
        LocalDateTime timestamp
) implements ModePayload {

    public CoverageReport {
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    /**
     * Builds a report computing the overall coverage as the mean of the given scores.
     */
    public static CoverageReport from(String documentName, Map<String, RobustnessScore> scores) {
        double overall = scores.values().stream()
                .mapToDouble(RobustnessScore::score)
                .average()
                .orElse(0.0);
        return new CoverageReport(documentName, scores, overall, LocalDateTime.now());
    }

    public double scoreOf(String categoryId) {
        RobustnessScore score = scores.get(categoryId);
        return score != null ? score.score() : 0.0;
    }
}
