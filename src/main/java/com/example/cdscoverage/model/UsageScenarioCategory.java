package com.example.cdscoverage.model;

import java.util.List;

/**
 * One CDS usage-scenario category of the coverage taxonomy.
 * Plain tagged data: every category is an instance of this record, never a subclass.
 *
 * @param id               Stable key (e.g. "1.1.2")
 * @param name             Snake-case slug (e.g. "treatment_recommendation")
 * @param displayName      Human-readable name
 * @param priorityTier     HIGH / MEDIUM / LOW
 * @param persona          Clinical persona asking the question
 * @param clinicalQuestion The decision the category supports (e.g. "What treatment should I order?")
 * @param matchFeatures    Ordered weighted signals used by the matcher
 */
public record UsageScenarioCategory(
        String id,
        String name,
        String displayName,
        PriorityTier priorityTier,
        String persona,
        String clinicalQuestion,
        List<MatchFeature> matchFeatures
) {
    public UsageScenarioCategory {
        matchFeatures = matchFeatures != null ? List.copyOf(matchFeatures) : List.of();
    }

    /** Maximum attainable weight, i.e. the score denominator. */
    public double totalWeight() {
        return matchFeatures.stream().mapToDouble(MatchFeature::weight).sum();
    }
}
