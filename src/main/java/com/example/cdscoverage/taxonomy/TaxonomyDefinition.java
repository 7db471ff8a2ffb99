package com.example.cdscoverage.taxonomy;

import com.example.cdscoverage.model.UsageScenarioCategory;

import java.util.List;
import java.util.Map;

/**
 * Static taxonomy definition as stored in {@code taxonomy/cds-usage-scenarios.json}.
 *
 * @param version    Definition version, reported alongside every batch
 * @param tierPolicy Expected number of categories per tier ("high", "medium", "low")
 * @param categories Categories in registry order
 */
public record TaxonomyDefinition(
        String version,
        Map<String, Integer> tierPolicy,
        List<UsageScenarioCategory> categories
) {}
