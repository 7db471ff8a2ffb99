package com.example.cdscoverage.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One scenario row of the "table" inventory: 15 descriptive fields plus the match score
 * copied from the report the row was built from.
 */
public record InventoryEntry(
        String scenarioId,
        String categoryId,
        String categoryName,
        String clinicalDomain,
        String persona,
        String priorityTier,
        String clinicalQuestion,
        String decisionPoint,
        String guidelineSource,
        String complexity,
        String fidelity,
        String testPriority,
        String tags,
        String evidenceSummary,
        String generationStatus,
        double matchScore,
        boolean synthetic
) {

    /** Names of the descriptive fields that are null or blank. */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        descriptiveFields().forEach((field, value) -> {
            if (value == null || value.isBlank()) missing.add(field);
        });
        return missing;
    }

    private Map<String, String> descriptiveFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("scenarioId", scenarioId);
        fields.put("categoryId", categoryId);
        fields.put("categoryName", categoryName);
        fields.put("clinicalDomain", clinicalDomain);
        fields.put("persona", persona);
        fields.put("priorityTier", priorityTier);
        fields.put("clinicalQuestion", clinicalQuestion);
        fields.put("decisionPoint", decisionPoint);
        fields.put("guidelineSource", guidelineSource);
        fields.put("complexity", complexity);
        fields.put("fidelity", fidelity);
        fields.put("testPriority", testPriority);
        fields.put("tags", tags);
        fields.put("evidenceSummary", evidenceSummary);
        fields.put("generationStatus", generationStatus);
        return fields;
    }
}
