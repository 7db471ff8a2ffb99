package com.example.cdscoverage.model;

import java.util.Map;

/**
 * Payload of the "full" and "full-fhir" fidelity levels.
 *
 * @param updatedReport        Report re-aggregated over the document plus every generated scenario
 * @param scenariosPerCategory categoryId → number of generated scenarios
 * @param totalScenarios       Sum of generated scenarios
 * @param fhirBundles          Scenarios carrying a FHIR bundle
 * @param fhirRequested        true for "full-fhir"
 */
public record GenerationSummary(
        CoverageReport updatedReport,
        Map<String, Integer> scenariosPerCategory,
        int totalScenarios,
        int fhirBundles,
        boolean fhirRequested
) implements ModePayload {}
