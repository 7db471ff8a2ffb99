package com.example.cdscoverage.model;

/**
 * Constraints passed to the generation collaborator.
 *
 * @param maxScenarios    Upper bound of scenarios per call
 * @param includeFhir     Ask for FHIR resources alongside the Gherkin text
 * @param targetThreshold Coverage target the scenarios should help reach
 * @param clinicalDomain  Domain of the source guideline
 */
public record GenerationConstraints(
        int maxScenarios,
        boolean includeFhir,
        double targetThreshold,
        String clinicalDomain
) {}
