package com.example.cdscoverage.model;

/**
 * Scenario proposed by the generation collaborator.
 *
 * @param scenarioId Identifier assigned by the collaborator
 * @param categoryId Category the scenario targets
 * @param title      Feature title
 * @param gherkin    Given/When/Then text
 * @param fhirBundle Serialized FHIR resources, present only when requested
 */
public record CandidateScenario(
        String scenarioId,
        String categoryId,
        String title,
        String gherkin,
        String fhirBundle
) {
    /** Text appended to the guideline when re-scoring a category. */
    public String asText() {
        StringBuilder sb = new StringBuilder();
        if (title != null) sb.append(title).append('\n');
        if (gherkin != null) sb.append(gherkin);
        return sb.toString().trim();
    }
}
