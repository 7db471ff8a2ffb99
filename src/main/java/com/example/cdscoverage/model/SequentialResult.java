package com.example.cdscoverage.model;

import java.util.List;

/**
 * Payload of the "sequential" fidelity level.
 *
 * @param updatedReport   Report re-aggregated with the re-scored categories
 * @param outcomes        One outcome per category, in processing order
 * @param residualGaps    Categories that ended SKIPPED
 * @param generationCalls Generation calls made (successful or not)
 * @param generationBudget Configured call budget
 * @param targetThreshold Threshold used for Sufficient / Filled decisions
 * @param cancelled       true when the batch was cancelled mid-run
 */
public record SequentialResult(
        CoverageReport updatedReport,
        List<CategoryOutcome> outcomes,
        List<ResidualGap> residualGaps,
        int generationCalls,
        int generationBudget,
        double targetThreshold,
        boolean cancelled
) implements ModePayload {
    public SequentialResult {
        outcomes = List.copyOf(outcomes);
        residualGaps = List.copyOf(residualGaps);
    }
}
