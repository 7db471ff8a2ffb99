package com.example.cdscoverage.model;

import java.util.List;

/**
 * Final state of one category after a sequential run.
 *
 * @param categoryId         Category
 * @param priorityRank       Position in the processing order
 * @param initialScore       Score before gap filling
 * @param finalScore         Score after re-scoring (equal to the initial score when not re-scored)
 * @param finalState         FILLED or SKIPPED
 * @param transitions        States traversed, starting with PENDING
 * @param skipReason         Reason when skipped, otherwise null
 * @param detail             Free-text note (failure message, re-score result)
 * @param scenariosGenerated Candidate scenarios returned for this category
 */
public record CategoryOutcome(
        String categoryId,
        int priorityRank,
        double initialScore,
        double finalScore,
        GapFillState finalState,
        List<GapFillState> transitions,
        SkipReason skipReason,
        String detail,
        int scenariosGenerated
) {
    public CategoryOutcome {
        transitions = List.copyOf(transitions);
    }
}
