package com.example.cdscoverage.model;

import java.util.List;

/**
 * Payload of the "draft" fidelity level: structure of the guideline without scoring.
 */
public record DraftSummary(
        String documentName,
        String detectedDomain,
        int characterCount,
        List<DecisionPoint> decisionPoints
) implements ModePayload {
    public DraftSummary {
        decisionPoints = List.copyOf(decisionPoints);
    }
}
