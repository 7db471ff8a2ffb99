package com.example.cdscoverage.model;

import java.util.List;

/**
 * Clinical decision extracted from guideline prose.
 *
 * @param action          Recommended action (e.g. "anticoagulation with DOAC")
 * @param patientCriteria Conditions the action applies to
 * @param context         Surrounding text
 */
public record DecisionPoint(
        String action,
        List<String> patientCriteria,
        String context
) {
    public DecisionPoint {
        patientCriteria = List.copyOf(patientCriteria);
    }
}
