package com.example.cdscoverage.model;

import java.util.List;

/**
 * Record of one (document, requested level) execution. Immutable once created.
 *
 * @param documentName   Document evaluated
 * @param requestedLevel Level asked for
 * @param fidelityLevel  Level that produced the payload (the last level attempted when failed)
 * @param executionTime  Wall-clock seconds spent across all attempted levels
 * @param success        true when a level succeeded
 * @param state          SUCCEEDED or FAILED
 * @param resultPayload  Payload of the achieved level, null when failed
 * @param fallbackFrom   Requested level when the achieved level is lower, otherwise null
 * @param fallbacks      Ordered trace of every degradation step
 * @param errorMessage   Failure description when {@code success} is false
 */
public record FidelityRun(
        String documentName,
        FidelityLevel requestedLevel,
        FidelityLevel fidelityLevel,
        double executionTime,
        boolean success,
        OrchestratorState state,
        ModePayload resultPayload,
        FidelityLevel fallbackFrom,
        List<FallbackRecord> fallbacks,
        String errorMessage
) {
    public FidelityRun {
        fallbacks = fallbacks != null ? List.copyOf(fallbacks) : List.of();
        if (executionTime < 0.0) executionTime = 0.0;
    }

    public boolean degraded() {
        return fallbackFrom != null;
    }
}
