package com.example.cdscoverage.orchestrator.mode;

import com.example.cdscoverage.model.CancellationToken;
import com.example.cdscoverage.model.FidelityLevel;
import com.example.cdscoverage.model.GuidelineDocument;
import com.example.cdscoverage.model.ModePayload;

/**
 * One rung of the fidelity ladder. Throwing any exception makes the orchestrator fall back
 * to the next lower level.
 */
public interface FidelityMode {

    FidelityLevel level();

    ModePayload execute(GuidelineDocument document, CancellationToken cancellation);
}
