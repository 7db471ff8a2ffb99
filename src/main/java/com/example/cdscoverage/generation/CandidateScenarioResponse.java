package com.example.cdscoverage.generation;

import com.example.cdscoverage.model.CandidateScenario;

import java.util.List;

/**
 * Wrapper for parsing the LLM response.
 */
public record CandidateScenarioResponse(
        List<CandidateScenario> scenarios
) {}
