package com.example.cdscoverage.generation;

import com.example.cdscoverage.exception.GenerationException;
import com.example.cdscoverage.model.CandidateScenario;
import com.example.cdscoverage.model.GenerationConstraints;
import com.example.cdscoverage.model.GuidelineDocument;
import com.example.cdscoverage.model.UsageScenarioCategory;

import java.util.List;

/**
 * External scenario generation collaborator. The engine treats it as a black box.
 */
public interface ScenarioGenerator {

    /**
     * Proposes test scenarios for one category of one guideline.
     *
     * @return candidate scenarios, never empty on success
     * @throws GenerationException if no scenario could be produced
     */
    List<CandidateScenario> generate(GuidelineDocument document,
                                     UsageScenarioCategory category,
                                     GenerationConstraints constraints);
}
