package com.example.cdscoverage.orchestrator.mode;

import com.example.cdscoverage.exception.FidelityLevelException;
import com.example.cdscoverage.exception.GenerationException;
import com.example.cdscoverage.generation.GenerationGateway;
import com.example.cdscoverage.model.*;
import com.example.cdscoverage.scoring.CoverageAggregator;
import com.example.cdscoverage.scoring.GapAnalyzer;
import com.example.cdscoverage.taxonomy.TaxonomyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * "full" and "full-fhir": generates scenarios for every category, then re-evaluates the document
 * augmented with all of them. Any generation failure fails the level; "full-fhir" additionally
 * fails when a scenario comes back without FHIR resources.
 * <p>
 * Instantiated twice by {@link FidelityModeConfig}, once per level.
 */
public class FullGenerationMode implements FidelityMode {

    private static final Logger log = LoggerFactory.getLogger(FullGenerationMode.class);

    private final FidelityLevel level;
    private final boolean includeFhir;
    private final TaxonomyRegistry registry;
    private final CoverageAggregator aggregator;
    private final GapAnalyzer gapAnalyzer;
    private final GenerationGateway generationGateway;
    private final int maxScenarios;

    public FullGenerationMode(boolean includeFhir,
                              TaxonomyRegistry registry,
                              CoverageAggregator aggregator,
                              GapAnalyzer gapAnalyzer,
                              GenerationGateway generationGateway,
                              int maxScenarios) {
        this.level = includeFhir ? FidelityLevel.FULL_FHIR : FidelityLevel.FULL;
        this.includeFhir = includeFhir;
        this.registry = registry;
        this.aggregator = aggregator;
        this.gapAnalyzer = gapAnalyzer;
        this.generationGateway = generationGateway;
        this.maxScenarios = maxScenarios;
    }

    @Override
    public FidelityLevel level() {
        return level;
    }

    @Override
    public ModePayload execute(GuidelineDocument document, CancellationToken cancellation) {
        GenerationConstraints constraints = new GenerationConstraints(
                maxScenarios, includeFhir, gapAnalyzer.targetThreshold(), document.domainTag());
        List<UsageScenarioCategory> categories = registry.categories();

        Map<String, Integer> perCategory = new LinkedHashMap<>();
        List<CandidateScenario> all = new ArrayList<>();
        int step = 0;
        for (UsageScenarioCategory category : categories) {
            step++;
            if (cancellation.isCancelled()) {
                throw new FidelityLevelException(level, "Batch cancelled after " + (step - 1)
                        + " of " + categories.size() + " categories");
            }
            List<CandidateScenario> scenarios;
            try {
                scenarios = generationGateway.generate(document, category, constraints);
            } catch (GenerationException e) {
                throw new FidelityLevelException(level,
                        "Generation failed for category " + category.id() + ": " + e.getMessage(), e);
            }
            if (includeFhir) {
                scenarios.stream()
                        .filter(s -> s.fhirBundle() == null || s.fhirBundle().isBlank())
                        .findFirst()
                        .ifPresent(s -> {
                            throw new FidelityLevelException(level, "Scenario " + s.scenarioId()
                                    + " of category " + category.id() + " has no FHIR resources");
                        });
            }
            log.debug("[{}/{}] {}: {} scenarios", step, categories.size(), category.id(), scenarios.size());
            perCategory.put(category.id(), scenarios.size());
            all.addAll(scenarios);
        }

        String generatedText = all.stream()
                .map(CandidateScenario::asText)
                .collect(Collectors.joining("\n\n"));
        CoverageReport updated = aggregator.evaluate(document.withAppendedText(generatedText));
        int fhirBundles = (int) all.stream()
                .filter(s -> s.fhirBundle() != null && !s.fhirBundle().isBlank())
                .count();

        log.info("{} generation for '{}': {} scenarios, coverage {}",
                level, document.name(), all.size(), updated.overallCoverage());
        return new GenerationSummary(updated, perCategory, all.size(), fhirBundles, includeFhir);
    }
}
