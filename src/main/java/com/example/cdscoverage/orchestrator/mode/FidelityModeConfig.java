package com.example.cdscoverage.orchestrator.mode;

import com.example.cdscoverage.config.CoverageProperties;
import com.example.cdscoverage.generation.GenerationGateway;
import com.example.cdscoverage.scoring.CoverageAggregator;
import com.example.cdscoverage.scoring.GapAnalyzer;
import com.example.cdscoverage.taxonomy.TaxonomyRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The two generation-backed levels share one implementation and differ only in the FHIR flag.
 */
@Configuration
public class FidelityModeConfig {

    @Bean
    public FidelityMode fullFhirMode(TaxonomyRegistry registry, CoverageAggregator aggregator,
                                     GapAnalyzer gapAnalyzer, GenerationGateway generationGateway,
                                     CoverageProperties properties) {
        return new FullGenerationMode(true, registry, aggregator, gapAnalyzer, generationGateway,
                properties.generation().maxScenarios());
    }

    @Bean
    public FidelityMode fullMode(TaxonomyRegistry registry, CoverageAggregator aggregator,
                                 GapAnalyzer gapAnalyzer, GenerationGateway generationGateway,
                                 CoverageProperties properties) {
        return new FullGenerationMode(false, registry, aggregator, gapAnalyzer, generationGateway,
                properties.generation().maxScenarios());
    }
}
