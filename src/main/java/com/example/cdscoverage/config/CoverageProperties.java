package com.example.cdscoverage.config;

import com.example.cdscoverage.model.FidelityLevel;
import com.example.cdscoverage.model.PriorityTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for the coverage engine.
 * Absent values get their default; a value that is present but out of range fails startup.
 *
 * @param targetThreshold  Score a category must reach to count as covered (default 0.5)
 * @param taxonomyLocation Resource holding the taxonomy definition
 * @param outputDir        Directory receiving the batch reports
 * @param generation       Scenario generation settings
 * @param inventory        "table" level settings
 * @param batch            Batch runner settings
 * @param pdfService       External PDF text extraction service
 * @param guidelines       Catalog of known guidelines, keyed by document identifier
 */
@ConfigurationProperties(prefix = "coverage")
public record CoverageProperties(
        Double targetThreshold,
        String taxonomyLocation,
        String outputDir,
        Generation generation,
        Inventory inventory,
        Batch batch,
        PdfService pdfService,
        Map<String, Guideline> guidelines
) {

    public CoverageProperties {
        if (targetThreshold == null) targetThreshold = 0.5;
        if (!(targetThreshold > 0.0 && targetThreshold <= 1.0)) {
            throw invalid("target-threshold", "must be in (0, 1]", targetThreshold);
        }
        if (taxonomyLocation == null || taxonomyLocation.isBlank()) {
            taxonomyLocation = "classpath:taxonomy/cds-usage-scenarios.json";
        }
        if (outputDir == null || outputDir.isBlank()) outputDir = "generated/fidelity-reports";
        if (generation == null) generation = new Generation(null, null, null, null, null);
        if (inventory == null) inventory = new Inventory(null, null);
        if (batch == null) batch = new Batch(null, null);
        if (pdfService == null) pdfService = new PdfService(null);
        guidelines = guidelines != null ? Map.copyOf(guidelines) : Map.of();
    }

    private static IllegalArgumentException invalid(String key, String constraint, Object value) {
        return new IllegalArgumentException("coverage.%s %s, got %s".formatted(key, constraint, value));
    }

    /**
     * Scenario generation settings.
     *
     * @param budget       Maximum generation calls per sequential run (default 23, one per category; 0 disables generation)
     * @param timeout      Per-call time limit (default 30s)
     * @param maxScenarios Scenarios requested per call (default 3)
     * @param maxRetries   LLM retries after the first attempt (default 2)
     * @param retryDelay   Base back-off between LLM attempts, multiplied by the attempt number (default 2s)
     */
    public record Generation(Integer budget, Duration timeout, Integer maxScenarios, Integer maxRetries,
                             Duration retryDelay) {
        public Generation {
            if (budget == null) budget = 23;
            if (timeout == null) timeout = Duration.ofSeconds(30);
            if (maxScenarios == null) maxScenarios = 3;
            if (maxRetries == null) maxRetries = 2;
            if (retryDelay == null) retryDelay = Duration.ofSeconds(2);
            if (budget < 0) throw invalid("generation.budget", "must not be negative", budget);
            if (timeout.isZero() || timeout.isNegative()) {
                throw invalid("generation.timeout", "must be positive", timeout);
            }
            if (maxScenarios < 1) throw invalid("generation.max-scenarios", "must be at least 1", maxScenarios);
            if (maxRetries < 0) throw invalid("generation.max-retries", "must not be negative", maxRetries);
            if (retryDelay.isNegative()) throw invalid("generation.retry-delay", "must not be negative", retryDelay);
        }
    }

    /**
     * "table" level settings.
     *
     * @param completionThreshold Share of fully populated rows required for SUCCESS (default 0.95)
     * @param syntheticTiers      Tiers whose zero-score categories get a synthetic row (default all)
     */
    public record Inventory(Double completionThreshold, Set<PriorityTier> syntheticTiers) {
        public Inventory {
            if (completionThreshold == null) completionThreshold = 0.95;
            if (!(completionThreshold > 0.0 && completionThreshold <= 1.0)) {
                throw invalid("inventory.completion-threshold", "must be in (0, 1]", completionThreshold);
            }
            syntheticTiers = syntheticTiers != null
                    ? (syntheticTiers.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(syntheticTiers)))
                    : Set.copyOf(EnumSet.allOf(PriorityTier.class));
        }
    }

    /**
     * Batch runner settings.
     *
     * @param concurrency   Worker threads for (document, level) pairs (default 4)
     * @param defaultLevels Levels run when the command does not name any
     */
    public record Batch(Integer concurrency, List<FidelityLevel> defaultLevels) {
        public Batch {
            if (concurrency == null) concurrency = 4;
            if (concurrency < 1) throw invalid("batch.concurrency", "must be at least 1", concurrency);
            defaultLevels = defaultLevels != null && !defaultLevels.isEmpty()
                    ? List.copyOf(defaultLevels)
                    : List.of(FidelityLevel.EVALUATION_ONLY, FidelityLevel.TABLE,
                    FidelityLevel.SEQUENTIAL, FidelityLevel.FULL);
        }
    }

    /**
     * Configuration for the PDF extraction service.
     *
     * @param baseUrl base URL of the service (e.g. http://localhost:5001)
     */
    public record PdfService(String baseUrl) {
        public PdfService {
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://localhost:5001";
        }
    }

    /**
     * Catalog entry of a known guideline.
     *
     * @param path   File holding the guideline (.txt, .md or .pdf)
     * @param name   Display name
     * @param domain Clinical domain; detected from the text when blank
     */
    public record Guideline(String path, String name, String domain) {}
}
