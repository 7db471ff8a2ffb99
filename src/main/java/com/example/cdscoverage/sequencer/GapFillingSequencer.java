package com.example.cdscoverage.sequencer;

import com.example.cdscoverage.config.CoverageProperties;
import com.example.cdscoverage.exception.GenerationException;
import com.example.cdscoverage.exception.GenerationTimeoutException;
import com.example.cdscoverage.generation.GenerationGateway;
import com.example.cdscoverage.model.*;
import com.example.cdscoverage.scoring.CoverageAggregator;
import com.example.cdscoverage.scoring.GapAnalyzer;
import com.example.cdscoverage.scoring.ScenarioMatcher;
import com.example.cdscoverage.taxonomy.TaxonomyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Gap-filling sequencer ("sequential" fidelity level).
 * <p>
 * Walks the categories in priority-rank order. Per category:
 * PENDING → EVALUATING → SUFFICIENT → FILLED when the score already clears the threshold, or
 * PENDING → EVALUATING → NEEDS_GENERATION → FILLED/SKIPPED after one generation call and a
 * re-score against the document augmented with the generated scenarios.
 * <p>
 * Generation failures and timeouts skip the category and never abort the run. When a category
 * needs generation and the budget is spent, the run stops: that category and every remaining one
 * are skipped with {@link SkipReason#BUDGET_EXHAUSTED}. Cancellation is checked before each
 * category and skips the rest with {@link SkipReason#CANCELLED}.
 */
@Service
public class GapFillingSequencer {

    private static final Logger log = LoggerFactory.getLogger(GapFillingSequencer.class);

    private final TaxonomyRegistry registry;
    private final ScenarioMatcher matcher;
    private final CoverageAggregator aggregator;
    private final GapAnalyzer gapAnalyzer;
    private final GenerationGateway generationGateway;
    private final CoverageProperties properties;

    public GapFillingSequencer(TaxonomyRegistry registry,
                               ScenarioMatcher matcher,
                               CoverageAggregator aggregator,
                               GapAnalyzer gapAnalyzer,
                               GenerationGateway generationGateway,
                               CoverageProperties properties) {
        this.registry = registry;
        this.matcher = matcher;
        this.aggregator = aggregator;
        this.gapAnalyzer = gapAnalyzer;
        this.generationGateway = generationGateway;
        this.properties = properties;
    }

    public SequentialResult run(GuidelineDocument document, CoverageReport report, CancellationToken cancellation) {
        double threshold = gapAnalyzer.targetThreshold();
        int budget = properties.generation().budget();
        List<GapEntry> order = gapAnalyzer.rank(report, threshold);
        GenerationConstraints constraints = new GenerationConstraints(
                properties.generation().maxScenarios(), false, threshold, document.domainTag());

        log.info("Gap filling for '{}': {} categories, {} below threshold {}, budget {} calls",
                document.name(), order.size(),
                order.stream().filter(GapEntry::belowThreshold).count(), threshold, budget);

        Map<String, RobustnessScore> updatedScores = new LinkedHashMap<>(report.scores());
        List<CategoryOutcome> outcomes = new ArrayList<>(order.size());
        int calls = 0;
        SkipReason haltReason = null;

        for (GapEntry entry : order) {
            String step = "[" + entry.priorityRank() + "/" + order.size() + "]";
            List<GapFillState> transitions = new ArrayList<>();
            transitions.add(GapFillState.PENDING);

            if (haltReason == null && cancellation.isCancelled()) {
                log.warn("{} Batch cancelled, remaining categories are skipped", step);
                haltReason = SkipReason.CANCELLED;
            }
            if (haltReason != null) {
                outcomes.add(skipped(entry, entry.currentScore(), transitions, haltReason,
                        haltDetail(haltReason), 0));
                continue;
            }

            transitions.add(GapFillState.EVALUATING);
            if (!entry.belowThreshold()) {
                transitions.add(GapFillState.SUFFICIENT);
                transitions.add(GapFillState.FILLED);
                log.debug("{} {} sufficient ({})", step, entry.categoryId(), entry.currentScore());
                outcomes.add(new CategoryOutcome(entry.categoryId(), entry.priorityRank(),
                        entry.currentScore(), entry.currentScore(), GapFillState.FILLED,
                        transitions, null, "Score already meets the threshold", 0));
                continue;
            }

            transitions.add(GapFillState.NEEDS_GENERATION);
            if (calls >= budget) {
                log.warn("{} Generation budget of {} calls spent, stopping at {}",
                        step, budget, entry.categoryId());
                haltReason = SkipReason.BUDGET_EXHAUSTED;
                outcomes.add(skipped(entry, entry.currentScore(), transitions, haltReason,
                        haltDetail(haltReason), 0));
                continue;
            }

            calls++;
            UsageScenarioCategory category = registry.get(entry.categoryId());
            log.info("{} Generating scenarios for {} (score {} < {})",
                    step, category.id(), entry.currentScore(), threshold);
            try {
                List<CandidateScenario> scenarios = generationGateway.generate(document, category, constraints);
                String generatedText = scenarios.stream()
                        .map(CandidateScenario::asText)
                        .collect(Collectors.joining("\n\n"));
                RobustnessScore rescored = matcher.score(document.withAppendedText(generatedText), category);
                updatedScores.put(category.id(), rescored);

                if (rescored.score() >= threshold) {
                    transitions.add(GapFillState.FILLED);
                    log.info("{} {} filled: {} → {}", step, category.id(), entry.currentScore(), rescored.score());
                    outcomes.add(new CategoryOutcome(category.id(), entry.priorityRank(), entry.currentScore(),
                            rescored.score(), GapFillState.FILLED, transitions, null,
                            rescored.rationale(), scenarios.size()));
                } else {
                    log.info("{} {} still below threshold after generation: {}",
                            step, category.id(), rescored.score());
                    outcomes.add(skipped(entry, rescored.score(), transitions, SkipReason.BELOW_THRESHOLD,
                            rescored.rationale(), scenarios.size()));
                }
            } catch (GenerationTimeoutException e) {
                log.warn("{} {} skipped: {}", step, category.id(), e.getMessage());
                outcomes.add(skipped(entry, entry.currentScore(), transitions,
                        SkipReason.GENERATION_TIMEOUT, e.getMessage(), 0));
            } catch (GenerationException e) {
                log.warn("{} {} skipped: {}", step, category.id(), e.getMessage());
                outcomes.add(skipped(entry, entry.currentScore(), transitions,
                        SkipReason.GENERATION_FAILED, e.getMessage(), 0));
            }
        }

        CoverageReport updatedReport = aggregator.assemble(report.documentName(), updatedScores);
        List<ResidualGap> residualGaps = outcomes.stream()
                .filter(o -> o.finalState() == GapFillState.SKIPPED)
                .map(o -> new ResidualGap(o.categoryId(), o.finalScore(),
                        Math.max(0.0, threshold - o.finalScore()), o.skipReason(), o.detail()))
                .toList();

        log.info("Gap filling for '{}' done: {} filled, {} residual gaps, {} generation calls, coverage {} → {}",
                document.name(), outcomes.size() - residualGaps.size(), residualGaps.size(), calls,
                report.overallCoverage(), updatedReport.overallCoverage());

        return new SequentialResult(updatedReport, outcomes, residualGaps, calls, budget, threshold,
                haltReason == SkipReason.CANCELLED);
    }

    private static CategoryOutcome skipped(GapEntry entry, double finalScore, List<GapFillState> transitions,
                                           SkipReason reason, String detail, int scenarios) {
        transitions.add(GapFillState.SKIPPED);
        return new CategoryOutcome(entry.categoryId(), entry.priorityRank(), entry.currentScore(),
                finalScore, GapFillState.SKIPPED, transitions, reason, detail, scenarios);
    }

    private static String haltDetail(SkipReason reason) {
        return reason == SkipReason.CANCELLED
                ? "Batch cancelled before this category was evaluated"
                : "Generation budget exhausted";
    }
}
