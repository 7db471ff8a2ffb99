package com.example.cdscoverage.scoring;

import com.example.cdscoverage.model.CoverageReport;
import com.example.cdscoverage.model.GuidelineDocument;
import com.example.cdscoverage.model.RobustnessScore;
import com.example.cdscoverage.model.UsageScenarioCategory;
import com.example.cdscoverage.taxonomy.TaxonomyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Runs the matcher across the whole taxonomy and assembles the coverage report.
 * Every registry category is present in the result; unmatched categories carry 0.0.
 */
@Service
public class CoverageAggregator {

    private static final Logger log = LoggerFactory.getLogger(CoverageAggregator.class);

    private final TaxonomyRegistry registry;
    private final ScenarioMatcher matcher;

    public CoverageAggregator(TaxonomyRegistry registry, ScenarioMatcher matcher) {
        this.registry = registry;
        this.matcher = matcher;
    }

    /**
     * Scores the document against every category (one matcher call each).
     *
     * @param document guideline to evaluate
     * @return report keyed by every registry category id
     */
    public CoverageReport evaluate(GuidelineDocument document) {
        String text = document.sourceText();
        boolean blank = text == null || text.isBlank();
        String lowerCase = blank ? "" : text.toLowerCase(Locale.ROOT);

        Map<String, RobustnessScore> scores = new LinkedHashMap<>();
        for (UsageScenarioCategory category : registry.categories()) {
            scores.put(category.id(), blank
                    ? RobustnessScore.zero(category.id(), "Empty document text")
                    : matcher.score(lowerCase, category));
        }

        CoverageReport report = assemble(document.name(), scores);
        log.info("Coverage of '{}': overall {} ({} of {} categories matched)",
                document.name(), "%.3f".formatted(report.overallCoverage()),
                report.scores().values().stream().filter(s -> s.score() > 0.0).count(),
                report.scores().size());
        return report;
    }

    /**
     * Re-aggregates a score map into a report, enforcing that its keys are exactly the
     * registry's category set. Scores are reordered to registry order.
     *
     * @throws IllegalStateException if a category is missing or an unknown one is present
     */
    public CoverageReport assemble(String documentName, Map<String, RobustnessScore> scores) {
        Set<String> expected = registry.categoryIds();
        if (!scores.keySet().equals(expected)) {
            Set<String> missing = new HashSet<>(expected);
            missing.removeAll(scores.keySet());
            Set<String> extra = new HashSet<>(scores.keySet());
            extra.removeAll(expected);
            throw new IllegalStateException("Coverage report for '%s' does not match the taxonomy (missing=%s, extra=%s)"
                    .formatted(documentName, missing, extra));
        }
        Map<String, RobustnessScore> ordered = new LinkedHashMap<>();
        for (UsageScenarioCategory category : registry.categories()) {
            ordered.put(category.id(), scores.get(category.id()));
        }
        return CoverageReport.from(documentName, ordered);
    }
}
