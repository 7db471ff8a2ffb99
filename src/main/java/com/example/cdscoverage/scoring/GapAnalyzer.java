package com.example.cdscoverage.scoring;

import com.example.cdscoverage.config.CoverageProperties;
import com.example.cdscoverage.model.CoverageReport;
import com.example.cdscoverage.model.GapEntry;
import com.example.cdscoverage.model.UsageScenarioCategory;
import com.example.cdscoverage.taxonomy.TaxonomyRegistry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Derives the ranked gap list of a coverage report.
 * The list is recomputed on every call and never cached: it is a view of its source report.
 */
@Service
public class GapAnalyzer {

    private final TaxonomyRegistry registry;
    private final double targetThreshold;

    public GapAnalyzer(TaxonomyRegistry registry, CoverageProperties properties) {
        this.registry = registry;
        this.targetThreshold = properties.targetThreshold();
    }

    public double targetThreshold() {
        return targetThreshold;
    }

    /** All categories ranked with the configured threshold. */
    public List<GapEntry> rank(CoverageReport report) {
        return rank(report, targetThreshold);
    }

    /**
     * Ranks every category: HIGH tier first, then larger gap first, then registry order.
     */
    public List<GapEntry> rank(CoverageReport report, double threshold) {
        List<Row> rows = new ArrayList<>();
        List<UsageScenarioCategory> categories = registry.categories();
        for (int i = 0; i < categories.size(); i++) {
            UsageScenarioCategory category = categories.get(i);
            double score = report.scoreOf(category.id());
            rows.add(new Row(category, i, score, Math.max(0.0, threshold - score)));
        }

        rows.sort(Comparator
                .comparing((Row r) -> r.category().priorityTier().ordinal())
                .thenComparing(Row::gap, Comparator.reverseOrder())
                .thenComparingInt(Row::registryIndex));

        List<GapEntry> ranked = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Row row = rows.get(i);
            ranked.add(new GapEntry(row.category().id(), row.category().priorityTier(),
                    row.score(), row.gap(), i + 1));
        }
        return List.copyOf(ranked);
    }

    /** Only the categories below the configured threshold, in rank order. */
    public List<GapEntry> gaps(CoverageReport report) {
        return rank(report).stream().filter(GapEntry::belowThreshold).toList();
    }

    private record Row(UsageScenarioCategory category, int registryIndex, double score, double gap) {}
}
