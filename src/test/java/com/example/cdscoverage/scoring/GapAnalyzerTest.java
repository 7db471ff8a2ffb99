package com.example.cdscoverage.scoring;

import com.example.cdscoverage.model.CoverageReport;
import com.example.cdscoverage.model.GapEntry;
import com.example.cdscoverage.model.PriorityTier;
import com.example.cdscoverage.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.cdscoverage.support.TestFixtures.document;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GapAnalyzerTest {

    private final CoverageAggregator aggregator =
            new CoverageAggregator(TestFixtures.REGISTRY, new ScenarioMatcher());
    private final GapAnalyzer analyzer = new GapAnalyzer(TestFixtures.REGISTRY, TestFixtures.properties());

    @Test
    @DisplayName("should rank HIGH before MEDIUM before LOW with 1-based ranks")
    void tierOrder() {
        List<GapEntry> ranked = analyzer.rank(aggregator.evaluate(document("empty", "")));

        assertThat(ranked).hasSize(23);
        assertThat(ranked).extracting(GapEntry::priorityRank)
                .containsExactlyElementsOf(java.util.stream.IntStream.rangeClosed(1, 23).boxed().toList());
        assertThat(ranked.subList(0, 4)).allSatisfy(e -> assertThat(e.priorityTier()).isEqualTo(PriorityTier.HIGH));
        assertThat(ranked.subList(4, 9)).allSatisfy(e -> assertThat(e.priorityTier()).isEqualTo(PriorityTier.MEDIUM));
        assertThat(ranked.subList(9, 23)).allSatisfy(e -> assertThat(e.priorityTier()).isEqualTo(PriorityTier.LOW));
    }

    @Test
    @DisplayName("should put the larger gap first within a tier and fall back to registry order")
    void gapOrderWithinTier() {
        // 1.1.2 and 1.1.5 are partially covered, 1.1.3 and 1.2.1 not at all
        CoverageReport report = aggregator.evaluate(document("g", "Therapy options. Imaging first."));

        List<GapEntry> high = analyzer.rank(report).subList(0, 4);

        assertThat(high).extracting(GapEntry::categoryId).containsExactly("1.1.3", "1.2.1", "1.1.2", "1.1.5");
        assertThat(high.get(0).gapSize()).isCloseTo(0.5, within(1e-9));
        assertThat(high.get(2).gapSize()).isCloseTo(0.3, within(1e-9));
    }

    @Test
    @DisplayName("gaps should keep only categories below the threshold")
    void gapsOnlyBelowThreshold() {
        CoverageReport report = aggregator.evaluate(document("afib", TestFixtures.AFIB_GUIDELINE));

        List<GapEntry> gaps = analyzer.gaps(report);

        assertThat(gaps).allSatisfy(g -> assertThat(g.currentScore()).isLessThan(0.5));
        assertThat(gaps).extracting(GapEntry::categoryId).doesNotContain("1.1.2", "1.1.3", "1.1.5", "1.2.1");
        assertThat(analyzer.targetThreshold()).isEqualTo(0.5);
    }
}
