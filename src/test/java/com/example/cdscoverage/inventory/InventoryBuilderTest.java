package com.example.cdscoverage.inventory;

import com.example.cdscoverage.model.*;
import com.example.cdscoverage.scoring.CoverageAggregator;
import com.example.cdscoverage.scoring.ScenarioMatcher;
import com.example.cdscoverage.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static com.example.cdscoverage.support.TestFixtures.document;
import static org.assertj.core.api.Assertions.assertThat;

class InventoryBuilderTest {

    private final CoverageAggregator aggregator =
            new CoverageAggregator(TestFixtures.REGISTRY, new ScenarioMatcher());

    private InventoryResult build(InventoryBuilder builder, GuidelineDocument document) {
        return builder.build(document, aggregator.evaluate(document));
    }

    @Nested
    @DisplayName("Matched categories")
    class Matched {

        private final InventoryBuilder builder = new InventoryBuilder(TestFixtures.REGISTRY,
                TestFixtures.propertiesWithSyntheticTiers(Set.of()));

        @Test
        @DisplayName("should emit one row per category with a positive score")
        void oneRowPerMatchedCategory() {
            GuidelineDocument doc = document("afib", TestFixtures.AFIB_GUIDELINE);
            CoverageReport report = aggregator.evaluate(doc);
            long matched = report.scores().values().stream().filter(s -> s.score() > 0).count();

            InventoryResult result = builder.build(doc, report);

            assertThat(result.entries()).hasSize((int) matched);
            assertThat(result.entries()).noneMatch(InventoryEntry::synthetic);
            assertThat(result.syntheticEntries()).isZero();
        }

        @Test
        @DisplayName("rows should be fully populated and quote the guideline")
        void completeRows() {
            InventoryResult result = build(builder, document("afib", TestFixtures.AFIB_GUIDELINE));

            assertThat(result.status()).isEqualTo(ModeStatus.SUCCESS);
            assertThat(result.completionRate()).isEqualTo(1.0);
            InventoryEntry medication = result.entries().stream()
                    .filter(e -> e.categoryId().equals("1.1.3"))
                    .findFirst().orElseThrow();
            assertThat(medication.missingFields()).isEmpty();
            assertThat(medication.scenarioId()).isEqualTo("afib-1.1.3");
            assertThat(medication.testPriority()).isEqualTo("P1");
            assertThat(medication.complexity()).isEqualTo("expert");
            assertThat(medication.decisionPoint()).contains("Medication dosage");
            assertThat(medication.generationStatus()).isEqualTo("CANDIDATE");
        }

        @Test
        @DisplayName("a document without a domain tag should yield PARTIAL_SUCCESS")
        void partialSuccess() {
            GuidelineDocument doc = GuidelineDocument.of("afib", TestFixtures.AFIB_GUIDELINE, "");

            InventoryResult result = build(builder, doc);

            assertThat(result.status()).isEqualTo(ModeStatus.PARTIAL_SUCCESS);
            assertThat(result.completionRate()).isLessThan(0.95);
            assertThat(result.entries()).allSatisfy(e -> assertThat(e.missingFields()).contains("clinicalDomain"));
        }

        @Test
        @DisplayName("an empty document without synthetic tiers should produce no rows and count as complete")
        void emptyDocument() {
            InventoryResult result = build(builder, document("empty", ""));

            assertThat(result.entries()).isEmpty();
            assertThat(result.completionRate()).isEqualTo(1.0);
            assertThat(result.status()).isEqualTo(ModeStatus.SUCCESS);
        }
    }

    @Nested
    @DisplayName("Synthetic rows")
    class Synthetic {

        @Test
        @DisplayName("should add a placeholder for every zero-score category by default")
        void allTiers() {
            InventoryBuilder builder = new InventoryBuilder(TestFixtures.REGISTRY, TestFixtures.properties());

            InventoryResult result = build(builder, document("empty", ""));

            assertThat(result.entries()).hasSize(23).allMatch(InventoryEntry::synthetic);
            assertThat(result.syntheticEntries()).isEqualTo(23);
            assertThat(result.entries().get(0).scenarioId()).endsWith("-S");
            assertThat(result.entries().get(0).generationStatus()).isEqualTo("PENDING_GENERATION");
        }

        @Test
        @DisplayName("should restrict placeholders to the configured tiers")
        void highOnly() {
            InventoryBuilder builder = new InventoryBuilder(TestFixtures.REGISTRY,
                    TestFixtures.propertiesWithSyntheticTiers(EnumSet.of(PriorityTier.HIGH)));

            InventoryResult result = build(builder, document("empty", ""));

            assertThat(result.entries()).hasSize(4);
            assertThat(result.entries()).extracting(InventoryEntry::priorityTier).containsOnly("high");
        }
    }
}
