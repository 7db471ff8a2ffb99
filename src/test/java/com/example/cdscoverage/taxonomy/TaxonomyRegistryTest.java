package com.example.cdscoverage.taxonomy;

import com.example.cdscoverage.exception.CategoryNotFoundException;
import com.example.cdscoverage.exception.InvalidCategoryException;
import com.example.cdscoverage.model.FidelityLevel;
import com.example.cdscoverage.model.MatchFeature;
import com.example.cdscoverage.model.PriorityTier;
import com.example.cdscoverage.model.UsageScenarioCategory;
import com.example.cdscoverage.support.TestFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaxonomyRegistryTest {

    private static final Map<String, Integer> POLICY = Map.of("high", 4, "medium", 5, "low", 14);

    private final TaxonomyRegistry registry = TestFixtures.REGISTRY;

    @Nested
    @DisplayName("Bundled taxonomy")
    class Bundled {

        @Test
        @DisplayName("should hold exactly 23 categories in definition order")
        void twentyThreeCategories() {
            assertThat(registry.size()).isEqualTo(TaxonomyRegistry.CATEGORY_COUNT);
            assertThat(registry.categories()).hasSize(23);
            assertThat(registry.categories().get(0).id()).isEqualTo("1.1.1");
            assertThat(registry.categoryIds()).doesNotHaveDuplicates().contains("1.1.2", "4.4.1");
        }

        @Test
        @DisplayName("should partition tiers 4 high, 5 medium, 14 low")
        void tierPartition() {
            assertThat(registry.categories()).filteredOn(c -> c.priorityTier() == PriorityTier.HIGH)
                    .extracting(UsageScenarioCategory::id)
                    .containsExactly("1.1.2", "1.1.3", "1.1.5", "1.2.1");
            assertThat(registry.categories()).filteredOn(c -> c.priorityTier() == PriorityTier.MEDIUM).hasSize(5);
            assertThat(registry.categories()).filteredOn(c -> c.priorityTier() == PriorityTier.LOW).hasSize(14);
        }

        @Test
        @DisplayName("every category should carry positive match features")
        void featuresPositive() {
            assertThat(registry.categories()).allSatisfy(c -> {
                assertThat(c.matchFeatures()).isNotEmpty();
                assertThat(c.matchFeatures()).allSatisfy(f -> assertThat(f.weight()).isPositive());
                assertThat(c.clinicalQuestion()).isNotBlank();
            });
        }

        @Test
        @DisplayName("get should return the category for a known id")
        void getKnown() {
            assertThat(registry.get("1.1.2").name()).isEqualTo(registry.categories().get(1).name());
        }

        @Test
        @DisplayName("get should throw CategoryNotFoundException for an unknown id")
        void getUnknown() {
            assertThatThrownBy(() -> registry.get("9.9.9"))
                    .isInstanceOf(CategoryNotFoundException.class)
                    .hasMessageContaining("9.9.9");
        }
    }

    @Nested
    @DisplayName("Invalid definitions")
    class Invalid {

        private List<UsageScenarioCategory> copy() {
            return new ArrayList<>(registry.categories());
        }

        private UsageScenarioCategory withFeatures(UsageScenarioCategory c, List<MatchFeature> features) {
            return new UsageScenarioCategory(c.id(), c.name(), c.displayName(), c.priorityTier(),
                    c.persona(), c.clinicalQuestion(), features);
        }

        @Test
        @DisplayName("should reject a category with zero match features")
        void zeroFeatures() {
            List<UsageScenarioCategory> categories = copy();
            categories.set(3, withFeatures(categories.get(3), List.of()));

            assertThatThrownBy(() -> new TaxonomyRegistry(new TaxonomyDefinition("t", POLICY, categories)))
                    .isInstanceOf(InvalidCategoryException.class)
                    .hasMessageContaining("no match features");
        }

        @Test
        @DisplayName("should reject a non-positive weight")
        void nonPositiveWeight() {
            List<UsageScenarioCategory> categories = copy();
            categories.set(0, withFeatures(categories.get(0), List.of(new MatchFeature("diagnosis", 0.0))));

            assertThatThrownBy(() -> new TaxonomyRegistry(new TaxonomyDefinition("t", POLICY, categories)))
                    .isInstanceOf(InvalidCategoryException.class)
                    .hasMessageContaining("non-positive weight");
        }

        @Test
        @DisplayName("should reject duplicate ids")
        void duplicateId() {
            List<UsageScenarioCategory> categories = copy();
            categories.set(22, categories.get(21));

            assertThatThrownBy(() -> new TaxonomyRegistry(new TaxonomyDefinition("t", POLICY, categories)))
                    .isInstanceOf(InvalidCategoryException.class)
                    .hasMessageContaining("Duplicate category id");
        }

        @Test
        @DisplayName("should reject a definition without exactly 23 categories")
        void wrongCount() {
            List<UsageScenarioCategory> categories = copy();
            categories.remove(22);

            assertThatThrownBy(() -> new TaxonomyRegistry(new TaxonomyDefinition("t", POLICY, categories)))
                    .isInstanceOf(InvalidCategoryException.class)
                    .hasMessageContaining("exactly 23");
        }

        @Test
        @DisplayName("should reject tier counts that disagree with the declared policy")
        void tierPolicyMismatch() {
            Map<String, Integer> policy = Map.of("high", 4, "medium", 5, "low", 9);

            assertThatThrownBy(() -> new TaxonomyRegistry(new TaxonomyDefinition("t", policy, registry.categories())))
                    .isInstanceOf(InvalidCategoryException.class)
                    .hasMessageContaining("Tier policy");
        }

        @Test
        @DisplayName("should reject a tier policy entry without a count")
        void tierPolicyNullCount() {
            Map<String, Integer> policy = new HashMap<>(POLICY);
            policy.put("high", null);

            assertThatThrownBy(() -> new TaxonomyRegistry(new TaxonomyDefinition("t", policy, registry.categories())))
                    .isInstanceOf(InvalidCategoryException.class)
                    .hasMessageContaining("non-negative");
        }

        @Test
        @DisplayName("should reject a negative tier policy count")
        void tierPolicyNegativeCount() {
            Map<String, Integer> policy = Map.of("high", -4, "medium", 5, "low", 14);

            assertThatThrownBy(() -> new TaxonomyRegistry(new TaxonomyDefinition("t", policy, registry.categories())))
                    .isInstanceOf(InvalidCategoryException.class)
                    .hasMessageContaining("non-negative");
        }

        @Test
        @DisplayName("should reject an empty definition")
        void empty() {
            assertThatThrownBy(() -> new TaxonomyRegistry(new TaxonomyDefinition("t", POLICY, List.of())))
                    .isInstanceOf(InvalidCategoryException.class);
        }
    }

    @Nested
    @DisplayName("Under a Turkish default locale")
    class TurkishLocale {

        private Locale previous;

        @BeforeEach
        void switchLocale() {
            previous = Locale.getDefault();
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        }

        @AfterEach
        void restoreLocale() {
            Locale.setDefault(previous);
        }

        @Test
        @DisplayName("should still load the bundled taxonomy with its tier policy")
        void loadsBundledTaxonomy() {
            TaxonomyRegistry loaded = TaxonomyRegistry.loadDefault();

            assertThat(loaded.size()).isEqualTo(23);
            assertThat(loaded.categories()).filteredOn(c -> c.priorityTier() == PriorityTier.HIGH).hasSize(4);
            assertThat(loaded.categories()).filteredOn(c -> c.priorityTier() == PriorityTier.MEDIUM).hasSize(5);
            assertThat(loaded.categories()).filteredOn(c -> c.priorityTier() == PriorityTier.LOW).hasSize(14);
        }

        @Test
        @DisplayName("should map wire names containing 'i' to their constants")
        void wireNames() {
            assertThat(PriorityTier.HIGH.wireName()).isEqualTo("high");
            assertThat(PriorityTier.fromWireName("medium")).isEqualTo(PriorityTier.MEDIUM);
            assertThat(PriorityTier.fromWireName("HIGH")).isEqualTo(PriorityTier.HIGH);
            assertThat(FidelityLevel.fromWireName("EVALUATION-ONLY")).contains(FidelityLevel.EVALUATION_ONLY);
        }
    }
}
