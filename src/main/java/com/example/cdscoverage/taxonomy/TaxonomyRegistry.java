package com.example.cdscoverage.taxonomy;

import com.example.cdscoverage.config.AiConfig;
import com.example.cdscoverage.config.CoverageProperties;
import com.example.cdscoverage.exception.CategoryNotFoundException;
import com.example.cdscoverage.exception.InvalidCategoryException;
import com.example.cdscoverage.model.MatchFeature;
import com.example.cdscoverage.model.PriorityTier;
import com.example.cdscoverage.model.UsageScenarioCategory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable catalog of the CDS usage-scenario categories.
 * <p>
 * Loaded once at startup from the static definition; every check that can reject the
 * definition runs here, so a bad taxonomy stops the application before any evaluation.
 * Read-only afterwards and safe to share across threads without synchronization.
 */
@Service
public class TaxonomyRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaxonomyRegistry.class);

    /** Number of categories fixed by policy. */
    public static final int CATEGORY_COUNT = 23;

    public static final String DEFAULT_LOCATION = "classpath:taxonomy/cds-usage-scenarios.json";

    private final String version;
    private final List<UsageScenarioCategory> categories;
    private final Map<String, UsageScenarioCategory> byId;

    @Autowired
    public TaxonomyRegistry(CoverageProperties properties, ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this(read(resourceLoader.getResource(properties.taxonomyLocation()), objectMapper));
    }

    public TaxonomyRegistry(TaxonomyDefinition definition) {
        validate(definition);
        this.version = definition.version() != null ? definition.version() : "unversioned";
        this.categories = List.copyOf(definition.categories());
        Map<String, UsageScenarioCategory> index = new LinkedHashMap<>();
        categories.forEach(c -> index.put(c.id(), c));
        this.byId = Collections.unmodifiableMap(index);
        log.info("Taxonomy {} loaded: {} categories ({} high, {} medium, {} low)",
                version, categories.size(),
                countTier(categories, PriorityTier.HIGH),
                countTier(categories, PriorityTier.MEDIUM),
                countTier(categories, PriorityTier.LOW));
    }

    /** Registry built from the bundled definition. */
    public static TaxonomyRegistry loadDefault() {
        Resource resource = new DefaultResourceLoader().getResource(DEFAULT_LOCATION);
        return new TaxonomyRegistry(read(resource, AiConfig.createObjectMapper()));
    }

    public List<UsageScenarioCategory> categories() {
        return categories;
    }

    public UsageScenarioCategory get(String id) {
        UsageScenarioCategory category = byId.get(id);
        if (category == null) {
            throw new CategoryNotFoundException(id);
        }
        return category;
    }

    public Set<String> categoryIds() {
        return byId.keySet();
    }

    public String version() {
        return version;
    }

    public int size() {
        return categories.size();
    }

    // ═══════════════════════════════════════════════════
    // Loading and validation
    // ═══════════════════════════════════════════════════

    static TaxonomyDefinition read(Resource resource, ObjectMapper objectMapper) {
        if (!resource.exists()) {
            throw new InvalidCategoryException("Taxonomy definition not found: " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, TaxonomyDefinition.class);
        } catch (IOException e) {
            throw new InvalidCategoryException(
                    "Unable to parse taxonomy definition " + resource.getDescription() + ": " + e.getMessage(), e);
        }
    }

    private static void validate(TaxonomyDefinition definition) {
        if (definition == null || definition.categories() == null || definition.categories().isEmpty()) {
            throw new InvalidCategoryException("Taxonomy definition has no categories");
        }
        List<UsageScenarioCategory> categories = definition.categories();
        if (categories.size() != CATEGORY_COUNT) {
            throw new InvalidCategoryException("Taxonomy must define exactly %d categories, found %d"
                    .formatted(CATEGORY_COUNT, categories.size()));
        }

        Map<String, UsageScenarioCategory> seen = new LinkedHashMap<>();
        for (UsageScenarioCategory category : categories) {
            if (category.id() == null || category.id().isBlank()) {
                throw new InvalidCategoryException("Category without id: " + category.displayName());
            }
            if (seen.put(category.id(), category) != null) {
                throw new InvalidCategoryException("Duplicate category id: " + category.id());
            }
            if (category.priorityTier() == null) {
                throw new InvalidCategoryException("Category %s has no priority tier".formatted(category.id()));
            }
            if (category.matchFeatures().isEmpty()) {
                throw new InvalidCategoryException("Category %s has no match features".formatted(category.id()));
            }
            for (MatchFeature feature : category.matchFeatures()) {
                if (feature == null || feature.phrase() == null || feature.phrase().isBlank()) {
                    throw new InvalidCategoryException("Category %s has a blank match feature".formatted(category.id()));
                }
                if (!(feature.weight() > 0.0) || Double.isInfinite(feature.weight())) {
                    throw new InvalidCategoryException("Category %s: feature '%s' has non-positive weight %s"
                            .formatted(category.id(), feature.phrase(), feature.weight()));
                }
            }
        }
        validateTierPolicy(definition.tierPolicy(), categories);
    }

    private static void validateTierPolicy(Map<String, Integer> policy, List<UsageScenarioCategory> categories) {
        if (policy == null || policy.isEmpty()) {
            throw new InvalidCategoryException("Taxonomy definition has no tier policy");
        }
        Map<PriorityTier, Integer> expected = new EnumMap<>(PriorityTier.class);
        policy.forEach((tier, count) -> {
            if (count == null || count < 0) {
                throw new InvalidCategoryException("Tier policy count for '%s' must be a non-negative number, got %s"
                        .formatted(tier, count));
            }
            try {
                expected.put(PriorityTier.fromWireName(tier), count);
            } catch (IllegalArgumentException e) {
                throw new InvalidCategoryException("Unknown tier in tier policy: " + tier, e);
            }
        });
        for (PriorityTier tier : PriorityTier.values()) {
            int want = expected.getOrDefault(tier, 0);
            long actual = countTier(categories, tier);
            if (actual != want) {
                throw new InvalidCategoryException("Tier policy expects %d %s categories, found %d"
                        .formatted(want, tier.wireName(), actual));
            }
        }
    }

    private static long countTier(List<UsageScenarioCategory> categories, PriorityTier tier) {
        return categories.stream().filter(c -> c.priorityTier() == tier).count();
    }
}
