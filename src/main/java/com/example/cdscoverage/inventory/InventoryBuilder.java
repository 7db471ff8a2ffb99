package com.example.cdscoverage.inventory;

import com.example.cdscoverage.config.CoverageProperties;
import com.example.cdscoverage.model.CoverageReport;
import com.example.cdscoverage.model.GuidelineDocument;
import com.example.cdscoverage.model.InventoryEntry;
import com.example.cdscoverage.model.InventoryResult;
import com.example.cdscoverage.model.ModeStatus;
import com.example.cdscoverage.model.PriorityTier;
import com.example.cdscoverage.model.RobustnessScore;
import com.example.cdscoverage.model.UsageScenarioCategory;
import com.example.cdscoverage.taxonomy.TaxonomyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Expands a coverage report into the per-scenario metadata table ("table" fidelity).
 * <p>
 * Rules:
 * <ul>
 *   <li>one row for every category with a score above zero</li>
 *   <li>one synthetic placeholder row for every zero-score category whose tier is synthesizable</li>
 *   <li>SUCCESS only when the share of rows with all 15 fields populated reaches the
 *       completion threshold, PARTIAL_SUCCESS otherwise</li>
 * </ul>
 * Rows are built fresh from the given report and go stale when the report is recomputed.
 */
@Service
public class InventoryBuilder {

    private static final Logger log = LoggerFactory.getLogger(InventoryBuilder.class);

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?;])\\s+|\\R+");
    private static final int MAX_DECISION_POINT_LENGTH = 240;

    private final TaxonomyRegistry registry;
    private final double completionThreshold;
    private final Set<PriorityTier> syntheticTiers;

    public InventoryBuilder(TaxonomyRegistry registry, CoverageProperties properties) {
        this.registry = registry;
        this.completionThreshold = properties.inventory().completionThreshold();
        this.syntheticTiers = properties.inventory().syntheticTiers();
    }

    public InventoryResult build(GuidelineDocument document, CoverageReport report) {
        List<String> sentences = sentences(document.sourceText());
        List<InventoryEntry> entries = new ArrayList<>();

        for (UsageScenarioCategory category : registry.categories()) {
            RobustnessScore score = report.scores().get(category.id());
            if (score != null && score.score() > 0.0) {
                entries.add(matchedEntry(document, category, score, sentences));
            } else if (syntheticTiers.contains(category.priorityTier())) {
                entries.add(syntheticEntry(document, category));
            }
        }

        int complete = (int) entries.stream().filter(e -> e.missingFields().isEmpty()).count();
        int synthetic = (int) entries.stream().filter(InventoryEntry::synthetic).count();
        double completionRate = entries.isEmpty() ? 1.0 : (double) complete / entries.size();
        ModeStatus status = completionRate >= completionThreshold ? ModeStatus.SUCCESS : ModeStatus.PARTIAL_SUCCESS;

        if (status == ModeStatus.PARTIAL_SUCCESS) {
            log.warn("Inventory of '{}': only {}/{} rows complete (rate {} below {})",
                    document.name(), complete, entries.size(),
                    "%.2f".formatted(completionRate), completionThreshold);
        } else {
            log.info("Inventory of '{}': {} rows ({} synthetic), completion {}",
                    document.name(), entries.size(), synthetic, "%.2f".formatted(completionRate));
        }

        return new InventoryResult(status, entries, completionRate, complete, synthetic, report.timestamp());
    }

    // ═══════════════════════════════════════════════════
    // Row construction
    // ═══════════════════════════════════════════════════

    private InventoryEntry matchedEntry(GuidelineDocument document, UsageScenarioCategory category,
                                        RobustnessScore score, List<String> sentences) {
        int signals = score.matchedFeatures().size();
        String complexity = signals >= 3 ? "expert" : signals == 2 ? "advanced" : "basic";
        return new InventoryEntry(
                scenarioId(document, category, false),
                category.id(),
                category.displayName(),
                document.domainTag(),
                category.persona(),
                category.priorityTier().wireName(),
                category.clinicalQuestion(),
                decisionPoint(sentences, score.matchedFeatures()),
                document.name(),
                complexity,
                "table",
                testPriority(category.priorityTier()),
                "@" + category.name() + " @" + tagSafe(document.domainTag()),
                score.rationale(),
                "CANDIDATE",
                score.score(),
                false
        );
    }

    private InventoryEntry syntheticEntry(GuidelineDocument document, UsageScenarioCategory category) {
        return new InventoryEntry(
                scenarioId(document, category, true),
                category.id(),
                category.displayName(),
                document.domainTag(),
                category.persona(),
                category.priorityTier().wireName(),
                category.clinicalQuestion(),
                "To be synthesized: " + category.clinicalQuestion(),
                document.name(),
                "basic",
                "table",
                testPriority(category.priorityTier()),
                "@" + category.name() + " @synthetic",
                "No signal in the guideline; placeholder for generated scenarios",
                "PENDING_GENERATION",
                0.0,
                true
        );
    }

    private static String scenarioId(GuidelineDocument document, UsageScenarioCategory category, boolean synthetic) {
        return "%s-%s%s".formatted(tagSafe(document.name()), category.id(), synthetic ? "-S" : "");
    }

    private static String testPriority(PriorityTier tier) {
        return switch (tier) {
            case HIGH -> "P1";
            case MEDIUM -> "P2";
            case LOW -> "P3";
        };
    }

    /** First sentence containing the first matched phrase. */
    private static String decisionPoint(List<String> sentences, List<String> matchedFeatures) {
        for (String phrase : matchedFeatures) {
            String needle = phrase.toLowerCase(Locale.ROOT);
            for (String sentence : sentences) {
                if (sentence.toLowerCase(Locale.ROOT).contains(needle)) {
                    return sentence.length() > MAX_DECISION_POINT_LENGTH
                            ? sentence.substring(0, MAX_DECISION_POINT_LENGTH - 3) + "..."
                            : sentence;
                }
            }
        }
        return "";
    }

    private static List<String> sentences(String text) {
        if (text == null || text.isBlank()) return List.of();
        List<String> result = new ArrayList<>();
        for (String part : SENTENCE_BOUNDARY.split(text)) {
            String trimmed = part.replaceAll("\\s+", " ").trim();
            if (!trimmed.isEmpty()) result.add(trimmed);
        }
        return result;
    }

    private static String tagSafe(String value) {
        if (value == null || value.isBlank()) return "";
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9.]+", "-");
    }
}
