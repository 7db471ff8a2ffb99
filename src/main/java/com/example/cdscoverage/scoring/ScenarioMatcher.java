package com.example.cdscoverage.scoring;

import com.example.cdscoverage.model.GuidelineDocument;
import com.example.cdscoverage.model.MatchFeature;
import com.example.cdscoverage.model.RobustnessScore;
import com.example.cdscoverage.model.UsageScenarioCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores a document against one category: weighted hit count of the category's features
 * (case-insensitive substring presence) divided by the maximum attainable weight.
 * <p>
 * No randomness and no external calls: identical inputs always give identical scores.
 */
@Service
public class ScenarioMatcher {

    private static final Logger log = LoggerFactory.getLogger(ScenarioMatcher.class);

    public RobustnessScore score(GuidelineDocument document, UsageScenarioCategory category) {
        String text = document.sourceText();
        if (text == null || text.isBlank()) {
            return RobustnessScore.zero(category.id(), "Empty document text");
        }
        return score(text.toLowerCase(Locale.ROOT), category);
    }

    /**
     * Scores text that is already lower-cased.
     */
    RobustnessScore score(String lowerCaseText, UsageScenarioCategory category) {
        double totalWeight = category.totalWeight();
        double hitWeight = 0.0;
        List<String> matched = new ArrayList<>();

        for (MatchFeature feature : category.matchFeatures()) {
            if (lowerCaseText.contains(feature.phrase().toLowerCase(Locale.ROOT))) {
                hitWeight += feature.weight();
                matched.add(feature.phrase());
            }
        }

        double score = totalWeight > 0.0 ? clamp(hitWeight / totalWeight) : 0.0;
        String rationale = matched.isEmpty()
                ? "No signal of '%s' found".formatted(category.displayName())
                : String.format(Locale.ROOT, "Matched %d/%d signals (weight %.2f of %.2f): %s",
                matched.size(), category.matchFeatures().size(), hitWeight, totalWeight,
                String.join(", ", matched));

        log.debug("Matcher: [{}] score={} matched={}", category.id(), score, matched);
        return new RobustnessScore(category.id(), score, matched, rationale);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
