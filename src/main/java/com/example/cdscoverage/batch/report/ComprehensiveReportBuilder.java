package com.example.cdscoverage.batch.report;

import com.example.cdscoverage.model.FidelityLevel;
import com.example.cdscoverage.model.FidelityRun;
import com.example.cdscoverage.model.GuidelineDocument;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds per-document comparisons and the batch-wide report from a sorted list of runs.
 * Pure aggregation: no I/O, no logging. Document names key the per-document reports and must be unique.
 */
@Service
public class ComprehensiveReportBuilder {

    /** A level is consistent across documents above this success rate. */
    static final double CONSISTENCY_THRESHOLD = 0.8;

    public ComprehensiveReport build(List<GuidelineDocument> documents, List<FidelityLevel> levels,
                                     List<FidelityRun> runs, int concurrency) {
        LocalDateTime now = LocalDateTime.now();
        List<String> documentNames = documents.stream().map(GuidelineDocument::name).toList();
        if (documentNames.stream().distinct().count() != documentNames.size()) {
            throw new IllegalArgumentException("Document names must be unique within a batch: " + documentNames);
        }
        List<String> levelNames = levels.stream().map(FidelityLevel::wireName).toList();

        Map<String, DocumentReport> individual = new LinkedHashMap<>();
        for (GuidelineDocument document : documents) {
            List<FidelityRun> documentRuns = runs.stream()
                    .filter(r -> r.documentName().equals(document.name()))
                    .toList();
            individual.put(document.name(), documentReport(document, documentRuns, now));
        }

        Map<String, ComprehensiveReport.ModeConsistency> consistency = new LinkedHashMap<>();
        for (FidelityLevel level : levels) {
            List<FidelityRun> levelRuns = runsOf(runs, level);
            if (levelRuns.isEmpty()) continue;
            LevelStats stats = stats(levelRuns);
            consistency.put(level.wireName(), new ComprehensiveReport.ModeConsistency(
                    stats.successRate(), stats.averageTime(), stats.successRate() > CONSISTENCY_THRESHOLD));
        }

        return new ComprehensiveReport(
                now,
                new ComprehensiveReport.TestConfiguration(documentNames, levelNames,
                        documentNames.size() * levelNames.size(), concurrency),
                documentNames,
                levelNames,
                individual,
                consistency,
                performanceSummary(documentNames, levels, runs),
                recommendations(levels, runs));
    }

    // ── Per document ──

    DocumentReport documentReport(GuidelineDocument document, List<FidelityRun> runs, LocalDateTime now) {
        Map<String, FidelityRun> results = new LinkedHashMap<>();
        Map<String, Double> times = new LinkedHashMap<>();
        Map<String, String> achieved = new LinkedHashMap<>();
        List<String> successful = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<String> degraded = new ArrayList<>();

        for (FidelityRun run : runs) {
            String level = run.requestedLevel().wireName();
            results.put(level, run);
            times.put(level, run.executionTime());
            achieved.put(level, run.success() ? run.fidelityLevel().wireName() : "failed");
            if (run.success()) successful.add(level);
            else failed.add(level);
            if (run.success() && run.degraded()) degraded.add(level);
        }

        List<Double> successfulTimes = runs.stream()
                .filter(FidelityRun::success)
                .map(FidelityRun::executionTime)
                .sorted()
                .toList();
        DocumentReport.PerformanceTrends trends = successfulTimes.isEmpty() ? null
                : new DocumentReport.PerformanceTrends(
                mean(successfulTimes), median(successfulTimes),
                successfulTimes.get(0), successfulTimes.get(successfulTimes.size() - 1));
        double successRate = runs.isEmpty() ? 0.0 : (double) successful.size() / runs.size();

        DocumentReport.TradeOff tradeOff = null;
        if (runs.size() >= 2) {
            List<FidelityRun> byTime = runs.stream()
                    .sorted(Comparator.comparingDouble(FidelityRun::executionTime))
                    .toList();
            FidelityRun fastest = byTime.get(0);
            FidelityRun slowest = byTime.get(byTime.size() - 1);
            tradeOff = new DocumentReport.TradeOff(fastest.requestedLevel().wireName(),
                    slowest.requestedLevel().wireName(), slowest.executionTime() - fastest.executionTime());
        }

        List<String> findings = new ArrayList<>();
        if (successful.isEmpty()) {
            findings.add("No fidelity level executed successfully - investigate the generation collaborator and the document source");
        } else {
            findings.add("Levels executed successfully: " + String.join(", ", successful));
        }
        if (!failed.isEmpty()) {
            findings.add("Failed levels (" + String.join(", ", failed) + ") need investigation");
        }
        if (!degraded.isEmpty()) {
            findings.add("Levels degraded below the requested fidelity: " + String.join(", ", degraded));
        }

        List<String> recommendations = List.of(
                "For " + document.name() + ", consider using evaluation-only mode for quick assessments",
                "Use full fidelity mode for comprehensive analysis of complex guidelines like " + document.name(),
                "Table mode provides good balance of speed and detail for most use cases");

        return new DocumentReport(document.name(), document.domainTag(), document.byteSize(), now, results,
                new DocumentReport.QuantitativeComparison(times, achieved, successRate, trends),
                new DocumentReport.QualitativeAnalysis(successful, failed, degraded, tradeOff, findings),
                recommendations);
    }

    // ── Batch-wide ──

    PerformanceSummary performanceSummary(List<String> documentNames, List<FidelityLevel> levels,
                                          List<FidelityRun> runs) {
        Map<String, LevelStats> byLevel = new LinkedHashMap<>();
        for (FidelityLevel level : levels) {
            byLevel.put(level.wireName(), stats(runsOf(runs, level)));
        }
        Map<String, LevelStats> byDocument = new LinkedHashMap<>();
        for (String name : documentNames) {
            byDocument.put(name, stats(runs.stream().filter(r -> r.documentName().equals(name)).toList()));
        }
        LevelStats overall = stats(runs);
        int fallbacks = runs.stream().mapToInt(r -> r.fallbacks().size()).sum();
        return new PerformanceSummary(overall.totalTests(), overall.successfulTests(),
                overall.totalTests() - overall.successfulTests(), overall.averageTime(), fallbacks,
                byLevel, byDocument);
    }

    List<String> recommendations(List<FidelityLevel> levels, List<FidelityRun> runs) {
        List<String> recommendations = new ArrayList<>();

        Map<FidelityLevel, LevelStats> reliable = new LinkedHashMap<>();
        for (FidelityLevel level : levels) {
            LevelStats stats = stats(runsOf(runs, level));
            if (stats.successfulTests() > 0) reliable.put(level, stats);
        }
        if (!reliable.isEmpty()) {
            Map.Entry<FidelityLevel, LevelStats> fastest = reliable.entrySet().stream()
                    .min(Comparator.comparingDouble((Map.Entry<FidelityLevel, LevelStats> e) -> e.getValue().averageTime())
                            .thenComparing(e -> -e.getValue().successRate()))
                    .orElseThrow();
            recommendations.add(String.format(Locale.ROOT, "Fastest reliable mode: %s (%.2fs avg)",
                    fastest.getKey(), fastest.getValue().averageTime()));

            Optional<Map.Entry<FidelityLevel, LevelStats>> mostReliable = reliable.entrySet().stream()
                    .reduce((best, candidate) ->
                            candidate.getValue().successRate() > best.getValue().successRate() ? candidate : best);
            mostReliable.ifPresent(e -> recommendations.add(String.format(Locale.ROOT,
                    "Most reliable mode: %s (%.1f%% success rate)", e.getKey(), e.getValue().successRate() * 100)));
        }

        long degraded = runs.stream().filter(r -> r.success() && r.degraded()).count();
        if (degraded > 0) {
            recommendations.add(degraded + " run(s) fell back below the requested level; see the fallback traces");
        }

        recommendations.add("Use evaluation-only mode for quick assessments and initial screening");
        recommendations.add("Use table mode for balanced analysis with good performance");
        recommendations.add("Use full mode for comprehensive analysis when time permits");
        recommendations.add("Sequential mode provides detailed gap analysis for quality improvement");
        return recommendations;
    }

    static LevelStats stats(List<FidelityRun> runs) {
        List<Double> times = runs.stream()
                .filter(FidelityRun::success)
                .map(FidelityRun::executionTime)
                .toList();
        int degraded = (int) runs.stream().filter(r -> r.success() && r.degraded()).count();
        double rate = runs.isEmpty() ? 0.0 : (double) times.size() / runs.size();
        return new LevelStats(runs.size(), times.size(), rate, mean(times), degraded);
    }

    private static List<FidelityRun> runsOf(List<FidelityRun> runs, FidelityLevel requested) {
        return runs.stream().filter(r -> r.requestedLevel() == requested).toList();
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    /** Median of an ascending list. */
    private static double median(List<Double> sorted) {
        int n = sorted.size();
        return n % 2 == 1 ? sorted.get(n / 2) : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }
}
