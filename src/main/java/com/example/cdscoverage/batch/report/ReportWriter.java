package com.example.cdscoverage.batch.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Persists batch reports:
 * <pre>
 * &lt;output-dir&gt;/individual_reports_&lt;ts&gt;/&lt;document&gt;_fidelity_comparison.json
 * &lt;output-dir&gt;/comprehensive_fidelity_test_&lt;ts&gt;.json
 * &lt;output-dir&gt;/fidelity_test_summary_&lt;ts&gt;.txt
 * </pre>
 */
@Service
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;

    public ReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Writes the requested report files.
     *
     * @return files written, in write order
     * @throws UncheckedIOException if the output directory or a file cannot be written
     */
    public List<Path> write(ComprehensiveReport report, Path outputDir,
                            boolean perDocument, boolean comprehensive) {
        String timestamp = report.timestamp().format(FILE_TIMESTAMP);
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(outputDir);

            if (perDocument) {
                Path individualDir = outputDir.resolve("individual_reports_" + timestamp);
                Files.createDirectories(individualDir);
                for (Map.Entry<String, DocumentReport> entry : report.individualReports().entrySet()) {
                    Path file = individualDir.resolve(fileSafe(entry.getKey()) + "_fidelity_comparison.json");
                    objectMapper.writeValue(file.toFile(), entry.getValue());
                    log.info("Saved individual report: {}", file);
                    written.add(file);
                }
            }

            if (comprehensive) {
                Path file = outputDir.resolve("comprehensive_fidelity_test_" + timestamp + ".json");
                objectMapper.writeValue(file.toFile(), report);
                log.info("Saved comprehensive report: {}", file);
                written.add(file);

                Path summary = outputDir.resolve("fidelity_test_summary_" + timestamp + ".txt");
                Files.writeString(summary, textSummary(report), StandardCharsets.UTF_8);
                log.info("Saved summary report: {}", summary);
                written.add(summary);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write reports to " + outputDir + ": " + e.getMessage(), e);
        }
        return written;
    }

    /**
     * Human-readable summary of a batch.
     */
    public String textSummary(ComprehensiveReport report) {
        PerformanceSummary perf = report.performanceSummary();
        List<String> lines = new ArrayList<>();
        lines.add("FIDELITY MODE TESTING SUMMARY");
        lines.add("=".repeat(50));
        lines.add("Timestamp: " + report.timestamp());
        lines.add("Guidelines Tested: " + report.documentsTested().size());
        lines.add("Fidelity Modes Tested: " + report.fidelityLevelsTested().size());
        lines.add("Total Test Combinations: " + report.testConfiguration().totalCombinations());
        lines.add("");

        lines.add("PERFORMANCE SUMMARY");
        lines.add("-".repeat(30));
        lines.add("Total Tests: " + perf.totalTests());
        lines.add(format("Successful: %d (%.1f%%)", perf.successfulTests(), percent(perf.successfulTests(), perf.totalTests())));
        lines.add(format("Failed: %d (%.1f%%)", perf.failedTests(), percent(perf.failedTests(), perf.totalTests())));
        lines.add(format("Average Execution Time: %.2fs", perf.averageExecutionTime()));
        lines.add("Fallbacks: " + perf.fallbackCount());
        lines.add("");

        lines.add("PERFORMANCE BY MODE");
        lines.add("-".repeat(30));
        for (Map.Entry<String, LevelStats> entry : perf.performanceByLevel().entrySet()) {
            LevelStats stats = entry.getValue();
            lines.add(entry.getKey() + ":");
            lines.add(format("  Success Rate: %.1f%%", stats.successRate() * 100));
            lines.add(format("  Average Time: %.2fs", stats.averageTime()));
            lines.add(format("  Tests: %d/%d", stats.successfulTests(), stats.totalTests()));
        }
        lines.add("");

        lines.add("PERFORMANCE BY GUIDELINE");
        lines.add("-".repeat(30));
        for (Map.Entry<String, LevelStats> entry : perf.performanceByDocument().entrySet()) {
            LevelStats stats = entry.getValue();
            lines.add(entry.getKey() + ":");
            lines.add(format("  Success Rate: %.1f%%", stats.successRate() * 100));
            lines.add(format("  Average Time: %.2fs", stats.averageTime()));
        }
        lines.add("");

        lines.add("RECOMMENDATIONS");
        lines.add("-".repeat(30));
        for (String recommendation : report.recommendations()) {
            lines.add("• " + recommendation);
        }
        lines.add("");
        return String.join("\n", lines);
    }

    private static double percent(int part, int total) {
        return total > 0 ? part * 100.0 / total : 0.0;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    static String fileSafe(String name) {
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
