package com.example.cdscoverage.batch.report;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Report across every document and level of a batch.
 */
public record ComprehensiveReport(
        LocalDateTime timestamp,
        TestConfiguration testConfiguration,
        List<String> documentsTested,
        List<String> fidelityLevelsTested,
        Map<String, DocumentReport> individualReports,
        Map<String, ModeConsistency> modeConsistency,
        PerformanceSummary performanceSummary,
        List<String> recommendations
) {

    public record TestConfiguration(
            List<String> documents,
            List<String> fidelityLevels,
            int totalCombinations,
            int concurrency
    ) {}

    /**
     * Behaviour of one level across documents; consistent when more than 80% of its runs succeed.
     */
    public record ModeConsistency(
            double successRate,
            double averageExecutionTime,
            boolean consistentPerformance
    ) {}
}
