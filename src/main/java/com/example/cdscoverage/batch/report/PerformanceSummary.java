package com.example.cdscoverage.batch.report;

import java.util.Map;

/**
 * Batch-wide performance figures.
 *
 * @param totalTests             All runs
 * @param successfulTests        Successful runs
 * @param failedTests            FAILED runs
 * @param averageExecutionTime   Mean execution time of the successful runs, in seconds
 * @param fallbackCount          Degradation steps recorded across all runs
 * @param performanceByLevel     Requested level → stats
 * @param performanceByDocument  Document → stats
 */
public record PerformanceSummary(
        int totalTests,
        int successfulTests,
        int failedTests,
        double averageExecutionTime,
        int fallbackCount,
        Map<String, LevelStats> performanceByLevel,
        Map<String, LevelStats> performanceByDocument
) {}
