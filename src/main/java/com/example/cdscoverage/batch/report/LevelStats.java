package com.example.cdscoverage.batch.report;

/**
 * Success and timing figures of a group of runs (one level, or one document).
 *
 * @param totalTests      Runs in the group
 * @param successfulTests Runs that reached a terminal success, degraded or not
 * @param successRate     successfulTests / totalTests, 0 for an empty group
 * @param averageTime     Mean execution time of the successful runs, in seconds
 * @param degradedTests   Successful runs that fell back below the requested level
 */
public record LevelStats(
        int totalTests,
        int successfulTests,
        double successRate,
        double averageTime,
        int degradedTests
) {}
