package com.example.cdscoverage.batch.report;

import com.example.cdscoverage.model.FidelityRun;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Comparison of every requested level for one document.
 *
 * @param documentName            Document
 * @param clinicalDomain          Domain tag of the document
 * @param byteSize                Size of the source
 * @param timestamp               Report time
 * @param fidelityResults         Requested level → run
 * @param quantitativeComparison  Timing and success figures
 * @param qualitativeAnalysis     Trade-offs between levels
 * @param recommendations         Usage advice for this document
 */
public record DocumentReport(
        String documentName,
        String clinicalDomain,
        long byteSize,
        LocalDateTime timestamp,
        Map<String, FidelityRun> fidelityResults,
        QuantitativeComparison quantitativeComparison,
        QualitativeAnalysis qualitativeAnalysis,
        List<String> recommendations
) {

    /**
     * @param executionTimes    Requested level → seconds
     * @param achievedLevels    Requested level → level that produced the result ("failed" when none)
     * @param successRate       Share of successful runs
     * @param performanceTrends Statistics over successful runs, null when none succeeded
     */
    public record QuantitativeComparison(
            Map<String, Double> executionTimes,
            Map<String, String> achievedLevels,
            double successRate,
            PerformanceTrends performanceTrends
    ) {}

    public record PerformanceTrends(
            double meanExecutionTime,
            double medianExecutionTime,
            double minExecutionTime,
            double maxExecutionTime
    ) {}

    /**
     * @param successfulLevels Levels whose run succeeded
     * @param failedLevels     Levels whose run failed
     * @param degradedLevels   Levels whose run fell back
     * @param speedVsDepth     Fastest and slowest level, null with fewer than two runs
     * @param findings         Short observations
     */
    public record QualitativeAnalysis(
            List<String> successfulLevels,
            List<String> failedLevels,
            List<String> degradedLevels,
            TradeOff speedVsDepth,
            List<String> findings
    ) {}

    public record TradeOff(
            String fastestLevel,
            String slowestLevel,
            double timeDifference
    ) {}
}
