package com.example.cdscoverage.model;

/**
 * Category left uncovered by a sequential run.
 */
public record ResidualGap(
        String categoryId,
        double score,
        double gapSize,
        SkipReason reason,
        String detail
) {}
