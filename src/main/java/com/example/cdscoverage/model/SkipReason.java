package com.example.cdscoverage.model;

/**
 * Why a category ended the sequential run in {@link GapFillState#SKIPPED}.
 */
public enum SkipReason {
    BELOW_THRESHOLD,
    GENERATION_FAILED,
    GENERATION_TIMEOUT,
    BUDGET_EXHAUSTED,
    CANCELLED
}
