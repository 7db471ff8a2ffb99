package com.example.cdscoverage.model;

/**
 * Per-category states of the gap-filling sequencer.
 */
public enum GapFillState {
    PENDING, EVALUATING, SUFFICIENT, NEEDS_GENERATION, FILLED, SKIPPED;

    public boolean isTerminal() {
        return this == FILLED || this == SKIPPED;
    }
}
