package com.example.cdscoverage.model;

/**
 * States of the fidelity orchestrator for one (document, level) pair.
 */
public enum OrchestratorState {
    IDLE, RUNNING, SUCCEEDED, FAILED_FALLBACK, FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
