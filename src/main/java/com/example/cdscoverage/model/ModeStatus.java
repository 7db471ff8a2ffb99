package com.example.cdscoverage.model;

/**
 * Outcome quality of a fidelity level that completed without error.
 */
public enum ModeStatus {
    SUCCESS, PARTIAL_SUCCESS
}
