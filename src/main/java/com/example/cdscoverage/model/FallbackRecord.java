package com.example.cdscoverage.model;

/**
 * One degradation step of the fidelity ladder.
 *
 * @param from   Level that failed
 * @param to     Level attempted next
 * @param reason Root-cause message of the failure
 */
public record FallbackRecord(
        FidelityLevel from,
        FidelityLevel to,
        String reason
) {}
