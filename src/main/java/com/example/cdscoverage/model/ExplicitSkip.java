package com.example.cdscoverage.model;

/**
 * Payload of the "none" fidelity level.
 */
public record ExplicitSkip(String reason) implements ModePayload {}
