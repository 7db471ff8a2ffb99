package com.example.cdscoverage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Priority tier of a usage-scenario category. Declaration order is the processing order
 * of the gap-filling sequencer (HIGH first).
 */
public enum PriorityTier {
    HIGH, MEDIUM, LOW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PriorityTier fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Priority tier must not be blank");
        }
        return PriorityTier.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
