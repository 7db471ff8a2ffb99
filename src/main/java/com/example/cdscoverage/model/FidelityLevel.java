package com.example.cdscoverage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Fidelity ladder, highest first. A failed level falls back to the next constant.
 */
public enum FidelityLevel {
    FULL_FHIR("full-fhir"),
    FULL("full"),
    SEQUENTIAL("sequential"),
    TABLE("table"),
    EVALUATION_ONLY("evaluation-only"),
    DRAFT("draft"),
    NONE("none");

    private final String wireName;

    FidelityLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Next lower level of the ladder, empty for {@link #NONE}. */
    public Optional<FidelityLevel> lower() {
        FidelityLevel[] ladder = values();
        return ordinal() + 1 < ladder.length ? Optional.of(ladder[ordinal() + 1]) : Optional.empty();
    }

    @JsonCreator
    public static FidelityLevel fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Fidelity level must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(level -> level.wireName.equals(normalized)
                        || level.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown fidelity level: " + raw));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
