package com.example.cdscoverage.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Result payload of a fidelity level, tagged with its type in the persisted reports.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "payload_type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GenerationSummary.class, name = "generation"),
        @JsonSubTypes.Type(value = SequentialResult.class, name = "sequential"),
        @JsonSubTypes.Type(value = InventoryResult.class, name = "inventory"),
        @JsonSubTypes.Type(value = CoverageReport.class, name = "coverage"),
        @JsonSubTypes.Type(value = DraftSummary.class, name = "draft"),
        @JsonSubTypes.Type(value = ExplicitSkip.class, name = "skip")
})
public interface ModePayload {
}
