package com.example.cdscoverage.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Payload of the "table" fidelity level.
 *
 * @param status           SUCCESS when the completion rate reaches the configured threshold
 * @param entries          Inventory rows, in registry order
 * @param completionRate   Share of rows with all 15 fields populated (1.0 when there are no rows)
 * @param completeEntries  Rows with no missing field
 * @param syntheticEntries Placeholder rows for zero-score categories
 * @param reportTimestamp  Timestamp of the coverage report the rows were built from
 */
public record InventoryResult(
        ModeStatus status,
        List<InventoryEntry> entries,
        double completionRate,
        int completeEntries,
        int syntheticEntries,
        LocalDateTime reportTimestamp
) implements ModePayload {
    public InventoryResult {
        entries = List.copyOf(entries);
    }
}
