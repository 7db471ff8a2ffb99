package com.example.cdscoverage.orchestrator.mode;

import com.example.cdscoverage.inventory.InventoryBuilder;
import com.example.cdscoverage.model.CancellationToken;
import com.example.cdscoverage.model.FidelityLevel;
import com.example.cdscoverage.model.GuidelineDocument;
import com.example.cdscoverage.model.ModePayload;
import com.example.cdscoverage.scoring.CoverageAggregator;
import org.springframework.stereotype.Component;

/**
 * "table": coverage report turned into a scenario inventory. PARTIAL_SUCCESS still counts as success.
 */
@Component
public class TableMode implements FidelityMode {

    private final CoverageAggregator aggregator;
    private final InventoryBuilder inventoryBuilder;

    public TableMode(CoverageAggregator aggregator, InventoryBuilder inventoryBuilder) {
        this.aggregator = aggregator;
        this.inventoryBuilder = inventoryBuilder;
    }

    @Override
    public FidelityLevel level() {
        return FidelityLevel.TABLE;
    }

    @Override
    public ModePayload execute(GuidelineDocument document, CancellationToken cancellation) {
        return inventoryBuilder.build(document, aggregator.evaluate(document));
    }
}
