package com.example.cdscoverage.orchestrator.mode;

import com.example.cdscoverage.model.CancellationToken;
import com.example.cdscoverage.model.FidelityLevel;
import com.example.cdscoverage.model.GuidelineDocument;
import com.example.cdscoverage.model.ModePayload;
import com.example.cdscoverage.scoring.CoverageAggregator;
import com.example.cdscoverage.sequencer.GapFillingSequencer;
import org.springframework.stereotype.Component;

/**
 * "sequential": coverage report followed by priority-ordered gap filling.
 */
@Component
public class SequentialMode implements FidelityMode {

    private final CoverageAggregator aggregator;
    private final GapFillingSequencer sequencer;

    public SequentialMode(CoverageAggregator aggregator, GapFillingSequencer sequencer) {
        this.aggregator = aggregator;
        this.sequencer = sequencer;
    }

    @Override
    public FidelityLevel level() {
        return FidelityLevel.SEQUENTIAL;
    }

    @Override
    public ModePayload execute(GuidelineDocument document, CancellationToken cancellation) {
        return sequencer.run(document, aggregator.evaluate(document), cancellation);
    }
}
