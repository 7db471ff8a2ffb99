package com.example.cdscoverage.orchestrator.mode;

import com.example.cdscoverage.model.CancellationToken;
import com.example.cdscoverage.model.FidelityLevel;
import com.example.cdscoverage.model.GuidelineDocument;
import com.example.cdscoverage.model.ModePayload;
import com.example.cdscoverage.scoring.CoverageAggregator;
import org.springframework.stereotype.Component;

/**
 * "evaluation-only": the coverage report alone.
 */
@Component
public class EvaluationOnlyMode implements FidelityMode {

    private final CoverageAggregator aggregator;

    public EvaluationOnlyMode(CoverageAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @Override
    public FidelityLevel level() {
        return FidelityLevel.EVALUATION_ONLY;
    }

    @Override
    public ModePayload execute(GuidelineDocument document, CancellationToken cancellation) {
        return aggregator.evaluate(document);
    }
}
