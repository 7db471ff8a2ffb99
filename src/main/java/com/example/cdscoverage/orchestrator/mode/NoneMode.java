package com.example.cdscoverage.orchestrator.mode;

import com.example.cdscoverage.model.CancellationToken;
import com.example.cdscoverage.model.ExplicitSkip;
import com.example.cdscoverage.model.FidelityLevel;
import com.example.cdscoverage.model.GuidelineDocument;
import com.example.cdscoverage.model.ModePayload;
import org.springframework.stereotype.Component;

/**
 * "none": bottom of the ladder, always succeeds with an explicit skip.
 */
@Component
public class NoneMode implements FidelityMode {

    @Override
    public FidelityLevel level() {
        return FidelityLevel.NONE;
    }

    @Override
    public ModePayload execute(GuidelineDocument document, CancellationToken cancellation) {
        return new ExplicitSkip("Evaluation skipped for '" + document.name() + "'");
    }
}
