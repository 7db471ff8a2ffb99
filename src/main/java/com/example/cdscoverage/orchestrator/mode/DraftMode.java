package com.example.cdscoverage.orchestrator.mode;

import com.example.cdscoverage.ingestion.DecisionPointExtractor;
import com.example.cdscoverage.ingestion.DomainDetector;
import com.example.cdscoverage.model.CancellationToken;
import com.example.cdscoverage.model.DraftSummary;
import com.example.cdscoverage.model.FidelityLevel;
import com.example.cdscoverage.model.GuidelineDocument;
import com.example.cdscoverage.model.ModePayload;
import org.springframework.stereotype.Component;

/**
 * "draft": structure of the guideline (domain and decision points) without any scoring.
 */
@Component
public class DraftMode implements FidelityMode {

    private final DomainDetector domainDetector;
    private final DecisionPointExtractor decisionPointExtractor;

    public DraftMode(DomainDetector domainDetector, DecisionPointExtractor decisionPointExtractor) {
        this.domainDetector = domainDetector;
        this.decisionPointExtractor = decisionPointExtractor;
    }

    @Override
    public FidelityLevel level() {
        return FidelityLevel.DRAFT;
    }

    @Override
    public ModePayload execute(GuidelineDocument document, CancellationToken cancellation) {
        String text = document.sourceText();
        String domain = document.domainTag() != null && !document.domainTag().isBlank()
                ? document.domainTag()
                : domainDetector.detect(text);
        return new DraftSummary(document.name(), domain, text.length(), decisionPointExtractor.extract(text));
    }
}
