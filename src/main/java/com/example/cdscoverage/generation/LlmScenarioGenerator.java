package com.example.cdscoverage.generation;

import com.example.cdscoverage.config.CoverageProperties;
import com.example.cdscoverage.exception.GenerationException;
import com.example.cdscoverage.model.CandidateScenario;
import com.example.cdscoverage.model.GenerationConstraints;
import com.example.cdscoverage.model.GuidelineDocument;
import com.example.cdscoverage.model.UsageScenarioCategory;
import com.example.cdscoverage.service.ResilientLlmCaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Scenario generation backed by an LLM: asks for BDD scenarios (and optionally FHIR resources)
 * exercising one CDS usage-scenario category of a guideline.
 */
@Service
public class LlmScenarioGenerator implements ScenarioGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmScenarioGenerator.class);

    private static final int MAX_GUIDELINE_CHARS = 60000;

    private static final String SYSTEM_PROMPT = """
            You are a clinical informaticist writing acceptance tests for a clinical decision
            support (CDS) system. You receive the text of a clinical guideline and ONE CDS
            usage-scenario category.

            TASK:
            Write test scenarios in Gherkin (Feature / Scenario / Given / When / Then) that
            exercise the category using recommendations that appear in the guideline.

            RULES:
            - Use only recommendations supported by the guideline text. Do NOT invent drugs,
              thresholds or tests that the guideline does not mention.
            - Use the clinical vocabulary of the category (its signal phrases) in the steps.
            - One positive scenario (expected recommendation) and, when meaningful, one negative
              scenario (contraindication or boundary condition).
            - When FHIR resources are requested, put a compact FHIR R4 Bundle (JSON) in "fhirBundle";
              otherwise leave "fhirBundle" null.
            - Write everything in ENGLISH.
            """;

    private final ChatClient chatClient;
    private final int maxRetries;
    private final Duration retryDelay;

    public LlmScenarioGenerator(@Qualifier("generationChatClient") ChatClient chatClient,
                                CoverageProperties properties) {
        this.chatClient = chatClient;
        this.maxRetries = properties.generation().maxRetries();
        this.retryDelay = properties.generation().retryDelay();
    }

    @Override
    public List<CandidateScenario> generate(GuidelineDocument document,
                                            UsageScenarioCategory category,
                                            GenerationConstraints constraints) {
        String signals = category.matchFeatures().stream()
                .map(f -> "    - " + f.phrase())
                .collect(Collectors.joining("\n"));

        String userPrompt = """
                CATEGORY: %s (%s)
                Clinical question: %s
                Persona: %s
                Signal phrases:
                %s

                CLINICAL DOMAIN: %s
                MAXIMUM SCENARIOS: %d
                FHIR RESOURCES REQUESTED: %s

                GUIDELINE:
                ===BEGIN===
                %s
                ===END===

                For each scenario return scenarioId, categoryId (exactly "%s"), title, gherkin and fhirBundle.
                """.formatted(category.displayName(), category.id(), category.clinicalQuestion(),
                category.persona(), signals, constraints.clinicalDomain(), constraints.maxScenarios(),
                constraints.includeFhir() ? "yes" : "no",
                truncate(document.sourceText(), MAX_GUIDELINE_CHARS), category.id());

        String callerName = "ScenarioGenerator[" + category.id() + "]";
        CandidateScenarioResponse response;
        try {
            response = ResilientLlmCaller.callEntity(chatClient, SYSTEM_PROMPT, userPrompt,
                    CandidateScenarioResponse.class, callerName, maxRetries, retryDelay);
        } catch (RuntimeException e) {
            throw new GenerationException(category.id(),
                    "Scenario generation failed for category %s: %s"
                            .formatted(category.id(), ResilientLlmCaller.rootCauseMessage(e)), e);
        }

        if (response == null || response.scenarios() == null || response.scenarios().isEmpty()) {
            throw new GenerationException(category.id(),
                    "No scenarios returned for category " + category.id());
        }

        List<CandidateScenario> scenarios = new ArrayList<>();
        for (CandidateScenario raw : response.scenarios()) {
            if (raw == null || raw.gherkin() == null || raw.gherkin().isBlank()) continue;
            if (scenarios.size() >= constraints.maxScenarios()) break;
            String id = raw.scenarioId() != null && !raw.scenarioId().isBlank()
                    ? raw.scenarioId()
                    : "%s-%s-G%02d".formatted(document.name(), category.id(), scenarios.size() + 1);
            scenarios.add(new CandidateScenario(id, category.id(), raw.title(), raw.gherkin(),
                    constraints.includeFhir() ? raw.fhirBundle() : null));
        }
        if (scenarios.isEmpty()) {
            throw new GenerationException(category.id(),
                    "Only empty scenarios returned for category " + category.id());
        }

        log.info("{}: {} scenarios generated for '{}'", callerName, scenarios.size(), document.name());
        return List.copyOf(scenarios);
    }

    private String truncate(String text, int maxChars) {
        if (text.length() <= maxChars) return text;
        return text.substring(0, maxChars) + "\n[... truncated ...]";
    }
}
