package com.example.cdscoverage.generation;

import com.example.cdscoverage.exception.GenerationException;
import com.example.cdscoverage.model.CandidateScenario;
import com.example.cdscoverage.model.GenerationConstraints;
import com.example.cdscoverage.model.GuidelineDocument;
import com.example.cdscoverage.model.UsageScenarioCategory;
import com.example.cdscoverage.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LlmScenarioGeneratorTest {

    private ChatClient chatClient;
    private LlmScenarioGenerator generator;

    private final GuidelineDocument document = TestFixtures.document("afib", TestFixtures.AFIB_GUIDELINE);
    private final UsageScenarioCategory interactions = TestFixtures.REGISTRY.get("1.2.1");

    @BeforeEach
    void setUp() {
        chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        generator = new LlmScenarioGenerator(chatClient, TestFixtures.properties());
    }

    private void respondWith(String content) {
        ChatResponse response = new ChatResponse(List.of(new Generation(new AssistantMessage(content))));
        when(chatClient.prompt().system(anyString()).user(anyString()).call().chatResponse()).thenReturn(response);
    }

    @Test
    @DisplayName("should parse scenarios, force the category id and drop FHIR when not requested")
    void parsesScenarios() {
        // GIVEN
        respondWith("""
                {"scenarios": [
                  {"scenarioId": "S1", "categoryId": "wrong", "title": "Amiodarone and warfarin",
                   "gherkin": "Given a patient on warfarin\\nWhen amiodarone is ordered\\nThen warn about the drug interaction",
                   "fhirBundle": "{\\"resourceType\\":\\"Bundle\\"}"},
                  {"scenarioId": "", "title": "Empty id", "gherkin": "Given a contraindication\\nThen alert"},
                  {"scenarioId": "S3", "title": "Over the limit", "gherkin": "Given x\\nThen y"},
                ]}
                """);

        // WHEN
        List<CandidateScenario> scenarios = generator.generate(document, interactions,
                new GenerationConstraints(2, false, 0.5, "cardiology"));

        // THEN
        assertThat(scenarios).hasSize(2);
        assertThat(scenarios).extracting(CandidateScenario::categoryId).containsOnly("1.2.1");
        assertThat(scenarios).extracting(CandidateScenario::fhirBundle).containsOnlyNulls();
        assertThat(scenarios.get(0).asText()).contains("drug interaction");
        assertThat(scenarios.get(1).scenarioId()).isEqualTo("afib-1.2.1-G02");
    }

    @Test
    @DisplayName("should keep FHIR bundles when requested")
    void keepsFhir() {
        respondWith("""
                {"scenarios": [{"scenarioId": "S1", "title": "t", "gherkin": "Given g", "fhirBundle": "{}"}]}
                """);

        List<CandidateScenario> scenarios = generator.generate(document, interactions,
                new GenerationConstraints(3, true, 0.5, "cardiology"));

        assertThat(scenarios).singleElement().extracting(CandidateScenario::fhirBundle).isEqualTo("{}");
    }

    @Test
    @DisplayName("should fail with GenerationException when no scenario comes back")
    void emptyResponse() {
        respondWith("{\"scenarios\": []}");

        assertThatThrownBy(() -> generator.generate(document, interactions,
                new GenerationConstraints(3, false, 0.5, "cardiology")))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("1.2.1");
    }

    @Test
    @DisplayName("should wrap LLM failures in GenerationException")
    void llmFailure() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().chatResponse())
                .thenThrow(new IllegalStateException("rate limited"));

        assertThatThrownBy(() -> generator.generate(document, interactions,
                new GenerationConstraints(3, false, 0.5, "cardiology")))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("rate limited")
                .satisfies(e -> assertThat(((GenerationException) e).getCategoryId()).isEqualTo("1.2.1"));
    }
}
