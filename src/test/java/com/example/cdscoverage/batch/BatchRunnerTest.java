package com.example.cdscoverage.batch;

import com.example.cdscoverage.model.*;
import com.example.cdscoverage.orchestrator.FidelityOrchestrator;
import com.example.cdscoverage.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.example.cdscoverage.support.TestFixtures.document;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BatchRunnerTest {

    private static final List<FidelityLevel> LEVELS = List.of(
            FidelityLevel.FULL, FidelityLevel.SEQUENTIAL, FidelityLevel.TABLE, FidelityLevel.EVALUATION_ONLY);

    @Mock
    private FidelityOrchestrator orchestrator;

    private BatchRunner batchRunner;

    // Names deliberately out of alphabetical order
    private final List<GuidelineDocument> documents = List.of(
            document("nccn-nscl", "Lung cancer guideline."),
            document("acc-afib", TestFixtures.AFIB_GUIDELINE),
            document("nccn-breast", "Breast cancer guideline."),
            document("diabetes-ada", "Diabetes guideline."),
            document("nccn-colon", "Colon cancer guideline."));

    private static FidelityRun succeeded(GuidelineDocument document, FidelityLevel level) {
        return new FidelityRun(document.name(), level, level, 0.01, true, OrchestratorState.SUCCEEDED,
                new ExplicitSkip("stub"), null, List.of(), null);
    }

    @BeforeEach
    void setUp() {
        batchRunner = new BatchRunner(orchestrator, TestFixtures.properties());
        lenient().doAnswer(inv -> succeeded(inv.getArgument(0), inv.getArgument(1)))
                .when(orchestrator).run(any(), any(), any());
    }

    @Nested
    @DisplayName("Batch execution")
    class Execution {

        @Test
        @DisplayName("5 documents × 4 levels should yield 20 runs sorted by document then ladder order")
        void fullMatrix() {
            // WHEN
            List<FidelityRun> runs = batchRunner.run(documents, LEVELS, CancellationToken.none());

            // THEN
            assertThat(runs).hasSize(20);
            assertThat(runs).isSortedAccordingTo(BatchRunner.RUN_ORDER);
            assertThat(runs.subList(0, 4)).allSatisfy(r -> assertThat(r.documentName()).isEqualTo("acc-afib"));
            assertThat(runs.subList(0, 4)).extracting(FidelityRun::requestedLevel).containsExactlyElementsOf(LEVELS);
            assertThat(runs.get(19).documentName()).isEqualTo("nccn-nscl");
            assertThat(runs).allMatch(FidelityRun::success);
            verify(orchestrator, times(20)).run(any(), any(), any());
        }

        @Test
        @DisplayName("ordering should not depend on the number of workers")
        void orderingIndependentOfConcurrency() {
            List<FidelityRun> sequential = batchRunner.run(documents, LEVELS, 1, CancellationToken.none());
            List<FidelityRun> parallel = batchRunner.run(documents, LEVELS, 8, CancellationToken.none());

            assertThat(parallel).extracting(FidelityRun::documentName, FidelityRun::requestedLevel)
                    .containsExactlyElementsOf(sequential.stream()
                            .map(r -> tuple(r.documentName(), r.requestedLevel()))
                            .toList());
        }

        @Test
        @DisplayName("an exception escaping one pair should only fail that pair")
        void failureIsolation() {
            // GIVEN
            lenient().doThrow(new IllegalStateException("taxonomy unavailable"))
                    .when(orchestrator).run(argThat(d -> d != null && d.name().equals("nccn-breast")),
                            eq(FidelityLevel.TABLE), any());

            // WHEN
            List<FidelityRun> runs = batchRunner.run(documents, LEVELS, CancellationToken.none());

            // THEN
            assertThat(runs).hasSize(20);
            List<FidelityRun> failed = runs.stream().filter(r -> !r.success()).toList();
            assertThat(failed).singleElement().satisfies(r -> {
                assertThat(r.documentName()).isEqualTo("nccn-breast");
                assertThat(r.requestedLevel()).isEqualTo(FidelityLevel.TABLE);
                assertThat(r.state()).isEqualTo(OrchestratorState.FAILED);
                assertThat(r.resultPayload()).isNull();
                assertThat(r.errorMessage()).isEqualTo("taxonomy unavailable");
            });
        }

        @Test
        @DisplayName("an empty document list should produce an empty batch")
        void emptyBatch() {
            assertThat(batchRunner.run(List.of(), LEVELS, CancellationToken.none())).isEmpty();
            verify(orchestrator, never()).run(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("a cancelled batch should record every queued pair as FAILED without running it")
        void cancelledBeforeStart() {
            CancellationToken token = CancellationToken.none();
            token.cancel();

            List<FidelityRun> runs = batchRunner.run(documents, LEVELS, token);

            assertThat(runs).hasSize(20);
            assertThat(runs).allSatisfy(r -> {
                assertThat(r.success()).isFalse();
                assertThat(r.errorMessage()).isEqualTo("Batch cancelled before execution");
            });
            verify(orchestrator, never()).run(any(), any(), any());
        }

        @Test
        @DisplayName("cancelling mid-batch should let running pairs finish and fail the queued ones")
        void cancelledMidBatch() {
            CancellationToken token = CancellationToken.none();
            AtomicInteger calls = new AtomicInteger();
            doAnswer(inv -> {
                if (calls.incrementAndGet() == 3) token.cancel();
                return succeeded(inv.getArgument(0), inv.getArgument(1));
            }).when(orchestrator).run(any(), any(), any());

            List<FidelityRun> runs = batchRunner.run(documents, LEVELS, 1, token);

            assertThat(runs).hasSize(20);
            assertThat(runs.stream().filter(FidelityRun::success).count()).isEqualTo(3);
            assertThat(calls.get()).isEqualTo(3);
        }
    }
}
