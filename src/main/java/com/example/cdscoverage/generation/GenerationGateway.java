package com.example.cdscoverage.generation;

import com.example.cdscoverage.config.CoverageProperties;
import com.example.cdscoverage.exception.GenerationException;
import com.example.cdscoverage.exception.GenerationTimeoutException;
import com.example.cdscoverage.model.CandidateScenario;
import com.example.cdscoverage.model.GenerationConstraints;
import com.example.cdscoverage.model.GuidelineDocument;
import com.example.cdscoverage.model.UsageScenarioCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point to the generation collaborator: runs each call on the generation
 * executor and waits at most the configured timeout. A timeout cancels the call and is
 * reported as a {@link GenerationTimeoutException}; any other failure as a
 * {@link GenerationException}.
 */
@Service
public class GenerationGateway {

    private static final Logger log = LoggerFactory.getLogger(GenerationGateway.class);

    private final ScenarioGenerator generator;
    private final ExecutorService executor;
    private final Duration timeout;

    public GenerationGateway(ScenarioGenerator generator,
                             @Qualifier("generationExecutor") ExecutorService executor,
                             CoverageProperties properties) {
        this.generator = generator;
        this.executor = executor;
        this.timeout = properties.generation().timeout();
    }

    public Duration timeout() {
        return timeout;
    }

    public List<CandidateScenario> generate(GuidelineDocument document,
                                            UsageScenarioCategory category,
                                            GenerationConstraints constraints) {
        Future<List<CandidateScenario>> future =
                executor.submit(() -> generator.generate(document, category, constraints));
        try {
            List<CandidateScenario> scenarios = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (scenarios == null || scenarios.isEmpty()) {
                throw new GenerationException(category.id(), "Collaborator returned no scenarios");
            }
            return scenarios;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Generation for [{}] of '{}' exceeded {} ms, cancelled",
                    category.id(), document.name(), timeout.toMillis());
            throw new GenerationTimeoutException(category.id(), timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GenerationException generationError) {
                throw generationError;
            }
            throw new GenerationException(category.id(),
                    "Generation collaborator failed: " + (cause != null ? cause.getMessage() : e.getMessage()),
                    cause != null ? cause : e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new GenerationException(category.id(), "Interrupted while waiting for generation", e);
        }
    }
}
