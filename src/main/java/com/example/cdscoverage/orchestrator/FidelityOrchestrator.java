package com.example.cdscoverage.orchestrator;

import com.example.cdscoverage.exception.CategoryNotFoundException;
import com.example.cdscoverage.exception.FidelityLevelException;
import com.example.cdscoverage.model.*;
import com.example.cdscoverage.orchestrator.mode.FidelityMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fidelity ladder orchestrator.
 * Ladder (highest first):
 * 1. full-fhir       generated scenarios with FHIR resources
 * 2. full            generated scenarios for every category
 * 3. sequential      priority-ordered gap filling
 * 4. table           scenario inventory
 * 5. evaluation-only coverage report
 * 6. draft           decision points, no scoring
 * 7. none            explicit skip, always succeeds
 * <p>
 * Starting at the requested level, a level that throws is recorded as a {@link FallbackRecord}
 * and the next lower level is attempted. The run is FAILED only when the ladder is exhausted.
 */
@Service
public class FidelityOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FidelityOrchestrator.class);

    private final Map<FidelityLevel, FidelityMode> modes = new EnumMap<>(FidelityLevel.class);

    public FidelityOrchestrator(List<FidelityMode> modes) {
        for (FidelityMode mode : modes) {
            FidelityMode previous = this.modes.put(mode.level(), mode);
            if (previous != null) {
                throw new IllegalStateException("Two modes registered for level " + mode.level());
            }
        }
    }

    public FidelityRun run(GuidelineDocument document, FidelityLevel requested) {
        return run(document, requested, CancellationToken.none());
    }

    public FidelityRun run(GuidelineDocument document, FidelityLevel requested, CancellationToken cancellation) {
        long start = System.nanoTime();
        OrchestratorState state = OrchestratorState.RUNNING;
        List<FallbackRecord> fallbacks = new ArrayList<>();
        FidelityLevel current = requested;

        log.info("═══════════════════════════════════════════════");
        log.info("Fidelity run for '{}' at level {}", document.name(), requested);
        log.info("═══════════════════════════════════════════════");

        while (true) {
            int step = current.ordinal() + 1;
            int total = FidelityLevel.values().length;
            try {
                log.info("[{}/{}] Running level {}{}", step, total, current,
                        state == OrchestratorState.FAILED_FALLBACK ? " (fallback)" : "");
                ModePayload payload = execute(current, document, cancellation);
                double elapsed = seconds(start);
                log.info("[{}/{}] Level {} succeeded for '{}' in {}s", step, total, current,
                        document.name(), String.format("%.2f", elapsed));
                return new FidelityRun(document.name(), requested, current, elapsed, true,
                        OrchestratorState.SUCCEEDED, payload,
                        current != requested ? requested : null, fallbacks, null);

            } catch (CategoryNotFoundException e) {
                throw e;
            } catch (RuntimeException e) {
                String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                Optional<FidelityLevel> next = current.lower();
                if (next.isEmpty()) {
                    log.error("[{}/{}] Level {} failed for '{}', ladder exhausted: {}",
                            step, total, current, document.name(), reason);
                    return new FidelityRun(document.name(), requested, current, seconds(start), false,
                            OrchestratorState.FAILED, null,
                            current != requested ? requested : null, fallbacks, reason);
                }
                state = OrchestratorState.FAILED_FALLBACK;
                log.warn("[{}/{}] Level {} failed for '{}' ({}), falling back to {}",
                        step, total, current, document.name(), reason, next.get());
                fallbacks.add(new FallbackRecord(current, next.get(), reason));
                current = next.get();
            }
        }
    }

    private ModePayload execute(FidelityLevel level, GuidelineDocument document, CancellationToken cancellation) {
        FidelityMode mode = modes.get(level);
        if (mode == null) {
            throw new FidelityLevelException(level, "No mode registered for level " + level);
        }
        ModePayload payload = mode.execute(document, cancellation);
        if (payload == null) {
            throw new FidelityLevelException(level, "Level " + level + " produced no result");
        }
        return payload;
    }

    private static double seconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
