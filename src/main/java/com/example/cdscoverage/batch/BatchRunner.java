package com.example.cdscoverage.batch;

import com.example.cdscoverage.config.AiConfig;
import com.example.cdscoverage.config.CoverageProperties;
import com.example.cdscoverage.model.*;
import com.example.cdscoverage.orchestrator.FidelityOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the orchestrator for every (document, level) pair on a bounded worker pool.
 * <p>
 * Pairs are independent: an exception escaping one run is recorded as a FAILED run for that
 * pair only. Pairs still queued when the batch is cancelled are recorded as FAILED without
 * running. Results are returned sorted by document name, then ladder order of the requested level.
 */
@Service
public class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    /** Deterministic run ordering: document name → requested level (ladder order). */
    static final Comparator<FidelityRun> RUN_ORDER = Comparator
            .comparing(FidelityRun::documentName)
            .thenComparing(run -> run.requestedLevel().ordinal());

    private final FidelityOrchestrator orchestrator;
    private final CoverageProperties properties;

    public BatchRunner(FidelityOrchestrator orchestrator, CoverageProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    public List<FidelityRun> run(List<GuidelineDocument> documents, List<FidelityLevel> levels,
                                 CancellationToken cancellation) {
        return run(documents, levels, properties.batch().concurrency(), cancellation);
    }

    public List<FidelityRun> run(List<GuidelineDocument> documents, List<FidelityLevel> levels,
                                 int concurrency, CancellationToken cancellation) {
        int pairs = documents.size() * levels.size();
        int workers = Math.max(1, concurrency);
        log.info("═══════════════════════════════════════════════");
        log.info("Starting batch: {} documents × {} levels = {} runs on {} workers",
                documents.size(), levels.size(), pairs, workers);
        log.info("═══════════════════════════════════════════════");

        ConcurrentLinkedQueue<FidelityRun> runs = new ConcurrentLinkedQueue<>();
        AtomicInteger completed = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, AiConfig.namedDaemonThreads("batch-"));
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>(pairs);
            for (GuidelineDocument document : documents) {
                for (FidelityLevel level : levels) {
                    futures.add(CompletableFuture.runAsync(() -> {
                        FidelityRun run = runPair(document, level, cancellation);
                        runs.add(run);
                        log.info("[{}/{}] {} @ {} → {} ({}{})", completed.incrementAndGet(), pairs,
                                document.name(), level, run.success() ? run.fidelityLevel() : "FAILED",
                                String.format("%.2fs", run.executionTime()),
                                run.degraded() ? ", degraded" : "");
                    }, pool));
                }
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            pool.shutdown();
        }

        List<FidelityRun> sorted = runs.stream().sorted(RUN_ORDER).toList();
        long failed = sorted.stream().filter(r -> !r.success()).count();
        log.info("Batch completed: {} runs, {} succeeded, {} failed", sorted.size(), sorted.size() - failed, failed);
        return sorted;
    }

    private FidelityRun runPair(GuidelineDocument document, FidelityLevel level, CancellationToken cancellation) {
        if (cancellation.isCancelled()) {
            return failedRun(document, level, "Batch cancelled before execution");
        }
        try {
            return orchestrator.run(document, level, cancellation);
        } catch (RuntimeException e) {
            log.error("Run {} @ {} aborted", document.name(), level, e);
            return failedRun(document, level, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static FidelityRun failedRun(GuidelineDocument document, FidelityLevel level, String error) {
        return new FidelityRun(document.name(), level, level, 0.0, false, OrchestratorState.FAILED,
                null, null, List.of(), error);
    }
}
