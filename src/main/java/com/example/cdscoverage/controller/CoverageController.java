package com.example.cdscoverage.controller;

import com.example.cdscoverage.ingestion.DocumentIngestionService;
import com.example.cdscoverage.model.FidelityLevel;
import com.example.cdscoverage.model.FidelityRun;
import com.example.cdscoverage.model.GuidelineDocument;
import com.example.cdscoverage.orchestrator.FidelityOrchestrator;
import com.example.cdscoverage.taxonomy.TaxonomyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for single-document evaluations.
 */
@RestController
@RequestMapping("/api")
public class CoverageController {

    private static final Logger log = LoggerFactory.getLogger(CoverageController.class);

    /** Largest guideline text accepted inline (5 MB). */
    static final int MAX_TEXT_LENGTH = 5 * 1024 * 1024;

    private final FidelityOrchestrator orchestrator;
    private final TaxonomyRegistry registry;
    private final DocumentIngestionService ingestionService;

    public CoverageController(FidelityOrchestrator orchestrator,
                              TaxonomyRegistry registry,
                              DocumentIngestionService ingestionService) {
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.ingestionService = ingestionService;
    }

    /**
     * Body of an evaluation request.
     *
     * @param documentName  Name used in the result
     * @param text          Guideline text
     * @param domain        Clinical domain; detected when blank
     * @param fidelityLevel Requested level (wire name), default "evaluation-only"
     */
    public record EvaluationRequest(String documentName, String text, String domain, String fidelityLevel) {}

    /**
     * Evaluates one guideline text at the requested fidelity level, falling back down the ladder.
     *
     * <p>Endpoint: POST /api/evaluate
     */
    @PostMapping(value = "/evaluate", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> evaluate(@RequestBody EvaluationRequest request) {
        // ── Input validation ──
        if (request == null || request.text() == null || request.text().isBlank()) {
            return badRequest("Empty text. Please submit the guideline text.");
        }
        if (request.text().length() > MAX_TEXT_LENGTH) {
            return badRequest("Text too large. Maximum size: 5MB.");
        }
        FidelityLevel level;
        try {
            level = request.fidelityLevel() == null || request.fidelityLevel().isBlank()
                    ? FidelityLevel.EVALUATION_ONLY
                    : FidelityLevel.fromWireName(request.fidelityLevel());
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }
        String name = request.documentName() != null && !request.documentName().isBlank()
                ? request.documentName()
                : "document";

        log.info("Received evaluation request for '{}' ({} characters) at level {}",
                name, request.text().length(), level);

        try {
            GuidelineDocument document = ingestionService.fromText(name, request.text(), request.domain());
            FidelityRun run = orchestrator.run(document, level);
            if (!run.success()) {
                return ResponseEntity.internalServerError().body(run);
            }
            return ResponseEntity.ok(run);
        } catch (Exception e) {
            log.error("Error during evaluation of '{}'", name, e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Error during evaluation",
                            "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                    ));
        }
    }

    /**
     * Lists the usage-scenario taxonomy.
     *
     * <p>Endpoint: GET /api/taxonomy
     */
    @GetMapping("/taxonomy")
    public ResponseEntity<Map<String, Object>> taxonomy() {
        return ResponseEntity.ok(Map.of(
                "version", registry.version(),
                "size", registry.size(),
                "categories", registry.categories()
        ));
    }

    /**
     * Checks the status of the engine and the PDF extraction service.
     *
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean pdfServiceUp = ingestionService.isServiceAvailable();
        return ResponseEntity.ok(Map.of(
                "status", pdfServiceUp ? "ok" : "degraded",
                "service", "cds-coverage-engine",
                "taxonomyCategories", registry.size(),
                "pdfExtractor", pdfServiceUp ? "up" : "down"
        ));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
