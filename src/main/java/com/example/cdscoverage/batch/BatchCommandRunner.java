package com.example.cdscoverage.batch;

import com.example.cdscoverage.batch.report.ComprehensiveReport;
import com.example.cdscoverage.batch.report.ComprehensiveReportBuilder;
import com.example.cdscoverage.batch.report.ReportWriter;
import com.example.cdscoverage.config.CoverageProperties;
import com.example.cdscoverage.ingestion.DocumentIngestionService;
import com.example.cdscoverage.model.CancellationToken;
import com.example.cdscoverage.model.FidelityLevel;
import com.example.cdscoverage.model.FidelityRun;
import com.example.cdscoverage.model.GuidelineDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Batch command surface. Active only when {@code --documents} is given; otherwise the
 * application keeps serving HTTP.
 * <pre>
 * --documents=acc-afib,guidelines/diabetes.txt   catalog ids or file paths (required)
 * --fidelity-levels=evaluation-only,table        default: coverage.batch.default-levels
 * --output-dir=reports                           default: coverage.output-dir
 * --per-document-reports[=true|false]            default: true
 * --comprehensive-report[=true|false]            default: true
 * --concurrency=4                                default: coverage.batch.concurrency
 * </pre>
 * Exit code 0 when every pair succeeded (possibly degraded), 1 when any pair FAILED,
 * 2 on invalid arguments.
 */
@Component
public class BatchCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(BatchCommandRunner.class);

    public static final String DOCUMENTS = "documents";
    static final String FIDELITY_LEVELS = "fidelity-levels";
    static final String OUTPUT_DIR = "output-dir";
    static final String PER_DOCUMENT_REPORTS = "per-document-reports";
    static final String COMPREHENSIVE_REPORT = "comprehensive-report";
    static final String CONCURRENCY = "concurrency";

    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_INVALID_ARGUMENTS = 2;

    private final DocumentIngestionService ingestionService;
    private final BatchRunner batchRunner;
    private final ComprehensiveReportBuilder reportBuilder;
    private final ReportWriter reportWriter;
    private final CoverageProperties properties;
    private final CancellationToken cancellation = CancellationToken.none();

    private volatile int exitCode = EXIT_OK;

    public BatchCommandRunner(DocumentIngestionService ingestionService,
                              BatchRunner batchRunner,
                              ComprehensiveReportBuilder reportBuilder,
                              ReportWriter reportWriter,
                              CoverageProperties properties) {
        this.ingestionService = ingestionService;
        this.batchRunner = batchRunner;
        this.reportBuilder = reportBuilder;
        this.reportWriter = reportWriter;
        this.properties = properties;
    }

    record BatchOptions(List<String> documents, List<FidelityLevel> levels, Path outputDir,
                        boolean perDocumentReports, boolean comprehensiveReport, int concurrency) {}

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(DOCUMENTS)) {
            return;
        }
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /** Cancels the running batch; queued pairs are recorded as FAILED. */
    public void cancel() {
        cancellation.cancel();
    }

    int execute(ApplicationArguments args) {
        BatchOptions options;
        List<GuidelineDocument> documents;
        try {
            options = parse(args);
            documents = options.documents().stream().map(ingestionService::load).toList();
            requireDistinctNames(options.documents(), documents);
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            return EXIT_INVALID_ARGUMENTS;
        }

        List<FidelityRun> runs = batchRunner.run(documents, options.levels(), options.concurrency(), cancellation);
        ComprehensiveReport report = reportBuilder.build(documents, options.levels(), runs, options.concurrency());
        if (options.perDocumentReports() || options.comprehensiveReport()) {
            reportWriter.write(report, options.outputDir(), options.perDocumentReports(), options.comprehensiveReport());
        }

        long failed = runs.stream().filter(r -> !r.success()).count();
        log.info("Results saved to: {} ({} of {} runs failed)", options.outputDir().toAbsolutePath(), failed, runs.size());
        return failed > 0 ? EXIT_RUN_FAILED : EXIT_OK;
    }

    /**
     * Reports are keyed by document name, so two identifiers resolving to the same name
     * (e.g. {@code a/guide.txt} and {@code b/guide.txt}) would overwrite each other.
     */
    private static void requireDistinctNames(List<String> ids, List<GuidelineDocument> documents) {
        Map<String, String> seen = new HashMap<>();
        for (int i = 0; i < documents.size(); i++) {
            String previous = seen.putIfAbsent(documents.get(i).name(), ids.get(i));
            if (previous != null) {
                throw new IllegalArgumentException("Documents '%s' and '%s' both resolve to the name '%s'"
                        .formatted(previous, ids.get(i), documents.get(i).name()));
            }
        }
    }

    BatchOptions parse(ApplicationArguments args) {
        List<String> documents = splitValues(args.getOptionValues(DOCUMENTS));
        if (documents.isEmpty()) {
            throw new IllegalArgumentException("--" + DOCUMENTS + " needs at least one document");
        }

        List<String> rawLevels = splitValues(args.getOptionValues(FIDELITY_LEVELS));
        List<FidelityLevel> levels = rawLevels.isEmpty()
                ? properties.batch().defaultLevels()
                : rawLevels.stream().map(FidelityLevel::fromWireName).distinct().toList();

        String outputDir = single(args, OUTPUT_DIR, properties.outputDir());

        int concurrency = properties.batch().concurrency();
        String rawConcurrency = single(args, CONCURRENCY, null);
        if (rawConcurrency != null) {
            try {
                concurrency = Integer.parseInt(rawConcurrency.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--" + CONCURRENCY + " must be an integer: " + rawConcurrency);
            }
            if (concurrency < 1) {
                throw new IllegalArgumentException("--" + CONCURRENCY + " must be at least 1");
            }
        }

        return new BatchOptions(documents, levels, Path.of(outputDir),
                flag(args, PER_DOCUMENT_REPORTS), flag(args, COMPREHENSIVE_REPORT), concurrency);
    }

    private static List<String> splitValues(List<String> values) {
        if (values == null) return List.of();
        Set<String> result = new LinkedHashSet<>();
        for (String value : values) {
            Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(result::add);
        }
        return new ArrayList<>(result);
    }

    private static String single(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return fallback;
        String value = values.get(values.size() - 1);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("--" + name + " needs a value");
        }
        return value;
    }

    /** Absent or bare flag → true; otherwise the value must be true or false. */
    private static boolean flag(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return true;
        String value = values.get(values.size() - 1).trim();
        if (value.equalsIgnoreCase("true")) return true;
        if (value.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException("--" + name + " expects true or false, got: " + value);
    }
}
