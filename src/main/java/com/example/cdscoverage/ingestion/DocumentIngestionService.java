package com.example.cdscoverage.ingestion;

import com.example.cdscoverage.config.CoverageProperties;
import com.example.cdscoverage.model.GuidelineDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns document identifiers into {@link GuidelineDocument}s.
 * <p>
 * An identifier is first looked up in the configured guideline catalog ({@code coverage.guidelines}),
 * otherwise it is taken as a file path. Text files are read directly; PDFs are sent to the
 * external extraction service. A catalog document that cannot be read is replaced by a
 * placeholder text naming the file, so the batch still produces a run for it.
 */
@Service
public class DocumentIngestionService {

    private static final Logger log = LoggerFactory.getLogger(DocumentIngestionService.class);

    private final RestClient restClient;
    private final Map<String, CoverageProperties.Guideline> catalog;
    private final DomainDetector domainDetector;

    @Autowired
    public DocumentIngestionService(CoverageProperties properties, DomainDetector domainDetector) {
        this(properties, domainDetector, defaultRestClient(properties));
    }

    DocumentIngestionService(CoverageProperties properties, DomainDetector domainDetector, RestClient restClient) {
        this.catalog = properties.guidelines();
        this.domainDetector = domainDetector;
        this.restClient = restClient;
    }

    private static RestClient defaultRestClient(CoverageProperties properties) {
        // Generous timeout: large guideline PDFs can take minutes to extract
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Duration.ofSeconds(30));
        factory.setReadTimeout(Duration.ofMinutes(5));

        return RestClient.builder()
                .baseUrl(properties.pdfService().baseUrl())
                .requestFactory(factory)
                .build();
    }

    /** Identifiers of the configured guideline catalog. */
    public Set<String> catalogIds() {
        return catalog.keySet();
    }

    /**
     * Loads a document by catalog identifier or file path.
     *
     * @throws IllegalArgumentException if the identifier is neither in the catalog nor an existing file
     */
    public GuidelineDocument load(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("Document identifier must not be blank");
        }
        CoverageProperties.Guideline entry = catalog.get(documentId);
        if (entry != null) {
            Path path = Path.of(entry.path());
            String text = readOrPlaceholder(path);
            log.info("Loaded guideline '{}' ({}): {} characters", documentId,
                    entry.name() != null ? entry.name() : path.getFileName(), text.length());
            return GuidelineDocument.of(documentId, text, domainOf(entry.domain(), text));
        }

        Path path = Path.of(documentId);
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Unknown document: " + documentId
                    + " (not in the guideline catalog and no such file)");
        }
        String text = readOrPlaceholder(path);
        log.info("Loaded guideline file '{}': {} characters", path, text.length());
        return GuidelineDocument.of(stem(path), text, domainOf(null, text));
    }

    /**
     * Wraps raw text submitted by a caller (e.g. the HTTP surface).
     */
    public GuidelineDocument fromText(String name, String text, String domain) {
        String safeText = text != null ? text : "";
        return GuidelineDocument.of(name, safeText, domainOf(domain, safeText));
    }

    private String domainOf(String configured, String text) {
        return configured != null && !configured.isBlank() ? configured : domainDetector.detect(text);
    }

    private String readOrPlaceholder(Path path) {
        try {
            return isPdf(path) ? extractPdfText(path) : Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to extract text from {}, using filename-based content: {}", path, e.getMessage());
            return "Clinical guideline content for " + stem(path);
        }
    }

    /**
     * Sends the PDF to the extraction service and returns the extracted text.
     *
     * @throws RuntimeException if the service is unreachable or reports a failure
     */
    String extractPdfText(Path pdf) {
        log.info("Sending PDF '{}' to extraction service", pdf.getFileName());

        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new FileSystemResource(pdf));
        body.add("mode", "text");

        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> response = restClient.post()
                    .uri("/extract")
                    .body(body)
                    .retrieve()
                    .body(Map.class);

            if (response != null && Boolean.TRUE.equals(response.get("success"))) {
                String text = (String) response.get("text");
                log.info("Extraction completed: {} characters extracted", text != null ? text.length() : 0);
                return text != null ? text : "";
            }

            String error = response != null ? response.toString() : "null response from service";
            throw new RuntimeException("PDF extraction failed: " + error);

        } catch (RestClientException e) {
            throw new RuntimeException(
                    "PDF extraction service unreachable. Ensure the extraction service is running on "
                            + "the configured port. Details: " + e.getMessage(), e);
        }
    }

    /**
     * Checks whether the extraction service is reachable.
     */
    public boolean isServiceAvailable() {
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> health = restClient.get()
                    .uri("/health")
                    .retrieve()
                    .body(Map.class);
            return health != null && "ok".equals(health.get("status"));
        } catch (Exception e) {
            log.warn("PDF extraction service not available: {}", e.getMessage());
            return false;
        }
    }

    private static boolean isPdf(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private static String stem(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
