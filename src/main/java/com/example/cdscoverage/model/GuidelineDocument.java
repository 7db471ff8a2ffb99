package com.example.cdscoverage.model;

import java.nio.charset.StandardCharsets;

/**
 * Clinical guideline under evaluation. Owned by the caller, only read by the engine.
 *
 * @param name       Document identifier used in reports
 * @param sourceText Full extracted text
 * @param domainTag  Clinical domain (e.g. "cardiology")
 * @param byteSize   Size of the source in bytes
 */
public record GuidelineDocument(
        String name,
        String sourceText,
        String domainTag,
        long byteSize
) {
    public GuidelineDocument {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Document name must not be blank");
        }
        if (sourceText == null) sourceText = "";
    }

    /** Creates a document whose size is the UTF-8 length of its text. */
    public static GuidelineDocument of(String name, String sourceText, String domainTag) {
        String text = sourceText != null ? sourceText : "";
        return new GuidelineDocument(name, text, domainTag, text.getBytes(StandardCharsets.UTF_8).length);
    }

    /** Copy of this document with extra text appended (used when re-scoring after generation). */
    public GuidelineDocument withAppendedText(String extra) {
        if (extra == null || extra.isBlank()) return this;
        return GuidelineDocument.of(name, sourceText + "\n" + extra, domainTag);
    }
}
