package com.example.cdscoverage.exception;

/**
 * Failure of a single call to the scenario generation collaborator.
 * Recoverable: the sequencer skips the category, the orchestrator falls back.
 */
public class GenerationException extends RuntimeException {

    private final String categoryId;

    public GenerationException(String categoryId, String message) {
        super(message);
        this.categoryId = categoryId;
    }

    public GenerationException(String categoryId, String message, Throwable cause) {
        super(message, cause);
        this.categoryId = categoryId;
    }

    public String getCategoryId() {
        return categoryId;
    }
}
