package com.example.cdscoverage.exception;

import java.time.Duration;

/**
 * Generation call that did not complete within its time limit.
 */
public class GenerationTimeoutException extends GenerationException {

    public GenerationTimeoutException(String categoryId, Duration timeout) {
        super(categoryId, "Generation for category %s timed out after %d ms"
                .formatted(categoryId, timeout.toMillis()));
    }
}
