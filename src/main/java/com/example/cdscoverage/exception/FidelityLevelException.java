package com.example.cdscoverage.exception;

import com.example.cdscoverage.model.FidelityLevel;

/**
 * Unrecoverable failure of one fidelity level; triggers fallback to the next lower level.
 */
public class FidelityLevelException extends RuntimeException {

    private final FidelityLevel level;

    public FidelityLevelException(FidelityLevel level, String message) {
        super(message);
        this.level = level;
    }

    public FidelityLevelException(FidelityLevel level, String message, Throwable cause) {
        super(message, cause);
        this.level = level;
    }

    public FidelityLevel getLevel() {
        return level;
    }
}
