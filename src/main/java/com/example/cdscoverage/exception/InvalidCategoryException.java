package com.example.cdscoverage.exception;

/**
 * Taxonomy definition rejected at load time. Fatal: the application does not start.
 */
public class InvalidCategoryException extends RuntimeException {

    public InvalidCategoryException(String message) {
        super(message);
    }

    public InvalidCategoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
