package com.example.cdscoverage.exception;

/**
 * Lookup of a category id that is not in the registry.
 */
public class CategoryNotFoundException extends RuntimeException {

    private final String categoryId;

    public CategoryNotFoundException(String categoryId) {
        super("Unknown usage-scenario category: " + categoryId);
        this.categoryId = categoryId;
    }

    public String getCategoryId() {
        return categoryId;
    }
}
