package com.example.cdscoverage.model;

/**
 * Weighted keyword or phrase signal of a category.
 *
 * @param phrase text looked up case-insensitively in the guideline
 * @param weight contribution to the category score when the phrase is present
 */
public record MatchFeature(
        String phrase,
        double weight
) {}
