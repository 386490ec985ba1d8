package com.production.pdf_analysis.model;

import java.util.List;

public record Category(String label, double score, String basis, List<String> keywords) {

    public static final String UNCATEGORIZED = "uncategorized";

    public Category {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    /** Neutral category used whenever nothing better is known. */
    public static Category uncategorized(String basis) {
        return new Category(UNCATEGORIZED, 0.0, basis, List.of());
    }
}
