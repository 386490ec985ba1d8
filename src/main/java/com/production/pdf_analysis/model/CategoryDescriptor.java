package com.production.pdf_analysis.model;

import java.util.List;

/**
 * An existing category offered to the LLM as a classification target.
 */
public record CategoryDescriptor(String label, String description, List<String> keywords) {

    public CategoryDescriptor {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
