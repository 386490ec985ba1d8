package com.production.pdf_analysis.model;

import java.util.Optional;

/**
 * Metadata used only by the orchestrator for post-processing. Never serialized into a prompt.
 */
public record InternalMetadata(ReadingMetrics readingMetrics) {

    private static final InternalMetadata EMPTY = new InternalMetadata(null);

    public static InternalMetadata empty() {
        return EMPTY;
    }

    public Optional<ReadingMetrics> contentMetrics() {
        return Optional.ofNullable(readingMetrics);
    }
}
