package com.production.pdf_analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Text and metadata pulled out of one PDF. {@code text} is the first page unless the
 * extraction policy is {@code full}. {@code readingMetrics} is present only when the
 * content-based estimator succeeded, in which case {@code wordCountHint} is its word total.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractedDocument(
        String text,
        @JsonProperty("page_count") Integer pageCount,
        @JsonProperty("byte_size") Long byteSize,
        @JsonProperty("word_count_hint") Integer wordCountHint,
        @JsonProperty("language_hint") String languageHint,
        @JsonProperty("source_name") String sourceName,
        @JsonProperty("toc_preview") String tocPreview,
        @JsonProperty("reading_metrics") ReadingMetrics readingMetrics
) {

    @JsonIgnore
    public LlmMetadata llmMetadata() {
        return LlmMetadata.builder()
                .byteSize(byteSize)
                .pageCount(pageCount)
                .precomputedWordCount(wordCountHint)
                .langHint(languageHint)
                .sourceName(sourceName)
                .tocPreview(tocPreview)
                .build();
    }

    @JsonIgnore
    public InternalMetadata internalMetadata() {
        return new InternalMetadata(readingMetrics);
    }
}
