package com.production.pdf_analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Document metadata that may be shown to a language model. Nothing internal
 * (reading-time breakdowns, host estimates) belongs here; see {@link InternalMetadata}.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmMetadata(
        @JsonProperty("byte_size") Long byteSize,
        @JsonProperty("page_count") Integer pageCount,
        @JsonProperty("precomputed_word_count") Integer precomputedWordCount,
        @JsonProperty("char_count") Integer charCount,
        @JsonProperty("lang_hint") String langHint,
        @JsonProperty("source_name") String sourceName,
        @JsonProperty("toc_preview") String tocPreview
) {

    public static LlmMetadata empty() {
        return LlmMetadata.builder().build();
    }
}
