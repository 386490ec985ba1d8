package com.production.pdf_analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/**
 * Canonical analysis of one document. This is the wire contract validated against
 * {@code schema/analysis-result.schema.json}; JSON names are fixed by the annotations.
 */
@Builder(toBuilder = true)
public record AnalysisResult(
        @JsonProperty("doc_language") String docLanguage,
        Volume volume,
        Complexity complexity,
        List<Topic> topics,
        Category category,
        Limitations limitations
) {

    public static final int MAX_TOPICS = 6;

    public AnalysisResult {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    @Builder(toBuilder = true)
    public record Volume(
            @JsonProperty("word_count") int wordCount,
            @JsonProperty("char_count") int charCount,
            @JsonProperty("page_count") Integer pageCount,
            @JsonProperty("byte_size") Long byteSize,
            @JsonProperty("reading_time_min") double readingTimeMin,
            VolumeMethod method
    ) {}

    public record VolumeMethod(
            @JsonProperty("word_count") String wordCount,
            @JsonProperty("char_count") String charCount
    ) {
        public static final String CONTENT_BASED = "content_based_full_scan";
        public static final String PRECOMPUTED = "precomputed";
        public static final String CHARS_NO_SPACES = "estimated_no_spaces";
    }

    @Builder(toBuilder = true)
    public record Complexity(
            int score,
            ComplexityLevel level,
            @JsonProperty("estimated_grade") String estimatedGrade,
            List<String> drivers,
            String notes
    ) {
        public Complexity {
            drivers = drivers == null ? List.of() : List.copyOf(drivers);
        }
    }

    public record Topic(String label, double score, List<String> keywords, String rationale) {
        public Topic {
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
        }
    }

    public record Limitations(
            @JsonProperty("short_or_noisy_input") boolean shortOrNoisyInput,
            String comments
    ) {}
}
