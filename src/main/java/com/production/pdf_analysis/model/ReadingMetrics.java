package com.production.pdf_analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Content-based reading-time breakdown of one PDF. Minutes are rounded to two decimals;
 * the per-kind values are whole seconds.
 */
@Builder
public record ReadingMetrics(
        @JsonProperty("total_min") double totalMinutes,
        @JsonProperty("text_min") double textMinutes,
        @JsonProperty("nontext_min") double nontextMinutes,
        @JsonProperty("words") int wordCount,
        @JsonProperty("effective_wpm") int effectiveWpm,
        @JsonProperty("pages") PageClassCounts pageClassCounts,
        @JsonProperty("images_s") int imageSeconds,
        @JsonProperty("tables_s") int tableSeconds,
        @JsonProperty("code_s") int codeSeconds,
        @JsonProperty("slides_s") int slideSeconds,
        ReadingTimeMode mode
) {

    public int nontextSeconds() {
        return imageSeconds + tableSeconds + codeSeconds + slideSeconds;
    }
}
