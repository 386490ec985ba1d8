package com.production.pdf_analysis.controller;

import com.production.pdf_analysis.model.LlmMetadata;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class TextAnalysisRequest {

    @NotNull(message = "Text is required")
    private String text;
    private LlmMetadata meta;
    private Integer timeoutSeconds;
}
