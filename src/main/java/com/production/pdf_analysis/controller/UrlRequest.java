package com.production.pdf_analysis.controller;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class UrlRequest {

    @NotBlank(message = "URL is required")
    private String url;

    /** Overrides the configured analysis timeout. */
    private Integer timeoutSeconds;
}
