package com.production.pdf_analysis.controller;

import jakarta.validation.constraints.AssertTrue;
import lombok.Data;

/**
 * Either a local {@code path} or an http(s) {@code url}, not both.
 */
@Data
public class ExtractRequest {

    private String path;
    private String url;
    private Integer timeoutSeconds;

    @AssertTrue(message = "Exactly one of 'path' or 'url' is required")
    public boolean isSingleSource() {
        boolean hasPath = path != null && !path.isBlank();
        boolean hasUrl = url != null && !url.isBlank();
        return hasPath ^ hasUrl;
    }
}
