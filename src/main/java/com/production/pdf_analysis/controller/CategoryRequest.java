package com.production.pdf_analysis.controller;

import com.production.pdf_analysis.model.CategoryDescriptor;
import com.production.pdf_analysis.model.LlmMetadata;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class CategoryRequest {

    @NotNull(message = "Text is required")
    private String text;
    private LlmMetadata meta;
    private List<CategoryDescriptor> existingCategories;
    private Integer timeoutSeconds;
}
