package com.production.pdf_analysis.llm;

public record LlmResponse(String content, String providerName) {}
