package com.production.pdf_analysis.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.production.pdf_analysis.config.AppConfig;
import com.production.pdf_analysis.extract.TextCleaningService;
import com.production.pdf_analysis.model.CategoryDescriptor;
import com.production.pdf_analysis.model.LlmMetadata;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Prompts for the analysis and category calls. Only {@link LlmMetadata} is ever serialized
 * into a prompt.
 */
@Component
public class PromptBuilder {

    public static final String ANALYSIS_SYSTEM_PROMPT = """
            You are a careful analyzer of PDF documents. From the supplied content determine the \
            document's volume, overall text complexity, topics and category, and return strictly \
            valid JSON. Do not use Markdown; return exactly one JSON object.""";

    public static final String CATEGORY_SYSTEM_PROMPT = """
            You categorize documents: assign the document to one of the existing categories or \
            define a new one. Return strictly valid JSON and nothing else.""";

    private static final String ANALYSIS_SHAPE = """
            {
              "doc_language": "ISO 639-1 code",
              "volume": {"word_count": int, "char_count": int, "page_count": int|null, "byte_size": int|null,
                         "reading_time_min": number, "method": {"word_count": string, "char_count": string}},
              "complexity": {"score": 0-100, "level": "very-low|low|medium|high|very-high",
                             "estimated_grade": string, "drivers": [string], "notes": string},
              "topics": [{"label": string, "score": 0-1, "keywords": [string], "rationale": string}] (at most 6),
              "category": {"label": string, "score": 0-1, "basis": string, "keywords": [string]},
              "limitations": {"short_or_noisy_input": boolean, "comments": string}
            }""";

    private static final String CATEGORY_SHAPE = """
            {
              "decision": "matched_existing" | "created_new",
              "category": {"label": string, "score": 0-1, "basis": string, "keywords": [string]},
              "existing_label": string (required when decision is matched_existing),
              "new_category_def": {"label": string, "description": string, "keywords": [string], "examples": [string]}
                                  (required when decision is created_new)
            }""";

    static final int CATEGORY_TEXT_CHARS = 6000;

    private final AppConfig appConfig;
    private final TextCleaningService textCleaningService;
    private final ObjectMapper objectMapper;

    public PromptBuilder(AppConfig appConfig, TextCleaningService textCleaningService, ObjectMapper objectMapper) {
        this.appConfig = appConfig;
        this.textCleaningService = textCleaningService;
        this.objectMapper = objectMapper;
    }

    public String analysisPrompt(String text, LlmMetadata meta) {
        String body = textCleaningService.truncate(text == null ? "" : text,
                appConfig.getExtraction().getMaxPromptChars());
        return "Input data for PDF analysis.\n"
                + "Important: TEXT is only the first page of the document, to save context.\n"
                + "Estimate volume and reading time from META; if precomputed_word_count is present, "
                + "treat it as the primary source of truth.\n"
                + "Do not invent page_count or byte_size: use the values from META or null.\n"
                + "Also determine the document category from TEXT and/or META.source_name "
                + "(file name or last URL segment) and META.toc_preview when present.\n"
                + "Answer with one JSON object of this shape:\n" + ANALYSIS_SHAPE + "\n\n"
                + "TEXT (first page, may be truncated):\n" + body + "\n\n"
                + "META (JSON):\n" + toJson(meta);
    }

    public String categoryPrompt(String text, LlmMetadata meta, List<CategoryDescriptor> existing) {
        String body = textCleaningService.truncate(text == null ? "" : text, CATEGORY_TEXT_CHARS);
        StringBuilder sb = new StringBuilder();
        sb.append("Decide the category of a document.\n");
        if (existing == null || existing.isEmpty()) {
            sb.append("There are no existing categories: define a new one (decision \"created_new\").\n");
        } else {
            sb.append("If the document fits one of the EXISTING categories, answer \"matched_existing\" and copy its ")
                    .append("label into existing_label. Otherwise answer \"created_new\" and define a new category ")
                    .append("that is neither too broad nor too narrow.\n");
        }
        sb.append("Answer with one JSON object of this shape:\n").append(CATEGORY_SHAPE).append("\n\n");
        sb.append("EXISTING (JSON):\n").append(toJson(existing == null ? List.of() : existing)).append("\n\n");
        sb.append("TEXT (first page, may be truncated):\n").append(body).append("\n\n");
        sb.append("META (JSON):\n").append(toJson(meta));
        return sb.toString();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return "{}";
        }
    }
}
