package com.production.pdf_analysis.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import com.production.pdf_analysis.exception.SchemaViolationException;
import com.production.pdf_analysis.model.AnalysisResult;
import com.production.pdf_analysis.model.CategoryDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Validates results against the draft-07 schemas under {@code classpath:schema/}.
 */
@Component
@Slf4j
public class SchemaValidator {

    static final String ANALYSIS_SCHEMA = "/schema/analysis-result.schema.json";
    static final String CATEGORY_SCHEMA = "/schema/category-decision.schema.json";

    private static final List<String> REQUIRED_TOP_LEVEL =
            List.of("doc_language", "volume", "complexity", "topics", "category", "limitations");

    private final ObjectMapper objectMapper;
    private final JsonSchema analysisSchema;
    private final JsonSchema categorySchema;

    public SchemaValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
        this.analysisSchema = load(factory, ANALYSIS_SCHEMA);
        this.categorySchema = load(factory, CATEGORY_SCHEMA);
    }

    private static JsonSchema load(JsonSchemaFactory factory, String resource) {
        try (InputStream in = SchemaValidator.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Schema not found on classpath: " + resource);
            }
            return factory.getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read schema " + resource, e);
        }
    }

    public List<String> validateAnalysis(AnalysisResult result) {
        return validate(analysisSchema, objectMapper.valueToTree(result));
    }

    public List<String> validateCategoryDecision(CategoryDecision decision) {
        return validate(categorySchema, objectMapper.valueToTree(decision));
    }

    /**
     * Logs schema violations and returns the result when it still has every top-level
     * section.
     *
     * @throws SchemaViolationException when a top-level section is missing
     */
    public AnalysisResult requireUsable(AnalysisResult result) {
        JsonNode tree = objectMapper.valueToTree(result);
        List<String> violations = validate(analysisSchema, tree);
        if (violations.isEmpty()) {
            return result;
        }

        List<String> missing = new ArrayList<>();
        for (String key : REQUIRED_TOP_LEVEL) {
            if (!tree.hasNonNull(key)) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaViolationException("Analysis result is missing " + missing, violations);
        }
        log.warn("Analysis result has {} schema violation(s), returning it anyway: {}", violations.size(), violations);
        return result;
    }

    private static List<String> validate(JsonSchema schema, JsonNode node) {
        Set<ValidationMessage> messages = schema.validate(node);
        List<String> violations = new ArrayList<>(messages.size());
        for (ValidationMessage message : messages) {
            violations.add(message.getMessage());
        }
        return violations;
    }
}
