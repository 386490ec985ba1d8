package com.production.pdf_analysis.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Result of the category decision flow: either the document fits one of the existing
 * categories, or a new category is defined for it.
 */
public record CategoryDecision(
        Decision decision,
        Category category,
        @JsonProperty("existing_label") String existingLabel,
        @JsonProperty("new_category_def") NewCategoryDefinition newCategoryDef
) {

    public static final String FALLBACK_DESCRIPTION = "defined without LLM";

    /** Neutral answer used when no LLM could decide. */
    public static CategoryDecision neutral() {
        return new CategoryDecision(
                Decision.CREATED_NEW,
                Category.uncategorized("unknown"),
                null,
                new NewCategoryDefinition(Category.UNCATEGORIZED, FALLBACK_DESCRIPTION, List.of(), null));
    }

    public enum Decision {
        MATCHED_EXISTING("matched_existing"),
        CREATED_NEW("created_new");

        private final String wireValue;

        Decision(String wireValue) {
            this.wireValue = wireValue;
        }

        @JsonValue
        public String getWireValue() {
            return wireValue;
        }

        @JsonCreator
        public static Decision fromWire(String value) {
            if (value == null) {
                return CREATED_NEW;
            }
            String v = value.trim().toLowerCase(Locale.ROOT);
            return v.startsWith("match") || v.equals("existing") ? MATCHED_EXISTING : CREATED_NEW;
        }
    }

    public record NewCategoryDefinition(
            String label,
            String description,
            List<String> keywords,
            List<String> examples
    ) {
        public NewCategoryDefinition {
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
            examples = examples == null ? null : List.copyOf(examples);
        }
    }
}
