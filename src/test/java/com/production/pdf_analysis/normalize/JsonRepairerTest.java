package com.production.pdf_analysis.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.production.pdf_analysis.exception.ResponseUnparseableException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonRepairerTest {

    private final JsonRepairer repairer = new JsonRepairer(new ObjectMapper());

    @Test
    void parsesCleanJson() {
        assertThat(repairer.repair("{\"doc_language\": \"en\"}")).containsEntry("doc_language", "en");
    }

    @Test
    void extractsFencedBlock() {
        String content = "Here is the analysis:\n```json\n{\"category\": {\"label\": \"Science\"}}\n```\nThanks!";

        Map<String, Object> data = repairer.repair(content);

        assertThat(data).containsKey("category");
        assertThat(asMap(data.get("category"))).containsEntry("label", "Science");
    }

    @Test
    void extractsFirstBalancedObjectFromProse() {
        String content = "Sure! {\"note\": \"braces } inside strings\", \"n\": 1} and then more text {oops";

        Map<String, Object> data = repairer.repair(content);

        assertThat(data).containsEntry("note", "braces } inside strings").containsEntry("n", 1);
    }

    @Test
    void removesTrailingCommasAndComments() {
        String content = "{\n  \"topics\": [\"a\", \"b\",], // trailing\n  /* block */ \"n\": 2,\n}";

        Map<String, Object> data = repairer.repair(content);

        assertThat(data.get("topics")).isEqualTo(List.of("a", "b"));
        assertThat(data).containsEntry("n", 2);
    }

    @Test
    void closesUnbalancedBrackets() {
        String content = "{\"volume\": {\"word_count\": 1200, \"pages\": [1, 2";

        Map<String, Object> data = repairer.repair(content);

        assertThat(asMap(data.get("volume"))).containsEntry("word_count", 1200);
    }

    @Test
    void closesUnterminatedString() {
        Map<String, Object> data = repairer.repair("{\"doc_language\": \"ru\", \"notes\": \"cut off");

        assertThat(data).containsEntry("doc_language", "ru").containsEntry("notes", "cut off");
    }

    @Test
    void failsWithPreviewWhenNothingParses() {
        String content = "I cannot analyze this document.";

        assertThatThrownBy(() -> repairer.repair(content))
                .isInstanceOf(ResponseUnparseableException.class)
                .hasMessageContaining("I cannot analyze");
        assertThatThrownBy(() -> repairer.repair("  "))
                .isInstanceOf(ResponseUnparseableException.class);
    }

    @Test
    void topLevelArrayIsNotAnObject() {
        assertThatThrownBy(() -> repairer.repair("[1, 2, 3]"))
                .isInstanceOf(ResponseUnparseableException.class);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }
}
