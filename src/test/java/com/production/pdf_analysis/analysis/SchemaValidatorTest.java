package com.production.pdf_analysis.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.production.pdf_analysis.config.AppConfig;
import com.production.pdf_analysis.exception.SchemaViolationException;
import com.production.pdf_analysis.model.AnalysisResult;
import com.production.pdf_analysis.model.AnalysisResult.Topic;
import com.production.pdf_analysis.model.LlmMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaValidatorTest {

    private final SchemaValidator validator = new SchemaValidator(new ObjectMapper());
    private final AnalysisResult valid = new HeuristicAnalyzer(new AppConfig())
            .analyze("short text", LlmMetadata.builder().sourceName("finance_q3.pdf").build(), null);

    @Test
    void validResultPasses() {
        assertThat(validator.validateAnalysis(valid)).isEmpty();
        assertThat(validator.requireUsable(valid)).isSameAs(valid);
    }

    @Test
    void outOfRangeValuesAreReportedButTolerated() {
        AnalysisResult skewed = valid.toBuilder()
                .topics(List.of(new Topic("Finance", 5.0, List.of(), "")))
                .build();

        assertThat(validator.validateAnalysis(skewed)).isNotEmpty();
        assertThat(validator.requireUsable(skewed)).isSameAs(skewed);
    }

    @Test
    void missingSectionIsRejected() {
        AnalysisResult broken = valid.toBuilder().category(null).build();

        assertThatThrownBy(() -> validator.requireUsable(broken))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("category");
    }
}
