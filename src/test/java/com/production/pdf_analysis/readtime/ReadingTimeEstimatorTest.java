package com.production.pdf_analysis.readtime;

import com.production.pdf_analysis.TestPdfs;
import com.production.pdf_analysis.config.AppConfig;
import com.production.pdf_analysis.exception.ExtractionFailureException;
import com.production.pdf_analysis.extract.TextStatistics;
import com.production.pdf_analysis.model.ComplexityLevel;
import com.production.pdf_analysis.model.PageClassCounts;
import com.production.pdf_analysis.model.ReadingMetrics;
import com.production.pdf_analysis.model.ReadingTimeMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReadingTimeEstimatorTest {

    private AppConfig appConfig;
    private ReadingTimeEstimator estimator;

    @BeforeEach
    void setUp() {
        appConfig = new AppConfig();
        estimator = new ReadingTimeEstimator(appConfig);
    }

    @Test
    void sameInputGivesSameMetrics() {
        byte[] pdf = TestPdfs.builder()
                .page(TestPdfs.words(250))
                .page(TestPdfs.words(100), 1)
                .page(TestPdfs.words(20), 2)
                .build();

        ReadingMetrics first = estimator.estimate(pdf, "en", ComplexityLevel.HIGH, ReadingTimeMode.ACCURATE);
        ReadingMetrics second = estimator.estimate(pdf, "en", ComplexityLevel.HIGH, ReadingTimeMode.ACCURATE);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void accurateModeClassifiesPagesAndAddsNontextTime() {
        byte[] pdf = TestPdfs.builder()
                .page(TestPdfs.words(250))
                .page(TestPdfs.words(100), 1)
                .page(TestPdfs.words(20), 2)
                .page("")
                .build();

        ReadingMetrics metrics = estimator.estimate(pdf, "en", null, ReadingTimeMode.ACCURATE);

        assertThat(metrics.mode()).isEqualTo(ReadingTimeMode.ACCURATE);
        assertThat(metrics.pageClassCounts()).isEqualTo(new PageClassCounts(1, 1, 1, 1));
        // slide pages contribute time, not words
        assertThat(metrics.wordCount()).isEqualTo(350);
        assertThat(metrics.effectiveWpm()).isEqualTo(170);
        assertThat(metrics.imageSeconds()).isEqualTo(3);
        assertThat(metrics.slideSeconds()).isEqualTo(8);
        assertThat(metrics.textMinutes()).isEqualTo(TextStatistics.round2(350 / 170.0));
        assertThat(metrics.nontextMinutes()).isEqualTo(TextStatistics.round2(11 / 60.0));
        assertThat(metrics.totalMinutes())
                .isEqualTo(TextStatistics.round2(metrics.textMinutes() + metrics.nontextMinutes()));
    }

    @Test
    void tablesAndCodeAddTimeOnAnyPage() {
        byte[] pdf = TestPdfs.builder()
                .page("Table 1 lists inputs\nTable 2 lists outputs\nfor (int i = 0; i < n; i++) {\n}")
                .build();

        ReadingMetrics metrics = estimator.estimate(pdf, "en", ComplexityLevel.LOW, ReadingTimeMode.ACCURATE);

        assertThat(metrics.tableSeconds()).isEqualTo(24);
        assertThat(metrics.codeSeconds()).isEqualTo(1);
        assertThat(metrics.nontextSeconds()).isEqualTo(25);
    }

    @Test
    void fastModeExtrapolatesFromFirstPage() {
        byte[] pdf = TestPdfs.builder()
                .page(TestPdfs.words(250))
                .page(TestPdfs.words(10))
                .page(TestPdfs.words(10))
                .build();

        ReadingMetrics metrics = estimator.estimate(pdf, "ru", ComplexityLevel.MEDIUM, ReadingTimeMode.FAST);

        assertThat(metrics.mode()).isEqualTo(ReadingTimeMode.FAST);
        assertThat(metrics.wordCount()).isEqualTo(750);
        assertThat(metrics.pageClassCounts()).isEqualTo(PageClassCounts.NONE);
        assertThat(metrics.nontextMinutes()).isZero();
        assertThat(metrics.totalMinutes()).isEqualTo(TextStatistics.round2(750 / 153.0));
    }

    @Test
    void longDocumentsAreForcedIntoFastMode() {
        appConfig.getReadtime().setMaxPages(2);
        byte[] pdf = TestPdfs.builder()
                .page(TestPdfs.words(250))
                .page(TestPdfs.words(250), 1)
                .page(TestPdfs.words(250))
                .build();

        ReadingMetrics metrics = estimator.estimate(pdf, "en", null, ReadingTimeMode.ACCURATE);

        assertThat(metrics.mode()).isEqualTo(ReadingTimeMode.FAST);
        assertThat(metrics.imageSeconds()).isZero();
    }

    @Test
    void configuredModeIsUsedByDefault() {
        appConfig.getReadtime().setMode("fast");
        byte[] pdf = TestPdfs.builder().page(TestPdfs.words(50)).build();

        assertThat(estimator.estimate(pdf, "en", null).mode()).isEqualTo(ReadingTimeMode.FAST);
    }

    @Test
    void unreadablePdfIsAnExtractionFailure() {
        byte[] broken = "%PDF-1.4 truncated".getBytes(StandardCharsets.US_ASCII);

        assertThatThrownBy(() -> estimator.estimate(broken, "en", null, ReadingTimeMode.ACCURATE))
                .isInstanceOf(ExtractionFailureException.class);
    }

    @Test
    void effectiveWpmScalesWithComplexity() {
        assertThat(ReadingTimeEstimator.effectiveWpm("en", null)).isEqualTo(170);
        assertThat(ReadingTimeEstimator.effectiveWpm("en", ComplexityLevel.VERY_LOW)).isEqualTo(220);
        assertThat(ReadingTimeEstimator.effectiveWpm("ru", ComplexityLevel.VERY_HIGH)).isEqualTo(99);
    }

    @Test
    void counters() {
        assertThat(ReadingTimeEstimator.countWords("Привет, world 42!")).isEqualTo(3);
        assertThat(ReadingTimeEstimator.countTables("See Table 3 and таблица 4; tables are plural")).isEqualTo(2);
        assertThat(ReadingTimeEstimator.countCodeLines("def run():\n  return x\nplain prose")).isEqualTo(1);
    }
}
