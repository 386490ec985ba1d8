package com.production.pdf_analysis.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextStatisticsTest {

    @Test
    void countWordsIgnoresUrlsAndSingleCharacterTokens() {
        assertThat(TextStatistics.countWords("see https://example.com for a full report")).isEqualTo(4);
        assertThat(TextStatistics.countWords("- a | b -- ok")).isEqualTo(1);
        assertThat(TextStatistics.countWords("Привет мир, это тест")).isEqualTo(4);
    }

    @Test
    void countWordsOnBlankInput() {
        assertThat(TextStatistics.countWords(null)).isZero();
        assertThat(TextStatistics.countWords("   \n\t")).isZero();
    }

    @Test
    void countCharsSkipsWhitespace() {
        assertThat(TextStatistics.countCharsNoSpaces("ab c\nd\te")).isEqualTo(5);
        assertThat(TextStatistics.countCharsNoSpaces(null)).isZero();
    }

    @Test
    void estimateTotalWordsFromFirstPageSample() {
        assertThat(TextStatistics.estimateTotalWords(250, 10, 100_000L)).isEqualTo(2500);
        // sample clamped to 900 words per page
        assertThat(TextStatistics.estimateTotalWords(2000, 3, null)).isEqualTo(2700);
    }

    @Test
    void estimateTotalWordsFallsBackToBytesThenDefault() {
        // 10 words is too small a sample: 60000 bytes / 10 pages / 6 = 1000 -> clamped 900
        assertThat(TextStatistics.estimateTotalWords(10, 10, 60_000L)).isEqualTo(9000);
        assertThat(TextStatistics.estimateTotalWords(10, 4, null)).isEqualTo(1200);
        assertThat(TextStatistics.estimateTotalWords(0, null, null)).isEqualTo(300);
    }

    @Test
    void readingSpeedDependsOnLanguage() {
        assertThat(TextStatistics.baseWordsPerMinute("en")).isEqualTo(200);
        assertThat(TextStatistics.baseWordsPerMinute("EN-us")).isEqualTo(200);
        assertThat(TextStatistics.baseWordsPerMinute("ru")).isEqualTo(180);
        assertThat(TextStatistics.baseWordsPerMinute(null)).isEqualTo(180);
        assertThat(TextStatistics.estimateReadingTimeMinutes("en", 1000)).isEqualTo(5.0);
    }

    @Test
    void avgCharsPerWordIsClamped() {
        assertThat(TextStatistics.avgCharsPerWord("a b c", 3)).isEqualTo(4.5);
        assertThat(TextStatistics.avgCharsPerWord("internationalization", 1)).isEqualTo(6.5);
        assertThat(TextStatistics.estimateCharCount(5.0, 100)).isEqualTo(500);
    }
}
