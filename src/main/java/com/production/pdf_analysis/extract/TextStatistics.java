package com.production.pdf_analysis.extract;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Word and character counting plus the first-page extrapolation used when no
 * content-based metrics are available.
 */
public final class TextStatistics {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern URL = Pattern.compile("(?i)^https?://.*");
    private static final Pattern NON_WORD = Pattern.compile("\\W+", Pattern.UNICODE_CHARACTER_CLASS);

    public static final int DEFAULT_WORDS_PER_PAGE = 300;
    public static final int MIN_WORDS_PER_PAGE = 60;
    public static final int MAX_WORDS_PER_PAGE = 900;
    /** First-page word count below which the sample is too small to extrapolate from. */
    public static final int MIN_SAMPLE_WORDS = 30;
    /** Below this many first-page words the input is flagged as short or noisy. */
    public static final int SHORT_INPUT_WORDS = 150;

    private TextStatistics() {}

    /**
     * Whitespace tokens, ignoring URLs and tokens with at most one word character.
     */
    public static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int count = 0;
        for (String token : WHITESPACE.split(text.trim())) {
            if (token.isEmpty() || URL.matcher(token).matches()) {
                continue;
            }
            if (NON_WORD.matcher(token).replaceAll("").length() <= 1) {
                continue;
            }
            count++;
        }
        return count;
    }

    /** Characters excluding all whitespace. */
    public static int countCharsNoSpaces(String text) {
        if (text == null) {
            return 0;
        }
        return WHITESPACE.matcher(text).replaceAll("").length();
    }

    /**
     * Extrapolates a document word total from the first page:
     * clamped first-page count times pages, else bytes-per-page / 6, else 300 per page.
     */
    public static int estimateTotalWords(int firstPageWords, Integer pageCount, Long byteSize) {
        if (pageCount != null && pageCount > 0 && firstPageWords >= MIN_SAMPLE_WORDS) {
            return (int) clamp(firstPageWords, MIN_WORDS_PER_PAGE, MAX_WORDS_PER_PAGE) * pageCount;
        }
        if (pageCount != null && pageCount > 0 && byteSize != null && byteSize > 0) {
            double approx = byteSize.doubleValue() / pageCount / 6.0;
            return (int) clamp(approx, MIN_WORDS_PER_PAGE, MAX_WORDS_PER_PAGE) * pageCount;
        }
        if (pageCount != null && pageCount > 0) {
            return DEFAULT_WORDS_PER_PAGE * pageCount;
        }
        return DEFAULT_WORDS_PER_PAGE;
    }

    /** Average non-space characters per word on the sample, clamped to [4.5, 6.5]. */
    public static double avgCharsPerWord(String sample, int sampleWords) {
        double base = (double) countCharsNoSpaces(sample) / Math.max(sampleWords, 1);
        return clamp(base, 4.5, 6.5);
    }

    public static int estimateCharCount(double avgCharsPerWord, int totalWords) {
        return (int) Math.round(totalWords * avgCharsPerWord);
    }

    /** Base reading speed: 200 wpm for English, 180 for everything else. */
    public static int baseWordsPerMinute(String language) {
        if (language != null && language.toLowerCase(Locale.ROOT).startsWith("en")) {
            return 200;
        }
        return 180;
    }

    /** Plain reading time without complexity or nontext adjustments, one decimal. */
    public static double estimateReadingTimeMinutes(String language, int wordCount) {
        return round1((double) Math.max(wordCount, 0) / baseWordsPerMinute(language));
    }

    public static double clamp(double value, double low, double high) {
        return Math.max(low, Math.min(high, value));
    }

    public static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
