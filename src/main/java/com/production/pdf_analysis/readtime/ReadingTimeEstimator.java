package com.production.pdf_analysis.readtime;

import com.production.pdf_analysis.config.AppConfig;
import com.production.pdf_analysis.exception.ExtractionFailureException;
import com.production.pdf_analysis.extract.TextStatistics;
import com.production.pdf_analysis.model.ComplexityLevel;
import com.production.pdf_analysis.model.PageClass;
import com.production.pdf_analysis.model.PageClassCounts;
import com.production.pdf_analysis.model.ReadingMetrics;
import com.production.pdf_analysis.model.ReadingTimeMode;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Content-based reading time of a PDF.
 * <p>
 * {@link ReadingTimeMode#ACCURATE} classifies every page and adds nontext time for images,
 * slides, tables and code. {@link ReadingTimeMode#FAST} samples page 1 and extrapolates;
 * documents with more than {@code readtime.max-pages} pages always run in fast mode.
 * The result depends only on the bytes, the mode, the language and the complexity level.
 */
@Service
@Slf4j
public class ReadingTimeEstimator {

    private static final Pattern WORD = Pattern.compile("[A-Za-zА-Яа-яЁё0-9\\u0400-\\u04FF]+");
    private static final Pattern TABLE = Pattern.compile(
            "\\b(table|таблица|табл\\.)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern CODE_LINE = Pattern.compile(
            "[;{}()\\[\\]]|^\\s*(def|class|#include|for\\s*\\(|while\\s*\\()", Pattern.CASE_INSENSITIVE);

    static final int SECONDS_PER_TABLE = 12;
    static final double SECONDS_PER_CODE_LINE = 0.6;
    static final int MIN_EFFECTIVE_WPM = 60;

    private final AppConfig appConfig;

    public ReadingTimeEstimator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    /** Estimates with the configured mode. */
    public ReadingMetrics estimate(byte[] pdf, String language, ComplexityLevel level) {
        return estimate(pdf, language, level, ReadingTimeMode.fromConfig(appConfig.getReadtime().getMode()));
    }

    /**
     * @param level complexity level, {@code null} for medium
     * @throws ExtractionFailureException when the PDF cannot be opened
     */
    public ReadingMetrics estimate(byte[] pdf, String language, ComplexityLevel level, ReadingTimeMode requested) {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            int pages = document.getNumberOfPages();
            ReadingTimeMode mode = requested;
            int maxPages = appConfig.getReadtime().getMaxPages();
            if (mode == ReadingTimeMode.ACCURATE && pages > maxPages) {
                log.debug("Accurate reading time requested but pages={} > max={}; using fast mode", pages, maxPages);
                mode = ReadingTimeMode.FAST;
            }

            int wpm = effectiveWpm(language, level);
            ReadingMetrics metrics = mode == ReadingTimeMode.ACCURATE
                    ? accurate(document, wpm)
                    : fast(document, wpm);

            log.debug("readtime mode={} pages={} words={} text_min={} nontext_min={} total={}",
                    metrics.mode(), metrics.pageClassCounts(), metrics.wordCount(),
                    metrics.textMinutes(), metrics.nontextMinutes(), metrics.totalMinutes());
            return metrics;
        } catch (IOException e) {
            throw new ExtractionFailureException("Cannot open PDF for reading-time estimate: " + e.getMessage(), e);
        }
    }

    /**
     * Words per minute for a language and complexity level, never below 60.
     */
    public static int effectiveWpm(String language, ComplexityLevel level) {
        ComplexityLevel effective = level != null ? level : ComplexityLevel.MEDIUM;
        int wpm = (int) (TextStatistics.baseWordsPerMinute(language) * effective.getReadingFactor());
        return Math.max(MIN_EFFECTIVE_WPM, wpm);
    }

    static int countWords(String text) {
        Matcher m = WORD.matcher(text);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }

    static int countTables(String text) {
        Matcher m = TABLE.matcher(text);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }

    static int countCodeLines(String text) {
        int count = 0;
        for (String line : text.split("\\R")) {
            if (CODE_LINE.matcher(line).find()) {
                count++;
            }
        }
        return count;
    }

    private ReadingMetrics accurate(PDDocument document, int wpm) {
        int perImageSeconds = appConfig.getReadtime().resolvePerImageSeconds()[0];
        int totalWords = 0;
        int imageSeconds = 0;
        int tableSeconds = 0;
        int codeSeconds = 0;
        int slideSeconds = 0;
        Map<PageClass, Integer> classes = new EnumMap<>(PageClass.class);

        int pageNum = 0;
        for (PDPage page : document.getPages()) {
            pageNum++;
            String text = pageText(document, pageNum);
            int words = countWords(text);
            int images = countImages(page);
            int tables = countTables(text);
            int codeLines = countCodeLines(text);

            PageClass pageClass = PageClass.classify(words, images);
            classes.merge(pageClass, 1, Integer::sum);

            if (pageClass == PageClass.TEXT || pageClass == PageClass.MIXED) {
                totalWords += words;
                imageSeconds += images * perImageSeconds;
            } else if (pageClass == PageClass.SLIDE) {
                slideSeconds += (int) TextStatistics.clamp(6 + words / 10.0, 8, 25);
            }
            tableSeconds += tables * SECONDS_PER_TABLE;
            codeSeconds += (int) (codeLines * SECONDS_PER_CODE_LINE);
        }

        double textMinutes = TextStatistics.round2((double) totalWords / Math.max(1, wpm));
        double nontextMinutes = TextStatistics.round2((imageSeconds + tableSeconds + codeSeconds + slideSeconds) / 60.0);

        return ReadingMetrics.builder()
                .totalMinutes(TextStatistics.round2(textMinutes + nontextMinutes))
                .textMinutes(textMinutes)
                .nontextMinutes(nontextMinutes)
                .wordCount(totalWords)
                .effectiveWpm(wpm)
                .pageClassCounts(PageClassCounts.of(classes))
                .imageSeconds(imageSeconds)
                .tableSeconds(tableSeconds)
                .codeSeconds(codeSeconds)
                .slideSeconds(slideSeconds)
                .mode(ReadingTimeMode.ACCURATE)
                .build();
    }

    private ReadingMetrics fast(PDDocument document, int wpm) {
        int pages = document.getNumberOfPages();
        int w1 = pages > 0 ? countWords(pageText(document, 1)) : 0;

        int totalWords;
        if (pages > 0 && w1 >= TextStatistics.MIN_SAMPLE_WORDS) {
            int wordsPerPage = (int) TextStatistics.clamp(w1,
                    TextStatistics.MIN_WORDS_PER_PAGE, TextStatistics.MAX_WORDS_PER_PAGE);
            totalWords = wordsPerPage * pages;
        } else if (pages > 0) {
            totalWords = TextStatistics.DEFAULT_WORDS_PER_PAGE * pages;
        } else {
            totalWords = Math.max(w1, TextStatistics.DEFAULT_WORDS_PER_PAGE);
        }

        double textMinutes = TextStatistics.round2((double) totalWords / Math.max(1, wpm));
        return ReadingMetrics.builder()
                .totalMinutes(textMinutes)
                .textMinutes(textMinutes)
                .nontextMinutes(0.0)
                .wordCount(totalWords)
                .effectiveWpm(wpm)
                .pageClassCounts(PageClassCounts.NONE)
                .mode(ReadingTimeMode.FAST)
                .build();
    }

    private String pageText(PDDocument document, int pageNum) {
        try {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(pageNum);
            stripper.setEndPage(pageNum);
            String text = stripper.getText(document);
            return text != null ? text : "";
        } catch (IOException | RuntimeException e) {
            log.debug("Text extraction failed on page {}: {}", pageNum, e.getMessage());
            return "";
        }
    }

    private int countImages(PDPage page) {
        PDResources resources = page.getResources();
        if (resources == null) {
            return 0;
        }
        int images = 0;
        for (COSName name : resources.getXObjectNames()) {
            if (resources.isImageXObject(name)) {
                images++;
            }
        }
        return images;
    }
}
