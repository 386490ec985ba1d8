package com.production.pdf_analysis.analysis;

import com.production.pdf_analysis.config.AppConfig;
import com.production.pdf_analysis.extract.LanguageDetector;
import com.production.pdf_analysis.extract.TextStatistics;
import com.production.pdf_analysis.model.AnalysisResult;
import com.production.pdf_analysis.model.AnalysisResult.Complexity;
import com.production.pdf_analysis.model.AnalysisResult.Limitations;
import com.production.pdf_analysis.model.AnalysisResult.Topic;
import com.production.pdf_analysis.model.AnalysisResult.Volume;
import com.production.pdf_analysis.model.AnalysisResult.VolumeMethod;
import com.production.pdf_analysis.model.Category;
import com.production.pdf_analysis.model.ComplexityLevel;
import com.production.pdf_analysis.model.InternalMetadata;
import com.production.pdf_analysis.model.LlmMetadata;
import com.production.pdf_analysis.model.ReadingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Analysis without a language model. Used when no provider answers and in mock mode,
 * so it must never throw.
 */
@Component
@Slf4j
public class HeuristicAnalyzer {

    static final String FEW_WORDS_NOTE = "few words";
    static final String HEURISTIC_NOTE = "heuristic without LM";
    static final int MAX_FILENAME_LABEL = 50;

    private final AppConfig appConfig;

    public HeuristicAnalyzer(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    public AnalysisResult analyze(String text, LlmMetadata meta, InternalMetadata internal) {
        String sourceText = text != null ? text : "";
        LlmMetadata metadata = meta != null ? meta : LlmMetadata.empty();
        InternalMetadata internalMetadata = internal != null ? internal : InternalMetadata.empty();

        int w1 = TextStatistics.countWords(sourceText);
        String language = Optional.ofNullable(metadata.langHint()).filter(s -> !s.isBlank())
                .or(() -> LanguageDetector.detect(sourceText))
                .orElse(appConfig.getAnalysis().getDefaultLanguage());

        int totalWords;
        double readingTime;
        String wordMethod;
        Optional<ReadingMetrics> metrics = internalMetadata.contentMetrics();
        if (metrics.isPresent()) {
            totalWords = metrics.get().wordCount();
            readingTime = TextStatistics.round2(metrics.get().totalMinutes());
            wordMethod = VolumeMethod.CONTENT_BASED;
        } else {
            totalWords = metadata.precomputedWordCount() != null ? metadata.precomputedWordCount() : w1;
            readingTime = TextStatistics.estimateReadingTimeMinutes(language, totalWords);
            wordMethod = VolumeMethod.PRECOMPUTED;
        }
        totalWords = Math.max(0, totalWords);

        int charCount = TextStatistics.estimateCharCount(TextStatistics.avgCharsPerWord(sourceText, w1), totalWords);

        boolean shortInput = w1 < TextStatistics.SHORT_INPUT_WORDS;
        String note = shortInput ? FEW_WORDS_NOTE : HEURISTIC_NOTE;
        Complexity complexity = Complexity.builder()
                .score(shortInput ? 15 : 40)
                .level(shortInput ? ComplexityLevel.LOW : ComplexityLevel.MEDIUM)
                .estimatedGrade("school")
                .drivers(List.of("heuristic estimate"))
                .notes(note)
                .build();

        CategoryGuess guess = guessCategory(metadata.sourceName());

        return AnalysisResult.builder()
                .docLanguage(language)
                .volume(Volume.builder()
                        .wordCount(totalWords)
                        .charCount(charCount)
                        .pageCount(metadata.pageCount())
                        .byteSize(metadata.byteSize())
                        .readingTimeMin(Math.max(0.0, readingTime))
                        .method(new VolumeMethod(wordMethod, VolumeMethod.CHARS_NO_SPACES))
                        .build())
                .complexity(complexity)
                .topics(guess.topics())
                .category(guess.category())
                .limitations(new Limitations(shortInput, note))
                .build();
    }

    CategoryGuess guessCategory(String sourceName) {
        if (sourceName == null || sourceName.isBlank()) {
            return new CategoryGuess(Category.uncategorized("none"), List.of());
        }
        AppConfig.Analysis.Heuristic heuristic = appConfig.getAnalysis().getHeuristic();
        if (heuristic.isFilenameCategories()) {
            String lower = sourceName.toLowerCase(Locale.ROOT);
            Set<String> tokens = Arrays.stream(lower.split("[^\\p{L}\\p{N}]+"))
                    .filter(t -> !t.isEmpty())
                    .collect(Collectors.toSet());
            for (Map.Entry<String, List<String>> entry : heuristic.getCategories().entrySet()) {
                List<String> hits = entry.getValue().stream()
                        .filter(keyword -> matches(keyword.toLowerCase(Locale.ROOT), lower, tokens))
                        .toList();
                if (!hits.isEmpty()) {
                    String label = entry.getKey();
                    return new CategoryGuess(
                            new Category(label, 0.6, "filename", hits),
                            List.of(new Topic(label, 0.7, hits, "filename heuristic")));
                }
            }
        }

        String stem = stemOf(sourceName);
        if (stem.isEmpty() || stem.length() > MAX_FILENAME_LABEL) {
            return new CategoryGuess(Category.uncategorized("none"), List.of());
        }
        return new CategoryGuess(
                new Category(stem, 0.6, "filename", List.of()),
                List.of(new Topic("General", 0.5, List.of(), "default category")));
    }

    /** Short keywords must match a whole token so "ai" does not fire on "email". */
    private static boolean matches(String keyword, String name, Set<String> tokens) {
        if (keyword.isBlank()) {
            return false;
        }
        return keyword.length() <= 3 ? tokens.contains(keyword) : name.contains(keyword);
    }

    static String stemOf(String sourceName) {
        String name = sourceName;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.indexOf('.');
        if (dot >= 0) {
            name = name.substring(0, dot);
        }
        return name.trim();
    }

    record CategoryGuess(Category category, List<Topic> topics) {}
}
