package com.production.pdf_analysis.normalize;

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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.production.pdf_analysis.normalize.LooseValues.asBoolean;
import static com.production.pdf_analysis.normalize.LooseValues.asMap;
import static com.production.pdf_analysis.normalize.LooseValues.asNumber;
import static com.production.pdf_analysis.normalize.LooseValues.asStringList;
import static com.production.pdf_analysis.normalize.LooseValues.asText;
import static com.production.pdf_analysis.normalize.LooseValues.asUnitScore;
import static com.production.pdf_analysis.normalize.LooseValues.first;

/**
 * Maps a loosely shaped model answer onto {@link AnalysisResult}, field by field.
 * Every field gets a value: what the model sent when it can be coerced, otherwise a value
 * derived from the metadata and the text, otherwise a fixed default.
 */
@Component
@Slf4j
public class ResponseNormalizer {

    static final int DEFAULT_SCORE = 40;
    static final String DEFAULT_GRADE = "school";
    static final double DEFAULT_TOPIC_SCORE = 0.5;

    private static final Map<String, String> TOP_LEVEL_ALIASES = Map.of(
            "объём", "volume",
            "объем", "volume",
            "сложность", "complexity",
            "тематика", "topics",
            "темы", "topics",
            "категория", "category",
            "ограничения", "limitations",
            "язык", "doc_language",
            "language", "doc_language",
            "lang", "doc_language");

    private final AppConfig appConfig;

    public ResponseNormalizer(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    public AnalysisResult normalize(Map<String, Object> data, LlmMetadata meta, InternalMetadata internal, String text) {
        Map<String, Object> canonical = canonicalKeys(data);
        LlmMetadata metadata = meta != null ? meta : LlmMetadata.empty();
        String sourceText = text != null ? text : "";
        boolean contentBased = internal != null && internal.contentMetrics().isPresent();

        String language = asText(canonical.get("doc_language"))
                .or(() -> Optional.ofNullable(metadata.langHint()).filter(s -> !s.isBlank()))
                .or(() -> LanguageDetector.detect(sourceText))
                .orElse(appConfig.getAnalysis().getDefaultLanguage());

        AnalysisResult result = AnalysisResult.builder()
                .docLanguage(language)
                .volume(volume(asMap(canonical.get("volume")), metadata, sourceText, language, contentBased))
                .complexity(complexity(canonical.get("complexity")))
                .topics(topics(canonical.get("topics")))
                .category(category(canonical.get("category")))
                .limitations(limitations(asMap(canonical.get("limitations")), sourceText))
                .build();

        if (Category.UNCATEGORIZED.equals(result.category().label())) {
            log.debug("No category in model answer; keys present: {}", canonical.keySet());
        }
        return result;
    }

    private static Map<String, Object> canonicalKeys(Map<String, Object> data) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        if (data == null) {
            return canonical;
        }
        for (Map.Entry<String, Object> e : data.entrySet()) {
            String key = e.getKey() == null ? "" : e.getKey().trim();
            String mapped = TOP_LEVEL_ALIASES.getOrDefault(key.toLowerCase(Locale.ROOT), key);
            // a canonical key wins over its alias
            if (!canonical.containsKey(mapped) || mapped.equals(key)) {
                canonical.put(mapped, e.getValue());
            }
        }
        return canonical;
    }

    private Volume volume(Map<String, Object> raw, LlmMetadata meta, String text, String language, boolean contentBased) {
        int wordCount = asNumber(first(raw, "word_count", "количество_слов", "words"))
                .map(ResponseNormalizer::count)
                .orElse(meta.precomputedWordCount() != null ? Math.max(0, meta.precomputedWordCount()) : 0);

        int charCount = asNumber(first(raw, "char_count", "количество_символов", "chars"))
                .map(ResponseNormalizer::count)
                .filter(c -> c > 0)
                .orElseGet(() -> TextStatistics.countCharsNoSpaces(text));

        Integer pageCount = asNumber(first(raw, "page_count", "количество_страниц", "pages"))
                .map(ResponseNormalizer::count)
                .orElse(meta.pageCount());

        Long byteSize = asNumber(first(raw, "byte_size", "размер_в_байтах", "size"))
                .map(d -> Math.max(0L, Math.round(d)))
                .orElse(meta.byteSize());

        double readingTime = asNumber(first(raw, "reading_time_min", "read_time_minutes",
                "reading_time_minutes", "время_чтения_минут", "time_to_read_minutes"))
                .filter(d -> d > 0)
                .orElseGet(() -> TextStatistics.estimateReadingTimeMinutes(language, wordCount));

        Map<String, Object> method = asMap(first(raw, "method"));
        String wordMethod = asText(first(method, "word_count"))
                .orElse(contentBased ? VolumeMethod.CONTENT_BASED : VolumeMethod.PRECOMPUTED);
        String charMethod = asText(first(method, "char_count")).orElse(VolumeMethod.CHARS_NO_SPACES);

        return Volume.builder()
                .wordCount(wordCount)
                .charCount(charCount)
                .pageCount(pageCount)
                .byteSize(byteSize)
                .readingTimeMin(readingTime)
                .method(new VolumeMethod(wordMethod, charMethod))
                .build();
    }

    private Complexity complexity(Object value) {
        Map<String, Object> raw = asMap(value);
        if (raw == null) {
            raw = new LinkedHashMap<>();
            if (value instanceof String s) {
                raw.put("level", s);
            }
        }

        Object scoreValue = first(raw, "score", "оценка", "оценка_1_5");
        int score = scoreValue == null ? DEFAULT_SCORE : rescaleScore(scoreValue);

        ComplexityLevel level = asText(first(raw, "level", "label", "уровень"))
                .flatMap(ComplexityLevel::fromLabel)
                .orElseGet(() -> scoreValue == null ? ComplexityLevel.MEDIUM : ComplexityLevel.fromScore(score));

        return Complexity.builder()
                .score(score)
                .level(level)
                .estimatedGrade(asText(first(raw, "estimated_grade", "grade", "класс")).orElse(DEFAULT_GRADE))
                .drivers(asStringList(first(raw, "drivers", "ключевые_слова", "keywords")))
                .notes(asText(first(raw, "notes", "description", "basis", "основание", "описание")).orElse(""))
                .build();
    }

    /**
     * Brings a complexity score onto 0-100: fractions in [0,1] are scaled by 100, integers
     * from 1 to 5 are read as a five-point scale, anything else is clamped. Unparseable
     * values give the default.
     */
    static int rescaleScore(Object value) {
        Optional<Double> number = asNumber(value);
        if (number.isEmpty()) {
            return DEFAULT_SCORE;
        }
        double v = number.get();
        if (LooseValues.isIntegral(value) && v >= 1 && v <= 5) {
            return (int) Math.round(v / 5 * 100);
        }
        if (v >= 0 && v <= 1) {
            return (int) Math.round(v * 100);
        }
        return (int) Math.max(0, Math.min(100, Math.round(v)));
    }

    /** Non-negative count; values beyond the int range saturate instead of wrapping. */
    static int count(double value) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(0L, Math.round(value)));
    }

    private List<Topic> topics(Object value) {
        List<Object> entries = new ArrayList<>();
        if (value instanceof List<?> list) {
            entries.addAll(list);
        } else if (value != null) {
            entries.add(value);
        }

        List<Topic> topics = new ArrayList<>();
        for (Object entry : entries) {
            if (topics.size() == AnalysisResult.MAX_TOPICS) {
                break;
            }
            Map<String, Object> raw = asMap(entry);
            Optional<String> label = raw != null
                    ? asText(first(raw, "label", "major", "name", "title"))
                    : asText(entry);
            if (label.isEmpty()) {
                continue;
            }
            topics.add(new Topic(
                    label.get(),
                    asUnitScore(first(raw, "score", "confidence"), DEFAULT_TOPIC_SCORE),
                    asStringList(first(raw, "keywords", "minor")),
                    asText(first(raw, "rationale", "basis")).orElse("")));
        }
        return topics;
    }

    /**
     * Category block with aliases; without a label the neutral {@code uncategorized} category.
     */
    static Category category(Object value) {
        Map<String, Object> raw = asMap(value);
        Optional<String> label = raw != null
                ? asText(first(raw, "label", "name", "title"))
                : asText(value);
        if (label.isEmpty()) {
            return Category.uncategorized("none");
        }
        double score = asUnitScore(first(raw, "score", "confidence", "уверенность"), 0.0);
        String basis = asText(first(raw, "basis", "description", "основание", "описание")).orElse("llm");
        List<String> keywords = asStringList(first(raw, "keywords", "ключевые_слова"));
        return new Category(label.get(), score, basis, keywords);
    }

    private Limitations limitations(Map<String, Object> raw, String text) {
        boolean shortInput = asBoolean(first(raw, "short_or_noisy_input"))
                .orElseGet(() -> TextStatistics.countWords(text) < TextStatistics.SHORT_INPUT_WORDS);
        String comments = asText(first(raw, "comments", "description")).orElse("");
        return new Limitations(shortInput, comments);
    }
}
