package com.production.pdf_analysis.analysis;

import com.production.pdf_analysis.config.AppConfig;
import com.production.pdf_analysis.exception.AnalysisTimeoutException;
import com.production.pdf_analysis.exception.DownloadFailureException;
import com.production.pdf_analysis.exception.ExtractionFailureException;
import com.production.pdf_analysis.exception.PdfAnalysisException;
import com.production.pdf_analysis.extract.PdfContentExtractor;
import com.production.pdf_analysis.extract.PdfSource;
import com.production.pdf_analysis.extract.TextStatistics;
import com.production.pdf_analysis.llm.LlmResponse;
import com.production.pdf_analysis.llm.LlmRouter;
import com.production.pdf_analysis.model.AnalysisResult;
import com.production.pdf_analysis.model.AnalysisResult.Volume;
import com.production.pdf_analysis.model.AnalysisResult.VolumeMethod;
import com.production.pdf_analysis.model.CategoryDecision;
import com.production.pdf_analysis.model.CategoryDecision.Decision;
import com.production.pdf_analysis.model.CategoryDecision.NewCategoryDefinition;
import com.production.pdf_analysis.model.CategoryDescriptor;
import com.production.pdf_analysis.model.ExtractedDocument;
import com.production.pdf_analysis.model.InternalMetadata;
import com.production.pdf_analysis.model.LlmMetadata;
import com.production.pdf_analysis.model.ReadingMetrics;
import com.production.pdf_analysis.normalize.CategoryDecisionNormalizer;
import com.production.pdf_analysis.normalize.JsonRepairer;
import com.production.pdf_analysis.normalize.ResponseNormalizer;
import com.production.pdf_analysis.readtime.ReadingTimeEstimator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point of the pipeline: extraction, content-based reading time, the LLM call with
 * repair and normalization, and the heuristic fallback.
 * <p>
 * {@code analyze} only fails when the caller's deadline passes; an unreachable or
 * misbehaving LLM degrades to {@link HeuristicAnalyzer}. Category decisions never fail.
 */
@Service
@Slf4j
public class AnalysisOrchestrator {

    static final double EXTRACTION_SHARE = 0.3;
    static final String AUTO_CATEGORY_DESCRIPTION = "Automatically created category";

    private final AppConfig appConfig;
    private final PdfContentExtractor contentExtractor;
    private final ReadingTimeEstimator readingTimeEstimator;
    private final LlmRouter llmRouter;
    private final PromptBuilder promptBuilder;
    private final JsonRepairer jsonRepairer;
    private final ResponseNormalizer responseNormalizer;
    private final CategoryDecisionNormalizer categoryDecisionNormalizer;
    private final HeuristicAnalyzer heuristicAnalyzer;
    private final SchemaValidator schemaValidator;
    private final Executor analysisExecutor;

    public AnalysisOrchestrator(AppConfig appConfig,
                                PdfContentExtractor contentExtractor,
                                ReadingTimeEstimator readingTimeEstimator,
                                LlmRouter llmRouter,
                                PromptBuilder promptBuilder,
                                JsonRepairer jsonRepairer,
                                ResponseNormalizer responseNormalizer,
                                CategoryDecisionNormalizer categoryDecisionNormalizer,
                                HeuristicAnalyzer heuristicAnalyzer,
                                SchemaValidator schemaValidator,
                                @Qualifier("analysisExecutor") Executor analysisExecutor) {
        this.appConfig = appConfig;
        this.contentExtractor = contentExtractor;
        this.readingTimeEstimator = readingTimeEstimator;
        this.llmRouter = llmRouter;
        this.promptBuilder = promptBuilder;
        this.jsonRepairer = jsonRepairer;
        this.responseNormalizer = responseNormalizer;
        this.categoryDecisionNormalizer = categoryDecisionNormalizer;
        this.heuristicAnalyzer = heuristicAnalyzer;
        this.schemaValidator = schemaValidator;
        this.analysisExecutor = analysisExecutor;
    }

    public Duration defaultTimeout() {
        return Duration.ofSeconds(appConfig.getAnalysis().getTimeoutSeconds());
    }

    // ---- extraction ----

    public ExtractedDocument extract(Path path, Duration timeout) {
        return withDeadline(() -> extractSource(contentExtractor.load(path)), timeout,
                e -> new DownloadFailureException("Extraction of " + path + " timed out after "
                        + timeout.toSeconds() + "s", e));
    }

    public ExtractedDocument extract(String url, Duration timeout) {
        return withDeadline(() -> extractSource(contentExtractor.load(url)), timeout,
                e -> new DownloadFailureException("Download of " + url + " timed out after "
                        + timeout.toSeconds() + "s", e));
    }

    public ExtractedDocument extract(PdfSource source, Duration timeout) {
        return withDeadline(() -> extractSource(source), timeout,
                e -> new DownloadFailureException("Extraction of " + source.sourceName() + " timed out after "
                        + timeout.toSeconds() + "s", e));
    }

    /**
     * Extracts the document and, when the estimator can read it, attaches content-based
     * reading metrics whose word total replaces the first-page extrapolation.
     */
    ExtractedDocument extractSource(PdfSource source) {
        ExtractedDocument document = contentExtractor.extract(source);
        try {
            ReadingMetrics metrics = readingTimeEstimator.estimate(source.data(), document.languageHint(), null);
            ExtractedDocument.ExtractedDocumentBuilder builder = document.toBuilder().readingMetrics(metrics);
            if (metrics.wordCount() > 0) {
                builder.wordCountHint(metrics.wordCount());
            }
            return builder.build();
        } catch (RuntimeException e) {
            log.warn("Reading-time estimate failed for {}, keeping heuristic word count: {}",
                    source.sourceName(), e.getMessage());
            return document;
        }
    }

    // ---- analysis ----

    public AnalysisResult analyze(ExtractedDocument document, Duration timeout) {
        return analyze(document.text(), document.llmMetadata(), document.internalMetadata(), timeout);
    }

    /**
     * @throws AnalysisTimeoutException when {@code timeout} passes first
     */
    public AnalysisResult analyze(String text, LlmMetadata meta, InternalMetadata internal, Duration timeout) {
        return withDeadline(() -> doAnalyze(text, meta, internal), timeout,
                e -> new AnalysisTimeoutException("Analysis timed out after " + timeout.toSeconds() + "s", e));
    }

    AnalysisResult doAnalyze(String rawText, LlmMetadata rawMeta, InternalMetadata rawInternal) {
        String text = rawText != null ? rawText : "";
        InternalMetadata internal = rawInternal != null ? rawInternal : InternalMetadata.empty();
        LlmMetadata meta = withPrecomputedCounts(rawMeta != null ? rawMeta : LlmMetadata.empty(), text);

        if (appConfig.getAnalysis().isMockEnabled()) {
            log.info("Using mock analysis (analysis.mock-enabled is on)");
            return schemaValidator.requireUsable(heuristicAnalyzer.analyze(text, meta, internal));
        }

        AnalysisResult result;
        long start = System.currentTimeMillis();
        try {
            LlmResponse response = llmRouter.generate(
                    promptBuilder.analysisPrompt(text, meta), PromptBuilder.ANALYSIS_SYSTEM_PROMPT);
            Map<String, Object> data = jsonRepairer.repair(response.content());
            result = responseNormalizer.normalize(data, meta, internal, text);
            result = applyContentMetrics(result, meta, internal);
            log.info("[TIMING] {} analysis via {}: {}ms", meta.sourceName(), response.providerName(),
                    System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            log.warn("LLM analysis failed, falling back to heuristic analysis: {}", e.getMessage());
            result = heuristicAnalyzer.analyze(text, meta, internal);
        }
        return schemaValidator.requireUsable(result);
    }

    static LlmMetadata withPrecomputedCounts(LlmMetadata meta, String text) {
        if (meta.precomputedWordCount() != null) {
            return meta;
        }
        return meta.toBuilder()
                .precomputedWordCount(TextStatistics.countWords(text))
                .charCount(meta.charCount() != null ? meta.charCount() : TextStatistics.countCharsNoSpaces(text))
                .build();
    }

    /**
     * Recomputes reading time from the counted words, the level the model reported and the
     * measured nontext time, so the number agrees with the content-based metrics.
     */
    static AnalysisResult applyContentMetrics(AnalysisResult result, LlmMetadata meta, InternalMetadata internal) {
        if (internal.contentMetrics().isEmpty()) {
            return result;
        }
        ReadingMetrics metrics = internal.contentMetrics().get();
        int words = metrics.wordCount() > 0
                ? metrics.wordCount()
                : (meta.precomputedWordCount() != null ? meta.precomputedWordCount() : 0);

        int wpm = ReadingTimeEstimator.effectiveWpm(result.docLanguage(), result.complexity().level());
        double textMinutes = TextStatistics.round2((double) words / Math.max(1, wpm));
        double nontextMinutes = TextStatistics.round2(metrics.nontextSeconds() / 60.0);

        Volume volume = result.volume();
        Volume adjusted = volume.toBuilder()
                .readingTimeMin(TextStatistics.round1(textMinutes + nontextMinutes))
                .wordCount(words > 0 ? words : volume.wordCount())
                .method(new VolumeMethod(VolumeMethod.CONTENT_BASED, volume.method().charCount()))
                .build();
        return result.toBuilder().volume(adjusted).build();
    }

    // ---- categories ----

    /**
     * Classifies the document into one of {@code existing} or defines a new category.
     * Returns {@link CategoryDecision#neutral()} on any failure, including the deadline.
     */
    public CategoryDecision classifyOrCreateCategory(String text, LlmMetadata meta,
                                                     List<CategoryDescriptor> existing, Duration timeout) {
        try {
            return withDeadline(() -> doClassify(text, meta, existing), timeout,
                    e -> new AnalysisTimeoutException("Category decision timed out after "
                            + timeout.toSeconds() + "s", e));
        } catch (RuntimeException e) {
            log.warn("LLM category decision failed: {}", e.getMessage());
            return CategoryDecision.neutral();
        }
    }

    CategoryDecision doClassify(String text, LlmMetadata meta, List<CategoryDescriptor> existing) {
        if (appConfig.getAnalysis().isMockEnabled()) {
            return CategoryDecision.neutral();
        }
        List<CategoryDescriptor> offered = existing != null ? existing : List.of();
        LlmResponse response = llmRouter.generate(
                promptBuilder.categoryPrompt(text, meta != null ? meta : LlmMetadata.empty(), offered),
                PromptBuilder.CATEGORY_SYSTEM_PROMPT);
        CategoryDecision decision = categoryDecisionNormalizer.normalize(jsonRepairer.repair(response.content()), offered);

        List<String> violations = schemaValidator.validateCategoryDecision(decision);
        if (!violations.isEmpty()) {
            log.warn("Category decision has schema violation(s), using it anyway: {}", violations);
        }
        log.info("Category decision via {}: {} '{}'", response.providerName(),
                decision.decision().getWireValue(), decision.category().label());
        return decision;
    }

    /**
     * Defines a new category for the document; a matched answer is turned into a new definition.
     */
    public CategoryDecision defineCategory(String text, LlmMetadata meta, Duration timeout) {
        CategoryDecision decision = classifyOrCreateCategory(text, meta, List.of(), timeout);
        if (decision.decision() != Decision.MATCHED_EXISTING) {
            return decision;
        }
        return new CategoryDecision(Decision.CREATED_NEW, decision.category(), null,
                new NewCategoryDefinition(decision.category().label(), AUTO_CATEGORY_DESCRIPTION,
                        decision.category().keywords(), null));
    }

    // ---- conveniences ----

    /** Extract and analyze a local file; 30% of {@code timeout} goes to extraction. */
    public AnalysisResult analyzePdfPath(Path path, Duration timeout) {
        Duration extraction = extractionShare(timeout);
        ExtractedDocument document = extract(path, extraction);
        return analyze(document, timeout.minus(extraction));
    }

    /** Extract and analyze a PDF behind an http(s) URL; 30% of {@code timeout} goes to extraction. */
    public AnalysisResult analyzePdfUrl(String url, Duration timeout) {
        String lower = url == null ? "" : url.trim().toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            throw new DownloadFailureException("URL must start with http:// or https://: " + url, 0);
        }
        Duration extraction = extractionShare(timeout);
        ExtractedDocument document = extract(url.trim(), extraction);
        return analyze(document, timeout.minus(extraction));
    }

    public AnalysisResult analyzePdf(PdfSource source, Duration timeout) {
        Duration extraction = extractionShare(timeout);
        ExtractedDocument document = extract(source, extraction);
        return analyze(document, timeout.minus(extraction));
    }

    public List<String> providerNames() {
        return llmRouter.providerNames();
    }

    private static Duration extractionShare(Duration total) {
        return Duration.ofMillis(Math.max(1, (long) (total.toMillis() * EXTRACTION_SHARE)));
    }

    private <T> T withDeadline(Supplier<T> task, Duration timeout,
                               Function<TimeoutException, ? extends PdfAnalysisException> onTimeout) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(task, analysisExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Analysis executor saturated, rejecting request");
            throw new AnalysisTimeoutException("Analysis capacity exhausted, try again later", e);
        }
        try {
            return future.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw onTimeout.apply(e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AnalysisTimeoutException("Interrupted while waiting for the result", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new ExtractionFailureException("Unexpected failure: " + cause, cause);
        }
    }
}
