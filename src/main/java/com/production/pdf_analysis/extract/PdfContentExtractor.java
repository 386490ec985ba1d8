package com.production.pdf_analysis.extract;

import com.production.pdf_analysis.config.AppConfig;
import com.production.pdf_analysis.exception.ExtractionFailureException;
import com.production.pdf_analysis.exception.NotAPdfException;
import com.production.pdf_analysis.model.ExtractedDocument;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns PDF bytes into an {@link ExtractedDocument}: first-page text (or every page under
 * the {@code full} policy), page and byte counts, a language hint, a TOC preview and a
 * heuristic word total extrapolated from the first page.
 */
@Service
@Slf4j
public class PdfContentExtractor {

    private final AppConfig appConfig;
    private final PdfDownloader pdfDownloader;
    private final TextCleaningService textCleaningService;
    private final TocExtractor tocExtractor;

    public PdfContentExtractor(AppConfig appConfig,
                               PdfDownloader pdfDownloader,
                               TextCleaningService textCleaningService,
                               TocExtractor tocExtractor) {
        this.appConfig = appConfig;
        this.pdfDownloader = pdfDownloader;
        this.textCleaningService = textCleaningService;
        this.tocExtractor = tocExtractor;
    }

    public PdfSource load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ExtractionFailureException("File not found: " + path);
        }
        try {
            return new PdfSource(Files.readAllBytes(path), path.getFileName().toString());
        } catch (IOException e) {
            throw new ExtractionFailureException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    public PdfSource load(String url) {
        return pdfDownloader.download(url);
    }

    public ExtractedDocument extract(PdfSource source) {
        if (!source.hasPdfSignature()) {
            throw new NotAPdfException(source.sourceName());
        }

        long start = System.currentTimeMillis();
        try (PDDocument document = Loader.loadPDF(source.data())) {
            int totalPages = document.getNumberOfPages();

            String firstPage = textCleaningService.fullClean(pageText(document, 1, totalPages));
            String text = firstPage;
            if (appConfig.getExtraction().isFullText()) {
                text = fullText(document, firstPage, totalPages);
            }

            int w1 = TextStatistics.countWords(firstPage);
            String language = LanguageDetector.detect(firstPage).orElse(null);
            int totalWords = TextStatistics.estimateTotalWords(w1, totalPages, source.byteSize());
            String toc = tocExtractor.extract(document);

            log.info("[TIMING] {} extract: {}ms ({} pages, first page {} words, lang={})",
                    source.sourceName(), System.currentTimeMillis() - start, totalPages, w1, language);

            return ExtractedDocument.builder()
                    .text(text)
                    .pageCount(totalPages)
                    .byteSize(source.byteSize())
                    .wordCountHint(totalWords)
                    .languageHint(language)
                    .sourceName(source.sourceName())
                    .tocPreview(toc)
                    .build();
        } catch (IOException e) {
            throw new ExtractionFailureException(
                    "Unreadable PDF " + source.sourceName() + " (corrupt or truncated): " + e.getMessage(), e);
        }
    }

    private String pageText(PDDocument document, int page, int totalPages) {
        if (page > totalPages) {
            return "";
        }
        try {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            return stripper.getText(document);
        } catch (IOException | RuntimeException e) {
            log.warn("Text extract failed on page {}: {}", page, e.getMessage());
            return "";
        }
    }

    private String fullText(PDDocument document, String firstPage, int totalPages) {
        List<String> texts = new ArrayList<>();
        if (!firstPage.isEmpty()) {
            texts.add(firstPage);
        }
        for (int page = 2; page <= totalPages; page++) {
            String t = textCleaningService.fullClean(pageText(document, page, totalPages));
            if (!t.isEmpty()) {
                texts.add(t);
            }
        }
        return String.join("\n\n", texts);
    }
}
