package com.production.pdf_analysis.extract;

import com.production.pdf_analysis.config.AppConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineNode;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds a short outline of the document used as extra classification evidence.
 * <p>
 * The PDF bookmark tree is preferred. Documents without bookmarks fall back to
 * heading-like lines from the first pages: explicit numbering ("1.", "1.2", "1.2.3")
 * and chapter/section keywords, in English and Russian. Dotted table-of-contents
 * lines ("Introduction ..... 3") are accepted as level-1 entries.
 */
@Component
@Slf4j
public class TocExtractor {

    private static final int MAX_OUTLINE_DEPTH = 3;

    private static final Pattern L1_KEYWORD = Pattern.compile(
            "^\\s*(Chapter|Part|Глава|Часть)\\s+[\\dIVXLC]+.*", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern L1_NUMBERED = Pattern.compile("^\\s*\\d{1,2}\\.\\s+\\p{Lu}.{2,}");
    private static final Pattern L2_KEYWORD = Pattern.compile(
            "^\\s*(Section|Раздел)\\s+\\d+.*", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern L2_NUMBERED = Pattern.compile("^\\s*\\d{1,2}\\.\\d{1,2}\\.?\\s+\\p{Lu}.{2,}");
    private static final Pattern L3_NUMBERED = Pattern.compile("^\\s*\\d{1,2}\\.\\d{1,2}\\.\\d{1,2}\\.?\\s+\\p{Lu}.{2,}");
    private static final Pattern DOTTED_TOC_LINE = Pattern.compile("^\\s*\\S.{2,}?\\s*(\\.\\s?){3,}\\s*\\d{1,4}\\s*$");

    private static final int MAX_HEADING_LENGTH = 120;

    private final AppConfig appConfig;

    public TocExtractor(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    /**
     * @return the preview, or {@code null} when disabled or nothing heading-like was found
     */
    public String extract(PDDocument document) {
        AppConfig.Toc toc = appConfig.getToc();
        if (!toc.isEnabled()) {
            return null;
        }

        List<String> entries = fromOutline(document);
        if (entries.isEmpty()) {
            entries = fromHeadings(document, toc.getMaxPages());
        }
        if (entries.isEmpty()) {
            return null;
        }

        StringBuilder sb = new StringBuilder();
        for (String entry : entries) {
            if (sb.length() + entry.length() + 1 > toc.getMaxChars()) {
                break;
            }
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(entry);
        }
        log.debug("TOC preview: {} entries, {} chars", entries.size(), sb.length());
        return sb.length() == 0 ? null : sb.toString();
    }

    List<String> fromOutline(PDDocument document) {
        List<String> entries = new ArrayList<>();
        PDDocumentOutline outline = document.getDocumentCatalog().getDocumentOutline();
        if (outline != null) {
            collect(outline, 0, entries);
        }
        return entries;
    }

    private void collect(PDOutlineNode node, int depth, List<String> entries) {
        if (depth >= MAX_OUTLINE_DEPTH) {
            return;
        }
        for (PDOutlineItem item : node.children()) {
            String title = item.getTitle();
            if (title != null && !title.isBlank()) {
                entries.add("  ".repeat(depth) + title.trim());
            }
            collect(item, depth + 1, entries);
        }
    }

    List<String> fromHeadings(PDDocument document, int maxPages) {
        List<String> entries = new ArrayList<>();
        int pages = Math.min(document.getNumberOfPages(), Math.max(maxPages, 0));
        if (pages == 0) {
            return entries;
        }
        String text;
        try {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(1);
            stripper.setEndPage(pages);
            text = stripper.getText(document);
        } catch (IOException e) {
            log.warn("TOC heading scan failed: {}", e.getMessage());
            return entries;
        }
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.length() > MAX_HEADING_LENGTH) {
                continue;
            }
            int level = headingLevel(trimmed);
            if (level > 0) {
                entries.add("  ".repeat(level - 1) + trimmed);
            }
        }
        return entries;
    }

    static int headingLevel(String line) {
        if (DOTTED_TOC_LINE.matcher(line).matches()) return 1;
        if (L3_NUMBERED.matcher(line).matches()) return 3;
        if (L2_NUMBERED.matcher(line).matches() || L2_KEYWORD.matcher(line).matches()) return 2;
        if (L1_NUMBERED.matcher(line).matches() || L1_KEYWORD.matcher(line).matches()) return 1;
        return 0;
    }
}
