package com.production.pdf_analysis.extract;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Normalizes raw PDF text before it is counted or placed into a prompt.
 */
@Service
@Slf4j
public class TextCleaningService {

    // Page numbers and boilerplate footers in English and Russian
    private static final Pattern HEADER_FOOTER_PATTERN = Pattern.compile(
            "(?m)^\\s*(Page\\s*\\d+(\\s*of\\s*\\d+)?|\\d+\\s*of\\s*\\d+|Страница\\s*\\d+(\\s*из\\s*\\d+)?|©.*|All rights reserved.*|Все права защищены.*)\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t\\u00A0]+");

    private static final Pattern MULTIPLE_NEWLINES = Pattern.compile("\\n{3,}");

    // Control characters except \n and \t
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private static final Pattern HYPHENATED_BREAK = Pattern.compile("(\\p{L})-\\s*\\n\\s*(\\p{Ll})");

    public String cleanText(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return "";
        }

        String text = dropLoneSurrogates(rawText);

        // NFKC resolves PDF ligatures like ﬁ -> fi
        text = Normalizer.normalize(text, Normalizer.Form.NFKC);
        text = text.replace("\r\n", "\n").replace("\r", "\n");
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        text = HEADER_FOOTER_PATTERN.matcher(text).replaceAll("");
        text = MULTIPLE_SPACES.matcher(text).replaceAll(" ");
        text = MULTIPLE_NEWLINES.matcher(text).replaceAll("\n\n");
        text = trimLines(text).trim();

        log.debug("Cleaned text: {} chars -> {} chars", rawText.length(), text.length());
        return text;
    }

    /**
     * Rejoins words split across lines and drops soft hyphens.
     */
    public String removeHyphenation(String text) {
        text = text.replace("\u00AD", "");
        return HYPHENATED_BREAK.matcher(text).replaceAll("$1$2");
    }

    public String normalizeQuotes(String text) {
        return text
                .replace('‘', '\'')
                .replace('’', '\'')
                .replace('“', '"')
                .replace('”', '"')
                .replace('«', '"')
                .replace('»', '"');
    }

    public String fullClean(String rawText) {
        String text = cleanText(rawText);
        text = removeHyphenation(text);
        return normalizeQuotes(text);
    }

    /**
     * Truncates to at most {@code maxChars}, preferring the last line break before the limit.
     */
    public String truncate(String text, int maxChars) {
        if (text == null || text.length() <= maxChars) {
            return text;
        }
        int cut = text.lastIndexOf('\n', maxChars);
        if (cut < maxChars / 2) {
            cut = maxChars;
        }
        return text.substring(0, cut);
    }

    private String trimLines(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder result = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            result.append(lines[i].trim());
            if (i < lines.length - 1) {
                result.append('\n');
            }
        }
        return result.toString();
    }

    private String dropLoneSurrogates(String text) {
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            boolean lone = (Character.isHighSurrogate(ch)
                    && (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))))
                    || (Character.isLowSurrogate(ch)
                    && (i == 0 || !Character.isHighSurrogate(text.charAt(i - 1))));
            if (lone && sb == null) {
                sb = new StringBuilder(text.length());
                sb.append(text, 0, i);
            }
            if (sb != null && !lone) {
                sb.append(ch);
            }
        }
        return sb == null ? text : sb.toString();
    }
}
