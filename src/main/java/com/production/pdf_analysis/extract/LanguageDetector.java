package com.production.pdf_analysis.extract;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic language guess from the dominant script, refined for Latin text by
 * counting frequent function words. Returns ISO 639-1 codes.
 */
public final class LanguageDetector {

    private static final int SAMPLE_CHARS = 5000;
    private static final int MIN_LETTERS = 20;
    private static final Pattern WORD = Pattern.compile("\\p{L}+");

    private static final Map<String, Set<String>> LATIN_STOPWORDS = Map.of(
            "en", Set.of("the", "and", "of", "to", "in", "is", "that", "for", "with", "this", "are", "on"),
            "de", Set.of("der", "die", "und", "das", "ist", "nicht", "mit", "den", "von", "zu", "ein", "sich"),
            "fr", Set.of("le", "la", "les", "et", "des", "est", "une", "dans", "pour", "que", "qui", "du"),
            "es", Set.of("el", "los", "las", "y", "es", "una", "por", "para", "con", "que", "del", "se"),
            "it", Set.of("il", "di", "che", "della", "per", "una", "sono", "non", "con", "gli", "del", "le")
    );

    private LanguageDetector() {}

    public static Optional<String> detect(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String sample = text.length() > SAMPLE_CHARS ? text.substring(0, SAMPLE_CHARS) : text;

        int cyrillic = 0;
        int latin = 0;
        int cjk = 0;
        for (int i = 0; i < sample.length(); i++) {
            char ch = sample.charAt(i);
            if (!Character.isLetter(ch)) {
                continue;
            }
            Character.UnicodeBlock block = Character.UnicodeBlock.of(ch);
            if (block == Character.UnicodeBlock.CYRILLIC || block == Character.UnicodeBlock.CYRILLIC_SUPPLEMENTARY) {
                cyrillic++;
            } else if (ch < 0x0250) {
                latin++;
            } else if (block == Character.UnicodeBlock.CJK_UNIFIED_IDEOGRAPHS) {
                cjk++;
            }
        }

        int letters = cyrillic + latin + cjk;
        if (letters < MIN_LETTERS) {
            return Optional.empty();
        }
        if (cyrillic >= latin && cyrillic >= cjk) {
            return Optional.of(sample.indexOf('є') >= 0 || sample.indexOf('ї') >= 0 ? "uk" : "ru");
        }
        if (cjk > latin) {
            return Optional.of("zh");
        }
        return Optional.of(bestLatinLanguage(sample));
    }

    private static String bestLatinLanguage(String sample) {
        Map<String, Integer> hits = new HashMap<>();
        Matcher m = WORD.matcher(sample.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String word = m.group();
            for (Map.Entry<String, Set<String>> e : LATIN_STOPWORDS.entrySet()) {
                if (e.getValue().contains(word)) {
                    hits.merge(e.getKey(), 1, Integer::sum);
                }
            }
        }
        // ties resolve to English
        String best = "en";
        int bestHits = hits.getOrDefault("en", 0);
        for (String lang : new String[]{"de", "fr", "es", "it"}) {
            int h = hits.getOrDefault(lang, 0);
            if (h > bestHits) {
                best = lang;
                bestHits = h;
            }
        }
        return best;
    }
}
