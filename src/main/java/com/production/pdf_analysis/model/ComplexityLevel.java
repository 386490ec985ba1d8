package com.production.pdf_analysis.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Five-step complexity scale. Each level carries the reading-speed factor applied to the
 * base words-per-minute of the document language.
 */
public enum ComplexityLevel {
    VERY_LOW("very-low", 1.10),
    LOW("low", 1.00),
    MEDIUM("medium", 0.85),
    HIGH("high", 0.70),
    VERY_HIGH("very-high", 0.55);

    private static final Map<String, ComplexityLevel> ALIASES = new HashMap<>();

    static {
        for (ComplexityLevel level : values()) {
            ALIASES.put(level.wireValue, level);
            ALIASES.put(level.name().toLowerCase(Locale.ROOT), level);
        }
        ALIASES.put("very low", VERY_LOW);
        ALIASES.put("очень низкая", VERY_LOW);
        ALIASES.put("низкая", LOW);
        ALIASES.put("easy", LOW);
        ALIASES.put("simple", LOW);
        ALIASES.put("средняя", MEDIUM);
        ALIASES.put("moderate", MEDIUM);
        ALIASES.put("intermediate", MEDIUM);
        ALIASES.put("высокая", HIGH);
        ALIASES.put("hard", HIGH);
        ALIASES.put("difficult", HIGH);
        ALIASES.put("advanced", HIGH);
        ALIASES.put("very high", VERY_HIGH);
        ALIASES.put("очень высокая", VERY_HIGH);
        ALIASES.put("expert", VERY_HIGH);
    }

    private final String wireValue;
    private final double readingFactor;

    ComplexityLevel(String wireValue, double readingFactor) {
        this.wireValue = wireValue;
        this.readingFactor = readingFactor;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public double getReadingFactor() {
        return readingFactor;
    }

    /**
     * Resolves a level from any known spelling (English, Russian, enum name, wire value).
     */
    public static Optional<ComplexityLevel> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String key = label.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        ComplexityLevel level = ALIASES.get(key);
        if (level == null) {
            level = ALIASES.get(key.replace('-', ' '));
        }
        return Optional.ofNullable(level);
    }

    /**
     * Maps a 0-100 score onto the scale in equal bands.
     */
    public static ComplexityLevel fromScore(int score) {
        if (score < 20) return VERY_LOW;
        if (score < 40) return LOW;
        if (score < 60) return MEDIUM;
        if (score < 80) return HIGH;
        return VERY_HIGH;
    }

    @JsonCreator
    static ComplexityLevel fromJson(String value) {
        return fromLabel(value).orElse(MEDIUM);
    }
}
