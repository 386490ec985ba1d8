package com.production.pdf_analysis.model;

import java.util.Locale;

public enum ReadingTimeMode {
    /** Scans and classifies every page. */
    ACCURATE,
    /** Samples the first page only and extrapolates. */
    FAST;

    public static ReadingTimeMode fromConfig(String value) {
        if (value != null && value.trim().toLowerCase(Locale.ROOT).equals("fast")) {
            return FAST;
        }
        return ACCURATE;
    }
}
