package com.production.pdf_analysis.model;

public enum PageClass {
    TEXT,
    MIXED,
    SLIDE,
    EMPTY;

    /**
     * Classifies a page by its word and image counts.
     */
    public static PageClass classify(int words, int images) {
        if (words >= 200) return TEXT;
        if (words >= 80) return MIXED;
        if (images > 0) return SLIDE;
        return EMPTY;
    }
}
