package com.production.pdf_analysis.model;

import java.util.Map;

public record PageClassCounts(int text, int mixed, int slide, int empty) {

    public static final PageClassCounts NONE = new PageClassCounts(0, 0, 0, 0);

    public static PageClassCounts of(Map<PageClass, Integer> counts) {
        return new PageClassCounts(
                counts.getOrDefault(PageClass.TEXT, 0),
                counts.getOrDefault(PageClass.MIXED, 0),
                counts.getOrDefault(PageClass.SLIDE, 0),
                counts.getOrDefault(PageClass.EMPTY, 0));
    }

    public int total() {
        return text + mixed + slide + empty;
    }
}
