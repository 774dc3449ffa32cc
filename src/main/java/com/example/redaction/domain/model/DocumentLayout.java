package com.example.redaction.domain.model;

import java.util.List;

/**
 * Layout of every page of a PDF, in page order, plus document-wide font statistics.
 */
public record DocumentLayout(List<PageLayout> pages, FontStatistics fontDistribution) {

    public DocumentLayout {
        pages = List.copyOf(pages);
    }

    public int pageCount() {
        return pages.size();
    }

    public float layoutComplexity() {
        float total = 0f;
        for (PageLayout page : pages) {
            total += page.complexity();
        }
        return total;
    }
}
