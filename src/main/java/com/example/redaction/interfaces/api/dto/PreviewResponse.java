package com.example.redaction.interfaces.api.dto;

import com.example.redaction.domain.model.DocumentLayout;
import com.example.redaction.domain.model.DocumentPreview;
import com.example.redaction.domain.model.FontStatistics;
import com.example.redaction.domain.model.PageLayout;
import com.example.redaction.domain.model.TextDirection;

import java.util.List;

/**
 * Preview payload: the flat text plus, for PDFs, a per-page layout summary without word geometry.
 */
public record PreviewResponse(String fileName, String format, String text, LayoutSummary layout) {

    public static PreviewResponse from(DocumentPreview preview) {
        return new PreviewResponse(
                preview.fileName(),
                preview.format().name(),
                preview.text(),
                preview.layout() == null ? null : LayoutSummary.from(preview.layout())
        );
    }

    public record LayoutSummary(int pageCount, float layoutComplexity, FontStatistics fontDistribution, List<PageSummary> pages) {

        static LayoutSummary from(DocumentLayout layout) {
            return new LayoutSummary(
                    layout.pageCount(),
                    layout.layoutComplexity(),
                    layout.fontDistribution(),
                    layout.pages().stream().map(PageSummary::from).toList()
            );
        }
    }

    public record PageSummary(int pageIndex, int columnCount, TextDirection textDirection, int readingZoneCount,
                              int textBlockCount, int wordCount, float verticalSpread) {

        static PageSummary from(PageLayout page) {
            return new PageSummary(
                    page.pageIndex(),
                    page.columns().size(),
                    page.textDirection(),
                    page.readingZones().size(),
                    page.textBlocks().size(),
                    page.wordCount(),
                    page.verticalSpread()
            );
        }
    }
}
