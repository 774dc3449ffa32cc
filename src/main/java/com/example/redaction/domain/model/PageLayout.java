package com.example.redaction.domain.model;

import java.util.List;

/**
 * Layout analysis result for a single PDF page.
 */
public record PageLayout(
        int pageIndex,
        List<Column> columns,
        TextDirection textDirection,
        List<ReadingZone> readingZones,
        List<TextBlock> textBlocks,
        int wordCount,
        float verticalSpread
) {
    public PageLayout {
        columns = List.copyOf(columns);
        readingZones = List.copyOf(readingZones);
        textBlocks = List.copyOf(textBlocks);
    }

    /**
     * Layout used for pages that could not be analyzed; matching simply finds nothing on them.
     */
    public static PageLayout empty(int pageIndex) {
        return new PageLayout(pageIndex, List.of(), TextDirection.LTR, List.of(), List.of(), 0, 0f);
    }

    public boolean isEmpty() {
        return wordCount == 0;
    }

    public float complexity() {
        float complexity = columns.size() * 0.5f;
        complexity += Math.abs(verticalSpread) / 100f;
        complexity += textDirection == TextDirection.MIXED ? 1f : 0f;
        return complexity;
    }
}
