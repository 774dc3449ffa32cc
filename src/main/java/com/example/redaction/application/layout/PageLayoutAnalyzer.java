package com.example.redaction.application.layout;

import com.example.redaction.domain.model.Column;
import com.example.redaction.domain.model.PageLayout;
import com.example.redaction.domain.model.PositionedWord;
import com.example.redaction.domain.model.ReadingZone;
import com.example.redaction.domain.model.TextBlock;
import com.example.redaction.domain.model.TextDirection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pure geometry over the words of one page: columns, text direction, reading zones and text blocks.
 * Stateless apart from its thresholds; safe to share between worker threads.
 */
public class PageLayoutAnalyzer {

    static final float ZONE_GAP = 10f;
    static final float BLOCK_VERTICAL_GAP = 5f;
    static final float BLOCK_HORIZONTAL_GAP = 20f;
    static final double LTR_THRESHOLD = 0.9d;
    static final double RTL_THRESHOLD = 0.1d;

    private static final Comparator<PositionedWord> READING_ORDER =
            Comparator.comparingDouble(PositionedWord::top).thenComparingDouble(PositionedWord::x0);

    private final ColumnDetector columnDetector;

    public PageLayoutAnalyzer(ColumnDetector columnDetector) {
        this.columnDetector = columnDetector;
    }

    public PageLayout analyze(int pageIndex, List<PositionedWord> words) {
        if (words.isEmpty()) {
            return PageLayout.empty(pageIndex);
        }
        List<Column> columns = columnDetector.detect(words);
        List<TextBlock> blocks = new ArrayList<>();
        for (Column column : columns) {
            blocks.addAll(textBlocks(column.words()));
        }
        return new PageLayout(
                pageIndex,
                columns,
                textDirection(words),
                readingZones(words),
                blocks,
                words.size(),
                verticalSpread(words)
        );
    }

    static TextDirection textDirection(List<PositionedWord> words) {
        if (words.isEmpty()) {
            return TextDirection.LTR;
        }
        long forward = words.stream().filter(word -> word.x1() > word.x0()).count();
        double ratio = (double) forward / words.size();
        if (ratio > LTR_THRESHOLD) {
            return TextDirection.LTR;
        }
        if (ratio < RTL_THRESHOLD) {
            return TextDirection.RTL;
        }
        return TextDirection.MIXED;
    }

    /**
     * Groups words sorted by their top edge; a gap of more than {@value #ZONE_GAP}pt starts a new zone.
     */
    static List<ReadingZone> readingZones(List<PositionedWord> words) {
        List<PositionedWord> sorted = new ArrayList<>(words);
        sorted.sort(Comparator.comparingDouble(PositionedWord::top));

        List<ReadingZone> zones = new ArrayList<>();
        List<PositionedWord> current = new ArrayList<>();
        float top = 0f;
        float bottom = 0f;
        for (PositionedWord word : sorted) {
            if (!current.isEmpty() && word.top() - bottom > ZONE_GAP) {
                zones.add(zone(top, bottom, current));
                current = new ArrayList<>();
            }
            if (current.isEmpty()) {
                top = word.top();
                bottom = word.bottom();
            } else {
                bottom = Math.max(bottom, word.bottom());
            }
            current.add(word);
        }
        if (!current.isEmpty()) {
            zones.add(zone(top, bottom, current));
        }
        return zones;
    }

    private static ReadingZone zone(float top, float bottom, List<PositionedWord> words) {
        StringBuilder text = new StringBuilder();
        for (PositionedWord word : words) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(word.text());
        }
        return new ReadingZone(top, bottom, words, text.toString());
    }

    /**
     * Builds blocks of words adjacent in reading order within one column.
     */
    static List<TextBlock> textBlocks(List<PositionedWord> columnWords) {
        List<PositionedWord> sorted = new ArrayList<>(columnWords);
        sorted.sort(READING_ORDER);

        List<TextBlock> blocks = new ArrayList<>();
        List<PositionedWord> current = new ArrayList<>();
        float bottom = 0f;
        float right = 0f;
        for (PositionedWord word : sorted) {
            boolean joins = !current.isEmpty()
                    && Math.max(0f, word.top() - bottom) <= BLOCK_VERTICAL_GAP
                    && word.x0() - right <= BLOCK_HORIZONTAL_GAP;
            if (!joins && !current.isEmpty()) {
                blocks.add(TextBlock.of(current));
                current = new ArrayList<>();
            }
            if (current.isEmpty()) {
                bottom = word.bottom();
                right = word.x1();
            } else {
                bottom = Math.max(bottom, word.bottom());
                right = Math.max(right, word.x1());
            }
            current.add(word);
        }
        if (!current.isEmpty()) {
            blocks.add(TextBlock.of(current));
        }
        return blocks;
    }

    static float verticalSpread(List<PositionedWord> words) {
        float top = Float.MAX_VALUE;
        float bottom = -Float.MAX_VALUE;
        for (PositionedWord word : words) {
            top = Math.min(top, word.top());
            bottom = Math.max(bottom, word.bottom());
        }
        return words.isEmpty() ? 0f : bottom - top;
    }
}
