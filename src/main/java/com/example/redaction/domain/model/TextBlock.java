package com.example.redaction.domain.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Words that are adjacent in reading order, merged into one block with a common bounding box.
 */
public record TextBlock(List<PositionedWord> words, BoundingBox bbox, FontStatistics fontStatistics) {

    public TextBlock {
        if (words == null || words.isEmpty()) {
            throw new IllegalArgumentException("A text block needs at least one word");
        }
        words = List.copyOf(words);
    }

    public static TextBlock of(List<PositionedWord> words) {
        return new TextBlock(
                words,
                BoundingBox.enclosing(words.stream().map(PositionedWord::bbox).toList()),
                FontStatistics.of(words)
        );
    }

    /**
     * @return the words joined by single spaces, the text phrase search runs against
     */
    public String text() {
        return words.stream().map(PositionedWord::text).collect(Collectors.joining(" "));
    }
}
