package com.example.redaction.domain.model;

import java.util.List;

/**
 * Horizontal band of a page holding the words assigned to one detected column.
 */
public record Column(float minX, float maxX, List<PositionedWord> words) {

    public Column {
        words = List.copyOf(words);
    }

    public boolean overlaps(Column other) {
        return other.minX < maxX && other.maxX > minX;
    }
}
