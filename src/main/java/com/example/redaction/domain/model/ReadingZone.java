package com.example.redaction.domain.model;

import java.util.List;

/**
 * Vertically grouped words approximating a paragraph or a group of lines.
 */
public record ReadingZone(float top, float bottom, List<PositionedWord> words, String text) {

    public ReadingZone {
        words = List.copyOf(words);
    }
}
