package com.example.redaction.domain.model;

import java.util.List;

/**
 * Word token extracted from a PDF page together with its geometry and font.
 * {@code glyphs} holds one box per character of {@code text}, so a match covering only part of a
 * token can still be mapped to exact page coordinates.
 */
public record PositionedWord(
        String text,
        int page,
        BoundingBox bbox,
        String fontName,
        float fontSize,
        List<BoundingBox> glyphs
) {
    public PositionedWord {
        text = text == null ? "" : text;
        fontName = fontName == null ? "unknown" : fontName;
        glyphs = glyphs == null ? List.of() : List.copyOf(glyphs);
        if (!glyphs.isEmpty() && glyphs.size() != text.length()) {
            throw new IllegalArgumentException("Expected one glyph box per character of '" + text.length()
                    + "' chars but got " + glyphs.size());
        }
    }

    public float x0() {
        return bbox.x0();
    }

    public float x1() {
        return bbox.x1();
    }

    public float top() {
        return bbox.top();
    }

    public float bottom() {
        return bbox.bottom();
    }

    /**
     * @param start first character index, inclusive
     * @param end   last character index, exclusive
     * @return box covering the characters, or the whole word when no glyph boxes were recorded
     */
    public BoundingBox boxOf(int start, int end) {
        if (glyphs.isEmpty() || start <= 0 && end >= text.length()) {
            return bbox;
        }
        return BoundingBox.enclosing(glyphs.subList(Math.max(0, start), Math.min(end, glyphs.size())));
    }
}
