package com.example.redaction.domain.model;

import java.util.Collection;

/**
 * Axis-aligned rectangle in page space with a top-left origin (y grows downwards),
 * matching the direction-adjusted coordinates PDFBox reports for text positions.
 */
public record BoundingBox(float x0, float top, float x1, float bottom) {

    public BoundingBox {
        if (x1 < x0) {
            float swap = x0;
            x0 = x1;
            x1 = swap;
        }
        if (bottom < top) {
            float swap = top;
            top = bottom;
            bottom = swap;
        }
    }

    public float width() {
        return x1 - x0;
    }

    public float height() {
        return bottom - top;
    }

    public float centerX() {
        return x0 + width() / 2f;
    }

    public float centerY() {
        return top + height() / 2f;
    }

    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(
                Math.min(x0, other.x0),
                Math.min(top, other.top),
                Math.max(x1, other.x1),
                Math.max(bottom, other.bottom)
        );
    }

    /**
     * @param padding distance added on every side
     * @return enlarged copy of this box
     */
    public BoundingBox expand(float padding) {
        return new BoundingBox(x0 - padding, top - padding, x1 + padding, bottom + padding);
    }

    public boolean contains(float x, float y) {
        return x >= x0 && x <= x1 && y >= top && y <= bottom;
    }

    public boolean intersects(BoundingBox other) {
        return other.x0 < x1 && other.x1 > x0 && other.top < bottom && other.bottom > top;
    }

    /**
     * @param boxes non-empty collection of boxes
     * @return the smallest box enclosing all of them
     */
    public static BoundingBox enclosing(Collection<BoundingBox> boxes) {
        BoundingBox merged = null;
        for (BoundingBox box : boxes) {
            merged = merged == null ? box : merged.union(box);
        }
        if (merged == null) {
            throw new IllegalArgumentException("Cannot enclose an empty set of boxes");
        }
        return merged;
    }
}
