package com.example.redaction.domain.model;

/**
 * Concrete match of a redaction literal inside a flat text, as half-open character offsets.
 */
public record Occurrence(String text, int start, int end) {

    public Occurrence {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid occurrence span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean overlaps(Occurrence other) {
        return other.start < end && other.end > start;
    }

    public boolean contains(Occurrence other) {
        return other.start >= start && other.end <= end;
    }
}
