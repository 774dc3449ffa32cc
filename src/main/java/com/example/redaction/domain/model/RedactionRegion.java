package com.example.redaction.domain.model;

/**
 * Area of a PDF page to black out and strip of glyphs, located for one accepted literal.
 */
public record RedactionRegion(int page, BoundingBox bbox, String text) {
}
