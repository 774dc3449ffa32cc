package com.example.redaction.infrastructure.pdf;

import com.example.redaction.domain.model.BoundingBox;

import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.TextPosition;

/**
 * Conversions between PDFBox text positions, top-left page boxes and PDF user space.
 * Word collection and glyph removal both go through {@link #boxOf(TextPosition)} so that a glyph's
 * centre always falls inside a region built from its own box.
 */
final class PdfGlyphGeometry {

    private static final float MIN_GLYPH_HEIGHT = 1f;

    private PdfGlyphGeometry() {
    }

    static BoundingBox boxOf(TextPosition position) {
        float x = position.getXDirAdj();
        float bottom = position.getYDirAdj();
        float height = Math.max(position.getHeightDir(), MIN_GLYPH_HEIGHT);
        return new BoundingBox(x, bottom - height, x + position.getWidthDirAdj(), bottom);
    }

    /**
     * Maps a top-left box to a PDF user-space rectangle (bottom-left origin) on the page's crop box.
     */
    static PDRectangle toUserSpace(BoundingBox box, PDPage page) {
        PDRectangle cropBox = page.getCropBox();
        float x = cropBox.getLowerLeftX() + box.x0();
        float y = cropBox.getUpperRightY() - box.bottom();
        return new PDRectangle(x, y, box.width(), box.height());
    }
}
