package com.example.redaction.infrastructure.pdf;

import org.apache.pdfbox.text.PDFTextStripper;

/**
 * Shared PDFBox stripper configuration, so extraction, layout analysis and glyph removal see the same text.
 */
final class PdfTextStrippers {

    private PdfTextStrippers() {
    }

    /**
     * Applies common PDFBox stripper configuration shared by all extraction routines.
     *
     * @param stripper stripper to configure
     */
    static void configure(PDFTextStripper stripper) {
        stripper.setSortByPosition(true);
        stripper.setShouldSeparateByBeads(true);
        stripper.setSuppressDuplicateOverlappingText(false);
        stripper.setLineSeparator("\n");
        stripper.setWordSeparator(" ");
        stripper.setParagraphEnd("\n");
    }
}
