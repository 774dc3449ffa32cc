package com.example.redaction.infrastructure.pdf;

import com.example.redaction.domain.model.BoundingBox;
import com.example.redaction.domain.model.PositionedWord;
import com.example.redaction.infrastructure.exception.DocumentExtractionException;
import com.example.redaction.support.TestDocuments;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PdfWordExtractorTest {

    private final PdfWordExtractor extractor = new PdfWordExtractor();

    @Test
    void splitsLinesIntoWordsWithGlyphBoxes() throws Exception {
        byte[] pdf = TestDocuments.pdfWithLines("Contact: Jane Roe");

        List<List<PositionedWord>> pages = extractor.extractWords(pdf, "contact.pdf");

        assertThat(pages).hasSize(1);
        List<PositionedWord> words = pages.get(0);
        assertThat(words).extracting(PositionedWord::text).containsExactly("Contact:", "Jane", "Roe");
        for (PositionedWord word : words) {
            assertThat(word.page()).isZero();
            assertThat(word.glyphs()).hasSize(word.text().length());
            assertThat(word.fontSize()).isEqualTo(TestDocuments.FONT_SIZE);
        }
        assertThat(words.get(0).x0()).isCloseTo(50f, offset(0.5f));
        assertThat(words.get(1).x0()).isGreaterThan(words.get(0).x1());
        assertThat(words.get(2).x0()).isGreaterThan(words.get(1).x1());
    }

    @Test
    void usesTopLeftCoordinates() throws Exception {
        byte[] pdf = TestDocuments.pdfWithLines("upper", "lower");

        List<PositionedWord> words = extractor.extractWords(pdf, "lines.pdf").get(0);

        PositionedWord upper = words.get(0);
        PositionedWord lower = words.get(1);
        assertThat(upper.text()).isEqualTo("upper");
        assertThat(lower.text()).isEqualTo("lower");
        assertThat(upper.bottom()).isLessThan(lower.bottom());
        // baseline 750 on a 792pt high page
        assertThat(upper.bottom()).isCloseTo(42f, offset(1f));
    }

    @Test
    void glyphBoxesTileTheWord() throws Exception {
        List<PositionedWord> words = extractor.extractWords(TestDocuments.pdfWithLines("Roe"), "roe.pdf").get(0);

        PositionedWord roe = words.get(0);
        BoundingBox first = roe.boxOf(0, 1);
        BoundingBox last = roe.boxOf(2, 3);
        assertThat(first.x0()).isEqualTo(roe.x0());
        assertThat(last.x1()).isEqualTo(roe.x1());
        assertThat(first.x1()).isLessThanOrEqualTo(last.x0());
    }

    @Test
    void returnsOneListPerPageIncludingEmptyPages() throws Exception {
        byte[] pdf = TestDocuments.pdf(List.of(
                List.of(new TestDocuments.PlacedText(50f, 700f, "one")),
                List.of(),
                List.of(new TestDocuments.PlacedText(50f, 700f, "three"))
        ));

        List<List<PositionedWord>> pages = extractor.extractWords(pdf, "pages.pdf");

        assertThat(pages).hasSize(3);
        assertThat(pages.get(1)).isEmpty();
        assertThat(pages.get(2)).extracting(PositionedWord::page).containsOnly(2);
    }

    @Test
    void rejectsBytesThatAreNotAPdf() {
        byte[] garbage = "plain text".getBytes(StandardCharsets.US_ASCII);

        assertThrows(DocumentExtractionException.class, () -> extractor.extractWords(garbage, "fake.pdf"));
    }
}
