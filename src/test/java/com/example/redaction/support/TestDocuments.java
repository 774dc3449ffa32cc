package com.example.redaction.support;

import com.example.redaction.domain.model.BoundingBox;
import com.example.redaction.domain.model.PositionedWord;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFFootnote;
import org.apache.poi.xwpf.usermodel.XWPFHyperlinkRun;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * In-memory fixtures: PDFs drawn with PDFBox, Word documents built with POI, and hand-made words.
 */
public final class TestDocuments {

    public static final float FONT_SIZE = 12f;
    public static final float GLYPH_WIDTH = 6f;

    private TestDocuments() {
    }

    /**
     * Text placed at a baseline position in PDF user space (origin bottom-left).
     */
    public record PlacedText(float x, float y, String text) {
    }

    /**
     * @param lines lines of text drawn top to bottom at x = 50, 20pt apart, each with one {@code Tj}
     */
    public static byte[] pdfWithLines(String... lines) throws IOException {
        List<PlacedText> placed = new ArrayList<>();
        float y = 750f;
        for (String line : lines) {
            placed.add(new PlacedText(50f, y, line));
            y -= 20f;
        }
        return pdf(List.of(placed));
    }

    /**
     * @param pages one list of placed texts per page
     */
    public static byte[] pdf(List<List<PlacedText>> pages) throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (List<PlacedText> texts : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    for (PlacedText text : texts) {
                        content.beginText();
                        content.setFont(font, FONT_SIZE);
                        content.newLineAtOffset(text.x(), text.y());
                        content.showText(text.text());
                        content.endText();
                    }
                }
            }
            document.save(out);
            return out.toByteArray();
        }
    }

    /**
     * Builds a PDF page with two columns of {@code rowsPerColumn} one-word lines each.
     */
    public static byte[] twoColumnPdf(int rowsPerColumn) throws IOException {
        List<PlacedText> placed = new ArrayList<>();
        for (int row = 0; row < rowsPerColumn; row++) {
            float y = 740f - row * 18f;
            placed.add(new PlacedText(50f, y, "left" + row));
            placed.add(new PlacedText(320f, y, "right" + row));
        }
        return pdf(List.of(placed));
    }

    /**
     * @param paragraphs body paragraphs, each written as a single run
     */
    public static byte[] docx(String... paragraphs) throws IOException {
        try (XWPFDocument document = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (String text : paragraphs) {
                document.createParagraph().createRun().setText(text);
            }
            document.write(out);
            return out.toByteArray();
        }
    }

    /**
     * A Word document with one body paragraph and one footnote.
     */
    public static byte[] docxWithFootnote(String body, String footnoteText) throws IOException {
        try (XWPFDocument document = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            XWPFParagraph paragraph = document.createParagraph();
            paragraph.createRun().setText(body);
            XWPFFootnote footnote = document.createFootnote();
            footnote.createParagraph().createRun().setText(footnoteText);
            document.write(out);
            return out.toByteArray();
        }
    }

    /**
     * A Word document with a single paragraph holding a hyperlink labelled {@code label} that points to {@code uri}.
     */
    public static byte[] docxWithHyperlink(String label, String uri) throws IOException {
        try (XWPFDocument document = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            XWPFParagraph paragraph = document.createParagraph();
            paragraph.createRun().setText("Write to ");
            XWPFHyperlinkRun link = paragraph.createHyperlinkRun(uri);
            link.setText(label);
            document.write(out);
            return out.toByteArray();
        }
    }

    /**
     * @return the raw content of one zip entry of an OOXML package, decoded as UTF-8
     */
    public static String packageEntry(byte[] ooxml, String entryName) throws IOException {
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(ooxml))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.getName().equals(entryName)) {
                    return new String(zip.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
        }
        throw new IllegalArgumentException("No entry " + entryName);
    }

    /**
     * Builds a Word document whose paragraph text is split over several runs, followed by a 1x2 table.
     */
    public static byte[] docxWithRunsAndTable(List<String> runs, String leftCell, String rightCell) throws IOException {
        try (XWPFDocument document = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            XWPFParagraph paragraph = document.createParagraph();
            for (String text : runs) {
                XWPFRun run = paragraph.createRun();
                run.setText(text);
                run.setItalic(true);
            }
            XWPFTable table = document.createTable(1, 2);
            table.getRow(0).getCell(0).setText(leftCell);
            table.getRow(0).getCell(1).setText(rightCell);
            document.write(out);
            return out.toByteArray();
        }
    }

    /**
     * A word whose characters are {@value #GLYPH_WIDTH}pt wide, starting at {@code x} on a 10pt high line.
     */
    public static PositionedWord word(String text, float x, float top) {
        return word(text, 0, x, top);
    }

    public static PositionedWord word(String text, int page, float x, float top) {
        List<BoundingBox> glyphs = new ArrayList<>();
        for (int i = 0; i < text.length(); i++) {
            glyphs.add(new BoundingBox(x + i * GLYPH_WIDTH, top, x + (i + 1) * GLYPH_WIDTH, top + 10f));
        }
        BoundingBox bbox = new BoundingBox(x, top, x + text.length() * GLYPH_WIDTH, top + 10f);
        return new PositionedWord(text, page, bbox, "Helvetica", FONT_SIZE, glyphs);
    }

    /**
     * Words laid out on one line with a single glyph of space between them.
     */
    public static List<PositionedWord> line(float x, float top, String... texts) {
        List<PositionedWord> words = new ArrayList<>();
        float cursor = x;
        for (String text : texts) {
            words.add(word(text, cursor, top));
            cursor += (text.length() + 1) * GLYPH_WIDTH;
        }
        return words;
    }
}
