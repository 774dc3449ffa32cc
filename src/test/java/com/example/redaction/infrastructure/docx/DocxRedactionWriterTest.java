package com.example.redaction.infrastructure.docx;

import com.example.redaction.infrastructure.exception.RedactionWriteException;
import com.example.redaction.support.TestDocuments;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFFootnote;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DocxRedactionWriterTest {

    private final DocxRedactionWriter writer = new DocxRedactionWriter();

    @Test
    void collapsesAMatchedParagraphIntoOneBlockedRun() throws Exception {
        byte[] docx = TestDocuments.docxWithRunsAndTable(List.of("Contact: ", "Jane ", "Roe"), "a", "b");

        byte[] redacted = writer.redact(docx, List.of("Jane Roe"), "contact.docx");

        try (XWPFDocument document = open(redacted)) {
            XWPFParagraph paragraph = document.getParagraphs().get(0);
            assertThat(paragraph.getRuns()).hasSize(1);
            XWPFRun run = paragraph.getRuns().get(0);
            assertThat(run.text()).isEqualTo("Contact: ████████");
            assertThat(run.getFontFamily()).isEqualTo("Calibri");
            assertThat(run.getFontSizeAsDouble()).isEqualTo(11d);
            assertThat(run.isBold()).isTrue();
            assertThat(run.isItalic()).isFalse();
            assertThat(run.getColor()).isEqualTo("000000");
        }
    }

    @Test
    void redactsFootnotes() throws Exception {
        byte[] docx = TestDocuments.docxWithFootnote("Contact: Jane Roe", "Source: Jane Roe interview");

        byte[] redacted = writer.redact(docx, List.of("Jane Roe"), "interview.docx");

        try (XWPFDocument document = open(redacted)) {
            assertThat(document.getParagraphs().get(0).getText()).isEqualTo("Contact: ████████");
            assertThat(document.getFootnotes())
                    .flatExtracting(XWPFFootnote::getParagraphs)
                    .extracting(XWPFParagraph::getText)
                    .contains("Source: ████████ interview");
        }
        assertThat(TestDocuments.packageEntry(redacted, "word/footnotes.xml")).doesNotContain("Jane Roe");
    }

    @Test
    void blanksHyperlinkTargetsContainingALiteral() throws Exception {
        byte[] docx = TestDocuments.docxWithHyperlink("our office", "mailto:jane@example.com");

        byte[] redacted = writer.redact(docx, List.of("jane@example.com"), "links.docx");

        String relationships = TestDocuments.packageEntry(redacted, "word/_rels/document.xml.rels");
        assertThat(relationships).doesNotContain("jane@example.com");
        assertThat(relationships).contains(DocxRedactionWriter.SCRUBBED_TARGET);
        try (XWPFDocument document = open(redacted)) {
            assertThat(document.getParagraphs().get(0).getText()).isEqualTo("Write to our office");
        }
    }

    @Test
    void redactsInsideTableCells() throws Exception {
        byte[] docx = TestDocuments.docxWithRunsAndTable(List.of("Bank details"), "IBAN", "DE89370400440532013000");

        byte[] redacted = writer.redact(docx, List.of("DE89370400440532013000"), "bank.docx");

        try (XWPFDocument document = open(redacted)) {
            XWPFTableCell cell = document.getTables().get(0).getRow(0).getCell(1);
            assertThat(cell.getText()).isEqualTo("█".repeat(22));
            assertThat(document.getTables().get(0).getRow(0).getCell(0).getText()).isEqualTo("IBAN");
        }
    }

    @Test
    void leavesParagraphsWithoutMatchesUntouched() throws Exception {
        byte[] docx = TestDocuments.docxWithRunsAndTable(List.of("Nothing ", "to ", "hide"), "a", "b");

        byte[] redacted = writer.redact(docx, List.of("Jane Roe"), "plain.docx");

        try (XWPFDocument document = open(redacted)) {
            XWPFParagraph paragraph = document.getParagraphs().get(0);
            assertThat(paragraph.getRuns()).hasSize(3);
            assertThat(paragraph.getRuns().get(0).isItalic()).isTrue();
        }
    }

    @Test
    void blocksEveryOccurrenceOfEveryLiteral() throws Exception {
        byte[] docx = TestDocuments.docx("Jane Roe and Roe", "Roe");

        byte[] redacted = writer.redact(docx, List.of("Jane Roe", "Roe"), "many.docx");

        try (XWPFDocument document = open(redacted)) {
            assertThat(document.getParagraphs().get(0).getText()).isEqualTo("████████ and ███");
            assertThat(document.getParagraphs().get(1).getText()).isEqualTo("███");
        }
    }

    @Test
    void unreadableInputIsAWriteError() {
        byte[] garbage = "not a zip".getBytes(StandardCharsets.US_ASCII);

        assertThrows(RedactionWriteException.class, () -> writer.redact(garbage, List.of("x"), "bad.docx"));
    }

    private static XWPFDocument open(byte[] bytes) throws IOException {
        return new XWPFDocument(new ByteArrayInputStream(bytes));
    }
}
