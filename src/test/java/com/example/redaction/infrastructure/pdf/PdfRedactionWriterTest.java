package com.example.redaction.infrastructure.pdf;

import com.example.redaction.domain.model.BoundingBox;
import com.example.redaction.domain.model.PositionedWord;
import com.example.redaction.domain.model.RedactionRegion;
import com.example.redaction.infrastructure.config.RedactionProperties;
import com.example.redaction.support.TestDocuments;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Redaction tests against PDFs drawn by PDFBox; the output is read back with the same text extraction
 * used for verification.
 */
class PdfRedactionWriterTest {

    private final PdfWordExtractor words = new PdfWordExtractor();
    private final PdfTextExtractor text = new PdfTextExtractor();
    private final PdfRedactionWriter writer = new PdfRedactionWriter(RedactionProperties.defaults());

    @Test
    void removesTheTextUnderTheRegionAndKeepsTheRest() throws Exception {
        byte[] pdf = TestDocuments.pdfWithLines("Contact: Jane Roe", "Phone 555-0100");
        List<PositionedWord> page = words.extractWords(pdf, "contact.pdf").get(0);
        BoundingBox name = find(page, "Jane").bbox().union(find(page, "Roe").bbox());

        byte[] redacted = writer.redact(pdf, List.of(new RedactionRegion(0, name, "Jane Roe")), "contact.pdf");

        String result = text.extract(redacted, "contact.pdf");
        assertThat(result).contains("Contact:").contains("Phone 555-0100");
        assertThat(result).doesNotContain("Jane").doesNotContain("Roe");
    }

    @Test
    void leavesWordsOutsideTheRegionIntact() throws Exception {
        byte[] pdf = TestDocuments.pdfWithLines("cat category");
        List<PositionedWord> page = words.extractWords(pdf, "cat.pdf").get(0);
        PositionedWord cat = find(page, "cat");

        byte[] redacted = writer.redact(pdf, List.of(new RedactionRegion(0, cat.bbox(), "cat")), "cat.pdf");

        String result = text.extract(redacted, "cat.pdf");
        assertThat(result).contains("category");
        assertThat(result.replace("category", "")).doesNotContain("cat");
    }

    @Test
    void removesWholeOperatorsWhenEveryGlyphIsCovered() throws Exception {
        byte[] pdf = TestDocuments.pdfWithLines("SECRET", "public");
        PositionedWord secret = find(words.extractWords(pdf, "s.pdf").get(0), "SECRET");

        byte[] redacted = writer.redact(pdf, List.of(new RedactionRegion(0, secret.bbox(), "SECRET")), "s.pdf");

        List<PositionedWord> remaining = words.extractWords(redacted, "s.pdf").get(0);
        assertThat(remaining).extracting(PositionedWord::text).containsExactly("public");
    }

    @Test
    void onlyTouchesThePagesThatCarryRegions() throws Exception {
        byte[] pdf = TestDocuments.pdf(List.of(
                List.of(new TestDocuments.PlacedText(50f, 700f, "token abc123")),
                List.of(new TestDocuments.PlacedText(50f, 700f, "token abc123"))
        ));
        PositionedWord secondPageToken = find(words.extractWords(pdf, "p.pdf").get(1), "abc123");

        byte[] redacted = writer.redact(pdf,
                List.of(new RedactionRegion(1, secondPageToken.bbox(), "abc123")), "p.pdf");

        List<List<PositionedWord>> pages = words.extractWords(redacted, "p.pdf");
        assertThat(pages.get(0)).extracting(PositionedWord::text).containsExactly("token", "abc123");
        assertThat(pages.get(1)).extracting(PositionedWord::text).containsExactly("token");
    }

    @Test
    void outputIsEncryptedAgainstModificationButStaysReadable() throws Exception {
        byte[] pdf = TestDocuments.pdfWithLines("Hello");

        byte[] redacted = writer.redact(pdf, List.of(), "hello.pdf");

        try (PDDocument document = Loader.loadPDF(redacted)) {
            assertThat(document.isEncrypted()).isTrue();
            assertThat(document.getEncryption().getLength()).isEqualTo(256);
            AccessPermission permission = document.getCurrentAccessPermission();
            assertThat(permission.canModify()).isFalse();
            assertThat(permission.canModifyAnnotations()).isFalse();
            assertThat(permission.canAssembleDocument()).isFalse();
            assertThat(permission.canPrint()).isTrue();
            assertThat(permission.canExtractContent()).isTrue();
        }
        assertThat(text.extract(redacted, "hello.pdf")).contains("Hello");
    }

    @Test
    void configuredOwnerPasswordUnlocksFullAccess() throws Exception {
        RedactionProperties properties = new RedactionProperties(DataSize.ofMegabytes(1), null,
                RedactionProperties.Layout.defaults(), new RedactionProperties.Pdf(1f, "owner-secret"));
        byte[] redacted = new PdfRedactionWriter(properties).redact(TestDocuments.pdfWithLines("Hello"), List.of(), "h.pdf");

        try (PDDocument document = Loader.loadPDF(redacted, "owner-secret")) {
            assertThat(document.getCurrentAccessPermission().isOwnerPermission()).isTrue();
        }
    }

    private static PositionedWord find(List<PositionedWord> page, String text) {
        return page.stream()
                .filter(word -> word.text().equals(text))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No word '" + text + "' in " + page));
    }
}
