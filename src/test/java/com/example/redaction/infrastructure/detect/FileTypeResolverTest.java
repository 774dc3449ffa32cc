package com.example.redaction.infrastructure.detect;

import com.example.redaction.domain.exception.DocumentNotFoundException;
import com.example.redaction.domain.exception.DocumentPathRequiredException;
import com.example.redaction.domain.exception.DocumentTooLargeException;
import com.example.redaction.domain.exception.UnsupportedDocumentTypeException;
import com.example.redaction.domain.model.Document;
import com.example.redaction.domain.model.FormatKind;
import com.example.redaction.infrastructure.config.RedactionProperties;
import com.example.redaction.support.TestDocuments;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for content-first file type resolution.
 */
class FileTypeResolverTest {

    @TempDir
    Path tempDir;

    private final FileTypeResolver resolver = new FileTypeResolver(RedactionProperties.defaults());

    @Test
    void resolvesPdfFromContentEvenWithMisleadingExtension() throws Exception {
        Path file = Files.write(tempDir.resolve("scan.bin"), TestDocuments.pdfWithLines("Hello"));

        assertThat(resolver.resolve(file)).isEqualTo(FormatKind.PDF);
    }

    @Test
    void resolvesWordDocument() throws Exception {
        Path file = Files.write(tempDir.resolve("letter.docx"), TestDocuments.docx("Dear Jane"));

        assertThat(resolver.resolve(file)).isEqualTo(FormatKind.DOCX);
    }

    @Test
    void rejectsWordDocumentNamedAsText() throws Exception {
        Path file = Files.write(tempDir.resolve("letter.txt"), TestDocuments.docx("Dear Jane"));

        assertThrows(UnsupportedDocumentTypeException.class, () -> resolver.resolve(file));
    }

    @Test
    void unknownBinaryFallsBackToAnyKnownExtension() throws Exception {
        Path file = Files.write(tempDir.resolve("legacy.doc"), new byte[]{0, 1, 2, 3, (byte) 0xFF, (byte) 0xFE, 0, 7});

        assertThat(resolver.resolve(file)).isEqualTo(FormatKind.DOCX);
    }

    @Test
    void resolvesPlainTextAndLoadsBytes() throws Exception {
        Path file = Files.writeString(tempDir.resolve("notes.txt"), "SSN: 123-45-6789", StandardCharsets.UTF_8);

        Document document = resolver.load(file);

        assertThat(document.format()).isEqualTo(FormatKind.TEXT);
        assertThat(document.fileName()).isEqualTo("notes.txt");
        assertThat(new String(document.content(), StandardCharsets.UTF_8)).isEqualTo("SSN: 123-45-6789");
    }

    @Test
    void rejectsUnknownBinaryContent() throws Exception {
        Path file = Files.write(tempDir.resolve("blob.xyz"), new byte[]{0, 1, 2, 3, (byte) 0xFF, (byte) 0xFE, 0, 7});

        assertThrows(UnsupportedDocumentTypeException.class, () -> resolver.resolve(file));
    }

    @Test
    void rejectsImages() throws Exception {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 0, 0, 0, 0x0D, 'I', 'H', 'D', 'R'};
        Path file = Files.write(tempDir.resolve("picture.png"), png);

        assertThrows(UnsupportedDocumentTypeException.class, () -> resolver.resolve(file));
    }

    @Test
    void rejectsMissingAndNullPaths() {
        assertThrows(DocumentPathRequiredException.class, () -> resolver.resolve(null));
        assertThrows(DocumentNotFoundException.class, () -> resolver.resolve(tempDir.resolve("missing.pdf")));
        assertThrows(DocumentNotFoundException.class, () -> resolver.resolve(tempDir));
    }

    @Test
    void rejectsFilesAboveTheSizeLimit() throws Exception {
        RedactionProperties small = new RedactionProperties(DataSize.ofBytes(8), null,
                RedactionProperties.Layout.defaults(), RedactionProperties.Pdf.defaults());
        Path file = Files.writeString(tempDir.resolve("big.txt"), "more than eight bytes");

        DocumentTooLargeException ex = assertThrows(DocumentTooLargeException.class,
                () -> new FileTypeResolver(small).resolve(file));
        assertThat(ex.getLimitBytes()).isEqualTo(8);
    }
}
