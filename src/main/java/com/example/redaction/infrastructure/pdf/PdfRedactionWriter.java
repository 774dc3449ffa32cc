package com.example.redaction.infrastructure.pdf;

import com.example.redaction.domain.model.BoundingBox;
import com.example.redaction.domain.model.RedactionRegion;
import com.example.redaction.infrastructure.config.RedactionProperties;
import com.example.redaction.infrastructure.exception.RedactionWriteException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes a redacted copy of a PDF: glyphs under each region are removed from the page content, opaque
 * black boxes are drawn over the regions, and the result is saved with AES-256 owner encryption that
 * forbids modification.
 */
@Component
public class PdfRedactionWriter {

    private static final Logger log = LoggerFactory.getLogger(PdfRedactionWriter.class);
    private static final int OWNER_PASSWORD_BYTES = 24;

    private final RedactionProperties.Pdf settings;
    private final SecureRandom random = new SecureRandom();

    public PdfRedactionWriter(RedactionProperties properties) {
        this.settings = properties.pdf();
    }

    /**
     * @param content  original PDF bytes; never modified
     * @param regions  areas to redact
     * @param fileName name used in logs and error messages
     * @return bytes of the redacted, encrypted PDF
     * @throws RedactionWriteException when PDFBox fails to rewrite or save the document
     */
    public byte[] redact(byte[] content, List<RedactionRegion> regions, String fileName) {
        Map<Integer, List<BoundingBox>> boxesByPage = new TreeMap<>();
        for (RedactionRegion region : regions) {
            boxesByPage.computeIfAbsent(region.page(), page -> new ArrayList<>()).add(region.bbox());
        }

        try (PDDocument document = Loader.loadPDF(content)) {
            if (!boxesByPage.isEmpty()) {
                PdfGlyphRemover remover = new PdfGlyphRemover(document, boxesByPage);
                remover.edit();
                log.info("Removed {} glyphs from {} page(s) of {}", remover.removedGlyphs(), boxesByPage.size(), fileName);
                drawBoxes(document, boxesByPage);
            }
            protect(document);
            ByteArrayOutputStream out = new ByteArrayOutputStream(content.length);
            document.save(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new RedactionWriteException("Unable to write redacted PDF for " + fileName, e);
        }
    }

    private void drawBoxes(PDDocument document, Map<Integer, List<BoundingBox>> boxesByPage) throws IOException {
        for (Map.Entry<Integer, List<BoundingBox>> entry : boxesByPage.entrySet()) {
            PDPage page = document.getPage(entry.getKey());
            try (PDPageContentStream stream = new PDPageContentStream(
                    document, page, PDPageContentStream.AppendMode.APPEND, true, true)) {
                stream.setNonStrokingColor(Color.BLACK);
                for (BoundingBox box : entry.getValue()) {
                    PDRectangle rectangle = PdfGlyphGeometry.toUserSpace(box.expand(settings.boxPadding()), page);
                    stream.addRect(rectangle.getLowerLeftX(), rectangle.getLowerLeftY(),
                            rectangle.getWidth(), rectangle.getHeight());
                }
                stream.fill();
            }
        }
    }

    private void protect(PDDocument document) throws IOException {
        AccessPermission permissions = new AccessPermission();
        permissions.setCanPrint(true);
        permissions.setCanPrintFaithful(true);
        permissions.setCanExtractContent(true);
        permissions.setCanExtractForAccessibility(true);
        permissions.setCanModify(false);
        permissions.setCanModifyAnnotations(false);
        permissions.setCanFillInForm(false);
        permissions.setCanAssembleDocument(false);

        StandardProtectionPolicy policy = new StandardProtectionPolicy(ownerPassword(), "", permissions);
        policy.setEncryptionKeyLength(256);
        policy.setPreferAES(true);
        document.protect(policy);
    }

    private String ownerPassword() {
        String configured = settings.ownerPassword();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        byte[] bytes = new byte[OWNER_PASSWORD_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
