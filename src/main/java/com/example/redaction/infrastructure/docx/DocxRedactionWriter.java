package com.example.redaction.infrastructure.docx;

import com.example.redaction.domain.model.Occurrence;
import com.example.redaction.domain.service.OccurrenceFinder;
import com.example.redaction.infrastructure.exception.RedactionWriteException;

import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.opc.PackagePart;
import org.apache.poi.openxml4j.opc.PackageRelationship;
import org.apache.poi.openxml4j.opc.TargetMode;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Redacts Word documents paragraph by paragraph. A paragraph containing an accepted literal loses all of its
 * runs and gets a single new run holding its text with every matched character replaced by {@code █}, so no
 * fragment of the literal survives in any run, field or hyperlink. External link targets containing a literal
 * are blanked as well.
 */
@Component
public class DocxRedactionWriter {

    static final char BLOCK = '█';
    static final String FONT_FAMILY = "Calibri";
    static final int FONT_SIZE = 11;
    static final String COLOR = "000000";
    static final String SCRUBBED_TARGET = "about:blank";

    private static final Logger log = LoggerFactory.getLogger(DocxRedactionWriter.class);

    /**
     * @param content  original DOCX bytes; never modified
     * @param literals accepted literals
     * @param fileName name used in logs and error messages
     * @return bytes of the redacted document
     * @throws RedactionWriteException when POI cannot read or write the document
     */
    public byte[] redact(byte[] content, Collection<String> literals, String fileName) {
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(content))) {
            int rewritten = 0;
            for (XWPFParagraph paragraph : DocxParagraphs.collect(document)) {
                String text = paragraph.getText();
                if (text == null || text.isEmpty() || literals.stream().noneMatch(text::contains)) {
                    continue;
                }
                rewrite(paragraph, redactedText(text, OccurrenceFinder.findAll(text, literals)));
                rewritten++;
            }
            int scrubbed = scrubExternalTargets(document, literals);
            log.info("Rewrote {} paragraph(s) and {} link target(s) of {}", rewritten, scrubbed, fileName);
            ByteArrayOutputStream out = new ByteArrayOutputStream(content.length);
            document.write(out);
            return out.toByteArray();
        } catch (IOException | InvalidFormatException | RuntimeException e) {
            throw new RedactionWriteException("Unable to write redacted DOCX for " + fileName, e);
        }
    }

    /**
     * Points every external relationship (hyperlinks, linked images) whose target contains a literal at
     * {@link #SCRUBBED_TARGET}, keeping the relationship id so the referencing markup stays valid.
     */
    private static int scrubExternalTargets(XWPFDocument document, Collection<String> literals) throws InvalidFormatException {
        int scrubbed = 0;
        for (PackagePart part : document.getPackage().getParts()) {
            if (part.isRelationshipPart()) {
                continue;
            }
            List<PackageRelationship> leaking = new ArrayList<>();
            for (PackageRelationship relationship : part.getRelationships()) {
                if (relationship.getTargetMode() == TargetMode.EXTERNAL
                        && DocxPackageText.targetContainsAny(relationship, literals)) {
                    leaking.add(relationship);
                }
            }
            for (PackageRelationship relationship : leaking) {
                part.removeRelationship(relationship.getId());
                part.addExternalRelationship(SCRUBBED_TARGET, relationship.getRelationshipType(), relationship.getId());
                scrubbed++;
            }
        }
        return scrubbed;
    }

    static String redactedText(String text, List<Occurrence> occurrences) {
        char[] chars = text.toCharArray();
        for (Occurrence occurrence : occurrences) {
            for (int i = occurrence.start(); i < occurrence.end(); i++) {
                chars[i] = BLOCK;
            }
        }
        return new String(chars);
    }

    private static void rewrite(XWPFParagraph paragraph, String redacted) {
        for (int i = paragraph.getRuns().size() - 1; i >= 0; i--) {
            paragraph.removeRun(i);
        }
        XWPFRun run = paragraph.createRun();
        run.setText(redacted);
        run.setFontFamily(FONT_FAMILY);
        run.setFontSize(FONT_SIZE);
        run.setBold(true);
        run.setColor(COLOR);
    }
}
