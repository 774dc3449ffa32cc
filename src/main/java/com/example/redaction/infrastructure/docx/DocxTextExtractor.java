package com.example.redaction.infrastructure.docx;

import com.example.redaction.domain.model.FormatKind;
import com.example.redaction.infrastructure.exception.DocumentExtractionException;
import com.example.redaction.infrastructure.extract.FormatTextExtractor;

import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.stream.Collectors;

/**
 * Extracts Word documents with Apache POI: the text of every paragraph, one per line.
 */
@Component
public class DocxTextExtractor implements FormatTextExtractor {

    @Override
    public FormatKind format() {
        return FormatKind.DOCX;
    }

    @Override
    public String extract(byte[] content, String fileName) {
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(content))) {
            return DocxParagraphs.collect(document).stream()
                    .map(XWPFParagraph::getText)
                    .collect(Collectors.joining("\n"));
        } catch (IOException | RuntimeException e) {
            // POI reports non-OOXML input (e.g. a legacy binary .doc) as an unchecked exception
            throw new DocumentExtractionException("DOCX text extraction failed for " + fileName, e);
        }
    }

    /**
     * The paragraph text followed by the text of the whole package: every XML part and every relationship target.
     */
    @Override
    public String recoverableText(byte[] content, String fileName) {
        String paragraphs = extract(content, fileName);
        try {
            return paragraphs + "\n" + DocxPackageText.read(content);
        } catch (IOException | InvalidFormatException | SAXException | RuntimeException e) {
            throw new DocumentExtractionException("DOCX package scan failed for " + fileName, e);
        }
    }
}
