package com.example.redaction.infrastructure.pdf;

import com.example.redaction.domain.model.FormatKind;
import com.example.redaction.infrastructure.exception.DocumentExtractionException;
import com.example.redaction.infrastructure.extract.FormatTextExtractor;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the text of a PDF page by page in reading order and joins the pages with a newline.
 */
@Component
public class PdfTextExtractor implements FormatTextExtractor {

    @Override
    public FormatKind format() {
        return FormatKind.PDF;
    }

    /**
     * @param content  PDF bytes, possibly owner-encrypted with an empty user password
     * @param fileName logical name used in error messages
     * @return concatenated page text
     * @throws DocumentExtractionException when PDFBox cannot load or read the document
     */
    @Override
    public String extract(byte[] content, String fileName) {
        try (PDDocument document = Loader.loadPDF(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            PdfTextStrippers.configure(stripper);
            List<String> pages = new ArrayList<>(document.getNumberOfPages());
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                pages.add(stripper.getText(document));
            }
            return String.join("\n", pages);
        } catch (IOException e) {
            throw new DocumentExtractionException("PDF text extraction failed for " + fileName, e);
        }
    }
}
