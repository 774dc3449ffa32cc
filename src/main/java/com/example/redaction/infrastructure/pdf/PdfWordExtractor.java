package com.example.redaction.infrastructure.pdf;

import com.example.redaction.domain.model.PositionedWord;
import com.example.redaction.infrastructure.exception.DocumentExtractionException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the positioned words of every page of a PDF, one page after the other.
 */
@Component
public class PdfWordExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfWordExtractor.class);

    /**
     * @param content  PDF bytes
     * @param fileName name used in error messages
     * @return one list of words per page, in page order
     * @throws DocumentExtractionException when the document cannot be parsed at all
     */
    public List<List<PositionedWord>> extractWords(byte[] content, String fileName) {
        try (PDDocument document = Loader.loadPDF(content)) {
            PdfWordCollector collector = new PdfWordCollector();
            List<List<PositionedWord>> pages = new ArrayList<>(document.getNumberOfPages());
            for (int pageIndex = 0; pageIndex < document.getNumberOfPages(); pageIndex++) {
                List<PositionedWord> words = collector.collect(document, pageIndex);
                log.debug("Collected {} words on page {} of {}", words.size(), pageIndex + 1, fileName);
                pages.add(words);
            }
            return pages;
        } catch (IOException e) {
            throw new DocumentExtractionException("Unable to read word positions from " + fileName, e);
        }
    }
}
