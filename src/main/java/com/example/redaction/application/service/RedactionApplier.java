package com.example.redaction.application.service;

import com.example.redaction.application.layout.LayoutAnalyzer;
import com.example.redaction.application.match.PdfRegionLocator;
import com.example.redaction.domain.model.AcceptedRedactionSet;
import com.example.redaction.domain.model.Document;
import com.example.redaction.domain.model.DocumentLayout;
import com.example.redaction.domain.model.RedactionRegion;
import com.example.redaction.infrastructure.docx.DocxRedactionWriter;
import com.example.redaction.infrastructure.exception.InfrastructureException;
import com.example.redaction.infrastructure.exception.RedactionWriteException;
import com.example.redaction.infrastructure.extract.DocumentTextExtractor;
import com.example.redaction.infrastructure.pdf.PdfRedactionWriter;
import com.example.redaction.infrastructure.text.PlainTextRedactionWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Produces the redacted bytes of a document with the writer of its format. Works on a copy of the
 * document bytes; the loaded document is never changed.
 */
@Service
public class RedactionApplier {

    private static final Logger log = LoggerFactory.getLogger(RedactionApplier.class);

    private final LayoutAnalyzer layoutAnalyzer;
    private final PdfRegionLocator regionLocator;
    private final PdfRedactionWriter pdfWriter;
    private final DocxRedactionWriter docxWriter;
    private final PlainTextRedactionWriter textWriter;
    private final DocumentTextExtractor textExtractor;

    public RedactionApplier(LayoutAnalyzer layoutAnalyzer,
                            PdfRegionLocator regionLocator,
                            PdfRedactionWriter pdfWriter,
                            DocxRedactionWriter docxWriter,
                            PlainTextRedactionWriter textWriter,
                            DocumentTextExtractor textExtractor) {
        this.layoutAnalyzer = layoutAnalyzer;
        this.regionLocator = regionLocator;
        this.pdfWriter = pdfWriter;
        this.docxWriter = docxWriter;
        this.textWriter = textWriter;
        this.textExtractor = textExtractor;
    }

    /**
     * @param document  loaded document
     * @param redactions accepted redactions
     * @return redacted bytes in the document's format
     * @throws RedactionWriteException when the format writer fails
     */
    public byte[] apply(Document document, AcceptedRedactionSet redactions) {
        List<String> literals = redactions.texts();
        try {
            return switch (document.format()) {
                case PDF -> {
                    DocumentLayout layout = layoutAnalyzer.analyze(document);
                    List<RedactionRegion> regions = regionLocator.locate(layout, redactions);
                    log.info("Located {} region(s) for {} literal(s) in {}", regions.size(), literals.size(), document.fileName());
                    yield pdfWriter.redact(document.content(), regions, document.fileName());
                }
                case DOCX -> docxWriter.redact(document.content(), literals, document.fileName());
                case TEXT -> textWriter.redact(textExtractor.extract(document), literals);
            };
        } catch (InfrastructureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RedactionWriteException("Unable to apply redactions to " + document.fileName(), e);
        }
    }
}
