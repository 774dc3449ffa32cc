package com.example.redaction.infrastructure.pdf;

import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdfwriter.ContentStreamWriter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDStream;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Set;

/**
 * Text stripper that re-writes the content stream of selected pages operator by operator while PDFBox
 * interprets it, so subclasses can inspect the glyphs an operator produced before deciding what to write.
 * Form XObjects are not descended into; their content is left untouched.
 */
abstract class PdfContentStreamEditor extends PDFTextStripper {

    protected final PDDocument document;
    private final Set<Integer> pagesToEdit;
    private ContentStreamWriter replacement;
    private boolean inOperator;
    private int currentPageIndex = -1;

    /**
     * @param document    document whose pages get new content streams
     * @param pagesToEdit zero-based indexes of the pages to re-write; other pages are left as they are
     */
    protected PdfContentStreamEditor(PDDocument document, Set<Integer> pagesToEdit) {
        this.document = document;
        this.pagesToEdit = Set.copyOf(pagesToEdit);
        PdfTextStrippers.configure(this);
    }

    /**
     * Interprets and re-writes every selected page.
     */
    public void edit() throws IOException {
        getText(document);
    }

    protected int currentPageIndex() {
        return currentPageIndex;
    }

    @Override
    public void processPage(PDPage page) throws IOException {
        int index = document.getPages().indexOf(page);
        if (!pagesToEdit.contains(index)) {
            return;
        }
        currentPageIndex = index;
        PDStream stream = new PDStream(document);
        try (OutputStream out = stream.createOutputStream(COSName.FLATE_DECODE)) {
            replacement = new ContentStreamWriter(out);
            super.processPage(page);
        } finally {
            replacement = null;
        }
        page.setContents(stream);
    }

    @Override
    public void showForm(PDFormXObject form) {
        // form content is shared between pages and is not re-written
    }

    @Override
    protected void processOperator(Operator operator, List<COSBase> operands) throws IOException {
        if (inOperator) {
            super.processOperator(operator, operands);
            return;
        }
        inOperator = true;
        try {
            nextOperation(operator, operands);
            super.processOperator(operator, operands);
            write(replacement, operator, operands);
        } finally {
            inOperator = false;
        }
    }

    /**
     * Called before an operator is interpreted.
     */
    protected void nextOperation(Operator operator, List<COSBase> operands) {
    }

    /**
     * Writes an operator to the new content stream; subclasses may rewrite or drop it.
     */
    protected void write(ContentStreamWriter writer, Operator operator, List<COSBase> operands) throws IOException {
        writer.writeTokens(operands);
        writer.writeToken(operator);
    }
}
