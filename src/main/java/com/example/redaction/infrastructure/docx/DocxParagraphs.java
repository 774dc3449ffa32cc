package com.example.redaction.infrastructure.docx;

import org.apache.poi.xwpf.usermodel.IBody;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFComment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFEndnote;
import org.apache.poi.xwpf.usermodel.XWPFFooter;
import org.apache.poi.xwpf.usermodel.XWPFFootnote;
import org.apache.poi.xwpf.usermodel.XWPFHeader;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks every paragraph that carries visible text: body paragraphs in document order (descending into
 * tables row by row, cell by cell), then headers, footers, footnotes, endnotes and comments.
 * Content controls and text boxes are not walked; verification scans the whole package and catches them.
 */
final class DocxParagraphs {

    private DocxParagraphs() {
    }

    static List<XWPFParagraph> collect(XWPFDocument document) {
        List<XWPFParagraph> paragraphs = new ArrayList<>();
        collect(document, paragraphs);
        for (XWPFHeader header : document.getHeaderList()) {
            collect(header, paragraphs);
        }
        for (XWPFFooter footer : document.getFooterList()) {
            collect(footer, paragraphs);
        }
        for (XWPFFootnote footnote : document.getFootnotes()) {
            collect(footnote, paragraphs);
        }
        for (XWPFEndnote endnote : document.getEndnotes()) {
            collect(endnote, paragraphs);
        }
        for (XWPFComment comment : document.getComments()) {
            collect(comment, paragraphs);
        }
        return paragraphs;
    }

    private static void collect(IBody body, List<XWPFParagraph> paragraphs) {
        for (IBodyElement element : body.getBodyElements()) {
            if (element instanceof XWPFParagraph paragraph) {
                paragraphs.add(paragraph);
            } else if (element instanceof XWPFTable table) {
                for (XWPFTableRow row : table.getRows()) {
                    for (XWPFTableCell cell : row.getTableCells()) {
                        collect(cell, paragraphs);
                    }
                }
            }
        }
    }
}
