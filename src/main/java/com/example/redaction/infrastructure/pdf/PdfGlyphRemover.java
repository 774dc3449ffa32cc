package com.example.redaction.infrastructure.pdf;

import com.example.redaction.domain.model.BoundingBox;

import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSFloat;
import org.apache.pdfbox.cos.COSNumber;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdfwriter.ContentStreamWriter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.graphics.state.PDTextState;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Removes every glyph whose centre lies inside a redaction box from the text-showing operators
 * ({@code Tj}, {@code TJ}, {@code '}, {@code "}) of the affected pages.
 * Kept glyphs stay in place: the advance of each removed glyph is replaced by a {@code TJ} offset.
 */
class PdfGlyphRemover extends PdfContentStreamEditor {

    private static final Logger log = LoggerFactory.getLogger(PdfGlyphRemover.class);
    private static final Set<String> TEXT_SHOWING_OPERATORS = Set.of(
            OperatorName.SHOW_TEXT,
            OperatorName.SHOW_TEXT_ADJUSTED,
            OperatorName.SHOW_TEXT_LINE,
            OperatorName.SHOW_TEXT_LINE_AND_SPACE
    );

    private final Map<Integer, List<BoundingBox>> boxesByPage;
    private final List<TextPosition> operatorGlyphs = new ArrayList<>();
    private int removedGlyphs;

    /**
     * @param document    document to edit in place
     * @param boxesByPage zero-based page index to the boxes whose glyphs must go
     */
    PdfGlyphRemover(PDDocument document, Map<Integer, List<BoundingBox>> boxesByPage) {
        super(document, boxesByPage.keySet());
        this.boxesByPage = boxesByPage;
    }

    int removedGlyphs() {
        return removedGlyphs;
    }

    @Override
    protected void nextOperation(Operator operator, List<COSBase> operands) {
        operatorGlyphs.clear();
    }

    @Override
    protected void processTextPosition(TextPosition text) {
        operatorGlyphs.add(text);
        super.processTextPosition(text);
    }

    @Override
    protected void write(ContentStreamWriter writer, Operator operator, List<COSBase> operands) throws IOException {
        if (!TEXT_SHOWING_OPERATORS.contains(operator.getName())) {
            super.write(writer, operator, operands);
            return;
        }
        boolean removeAny = false;
        boolean keepAny = false;
        for (TextPosition glyph : operatorGlyphs) {
            boolean removed = isRedacted(glyph);
            removeAny |= removed;
            keepAny |= !removed;
        }
        if (!removeAny) {
            super.write(writer, operator, operands);
            return;
        }
        if (!keepAny) {
            removedGlyphs += operatorGlyphs.size();
            writeLineAdvance(writer, operator, operands);
            return;
        }

        String name = operator.getName();
        COSArray shown;
        if (OperatorName.SHOW_TEXT_ADJUSTED.equals(name)) {
            shown = operands.isEmpty() || !(operands.get(0) instanceof COSArray array) ? null : array;
        } else {
            COSBase last = operands.isEmpty() ? null : operands.get(operands.size() - 1);
            shown = new COSArray();
            if (last instanceof COSString string) {
                shown.add(string);
            }
        }
        List<COSBase> patched = shown == null ? null : patch(shown);
        writeLineAdvance(writer, operator, operands);
        if (patched == null) {
            // glyphs could not be mapped onto character codes; drop the whole operator
            log.debug("Dropping text operator on page {} whose glyphs do not map onto its codes", currentPageIndex() + 1);
            removedGlyphs += operatorGlyphs.size();
            return;
        }
        COSArray array = new COSArray();
        for (COSBase item : patched) {
            array.add(item);
        }
        super.write(writer, Operator.getOperator(OperatorName.SHOW_TEXT_ADJUSTED), List.of(array));
    }

    /**
     * {@code '} and {@code "} move to the next line before showing text; that movement (and the spacing
     * {@code "} sets) must survive even when the text itself is removed.
     */
    private void writeLineAdvance(ContentStreamWriter writer, Operator operator, List<COSBase> operands) throws IOException {
        String name = operator.getName();
        if (OperatorName.SHOW_TEXT_LINE_AND_SPACE.equals(name) && operands.size() == 3) {
            super.write(writer, Operator.getOperator(OperatorName.SET_WORD_SPACING), List.of(operands.get(0)));
            super.write(writer, Operator.getOperator(OperatorName.SET_CHAR_SPACING), List.of(operands.get(1)));
        }
        if (OperatorName.SHOW_TEXT_LINE.equals(name) || OperatorName.SHOW_TEXT_LINE_AND_SPACE.equals(name)) {
            super.write(writer, Operator.getOperator(OperatorName.NEXT_LINE), List.of());
        }
    }

    /**
     * Re-encodes a {@code TJ} array without the redacted glyphs.
     *
     * @return new array items, or {@code null} when the operator's codes and glyphs disagree
     */
    private List<COSBase> patch(COSArray shown) throws IOException {
        PDTextState textState = getGraphicsState().getTextState();
        PDFont font = textState.getFont();
        float fontSize = textState.getFontSize();
        if (font == null || fontSize == 0f) {
            return null;
        }
        float charSpacing = textState.getCharacterSpacing() * 1000f / fontSize;
        float wordSpacing = textState.getWordSpacing() * 1000f / fontSize;

        List<COSBase> result = new ArrayList<>();
        ByteArrayOutputStream kept = new ByteArrayOutputStream();
        float offset = 0f;
        int glyphIndex = 0;
        for (int i = 0; i < shown.size(); i++) {
            COSBase item = shown.getObject(i);
            if (item instanceof COSNumber number) {
                offset += number.floatValue();
                continue;
            }
            if (!(item instanceof COSString string)) {
                continue;
            }
            byte[] bytes = string.getBytes();
            ByteArrayInputStream in = new ByteArrayInputStream(bytes);
            int position = 0;
            while (in.available() > 0) {
                if (glyphIndex >= operatorGlyphs.size()) {
                    return null;
                }
                int code = font.readCode(in);
                int consumed = bytes.length - in.available() - position;
                TextPosition glyph = operatorGlyphs.get(glyphIndex++);
                if (isRedacted(glyph)) {
                    float advance = font.getWidth(code) + charSpacing;
                    if (consumed == 1 && code == 32) {
                        advance += wordSpacing;
                    }
                    offset -= advance;
                    removedGlyphs++;
                } else {
                    if (offset != 0f) {
                        flush(result, kept);
                        result.add(new COSFloat(offset));
                        offset = 0f;
                    }
                    kept.write(bytes, position, consumed);
                }
                position += consumed;
            }
        }
        if (glyphIndex != operatorGlyphs.size()) {
            return null;
        }
        flush(result, kept);
        if (offset != 0f) {
            result.add(new COSFloat(offset));
        }
        return result;
    }

    private static void flush(List<COSBase> result, ByteArrayOutputStream kept) {
        if (kept.size() > 0) {
            result.add(new COSString(kept.toByteArray()));
            kept.reset();
        }
    }

    private boolean isRedacted(TextPosition glyph) {
        List<BoundingBox> boxes = boxesByPage.get(currentPageIndex());
        if (boxes == null) {
            return false;
        }
        BoundingBox box = PdfGlyphGeometry.boxOf(glyph);
        for (BoundingBox region : boxes) {
            if (region.contains(box.centerX(), box.centerY())) {
                return true;
            }
        }
        return false;
    }
}
