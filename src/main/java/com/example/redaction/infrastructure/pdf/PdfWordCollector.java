package com.example.redaction.infrastructure.pdf;

import com.example.redaction.domain.model.BoundingBox;
import com.example.redaction.domain.model.PositionedWord;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * PDFBox stripper that turns the text positions of one page into {@link PositionedWord}s with per-character
 * glyph boxes. Fragments on the same baseline that PDFBox split only because of kerning or tight spacing
 * are stitched back together, but never across an actual space glyph.
 * Instances are not thread-safe; use one per document.
 */
public class PdfWordCollector extends PDFTextStripper {

    static final float BASELINE_TOLERANCE = 2f;
    static final float MAX_FRAGMENT_GAP = 2f;

    private final List<Fragment> fragments = new ArrayList<>();
    private int pageIndex;

    public PdfWordCollector() {
        PdfTextStrippers.configure(this);
    }

    /**
     * @param document  loaded document
     * @param pageIndex zero-based page index
     * @return words of the page in reading order
     * @throws IOException when PDFBox fails to parse the page content
     */
    public List<PositionedWord> collect(PDDocument document, int pageIndex) throws IOException {
        this.pageIndex = pageIndex;
        this.fragments.clear();
        setStartPage(pageIndex + 1);
        setEndPage(pageIndex + 1);
        writeText(document, new StringWriter());
        return merge(fragments);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        FragmentBuilder current = new FragmentBuilder();
        for (TextPosition position : textPositions) {
            String unicode = position.getUnicode();
            if (unicode == null || unicode.isBlank()) {
                current.flushInto(fragments, true);
                current = new FragmentBuilder();
                continue;
            }
            current.add(position, unicode);
        }
        current.flushInto(fragments, false);
        super.writeString(text, textPositions);
    }

    private List<PositionedWord> merge(List<Fragment> collected) {
        List<PositionedWord> words = new ArrayList<>();
        Fragment previous = null;
        for (Fragment fragment : collected) {
            if (previous != null && !previous.endedBySpace() && joins(previous.word(), fragment.word())) {
                previous = new Fragment(concat(previous.word(), fragment.word()), fragment.endedBySpace());
                words.set(words.size() - 1, previous.word());
                continue;
            }
            words.add(fragment.word());
            previous = fragment;
        }
        return words;
    }

    private static boolean joins(PositionedWord left, PositionedWord right) {
        float gap = right.x0() - left.x1();
        return Math.abs(left.bottom() - right.bottom()) <= BASELINE_TOLERANCE
                && gap <= MAX_FRAGMENT_GAP
                && gap >= -MAX_FRAGMENT_GAP;
    }

    private static PositionedWord concat(PositionedWord left, PositionedWord right) {
        List<BoundingBox> glyphs = new ArrayList<>(left.glyphs());
        glyphs.addAll(right.glyphs());
        return new PositionedWord(
                left.text() + right.text(),
                left.page(),
                left.bbox().union(right.bbox()),
                left.fontName(),
                left.fontSize(),
                glyphs
        );
    }

    private record Fragment(PositionedWord word, boolean endedBySpace) {
    }

    private final class FragmentBuilder {

        private final StringBuilder text = new StringBuilder();
        private final List<BoundingBox> glyphs = new ArrayList<>();
        private TextPosition first;

        void add(TextPosition position, String unicode) {
            if (first == null) {
                first = position;
            }
            text.append(unicode);
            BoundingBox box = PdfGlyphGeometry.boxOf(position);
            int chars = unicode.length();
            if (chars == 1) {
                glyphs.add(box);
                return;
            }
            // ligatures and expanded glyphs: share the advance evenly among their characters
            float step = box.width() / chars;
            for (int i = 0; i < chars; i++) {
                glyphs.add(new BoundingBox(box.x0() + step * i, box.top(), box.x0() + step * (i + 1), box.bottom()));
            }
        }

        void flushInto(List<Fragment> target, boolean endedBySpace) {
            if (first == null) {
                if (endedBySpace && !target.isEmpty()) {
                    Fragment last = target.remove(target.size() - 1);
                    target.add(new Fragment(last.word(), true));
                }
                return;
            }
            PDFont font = first.getFont();
            String fontName = font == null ? null : font.getName();
            target.add(new Fragment(
                    new PositionedWord(text.toString(), pageIndex, BoundingBox.enclosing(glyphs), fontName,
                            first.getFontSizeInPt(), glyphs),
                    endedBySpace
            ));
        }
    }
}
