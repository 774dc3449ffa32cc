package com.example.redaction.application.match;

import com.example.redaction.domain.model.AcceptedRedactionSet;
import com.example.redaction.domain.model.BoundingBox;
import com.example.redaction.domain.model.DocumentLayout;
import com.example.redaction.domain.model.Occurrence;
import com.example.redaction.domain.model.PageLayout;
import com.example.redaction.domain.model.PositionedWord;
import com.example.redaction.domain.model.RedactionRegion;
import com.example.redaction.domain.model.TextBlock;
import com.example.redaction.domain.service.OccurrenceFinder;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps accepted literals onto page regions of an analyzed PDF.
 * <p>
 * Each literal is searched as a phrase inside every text block (block text is its words joined by single
 * spaces) and as a token inside every word. Hits must be whole words: the characters around them must not be
 * letters or digits, so {@code cat} never touches {@code category}. A hit running over several lines yields
 * one region per line.
 */
@Component
public class PdfRegionLocator {

    static final float LINE_TOLERANCE = 2f;

    public List<RedactionRegion> locate(DocumentLayout layout, AcceptedRedactionSet accepted) {
        Set<RedactionRegion> regions = new LinkedHashSet<>();
        List<String> literals = accepted.texts();
        for (PageLayout page : layout.pages()) {
            for (TextBlock block : page.textBlocks()) {
                for (String literal : literals) {
                    locateInBlock(page.pageIndex(), block, normalizeSpaces(literal), regions);
                    for (PositionedWord word : block.words()) {
                        locateInWord(page.pageIndex(), word, literal, regions);
                    }
                }
            }
        }
        return new ArrayList<>(regions);
    }

    private static void locateInBlock(int page, TextBlock block, String literal, Set<RedactionRegion> regions) {
        String text = block.text();
        List<Occurrence> hits = OccurrenceFinder.findWholeWords(text, literal);
        if (hits.isEmpty()) {
            return;
        }
        List<PositionedWord> words = block.words();
        int[] starts = new int[words.size()];
        int offset = 0;
        for (int i = 0; i < words.size(); i++) {
            starts[i] = offset;
            offset += words.get(i).text().length() + 1;
        }
        for (Occurrence hit : hits) {
            List<Segment> segments = new ArrayList<>();
            for (int i = 0; i < words.size(); i++) {
                PositionedWord word = words.get(i);
                int wordStart = starts[i];
                int wordEnd = wordStart + word.text().length();
                if (wordEnd <= hit.start() || wordStart >= hit.end()) {
                    continue;
                }
                int localStart = Math.max(hit.start(), wordStart) - wordStart;
                int localEnd = Math.min(hit.end(), wordEnd) - wordStart;
                segments.add(new Segment(word, word.boxOf(localStart, localEnd)));
            }
            addPerLine(page, segments, hit.text(), regions);
        }
    }

    private static void locateInWord(int page, PositionedWord word, String literal, Set<RedactionRegion> regions) {
        for (Occurrence hit : OccurrenceFinder.findWholeWords(word.text(), literal)) {
            regions.add(new RedactionRegion(page, word.boxOf(hit.start(), hit.end()), literal));
        }
    }

    private static void addPerLine(int page, List<Segment> segments, String text, Set<RedactionRegion> regions) {
        List<List<Segment>> lines = new ArrayList<>();
        for (Segment segment : segments) {
            List<Segment> line = lines.isEmpty() ? null : lines.get(lines.size() - 1);
            if (line != null && Math.abs(line.get(0).word().bottom() - segment.word().bottom()) <= LINE_TOLERANCE) {
                line.add(segment);
            } else {
                List<Segment> next = new ArrayList<>();
                next.add(segment);
                lines.add(next);
            }
        }
        for (List<Segment> line : lines) {
            BoundingBox box = BoundingBox.enclosing(line.stream().map(Segment::box).toList());
            regions.add(new RedactionRegion(page, box, text));
        }
    }

    private static String normalizeSpaces(String literal) {
        return literal.trim().replaceAll("\\s+", " ");
    }

    private record Segment(PositionedWord word, BoundingBox box) {
    }
}
