package com.example.redaction.application.match;

import com.example.redaction.domain.model.AcceptedRedactionSet;
import com.example.redaction.domain.model.BoundingBox;
import com.example.redaction.domain.model.DocumentLayout;
import com.example.redaction.domain.model.FontStatistics;
import com.example.redaction.domain.model.PageLayout;
import com.example.redaction.domain.model.PositionedWord;
import com.example.redaction.domain.model.RedactionKind;
import com.example.redaction.domain.model.RedactionRegion;
import com.example.redaction.domain.model.RedactionRequest;
import com.example.redaction.domain.model.TextBlock;
import com.example.redaction.domain.model.TextDirection;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.example.redaction.support.TestDocuments.line;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for mapping accepted literals onto glyph regions. Each layout holds a single text block built from
 * words whose glyphs are 6pt wide and 10pt high.
 */
class PdfRegionLocatorTest {

    private final PdfRegionLocator locator = new PdfRegionLocator();

    @Test
    void coversAPhraseFollowedByPunctuation() {
        DocumentLayout layout = layoutOf(0, line(50f, 100f, "Contact:", "Jane", "Roe."));

        List<RedactionRegion> regions = locator.locate(layout, accept("Jane Roe"));

        assertThat(regions).containsExactly(new RedactionRegion(0, new BoundingBox(104f, 100f, 152f, 110f), "Jane Roe"));
    }

    @Test
    void neverTouchesLongerWordsContainingTheLiteral() {
        DocumentLayout layout = layoutOf(0, line(50f, 100f, "cat", "category", "concat"));

        List<RedactionRegion> regions = locator.locate(layout, accept("cat"));

        assertThat(regions).containsExactly(new RedactionRegion(0, new BoundingBox(50f, 100f, 68f, 110f), "cat"));
    }

    @Test
    void splitsPhrasesRunningOverTwoLines() {
        List<PositionedWord> words = new ArrayList<>(line(50f, 100f, "Dear", "Jane"));
        words.addAll(line(50f, 114f, "Roe", "wrote"));

        List<RedactionRegion> regions = locator.locate(layoutOf(2, words), accept("Jane Roe"));

        assertThat(regions).containsExactly(
                new RedactionRegion(2, new BoundingBox(80f, 100f, 104f, 110f), "Jane Roe"),
                new RedactionRegion(2, new BoundingBox(50f, 114f, 68f, 124f), "Jane Roe"));
    }

    @Test
    void findsTokensInsidePunctuatedWords() {
        DocumentLayout layout = layoutOf(0, line(50f, 100f, "ID:4411,", "ok"));

        List<RedactionRegion> regions = locator.locate(layout, accept("4411"));

        assertThat(regions).containsExactly(new RedactionRegion(0, new BoundingBox(68f, 100f, 92f, 110f), "4411"));
    }

    @Test
    void normalizesWhitespaceInsideLiterals() {
        DocumentLayout layout = layoutOf(0, line(50f, 100f, "Jane", "Roe"));

        List<RedactionRegion> regions = locator.locate(layout, accept(" Jane \t Roe "));

        assertThat(regions).hasSize(1);
        assertThat(regions.get(0).bbox()).isEqualTo(new BoundingBox(50f, 100f, 98f, 110f));
    }

    @Test
    void absentLiteralsYieldNoRegions() {
        DocumentLayout layout = layoutOf(0, line(50f, 100f, "nothing", "here"));

        assertThat(locator.locate(layout, accept("Jane"))).isEmpty();
    }

    private static AcceptedRedactionSet accept(String... literals) {
        AcceptedRedactionSet set = AcceptedRedactionSet.empty();
        for (String literal : literals) {
            set = set.accept(RedactionRequest.of(literal, RedactionKind.PII));
        }
        return set;
    }

    private static DocumentLayout layoutOf(int pageIndex, List<PositionedWord> words) {
        List<PageLayout> pages = new ArrayList<>();
        for (int i = 0; i < pageIndex; i++) {
            pages.add(PageLayout.empty(i));
        }
        pages.add(new PageLayout(pageIndex, List.of(), TextDirection.LTR, List.of(), List.of(TextBlock.of(words)),
                words.size(), 0f));
        return new DocumentLayout(pages, FontStatistics.of(words));
    }
}
