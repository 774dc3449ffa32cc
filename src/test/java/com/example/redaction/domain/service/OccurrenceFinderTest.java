package com.example.redaction.domain.service;

import com.example.redaction.domain.model.Occurrence;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for literal search over flat text.
 */
class OccurrenceFinderTest {

    @Test
    void findAllScansLeftToRightWithoutOverlap() {
        List<Occurrence> occurrences = OccurrenceFinder.findAll("aaaaa", "aa");

        assertThat(occurrences).containsExactly(new Occurrence("aa", 0, 2), new Occurrence("aa", 2, 4));
    }

    @Test
    void findAllIsCaseSensitive() {
        assertThat(OccurrenceFinder.findAll("Jane jane JANE", "Jane")).hasSize(1);
    }

    @Test
    void nestedLiteralIsClaimedByTheLongerOne() {
        String text = "Jane Roe met Roe.";

        List<Occurrence> spans = OccurrenceFinder.findAll(text, List.of("Roe", "Jane Roe"));

        assertThat(spans).containsExactly(new Occurrence("Jane Roe", 0, 8), new Occurrence("Roe", 13, 16));
    }

    @Test
    void partiallyOverlappingLiteralsAreMerged() {
        String text = "xx abcdef yy";

        List<Occurrence> spans = OccurrenceFinder.findAll(text, List.of("abcd", "cdef"));

        assertThat(spans).containsExactly(new Occurrence("abcdef", 3, 9));
    }

    @Test
    void spansNeverOverlap() {
        String text = "123-45-6789 and 45-6789 and 123-45";

        List<Occurrence> spans = OccurrenceFinder.findAll(text, List.of("45-6789", "123-45-6789", "123-45"));

        for (int i = 1; i < spans.size(); i++) {
            assertThat(spans.get(i).start()).isGreaterThanOrEqualTo(spans.get(i - 1).end());
        }
        assertThat(spans).extracting(Occurrence::text).containsExactly("123-45-6789", "45-6789", "123-45");
    }

    @Test
    void wholeWordSearchSkipsLongerWords() {
        String text = "category cat concat cat.";

        List<Occurrence> hits = OccurrenceFinder.findWholeWords(text, "cat");

        assertThat(hits).extracting(Occurrence::start).containsExactly(9, 20);
    }

    @Test
    void emptyLiteralFindsNothing() {
        assertThat(OccurrenceFinder.findAll("text", "")).isEmpty();
    }
}
