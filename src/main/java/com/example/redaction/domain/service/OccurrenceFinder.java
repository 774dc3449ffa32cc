package com.example.redaction.domain.service;

import com.example.redaction.domain.model.Occurrence;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Exact, case-sensitive literal search over flat text.
 */
public final class OccurrenceFinder {

    private static final Comparator<String> CLAIM_ORDER =
            Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder());

    private OccurrenceFinder() {
    }

    /**
     * Finds every non-overlapping occurrence of {@code literal}, scanning left to right.
     *
     * @param text    text to search
     * @param literal literal to find; an empty literal finds nothing
     * @return occurrences in ascending start order
     */
    public static List<Occurrence> findAll(String text, String literal) {
        List<Occurrence> occurrences = new ArrayList<>();
        if (text == null || literal == null || literal.isEmpty()) {
            return occurrences;
        }
        int from = 0;
        int index;
        while ((index = text.indexOf(literal, from)) >= 0) {
            occurrences.add(new Occurrence(literal, index, index + literal.length()));
            from = index + literal.length();
        }
        return occurrences;
    }

    /**
     * Finds the spans covered by any of the literals. Longer literals claim text first (ties broken
     * lexicographically); a hit inside a claimed span is dropped and a hit partially overlapping claimed
     * spans is merged with them, so the result never contains two overlapping spans.
     *
     * @param text     text to search
     * @param literals literals to find
     * @return disjoint spans in ascending start order, each carrying the text it covers
     */
    public static List<Occurrence> findAll(String text, Collection<String> literals) {
        List<String> ordered = new ArrayList<>(new LinkedHashSet<>(literals));
        ordered.sort(CLAIM_ORDER);

        List<Occurrence> claimed = new ArrayList<>();
        for (String literal : ordered) {
            for (Occurrence hit : findAll(text, literal)) {
                claim(text, claimed, hit);
            }
        }
        claimed.sort(Comparator.comparingInt(Occurrence::start));
        return claimed;
    }

    /**
     * @return whether the characters around {@code [start, end)} are not letters or digits
     */
    public static boolean isWholeWord(String text, int start, int end) {
        boolean leftBoundary = start <= 0 || !Character.isLetterOrDigit(text.charAt(start - 1));
        boolean rightBoundary = end >= text.length() || !Character.isLetterOrDigit(text.charAt(end));
        return leftBoundary && rightBoundary;
    }

    /**
     * Finds non-overlapping whole-word occurrences of {@code literal}.
     */
    public static List<Occurrence> findWholeWords(String text, String literal) {
        List<Occurrence> occurrences = new ArrayList<>();
        if (text == null || literal == null || literal.isEmpty()) {
            return occurrences;
        }
        int from = 0;
        int index;
        while ((index = text.indexOf(literal, from)) >= 0) {
            int end = index + literal.length();
            if (isWholeWord(text, index, end)) {
                occurrences.add(new Occurrence(literal, index, end));
                from = end;
            } else {
                from = index + 1;
            }
        }
        return occurrences;
    }

    private static void claim(String text, List<Occurrence> claimed, Occurrence hit) {
        int start = hit.start();
        int end = hit.end();
        List<Occurrence> overlapping = new ArrayList<>();
        for (Occurrence span : claimed) {
            if (span.contains(hit)) {
                return;
            }
            if (span.overlaps(hit)) {
                overlapping.add(span);
                start = Math.min(start, span.start());
                end = Math.max(end, span.end());
            }
        }
        if (overlapping.isEmpty()) {
            claimed.add(hit);
            return;
        }
        claimed.removeAll(overlapping);
        claimed.add(new Occurrence(text.substring(start, end), start, end));
    }
}
