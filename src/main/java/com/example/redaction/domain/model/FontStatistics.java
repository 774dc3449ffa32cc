package com.example.redaction.domain.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate font size statistics and font name counts over a group of words.
 */
public record FontStatistics(float minSize, float maxSize, float medianSize, float meanSize, Map<String, Integer> fontCounts) {

    public static final FontStatistics EMPTY = new FontStatistics(0f, 0f, 0f, 0f, Map.of());

    public FontStatistics {
        fontCounts = Map.copyOf(fontCounts);
    }

    public static FontStatistics of(Collection<PositionedWord> words) {
        if (words == null || words.isEmpty()) {
            return EMPTY;
        }
        List<Float> sizes = words.stream().map(PositionedWord::fontSize).sorted().toList();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (PositionedWord word : words) {
            counts.merge(word.fontName(), 1, Integer::sum);
        }
        double sum = 0;
        for (Float size : sizes) {
            sum += size;
        }
        int middle = sizes.size() / 2;
        float median = sizes.size() % 2 == 1
                ? sizes.get(middle)
                : (sizes.get(middle - 1) + sizes.get(middle)) / 2f;
        return new FontStatistics(
                sizes.get(0),
                sizes.get(sizes.size() - 1),
                median,
                (float) (sum / sizes.size()),
                counts
        );
    }
}
