package com.example.redaction.application.layout;

import com.example.redaction.domain.model.Column;
import com.example.redaction.domain.model.PositionedWord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Splits the words of a page into 1 to 3 columns by clustering their left edges.
 * <p>
 * Candidate splits into 2 and 3 clusters come from 1-D k-means (k-means++ seeding from a fixed-seed
 * random source, several restarts, lowest inertia wins) and are scored with the silhouette coefficient.
 * The best split is kept only when its score reaches the configured minimum separation; otherwise the
 * page is a single column. Results are deterministic for a given word list.
 */
public class ColumnDetector {

    static final long SEED = 42L;
    static final int MAX_COLUMNS = 3;
    static final int RESTARTS = 10;
    static final int MAX_ITERATIONS = 100;
    private static final double DISTINCT_EPSILON = 0.5d;

    private final double minSeparation;

    /**
     * @param minSeparation silhouette score below which a multi-column split is rejected
     */
    public ColumnDetector(double minSeparation) {
        this.minSeparation = minSeparation;
    }

    /**
     * @param words words of one page
     * @return columns ordered left to right with non-overlapping x ranges; empty for a page without words
     */
    public List<Column> detect(List<PositionedWord> words) {
        if (words.isEmpty()) {
            return List.of();
        }
        double[] xs = new double[words.size()];
        for (int i = 0; i < xs.length; i++) {
            xs[i] = words.get(i).x0();
        }
        int distinct = countDistinct(xs);
        int maxK = Math.min(Math.min(MAX_COLUMNS, distinct), xs.length - 1);
        if (distinct < 2 || maxK < 2) {
            return List.of(toColumn(words));
        }

        Random random = new Random(SEED);
        int[] bestLabels = null;
        int bestK = 1;
        double bestScore = -1d;
        for (int k = 2; k <= maxK; k++) {
            int[] labels = cluster(xs, k, random);
            double score = silhouette(xs, labels, k);
            if (score > bestScore) {
                bestScore = score;
                bestLabels = labels;
                bestK = k;
            }
        }
        if (bestLabels == null || bestScore < minSeparation) {
            return List.of(toColumn(words));
        }
        return mergeOverlapping(group(words, bestLabels, bestK));
    }

    private static int countDistinct(double[] xs) {
        double[] sorted = xs.clone();
        Arrays.sort(sorted);
        int distinct = 1;
        for (int i = 1; i < sorted.length; i++) {
            if (sorted[i] - sorted[i - 1] > DISTINCT_EPSILON) {
                distinct++;
            }
        }
        return distinct;
    }

    /**
     * Runs k-means several times and keeps the labelling with the lowest inertia.
     */
    static int[] cluster(double[] xs, int k, Random random) {
        int[] best = null;
        double bestInertia = Double.MAX_VALUE;
        for (int restart = 0; restart < RESTARTS; restart++) {
            double[] centroids = seed(xs, k, random);
            int[] labels = new int[xs.length];
            for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
                boolean changed = assign(xs, centroids, labels);
                update(xs, centroids, labels);
                if (!changed && iteration > 0) {
                    break;
                }
            }
            double inertia = 0d;
            for (int i = 0; i < xs.length; i++) {
                double d = xs[i] - centroids[labels[i]];
                inertia += d * d;
            }
            if (inertia < bestInertia) {
                bestInertia = inertia;
                best = labels;
            }
        }
        return best;
    }

    /**
     * k-means++ seeding: each next centroid is drawn with probability proportional to the squared distance
     * to the nearest centroid chosen so far.
     */
    private static double[] seed(double[] xs, int k, Random random) {
        double[] centroids = new double[k];
        centroids[0] = xs[random.nextInt(xs.length)];
        double[] distances = new double[xs.length];
        for (int c = 1; c < k; c++) {
            double total = 0d;
            for (int i = 0; i < xs.length; i++) {
                double nearest = Double.MAX_VALUE;
                for (int j = 0; j < c; j++) {
                    double d = xs[i] - centroids[j];
                    nearest = Math.min(nearest, d * d);
                }
                distances[i] = nearest;
                total += nearest;
            }
            if (total == 0d) {
                centroids[c] = xs[random.nextInt(xs.length)];
                continue;
            }
            double target = random.nextDouble() * total;
            int chosen = xs.length - 1;
            for (int i = 0; i < xs.length; i++) {
                target -= distances[i];
                if (target <= 0d) {
                    chosen = i;
                    break;
                }
            }
            centroids[c] = xs[chosen];
        }
        return centroids;
    }

    private static boolean assign(double[] xs, double[] centroids, int[] labels) {
        boolean changed = false;
        for (int i = 0; i < xs.length; i++) {
            int nearest = 0;
            double nearestDistance = Math.abs(xs[i] - centroids[0]);
            for (int c = 1; c < centroids.length; c++) {
                double distance = Math.abs(xs[i] - centroids[c]);
                if (distance < nearestDistance) {
                    nearest = c;
                    nearestDistance = distance;
                }
            }
            if (labels[i] != nearest) {
                labels[i] = nearest;
                changed = true;
            }
        }
        return changed;
    }

    private static void update(double[] xs, double[] centroids, int[] labels) {
        double[] sums = new double[centroids.length];
        int[] counts = new int[centroids.length];
        for (int i = 0; i < xs.length; i++) {
            sums[labels[i]] += xs[i];
            counts[labels[i]]++;
        }
        for (int c = 0; c < centroids.length; c++) {
            if (counts[c] > 0) {
                centroids[c] = sums[c] / counts[c];
            }
        }
    }

    /**
     * Mean silhouette coefficient. Mean distances to a cluster are computed from sorted values and prefix
     * sums, so scoring a page stays O(n log n). Points in singleton clusters score 0.
     */
    static double silhouette(double[] xs, int[] labels, int k) {
        double[][] sortedByCluster = new double[k][];
        double[][] prefixByCluster = new double[k][];
        int[] counts = new int[k];
        for (int label : labels) {
            counts[label]++;
        }
        int nonEmpty = 0;
        for (int c = 0; c < k; c++) {
            double[] values = new double[counts[c]];
            int n = 0;
            for (int i = 0; i < xs.length; i++) {
                if (labels[i] == c) {
                    values[n++] = xs[i];
                }
            }
            Arrays.sort(values);
            double[] prefix = new double[values.length + 1];
            for (int i = 0; i < values.length; i++) {
                prefix[i + 1] = prefix[i] + values[i];
            }
            sortedByCluster[c] = values;
            prefixByCluster[c] = prefix;
            if (values.length > 0) {
                nonEmpty++;
            }
        }
        if (nonEmpty < 2) {
            return -1d;
        }

        double total = 0d;
        for (int i = 0; i < xs.length; i++) {
            int own = labels[i];
            if (counts[own] <= 1) {
                continue;
            }
            double a = distanceSum(xs[i], sortedByCluster[own], prefixByCluster[own]) / (counts[own] - 1);
            double b = Double.MAX_VALUE;
            for (int c = 0; c < k; c++) {
                if (c != own && counts[c] > 0) {
                    b = Math.min(b, distanceSum(xs[i], sortedByCluster[c], prefixByCluster[c]) / counts[c]);
                }
            }
            double denominator = Math.max(a, b);
            total += denominator == 0d ? 0d : (b - a) / denominator;
        }
        return total / xs.length;
    }

    private static double distanceSum(double x, double[] sorted, double[] prefix) {
        int below = lowerBound(sorted, x);
        double left = x * below - prefix[below];
        double right = (prefix[sorted.length] - prefix[below]) - x * (sorted.length - below);
        return left + right;
    }

    private static int lowerBound(double[] sorted, double x) {
        int low = 0;
        int high = sorted.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (sorted[mid] < x) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private static List<Column> group(List<PositionedWord> words, int[] labels, int k) {
        List<List<PositionedWord>> members = new ArrayList<>();
        for (int c = 0; c < k; c++) {
            members.add(new ArrayList<>());
        }
        for (int i = 0; i < words.size(); i++) {
            members.get(labels[i]).add(words.get(i));
        }
        List<Column> columns = new ArrayList<>();
        for (List<PositionedWord> clusterWords : members) {
            if (!clusterWords.isEmpty()) {
                columns.add(toColumn(clusterWords));
            }
        }
        columns.sort(Comparator.comparingDouble(Column::minX));
        return columns;
    }

    private static List<Column> mergeOverlapping(List<Column> columns) {
        List<Column> merged = new ArrayList<>();
        for (Column column : columns) {
            if (!merged.isEmpty() && merged.get(merged.size() - 1).overlaps(column)) {
                Column previous = merged.remove(merged.size() - 1);
                List<PositionedWord> words = new ArrayList<>(previous.words());
                words.addAll(column.words());
                merged.add(toColumn(words));
            } else {
                merged.add(column);
            }
        }
        return merged;
    }

    private static Column toColumn(List<PositionedWord> words) {
        float minX = Float.MAX_VALUE;
        float maxX = -Float.MAX_VALUE;
        for (PositionedWord word : words) {
            minX = Math.min(minX, word.x0());
            maxX = Math.max(maxX, word.x1());
        }
        return new Column(minX, maxX, words);
    }
}
