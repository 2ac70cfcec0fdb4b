package com.bricks.sorter.cluster;

import java.util.Arrays;
import java.util.Random;

/**
 * Lloyd's k-means with per-point weights and weighted k-means++ seeding.
 *
 * <p>Deterministic for a given {@link Random}: every restart draws from the
 * same generator, and ties always resolve the same way (a point keeps its
 * current cluster on equal distance; otherwise the lowest cluster index
 * wins).</p>
 */
public final class WeightedKMeans {

    private final int maxIterations;

    private final int restarts;

    public WeightedKMeans(final int maxIterations, final int restarts) {
        if (maxIterations < 1 || restarts < 1) {
            throw new IllegalArgumentException("maxIterations and restarts must be positive");
        }
        this.maxIterations = maxIterations;
        this.restarts = restarts;
    }

    /**
     * Result of the best restart.
     *
     * @param labels     cluster index per point
     * @param centers    cluster centres
     * @param inertia    weighted within-cluster sum of squares
     * @param iterations Lloyd iterations the winning restart needed
     */
    public record Fit(int[] labels, double[][] centers, double inertia, int iterations) {
    }

    /**
     * @param points  n points of equal dimension
     * @param weights n non-negative weights
     * @param k       number of clusters, {@code 1 <= k <= n}
     * @param random  source of randomness for the seeding
     * @return the restart with the lowest inertia (the first one on ties)
     */
    public Fit fit(final double[][] points, final double[] weights, final int k, final Random random) {
        int n = points.length;
        if (weights.length != n) {
            throw new IllegalArgumentException("Expected " + n + " weights, got " + weights.length);
        }
        if (k < 1 || k > n) {
            throw new IllegalArgumentException("k must be within [1, " + n + "], got " + k);
        }

        Fit best = null;
        for (int r = 0; r < restarts; r++) {
            Fit fit = lloyd(points, weights, seed(points, weights, k, random));
            if (best == null || fit.inertia() < best.inertia()) {
                best = fit;
            }
        }
        return best;
    }

    /**
     * Weighted k-means++: the first centre is drawn proportionally to weight,
     * each further one proportionally to weight times squared distance to the
     * nearest chosen centre. Returns k distinct point indices.
     */
    int[] seed(final double[][] points, final double[] weights, final int k, final Random random) {
        int n = points.length;
        int[] chosen = new int[k];
        boolean[] taken = new boolean[n];
        double[] nearest = new double[n];
        Arrays.fill(nearest, Double.POSITIVE_INFINITY);

        for (int c = 0; c < k; c++) {
            double[] p = new double[n];
            for (int i = 0; i < n; i++) {
                if (!taken[i]) {
                    p[i] = c == 0 ? weights[i] : weights[i] * nearest[i];
                }
            }
            int pick = draw(p, taken, random);
            chosen[c] = pick;
            taken[pick] = true;
            for (int i = 0; i < n; i++) {
                nearest[i] = Math.min(nearest[i], squaredDistance(points[i], points[pick]));
            }
        }
        return chosen;
    }

    private static int draw(final double[] p, final boolean[] taken, final Random random) {
        double total = 0.0;
        for (double v : p) {
            total += v;
        }
        if (total > 0.0) {
            double u = random.nextDouble() * total;
            int last = -1;
            for (int i = 0; i < p.length; i++) {
                if (p[i] > 0.0) {
                    last = i;
                    u -= p[i];
                    if (u < 0.0) {
                        return i;
                    }
                }
            }
            return last;   // rounding
        }
        // no mass left: uniform among the points not chosen yet
        int free = 0;
        for (boolean t : taken) {
            if (!t) {
                free++;
            }
        }
        int skip = random.nextInt(free);
        for (int i = 0; i < taken.length; i++) {
            if (!taken[i] && skip-- == 0) {
                return i;
            }
        }
        throw new IllegalStateException("no point left to draw");
    }

    private Fit lloyd(final double[][] points, final double[] weights, final int[] seeds) {
        int n = points.length;
        int k = seeds.length;
        int dim = n == 0 ? 0 : points[0].length;

        double[][] centers = new double[k][];
        int[] labels = new int[n];
        Arrays.fill(labels, -1);
        for (int c = 0; c < k; c++) {
            centers[c] = points[seeds[c]].clone();
            labels[seeds[c]] = c;
        }
        for (int i = 0; i < n; i++) {
            if (labels[i] < 0) {
                labels[i] = nearestCenter(points[i], centers, 0);
            }
        }

        int iterations = 0;
        while (iterations < maxIterations) {
            iterations++;
            updateCenters(points, weights, labels, centers, dim);

            boolean changed = false;
            for (int i = 0; i < n; i++) {
                int next = nearestCenter(points[i], centers, labels[i]);
                if (next != labels[i]) {
                    labels[i] = next;
                    changed = true;
                }
            }
            if (!changed) {
                break;
            }
        }
        updateCenters(points, weights, labels, centers, dim);

        return new Fit(labels, centers, inertia(points, weights, labels, centers), iterations);
    }

    /**
     * Index of the closest centre; {@code current} is kept unless another is strictly closer.
     */
    private static int nearestCenter(final double[] point, final double[][] centers, final int current) {
        int best = current;
        double bestDist = squaredDistance(point, centers[current]);
        for (int c = 0; c < centers.length; c++) {
            double d = squaredDistance(point, centers[c]);
            if (d < bestDist) {
                best = c;
                bestDist = d;
            }
        }
        return best;
    }

    private static void updateCenters(final double[][] points, final double[] weights,
                                      final int[] labels, final double[][] centers, final int dim) {
        int k = centers.length;
        double[][] sum = new double[k][dim];
        double[][] plain = new double[k][dim];
        double[] mass = new double[k];
        int[] size = new int[k];

        for (int i = 0; i < points.length; i++) {
            int c = labels[i];
            size[c]++;
            mass[c] += weights[i];
            for (int d = 0; d < dim; d++) {
                sum[c][d] += weights[i] * points[i][d];
                plain[c][d] += points[i][d];
            }
        }

        for (int c = 0; c < k; c++) {
            if (size[c] == 0) {
                continue;
            }
            for (int d = 0; d < dim; d++) {
                centers[c][d] = mass[c] > 0.0 ? sum[c][d] / mass[c] : plain[c][d] / size[c];
            }
        }

        for (int c = 0; c < k; c++) {
            if (size[c] == 0) {
                relocate(points, labels, centers, size, c);
            }
        }
    }

    /**
     * Moves the point farthest from its own centre, taken from a cluster with
     * more than one member, into the empty cluster {@code empty}.
     */
    private static void relocate(final double[][] points, final int[] labels,
                                 final double[][] centers, final int[] size, final int empty) {
        int far = -1;
        double farDist = -1.0;
        for (int i = 0; i < points.length; i++) {
            if (size[labels[i]] > 1) {
                double d = squaredDistance(points[i], centers[labels[i]]);
                if (d > farDist) {
                    far = i;
                    farDist = d;
                }
            }
        }
        if (far < 0) {
            throw new IllegalStateException("cannot refill empty cluster " + empty);
        }
        size[labels[far]]--;
        labels[far] = empty;
        size[empty] = 1;
        centers[empty] = points[far].clone();
    }

    private static double inertia(final double[][] points, final double[] weights,
                                  final int[] labels, final double[][] centers) {
        double total = 0.0;
        for (int i = 0; i < points.length; i++) {
            total += weights[i] * squaredDistance(points[i], centers[labels[i]]);
        }
        return total;
    }

    static double squaredDistance(final double[] a, final double[] b) {
        double sumSq = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sumSq += d * d;
        }
        return sumSq;
    }

    /**
     * Mean silhouette coefficient with euclidean distance, all points weighted
     * equally.
     *
     * @param points points
     * @param labels cluster index per point
     * @param k      number of clusters
     * @return score in [-1, 1], or {@code NaN} unless 2 &lt;= occupied clusters &lt;= n - 1
     */
    public static double silhouette(final double[][] points, final int[] labels, final int k) {
        int n = points.length;
        int[] size = new int[k];
        for (int l : labels) {
            size[l]++;
        }
        int occupied = (int) Arrays.stream(size).filter(s -> s > 0).count();
        if (occupied < 2 || occupied > n - 1) {
            return Double.NaN;
        }

        double total = 0.0;
        for (int i = 0; i < n; i++) {
            if (size[labels[i]] == 1) {
                continue;   // s(i) = 0
            }
            double[] dist = new double[k];
            for (int j = 0; j < n; j++) {
                if (j != i) {
                    dist[labels[j]] += Math.sqrt(squaredDistance(points[i], points[j]));
                }
            }
            double a = dist[labels[i]] / (size[labels[i]] - 1);
            double b = Double.POSITIVE_INFINITY;
            for (int c = 0; c < k; c++) {
                if (c != labels[i] && size[c] > 0) {
                    b = Math.min(b, dist[c] / size[c]);
                }
            }
            double m = Math.max(a, b);
            total += m > 0.0 ? (b - a) / m : 0.0;
        }
        return total / n;
    }
}
