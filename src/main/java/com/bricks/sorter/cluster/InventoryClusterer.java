package com.bricks.sorter.cluster;

import com.bricks.sorter.config.SorterProperties;
import com.bricks.sorter.error.InvalidParameterException;
import com.bricks.sorter.model.ClusterSummary;
import com.bricks.sorter.model.ClusteringResult;
import com.bricks.sorter.model.EnrichedRecord;
import com.bricks.sorter.model.EnrichedWorkingSet;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.OptionalLong;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

import static com.bricks.sorter.service.catalog.CatalogHttpEngine.MILLISECONDS_VALUE;

/**
 * <h2>InventoryClusterer</h2>
 *
 * <p>Groups the parts of a working set into {@code k} bins by category
 * similarity, weighting every part by the number of pieces owned.</p>
 *
 * <p>Each bin is named after the categories all of its root-carrying members
 * share (comma-joined, in column order), or {@value #OTHER} when they share
 * none. Bins are returned smallest first.</p>
 */
@Slf4j
@Service
public class InventoryClusterer {

    /** Label of a bin without a common category. */
    public static final String OTHER = "Other";

    /** Seeds are unsigned 32-bit values. */
    static final long SEED_BOUND = 1L << 32;

    private final LabelHierarchyEncoder encoder;

    private final SorterProperties props;

    public InventoryClusterer(final LabelHierarchyEncoder encoder, final SorterProperties props) {
        this.encoder = encoder;
        this.props = props;
    }

    /**
     * @param workingSet enriched inventory
     * @param k          number of bins, {@code 1 <= k <= workingSet.size()}
     * @param seed       decimal seed in [0, 2^32); anything else draws a fresh one
     * @return bins sorted ascending by quantity, and the seed that reproduces them
     * @throws InvalidParameterException if {@code k} is out of range
     */
    public ClusteringResult cluster(final EnrichedWorkingSet workingSet, final int k, final String seed) {
        int n = workingSet.size();
        if (k < 1 || k > n) {
            throw new InvalidParameterException(
                    "Number of clusters must be between 1 and " + n + " (distinct parts), got " + k);
        }
        long usedSeed = parseSeed(seed).orElseGet(() -> ThreadLocalRandom.current().nextLong(0, SEED_BOUND));

        long t0 = System.nanoTime();
        FeatureMatrix matrix = encoder.encode(workingSet.records());
        double[][] points = matrix.points();

        WeightedKMeans kmeans = new WeightedKMeans(props.getKmeans().getMaxIterations(),
                props.getKmeans().getRestarts());
        WeightedKMeans.Fit fit = kmeans.fit(points, matrix.weights(), k, new Random(usedSeed));
        long t1 = System.nanoTime();

        List<ClusterSummary> clusters = summarize(matrix, fit.labels(), k);
        logDiagnostics(points, fit, k, clusters, usedSeed, (t1 - t0) / MILLISECONDS_VALUE);

        return new ClusteringResult(clusters, usedSeed, k);
    }

    /**
     * @param seed user input
     * @return the seed when it is a decimal integer in [0, 2^32)
     */
    static OptionalLong parseSeed(final String seed) {
        String text = StringUtils.trimToNull(seed);
        if (text == null) {
            return OptionalLong.empty();
        }
        try {
            long value = Long.parseLong(text);
            if (value >= 0 && value < SEED_BOUND) {
                return OptionalLong.of(value);
            }
        } catch (NumberFormatException ex) {
            log.debug("Ignoring malformed seed '{}'", text);
            return OptionalLong.empty();
        }
        log.debug("Ignoring out-of-range seed {}", text);
        return OptionalLong.empty();
    }

    private List<ClusterSummary> summarize(final FeatureMatrix matrix, final int[] labels, final int k) {
        int columns = matrix.columns().size();
        long[] quantity = new long[k];
        int[][] columnSum = new int[k][columns];
        List<List<Integer>> members = new ArrayList<>(k);
        for (int c = 0; c < k; c++) {
            members.add(new ArrayList<>());
        }

        // records are ascending by design id, so members stay ascending
        for (int i = 0; i < matrix.rows(); i++) {
            EnrichedRecord r = matrix.records().get(i);
            int c = labels[i];
            members.get(c).add(r.designId());
            quantity[c] += r.quantity();
            for (int j = 0; j < columns; j++) {
                if (matrix.value(i, j)) {
                    columnSum[c][j]++;
                }
            }
        }

        List<Integer> order = new ArrayList<>(k);
        for (int c = 0; c < k; c++) {
            order.add(c);
        }
        order.sort(Comparator.<Integer>comparingLong(c -> quantity[c]).thenComparingInt(c -> c));

        List<ClusterSummary> out = new ArrayList<>(k);
        for (int c : order) {
            out.add(new ClusterSummary(label(matrix.columns(), columnSum[c], members.get(c).size()),
                    quantity[c], members.get(c)));
        }
        return out;
    }

    /** Columns carried by every member of the bin; a member without breadcrumbs carries none. */
    private static String label(final List<String> columns, final int[] columnSum, final int size) {
        List<String> shared = new ArrayList<>();
        for (int j = 0; j < columns.size(); j++) {
            if (columnSum[j] > 0 && columnSum[j] == size) {
                shared.add(columns.get(j));
            }
        }
        return shared.isEmpty() ? OTHER : String.join(", ", shared);
    }

    private static void logDiagnostics(final double[][] points, final WeightedKMeans.Fit fit, final int k,
                                       final List<ClusterSummary> clusters, final long seed, final long millis) {
        DoubleSummaryStatistics qty = clusters.stream()
                .mapToDouble(ClusterSummary::quantity)
                .summaryStatistics();
        double silhouette = WeightedKMeans.silhouette(points, fit.labels(), k);

        log.info("KMEANS k={} seed={} iterations={} WSS={} silhouette={} ({} ms)",
                k, seed, fit.iterations(), String.format("%.3f", fit.inertia()),
                String.format("%.3f", silhouette), millis);
        log.info("Bin quantities: count={} min={} mean={} max={}",
                qty.getCount(), (long) qty.getMin(), String.format("%.1f", qty.getAverage()), (long) qty.getMax());
    }
}
