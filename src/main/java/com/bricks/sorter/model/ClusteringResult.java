package com.bricks.sorter.model;

import java.util.List;

/**
 * Output of one clustering call.
 *
 * @param clusters          bins sorted ascending by quantity
 * @param usedSeed          seed that reproduces this run
 * @param requestedClusters the k the caller asked for
 */
public record ClusteringResult(List<ClusterSummary> clusters, long usedSeed, int requestedClusters) {

    public ClusteringResult {
        clusters = List.copyOf(clusters);
    }
}
