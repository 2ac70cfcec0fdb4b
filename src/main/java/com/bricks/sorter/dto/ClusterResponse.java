package com.bricks.sorter.dto;

import com.bricks.sorter.model.ClusterSummary;

import java.util.List;

/**
 * Response body of {@code POST /api/clusters}.
 *
 * @param seed     seed that reproduces the clustering
 * @param clusters bins, smallest first
 * @param html     rendered bins with part images
 */
public record ClusterResponse(long seed, List<ClusterSummary> clusters, String html) {
}
