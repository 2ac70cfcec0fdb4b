package com.bricks.sorter.service;

import com.bricks.sorter.cache.PartCacheRepository;
import com.bricks.sorter.cluster.InventoryClusterer;
import com.bricks.sorter.input.InventoryFormatRegistry;
import com.bricks.sorter.model.CacheEntry;
import com.bricks.sorter.model.ClusterSummary;
import com.bricks.sorter.model.ClusteringResult;
import com.bricks.sorter.model.EnrichedRecord;
import com.bricks.sorter.model.EnrichedWorkingSet;
import com.bricks.sorter.model.PartRecord;
import com.bricks.sorter.render.ClusterHtmlRenderer;
import com.bricks.sorter.service.enrich.EnrichmentFetcher;
import com.bricks.sorter.service.enrich.StaleImageRefresher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.bricks.sorter.service.catalog.CatalogHttpEngine.MILLISECONDS_VALUE;

/**
 * <h2>InventorySortingService</h2>
 *
 * <p>Entry point of the sorting pipeline. One call of each operation is
 * self-contained; nothing is remembered between calls.</p>
 *
 * <pre>{@code
 * EnrichedWorkingSet parts = sorting.loadAndEnrich("42115", null);
 * ClusteringResult bins    = sorting.cluster(parts, 12, null);
 * String html              = sorting.render(bins.clusters());
 * }</pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventorySortingService {

    private final InventoryFormatRegistry registry;

    private final PartCacheRepository cache;

    private final EnrichmentFetcher fetcher;

    private final StaleImageRefresher refresher;

    private final InventoryClusterer clusterer;

    private final ClusterHtmlRenderer renderer;

    /**
     * Loads an inventory and attaches category breadcrumbs to every part.
     *
     * @param setNumber set number to look up, may be {@code null}
     * @param file      uploaded inventory, may be {@code null}
     * @return one enriched record per design id, ascending
     * @throws com.bricks.sorter.error.FormatUnrecognizedException if no inventory could be read
     */
    public EnrichedWorkingSet loadAndEnrich(final String setNumber, final Path file) {
        long t0 = System.nanoTime();
        List<PartRecord> parts = registry.load(setNumber, file);
        long t1 = System.nanoTime();

        List<Integer> ids = parts.stream().map(PartRecord::designId).toList();
        Map<Integer, CacheEntry> cached = cache.get(ids);

        List<EnrichedRecord> records = new ArrayList<>(parts.size());
        List<Integer> missing = new ArrayList<>();
        for (PartRecord p : parts) {
            CacheEntry hit = cached.get(p.designId());
            records.add(new EnrichedRecord(p, hit == null ? null : hit.labels()));
            if (hit == null) {
                missing.add(p.designId());
            }
        }
        log.info("{} parts, {} cached, {} unknown", parts.size(), cached.size(), missing.size());

        Map<Integer, List<String>> fetched = fetcher.fetchMissing(missing);
        if (!fetched.isEmpty()) {
            records.replaceAll(r -> r.hasLabels() ? r : r.withLabels(fetched.get(r.designId())));
        }
        long t2 = System.nanoTime();

        refresher.refresh(ids);
        long t3 = System.nanoTime();

        log.info("LOAD  INPUT={} ms  ENRICH={} ms  IMAGES={} ms  TOTAL={} ms",
                (t1 - t0) / MILLISECONDS_VALUE, (t2 - t1) / MILLISECONDS_VALUE,
                (t3 - t2) / MILLISECONDS_VALUE, (t3 - t0) / MILLISECONDS_VALUE);
        return new EnrichedWorkingSet(records);
    }

    /**
     * @param workingSet result of {@link #loadAndEnrich(String, Path)}
     * @param clusters   number of bins
     * @param seed       optional seed; see {@link InventoryClusterer#cluster}
     * @return bins and the seed used
     */
    public ClusteringResult cluster(final EnrichedWorkingSet workingSet, final int clusters, final String seed) {
        return clusterer.cluster(workingSet, clusters, seed);
    }

    /**
     * @param clusters bins in display order
     * @return HTML fragment
     */
    public String render(final List<ClusterSummary> clusters) {
        return renderer.render(clusters);
    }
}
