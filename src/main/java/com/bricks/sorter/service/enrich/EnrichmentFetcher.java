package com.bricks.sorter.service.enrich;

import com.bricks.sorter.cache.PartCacheRepository;
import com.bricks.sorter.config.SorterProperties;
import com.bricks.sorter.model.CacheEntry;
import com.bricks.sorter.model.PartLookup;
import com.bricks.sorter.service.catalog.PartCatalogClient;
import com.bricks.sorter.service.catalog.TaxonomyLookup;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.decorators.Decorators;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.bricks.sorter.service.catalog.CatalogHttpEngine.MILLISECONDS_VALUE;

/**
 * <h2>EnrichmentFetcher</h2>
 *
 * <p>Fills the cache for design ids it does not know yet:</p>
 * <ol>
 *   <li>each id is looked up on a bounded pool ({@code sorter.fetch-concurrency});</li>
 *   <li>breadcrumbs first, then the image of the <em>resolved</em> id;</li>
 *   <li>all results are written to the cache as a single batch.</li>
 * </ol>
 *
 * <p>Every remote call runs through the {@code catalogLookup} retry and
 * circuit breaker. A failed breadcrumb lookup degrades to the root term alone;
 * a failed image lookup leaves the image empty for the
 * {@link StaleImageRefresher} to retry on a later day.</p>
 */
@Slf4j
@Service
public class EnrichmentFetcher {

    private final PartCatalogClient client;

    private final PartCacheRepository cache;

    private final Retry retry;

    private final CircuitBreaker circuitBreaker;

    private final SorterProperties props;

    private final Clock clock;

    public EnrichmentFetcher(final PartCatalogClient client,
                             final PartCacheRepository cache,
                             final Retry catalogRetry,
                             final CircuitBreaker catalogCircuitBreaker,
                             final SorterProperties props,
                             final Clock clock) {
        this.client = client;
        this.cache = cache;
        this.retry = catalogRetry;
        this.circuitBreaker = catalogCircuitBreaker;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Looks up every id and stores the results.
     *
     * @param missingIds queried design ids absent from the cache
     * @return labels per queried id, for every id in {@code missingIds}
     */
    public Map<Integer, List<String>> fetchMissing(final Collection<Integer> missingIds) {
        if (missingIds.isEmpty()) {
            return Map.of();
        }
        log.info("Fetching {} unknown parts from {} ({} in parallel)",
                missingIds.size(), client.catalog(), props.getFetchConcurrency());

        long t0 = System.nanoTime();
        List<PartLookup> lookups = Flux.fromIterable(missingIds)
                .flatMap(id -> Mono.fromCallable(() -> lookup(id))
                                .subscribeOn(Schedulers.boundedElastic()),
                        props.getFetchConcurrency())
                .collectList()
                .block();
        long t1 = System.nanoTime();

        List<PartLookup> ordered = new ArrayList<>(lookups);
        ordered.sort(Comparator.comparingInt(PartLookup::queriedId));

        cache.putMany(toEntries(ordered));
        long t2 = System.nanoTime();

        Map<Integer, List<String>> labels = new TreeMap<>();
        ordered.forEach(l -> labels.put(l.queriedId(), l.labels()));

        log.info("FETCH  PARTS={}  NET={} ms  STORE={} ms",
                ordered.size(), (t1 - t0) / MILLISECONDS_VALUE, (t2 - t1) / MILLISECONDS_VALUE);
        return labels;
    }

    /**
     * Breadcrumbs and image for one id, each with its own fallback.
     *
     * @param designId queried design id
     * @return lookup result; never {@code null}
     */
    PartLookup lookup(final int designId) {
        TaxonomyLookup taxonomy = guarded(
                () -> client.lookupTaxonomy(designId),
                () -> new TaxonomyLookup(designId, List.of(props.getRootTerm())),
                "breadcrumbs", designId);

        byte[] image = fetchImageOrNull(taxonomy.resolvedId());
        if (taxonomy.resolvedId() != designId) {
            log.debug("Part {} resolved to {}", designId, taxonomy.resolvedId());
        }
        return new PartLookup(designId, taxonomy.resolvedId(), taxonomy.labels(), image);
    }

    /**
     * Image download with the catalog resilience policy.
     *
     * @param designId design id of the image
     * @return PNG bytes, or {@code null} when the image could not be fetched
     */
    public byte[] fetchImageOrNull(final int designId) {
        return guarded(() -> client.fetchImage(designId), () -> null, "image", designId);
    }

    private <T> T guarded(final Supplier<T> call, final Supplier<T> fallback,
                          final String what, final int designId) {
        Supplier<T> decorated = Decorators
                .ofSupplier(call)
                .withRetry(retry)
                .withCircuitBreaker(circuitBreaker)
                .withFallback(
                        List.of(Exception.class),
                        ex -> {
                            log.warn("{} lookup failed for part {}: {}", what, designId, ex.toString());
                            return fallback.get();
                        })
                .decorate();
        return decorated.get();
    }

    /**
     * One entry per resolved id; the first queried id (ascending) wins when
     * several resolve to the same part. A redirect onto a part that is
     * already cached adds nothing, so cached rows are never overwritten.
     */
    private List<CacheEntry> toEntries(final List<PartLookup> ordered) {
        LocalDate today = LocalDate.now(clock);
        Set<Integer> redirectTargets = ordered.stream()
                .filter(l -> l.resolvedId() != l.queriedId())
                .map(PartLookup::resolvedId)
                .collect(Collectors.toSet());
        Set<Integer> cached = redirectTargets.isEmpty()
                ? Set.of()
                : cache.get(redirectTargets).keySet();

        Map<Integer, CacheEntry> byResolved = new LinkedHashMap<>();
        for (PartLookup l : ordered) {
            if (cached.contains(l.resolvedId())) {
                log.debug("Part {} resolves to cached part {}; keeping the cached row",
                        l.queriedId(), l.resolvedId());
                continue;
            }
            CacheEntry previous = byResolved.putIfAbsent(l.resolvedId(),
                    new CacheEntry(l.resolvedId(), l.labels(), l.image(), today));
            if (previous != null) {
                log.debug("Part {} resolves to already fetched part {}", l.queriedId(), l.resolvedId());
            }
        }
        return new ArrayList<>(byResolved.values());
    }
}
