package com.bricks.sorter.model;

import java.util.List;

/**
 * Outcome of a catalog lookup for one queried design id.
 *
 * @param queriedId  id taken from the inventory; the working-set join key
 * @param resolvedId id the catalog redirected to; the cache key
 * @param labels     breadcrumbs, or the root-only fallback
 * @param image      PNG bytes, {@code null} when the image fetch failed
 */
public record PartLookup(int queriedId, int resolvedId, List<String> labels, byte[] image) {

    public PartLookup {
        labels = List.copyOf(labels);
    }
}
