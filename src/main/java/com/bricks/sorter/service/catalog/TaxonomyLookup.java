package com.bricks.sorter.service.catalog;

import java.util.List;

/**
 * Category breadcrumbs of a part page.
 *
 * @param resolvedId design id the catalog redirected to (often the queried id)
 * @param labels     breadcrumbs, root-most first; never empty
 */
public record TaxonomyLookup(int resolvedId, List<String> labels) {

    public TaxonomyLookup {
        labels = List.copyOf(labels);
    }
}
