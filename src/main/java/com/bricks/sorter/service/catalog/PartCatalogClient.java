package com.bricks.sorter.service.catalog;

import com.bricks.sorter.error.RemoteLookupException;

/**
 * Remote source of part categories and images.
 */
public interface PartCatalogClient {

    /**
     * @return short catalog name used in log lines
     */
    String catalog();

    /**
     * Fetches the category breadcrumbs of a part, following redirects to the
     * canonical part page.
     *
     * @param designId queried design id
     * @return resolved id and breadcrumbs
     * @throws RemoteLookupException     if the catalog answers with an error or without breadcrumbs
     * @throws java.io.UncheckedIOException on transport failures (retryable)
     */
    TaxonomyLookup lookupTaxonomy(int designId);

    /**
     * Downloads the PNG image of a part.
     *
     * @param designId resolved design id
     * @return image bytes
     * @throws RemoteLookupException     if the catalog has no image for the part
     * @throws java.io.UncheckedIOException on transport failures (retryable)
     */
    byte[] fetchImage(int designId);
}
