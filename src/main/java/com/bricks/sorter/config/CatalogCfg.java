package com.bricks.sorter.config;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

/**
 * Holds configuration properties for one remote parts catalog.
 * <p>
 * Each instance encapsulates the endpoint URLs and credentials required to
 * resolve a set inventory (Rebrickable) or to look up a part's category
 * breadcrumbs and image (BrickArchitect).
 * </p>
 */
@Getter
@Setter
public class CatalogCfg {

    /**
     * The base URL to which all catalog-specific paths are relative.
     * <p>For example, "https://brickarchitect.com".</p>
     */
    private String baseUrl;

    /**
     * Path template of the set inventory endpoint; {@code {set}} is replaced
     * by the versioned set number.
     * <p>For example, "/api/v3/lego/sets/{set}/parts/".</p>
     */
    private String setPartsPath;

    /**
     * Path template of the part page holding the category breadcrumbs;
     * {@code {part}} is replaced by the design id.
     * <p>For example, "/parts/{part}".</p>
     */
    private String partPath;

    /**
     * Path template of the part image; {@code {part}} is replaced by the design id.
     * <p>For example, "/content/parts/{part}.png".</p>
     */
    private String imagePath;

    /**
     * Opaque API key sent as {@code Authorization: key <apiKey>}; blank disables the catalog.
     */
    private String apiKey;

    /**
     * Whether the catalog should be used at all.
     */
    private boolean enabled = true;

    /**
     * API page size (where the catalog supports paging).
     */
    private int pageSize = 1000;

    /**
     * Upper bound on pages followed for one request.
     */
    private int maxPages = 20;

    /**
     * Blocking timeout for one HTTP exchange.
     */
    private Duration timeout = Duration.ofSeconds(20);
}
