package com.bricks.sorter.config;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Factory component responsible for producing {@link CatalogCfg} instances
 * for a given catalog identifier. It delegates to {@link CatalogProperties}
 * to look up the configuration section for each catalog as defined in
 * <code>application.yml</code>.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * CatalogCfg rebrickable = configFactory.forCatalog(CatalogConfigFactory.REBRICKABLE);
 * }</pre>
 */
@Component
@RequiredArgsConstructor
public class CatalogConfigFactory {

    /** Identifier of the set inventory catalog. */
    public static final String REBRICKABLE = "rebrickable";

    /** Identifier of the part taxonomy and image catalog. */
    public static final String BRICKARCHITECT = "brickarchitect";

    private final CatalogProperties catalogProps;

    /**
     * Retrieves the {@link CatalogCfg} for the specified catalog ID.
     *
     * @param id the catalog identifier (must match a key under
     *           <code>catalogs.configs.{id}</code> in application.yml)
     * @return the corresponding {@link CatalogCfg} instance
     * @throws IllegalArgumentException if no configuration section is found
     *                                  for the given catalog ID
     */
    public CatalogCfg forCatalog(final String id) {
        return Optional.ofNullable(catalogProps.forName(id))
                .orElseThrow(() -> new IllegalArgumentException(
                        "No <catalogs.configs." + id + "> section found in application.yml"));
    }
}
