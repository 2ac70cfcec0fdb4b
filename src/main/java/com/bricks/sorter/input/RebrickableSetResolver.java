package com.bricks.sorter.input;

import com.bricks.sorter.config.CatalogCfg;
import com.bricks.sorter.config.CatalogConfigFactory;
import com.bricks.sorter.config.SorterProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.bricks.sorter.service.catalog.CatalogHttpEngine.MILLISECONDS_VALUE;

/**
 * <h2>Rebrickable set inventory lookup</h2>
 *
 * <p>Turns a set number ("42115" or "42115-1") into a local inventory file in
 * the Rebrickable JSON export layout, so the regular format dispatch picks it
 * up:</p>
 *
 * <ol>
 *   <li>{@code GET /api/v3/lego/sets/{set}/parts/?page_size=N} with
 *       {@code Authorization: key …}</li>
 *   <li>follow {@code next} until exhausted (bounded by {@code max-pages})</li>
 *   <li>write {@code {"count":…,"results":[…]}} under {@code <work-dir>/sets}</li>
 * </ol>
 *
 * <p>Any failure to obtain the inventory yields
 * {@link SetResolution#notApplicable(String)}; the caller then falls back to
 * the uploaded file.</p>
 */
@Slf4j
@Component
public class RebrickableSetResolver {

    /** Set numbers shorter than this are never looked up. */
    static final int MIN_SET_NUMBER_LENGTH = 4;

    private final CatalogCfg cfg;

    private final WebClient webClient;

    private final ObjectMapper mapper;

    private final Path setDir;

    public RebrickableSetResolver(final CatalogConfigFactory factory,
                                  final WebClient.Builder builder,
                                  @Qualifier("sorterObjectMapper") final ObjectMapper mapper,
                                  final SorterProperties props) {
        this.cfg = factory.forCatalog(CatalogConfigFactory.REBRICKABLE);
        this.webClient = builder.clone().build();
        this.mapper = mapper;
        this.setDir = Path.of(props.getWorkDir(), "sets");
    }

    /**
     * @return {@code true} when an API key is configured and the catalog is enabled
     */
    public boolean isEnabled() {
        return cfg.isEnabled() && StringUtils.isNotBlank(cfg.getApiKey());
    }

    /**
     * Fetches the full inventory of a set.
     *
     * @param setNumber set number, with or without the "-N" version suffix
     * @return the materialized file, or the reason the lookup does not apply
     * @throws UncheckedIOException if the fetched inventory cannot be written to disk
     */
    public SetResolution resolve(final String setNumber) {
        if (!isEnabled()) {
            return SetResolution.notApplicable("no Rebrickable API key configured");
        }
        String trimmed = StringUtils.trimToEmpty(setNumber);
        if (trimmed.length() < MIN_SET_NUMBER_LENGTH) {
            return SetResolution.notApplicable("set number '" + trimmed + "' is too short");
        }
        String versioned = versioned(trimmed);

        long t0 = System.nanoTime();
        ObjectNode inventory;
        try {
            inventory = fetchAllPages(versioned);
        } catch (RuntimeException ex) {
            log.warn("Rebrickable lookup of set {} failed: {}", versioned, ex.toString());
            return SetResolution.notApplicable("set " + versioned + " could not be fetched");
        }
        long t1 = System.nanoTime();

        Path file = write(versioned, inventory);
        log.info("Rebrickable set {}  PARTS={}  NET={} ms", versioned,
                inventory.path("count").asInt(), (t1 - t0) / MILLISECONDS_VALUE);
        return SetResolution.fetched(file);
    }

    /**
     * Appends the default version "-1" when the set number carries none.
     */
    static String versioned(final String setNumber) {
        return setNumber.contains("-") ? setNumber : setNumber + "-1";
    }

    private ObjectNode fetchAllPages(final String versioned) {
        ArrayNode results = mapper.createArrayNode();
        URI next = UriComponentsBuilder.fromUriString(cfg.getBaseUrl())
                .path(cfg.getSetPartsPath())
                .queryParam("page_size", cfg.getPageSize())
                .buildAndExpand(versioned)
                .encode()
                .toUri();

        int pages = 0;
        while (next != null && pages < cfg.getMaxPages()) {
            JsonNode page = get(next);
            if (page == null || !page.path("results").isArray()) {
                throw new IllegalStateException("Unexpected Rebrickable payload from " + next);
            }
            results.addAll((ArrayNode) page.get("results"));
            pages++;

            String link = page.path("next").asText(null);
            next = StringUtils.isNotBlank(link) ? URI.create(link) : null;
        }
        if (next != null) {
            log.warn("Set {} has more than {} pages; inventory truncated", versioned, cfg.getMaxPages());
        }

        ObjectNode doc = mapper.createObjectNode();
        doc.put("count", results.size());
        doc.set("results", results);
        return doc;
    }

    private JsonNode get(final URI uri) {
        return webClient.get()
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, "key " + cfg.getApiKey())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(cfg.getTimeout());
    }

    private Path write(final String versioned, final ObjectNode inventory) {
        try {
            Files.createDirectories(setDir);
            Path file = Files.createTempFile(setDir, versioned + "-", ".json");
            mapper.writeValue(file.toFile(), inventory);
            return file;
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot store inventory of set " + versioned, ex);
        }
    }
}
