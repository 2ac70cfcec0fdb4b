package com.bricks.sorter.controller;

import com.bricks.sorter.config.SorterProperties;
import com.bricks.sorter.dto.ClusterResponse;
import com.bricks.sorter.dto.FormatsResponse;
import com.bricks.sorter.input.InventoryFormatRegistry;
import com.bricks.sorter.model.ClusteringResult;
import com.bricks.sorter.model.EnrichedWorkingSet;
import com.bricks.sorter.service.InventorySortingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * REST controller turning an uploaded inventory (or a set number) into
 * sorting bins.
 * <p>
 * Endpoint: <code>POST /api/clusters</code><br>
 * Consumes: <code>multipart/form-data</code><br>
 * Produces: <code>application/json</code>
 * </p>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * curl -F partList=@inventory.bsx -F clusters=8 -F seed=1234 http://localhost:8080/api/clusters
 * }</pre>
 *
 * <h3>Example Response</h3>
 * <pre>{@code
 * {
 *   "seed": 1234,
 *   "clusters": [
 *     { "label": "Other", "quantity": 3, "members": [ 99999 ] },
 *     { "label": "1. Basic, Bricks", "quantity": 120, "members": [ 3001, 3003 ] },
 *     ...
 *   ],
 *   "html": "<div>..."
 * }
 * }</pre>
 */
@Slf4j
@RestController
@RequestMapping("/api/clusters")
@RequiredArgsConstructor
public class ClusterController {

    private final InventorySortingService sorting;

    private final InventoryFormatRegistry registry;

    private final SorterProperties props;

    /**
     * Runs the whole pipeline for one inventory.
     *
     * @param partList  inventory file in one of the supported formats
     * @param setNumber set number, tried before the file
     * @param clusters  number of bins; defaults to {@code sorter.default-clusters}
     * @param seed      optional seed; a fresh one is drawn when absent or malformed
     * @return bins, the seed used and the rendered HTML
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ClusterResponse cluster(@RequestParam(value = "partList", required = false) final MultipartFile partList,
                                   @RequestParam(value = "setNumber", required = false) final String setNumber,
                                   @RequestParam(value = "clusters", required = false) final Integer clusters,
                                   @RequestParam(value = "seed", required = false) final String seed) {
        int k = clusters != null ? clusters : props.getDefaultClusters();

        Path upload = store(partList);
        try {
            EnrichedWorkingSet parts = sorting.loadAndEnrich(setNumber, upload);
            ClusteringResult result = sorting.cluster(parts, k, seed);
            String html = sorting.render(result.clusters());
            return new ClusterResponse(result.usedSeed(), result.clusters(), html);
        } finally {
            delete(upload);
        }
    }

    /**
     * Lists the accepted inventory formats.
     *
     * @return extensions for the upload dialog and whether set numbers work
     */
    @GetMapping(value = "/formats", produces = MediaType.APPLICATION_JSON_VALUE)
    public FormatsResponse formats() {
        return new FormatsResponse(registry.supportedExtensions(), registry.isSetLookupEnabled());
    }

    private Path store(final MultipartFile partList) {
        if (partList == null || partList.isEmpty()) {
            return null;
        }
        try {
            Path dir = Files.createDirectories(Path.of(props.getWorkDir(), "uploads"));
            Path file = Files.createTempFile(dir, "inventory-", ".upload");
            partList.transferTo(file);
            return file;
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot store uploaded inventory", ex);
        }
    }

    private static void delete(final Path upload) {
        if (upload == null) {
            return;
        }
        try {
            Files.deleteIfExists(upload);
        } catch (IOException ex) {
            log.warn("Could not delete upload {}: {}", upload, ex.toString());
        }
    }
}
